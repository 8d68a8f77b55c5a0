package org.csu.crusty.engine;

import java.nio.file.Path;

/**
 * @author hidyouth
 * @description: 把生成的 Rust 源文件交给外部工具链编译为可执行文件
 */
public interface NativeCompiler {

    /**
     * @throws org.csu.crusty.common.exception.CompilationFailedException 工具链无法启动或编译失败
     */
    void compile(Path rustSource, Path outputBinary);
}
