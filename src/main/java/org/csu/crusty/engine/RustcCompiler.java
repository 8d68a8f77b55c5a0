package org.csu.crusty.engine;

import org.csu.crusty.common.exception.CompilationFailedException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * @author hidyouth
 * @description: 通过子进程调用 rustc &lt;file&gt; -o &lt;out&gt;
 */
public class RustcCompiler implements NativeCompiler {

    private static final Logger LOG = Logger.getLogger(RustcCompiler.class.getName());

    private final String rustc;
    private final List<String> extraFlags;

    public RustcCompiler() {
        this(CompilerConfig.RUSTC, List.of());
    }

    public RustcCompiler(String rustc, List<String> extraFlags) {
        this.rustc = rustc;
        this.extraFlags = List.copyOf(extraFlags);
    }

    List<String> command(Path rustSource, Path outputBinary) {
        List<String> command = new ArrayList<>();
        command.add(rustc);
        command.add(rustSource.toString());
        command.add("-o");
        command.add(outputBinary.toString());
        command.addAll(extraFlags);
        return command;
    }

    @Override
    public void compile(Path rustSource, Path outputBinary) {
        List<String> command = command(rustSource, outputBinary);
        LOG.fine(() -> "Running " + String.join(" ", command));
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new CompilationFailedException("Failed to start '" + rustc + "': " + e.getMessage(), e);
        }

        try {
            // stdout 和 stderr 都要读走, 否则子进程可能阻塞在写管道上
            CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
            String stderr = drain(process.getErrorStream());
            int exitCode = process.waitFor();
            LOG.finer(() -> "rustc stdout: " + stdout.join());
            if (exitCode != 0) {
                throw new CompilationFailedException("rustc compilation failed (exit code: " + exitCode + "):\n"
                        + summarize(stderr));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new CompilationFailedException("Interrupted while waiting for rustc", e);
        }
    }

    /**
     * 只保留以 error 开头的行; 没有这样的行时返回完整输出
     */
    static String summarize(String stderr) {
        List<String> errors = stderr.lines()
                .filter(line -> line.startsWith("error"))
                .collect(Collectors.toList());
        return errors.isEmpty() ? stderr : String.join("\n", errors);
    }

    private static String drain(InputStream stream) {
        try (InputStream in = stream) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            in.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CompilationFailedException("Failed to read rustc output", e);
        }
    }
}
