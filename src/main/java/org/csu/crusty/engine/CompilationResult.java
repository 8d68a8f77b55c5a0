package org.csu.crusty.engine;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.csu.crusty.compiler.codegen.TargetLanguage;
import org.csu.crusty.compiler.parser.ast.CrustyFile;
import org.csu.crusty.compiler.semantic.AnalysisResult;

/**
 * @author hidyouth
 * @description: 一次成功编译的产物
 */
@Getter
@RequiredArgsConstructor
public class CompilationResult {
    private final TargetLanguage target;
    private final String output;
    private final CrustyFile ast;
    private final AnalysisResult analysis;
}
