package org.csu.crusty.engine;

import org.csu.crusty.common.exception.SemanticException;
import org.csu.crusty.compiler.codegen.CodeGenerator;
import org.csu.crusty.compiler.codegen.TargetLanguage;
import org.csu.crusty.compiler.lexer.Lexer;
import org.csu.crusty.compiler.lexer.Token;
import org.csu.crusty.compiler.parser.Parser;
import org.csu.crusty.compiler.parser.ast.CrustyFile;
import org.csu.crusty.compiler.semantic.AnalysisResult;
import org.csu.crusty.compiler.semantic.CaptureAnalyzer;

import java.util.List;
import java.util.logging.Logger;

/**
 * @author hidyouth
 * @description: 编译流水线
 * 词法分析 -> 语法分析 -> 捕获分析 -> 代码生成, 每次调用处理一个源文件, 调用之间不共享状态。
 * 任何阶段出错都不会进入代码生成。
 */
public class CompilationPipeline {

    private static final Logger LOG = Logger.getLogger(CompilationPipeline.class.getName());

    private final String indentUnit;

    public CompilationPipeline() {
        this(CompilerConfig.indentUnit());
    }

    public CompilationPipeline(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public CrustyFile parseOnly(String source) {
        List<Token> tokens = tokenize(source);
        LOG.fine(() -> "Lexed " + tokens.size() + " tokens");
        return new Parser(tokens).parse();
    }

    /**
     * @throws org.csu.crusty.common.exception.LexException   词法错误
     * @throws org.csu.crusty.common.exception.ParseException 第一个语法错误
     * @throws SemanticException                                全部语义错误
     */
    public CompilationResult compile(String source, TargetLanguage target) {
        CrustyFile ast = parseOnly(source);
        LOG.fine(() -> "Parsed " + ast.items().size() + " items");

        AnalysisResult analysis = new CaptureAnalyzer().analyzeOrThrow(ast);
        LOG.fine(() -> "Analysis succeeded, " + analysis.getNestedFunctions().size() + " nested functions");

        String output = new CodeGenerator(target, analysis, indentUnit).generate(ast);
        return new CompilationResult(target, output, ast, analysis);
    }
}
