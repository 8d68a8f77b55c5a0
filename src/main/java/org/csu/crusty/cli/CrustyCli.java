package org.csu.crusty.cli;

import org.csu.crusty.common.exception.CodeGenException;
import org.csu.crusty.common.exception.CompilationFailedException;
import org.csu.crusty.common.exception.LexException;
import org.csu.crusty.common.exception.ParseException;
import org.csu.crusty.common.exception.SemanticException;
import org.csu.crusty.compiler.codegen.TargetLanguage;
import org.csu.crusty.compiler.lexer.Token;
import org.csu.crusty.compiler.parser.ast.CrustyFile;
import org.csu.crusty.compiler.parser.ast.ItemNode;
import org.csu.crusty.compiler.semantic.SemanticError;
import org.csu.crusty.engine.CompilationPipeline;
import org.csu.crusty.engine.CompilationResult;
import org.csu.crusty.engine.CompilerConfig;
import org.csu.crusty.engine.NativeCompiler;
import org.csu.crusty.engine.RustcCompiler;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * @author hidyouth
 * @description: 命令行入口 crustyc
 * 读取一个 Crusty 源文件, 按 --emit 输出 Rust 代码、格式化后的 Crusty 代码、AST、Token 列表或可执行文件。
 * 成功返回 0, 任何错误返回 1, 错误信息写到标准错误。
 */
public class CrustyCli {

    // 持有强引用, 否则配置过的 Logger 可能被回收
    private static final Logger ROOT_LOGGER = Logger.getLogger("org.csu.crusty");

    private final PrintStream out;
    private final PrintStream err;
    private final NativeCompiler nativeCompiler;

    public CrustyCli(PrintStream out, PrintStream err) {
        this(out, err, new RustcCompiler());
    }

    public CrustyCli(PrintStream out, PrintStream err, NativeCompiler nativeCompiler) {
        this.out = out;
        this.err = err;
        this.nativeCompiler = nativeCompiler;
    }

    public static void main(String[] args) {
        int exitCode = new CrustyCli(System.out, System.err).run(args);
        System.exit(exitCode);
    }

    public int run(String[] args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.println(CliOptions.USAGE);
            return 1;
        }
        if (options.isHelp()) {
            out.println(CliOptions.USAGE);
            return 0;
        }
        if (options.isVerbose() || CompilerConfig.VERBOSE) {
            enableVerboseLogging();
        }

        try {
            execute(options);
            return 0;
        } catch (SemanticException e) {
            for (SemanticError error : e.getErrors()) {
                err.println(error.describe());
            }
            err.println("error: aborting due to " + e.getErrors().size() + " previous error(s)");
        } catch (LexException | ParseException | CodeGenException | CompilationFailedException
                 | UnsupportedOperationException | IOException e) {
            err.println("error: " + e.getMessage());
        }
        return 1;
    }

    private void execute(CliOptions options) throws IOException {
        if (!"crusty".equalsIgnoreCase(options.getFromLang())) {
            throw new UnsupportedOperationException(
                    "source language '" + options.getFromLang() + "' is not supported, only crusty input is accepted");
        }
        verbose(options, "Compiling: " + options.getInput());
        verbose(options, "Emit mode: " + options.getEmit());

        String source;
        try {
            source = Files.readString(options.getInput(), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new IOException("input file not found: " + options.getInput(), e);
        }
        verbose(options, "Read " + source.length() + " characters from source file");

        CompilationPipeline pipeline = new CompilationPipeline();
        switch (options.getEmit()) {
            case TOKENS -> {
                List<Token> tokens = pipeline.tokenize(source);
                emit(options, tokens.stream().map(Token::toString).collect(Collectors.joining("\n")) + "\n");
            }
            case AST -> {
                CrustyFile ast = pipeline.parseOnly(source);
                verbose(options, "Parsed " + ast.items().size() + " items");
                emit(options, ast.items().stream().map(ItemNode::toString).collect(Collectors.joining("\n")) + "\n");
            }
            case CRUSTY -> emit(options, pipeline.compile(source, TargetLanguage.CRUSTY).getOutput());
            case RUST -> emit(options, pipeline.compile(source, TargetLanguage.RUST).getOutput());
            case BINARY -> buildBinary(options, pipeline, source);
        }
    }

    private void buildBinary(CliOptions options, CompilationPipeline pipeline, String source) throws IOException {
        CompilationResult result = pipeline.compile(source, TargetLanguage.RUST);
        Path rustSource = options.rustSourceForBinary();
        Files.writeString(rustSource, result.getOutput(), StandardCharsets.UTF_8);
        verbose(options, "Wrote Rust code to: " + rustSource);
        if (options.isNoCompile()) {
            verbose(options, "Skipping native compilation (--no-compile)");
            return;
        }
        Path binary = options.resolveOutput();
        verbose(options, "Invoking native compiler for " + binary);
        nativeCompiler.compile(rustSource, binary);
        verbose(options, "Built executable: " + binary);
    }

    private void emit(CliOptions options, String text) throws IOException {
        Path target = options.resolveOutput();
        if (target == null) {
            out.print(text);
            return;
        }
        Files.writeString(target, text, StandardCharsets.UTF_8);
        verbose(options, "Wrote output to: " + target);
    }

    private void verbose(CliOptions options, String message) {
        if (options.isVerbose()) {
            out.println(message);
        }
    }

    private static void enableVerboseLogging() {
        ROOT_LOGGER.setLevel(Level.FINE);
        for (Handler handler : ROOT_LOGGER.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                return;
            }
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        ROOT_LOGGER.addHandler(handler);
    }
}
