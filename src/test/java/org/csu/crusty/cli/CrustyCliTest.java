package org.csu.crusty.cli;

import org.csu.crusty.common.exception.CompilationFailedException;
import org.csu.crusty.engine.NativeCompiler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hidyouth
 * @description: 命令行入口的集成测试, 使用临时目录和一个记录调用的本地编译器替身
 */
public class CrustyCliTest {

    private static final String HELLO = "int main() { let int x = 42; return x; }";

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream stdout;
    private ByteArrayOutputStream stderr;
    private final List<Path[]> nativeCalls = new ArrayList<>();
    private CrustyCli cli;

    @BeforeEach
    void setUp() {
        stdout = new ByteArrayOutputStream();
        stderr = new ByteArrayOutputStream();
        nativeCalls.clear();
        NativeCompiler recording = (rustSource, outputBinary) -> nativeCalls.add(new Path[]{rustSource, outputBinary});
        cli = newCli(recording);
    }

    private CrustyCli newCli(NativeCompiler nativeCompiler) {
        return new CrustyCli(new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8), nativeCompiler);
    }

    private Path write(String name, String source) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, source, StandardCharsets.UTF_8);
        return file;
    }

    private int run(String... args) {
        int code = cli.run(args);
        System.out.println("Exit code: " + code);
        System.out.println("stdout:\n" + out());
        System.out.println("stderr:\n" + err());
        return code;
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testDefaultWritesRustNextToInput() throws IOException {
        System.out.println("--- Running test: testDefaultWritesRustNextToInput ---");
        Path input = write("hello.crst", HELLO);

        assertEquals(0, run(input.toString()));
        Path rust = tempDir.resolve("hello.rs");
        assertTrue(Files.exists(rust));
        String content = Files.readString(rust, StandardCharsets.UTF_8);
        assertTrue(content.startsWith("pub fn main() -> i32 {\n"));
        assertTrue(content.contains("let x: i32 = 42;"));
        assertTrue(nativeCalls.isEmpty());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testEmitCrustyAndTokensToStdout() throws IOException {
        System.out.println("--- Running test: testEmitCrustyAndTokensToStdout ---");
        Path input = write("fmt.crst", "int main(){return 0;}");

        assertEquals(0, run("--emit", "crusty", input.toString()));
        assertEquals("int main() {\n    return 0;\n}\n", out());

        stdout.reset();
        assertEquals(0, run("--emit", "tokens", input.toString()));
        assertTrue(out().contains("Token[Type=INT"));
        assertTrue(out().contains("Token[Type=EOF"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testEmitAstToFile() throws IOException {
        System.out.println("--- Running test: testEmitAstToFile ---");
        Path input = write("ast.crst", HELLO);
        Path output = tempDir.resolve("ast.txt");

        assertEquals(0, run("--emit", "ast", "-o", output.toString(), input.toString()));
        assertTrue(Files.readString(output, StandardCharsets.UTF_8).startsWith("FunctionNode["));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testBinaryWithoutNativeCompile() throws IOException {
        System.out.println("--- Running test: testBinaryWithoutNativeCompile ---");
        Path input = write("app.crst", HELLO);
        Path binary = tempDir.resolve("app");

        assertEquals(0, run("--emit", "binary", "--no-compile", "-o", binary.toString(), input.toString()));
        assertTrue(Files.exists(tempDir.resolve("app.rs")));
        assertTrue(nativeCalls.isEmpty(), "--no-compile must skip the native toolchain");
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testBinaryInvokesNativeCompiler() throws IOException {
        System.out.println("--- Running test: testBinaryInvokesNativeCompiler ---");
        Path input = write("app.crst", HELLO);

        assertEquals(0, run("--emit", "binary", "-v", input.toString()));
        assertEquals(1, nativeCalls.size());
        assertEquals(tempDir.resolve("app.rs"), nativeCalls.get(0)[0]);
        assertEquals(tempDir.resolve("app"), nativeCalls.get(0)[1]);
        assertTrue(out().contains("Compiling: " + input));
        assertTrue(out().contains("Built executable: " + tempDir.resolve("app")));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testNativeCompilerFailureIsReported() throws IOException {
        System.out.println("--- Running test: testNativeCompilerFailureIsReported ---");
        Path input = write("bad.crst", HELLO);
        cli = newCli((rustSource, outputBinary) -> {
            throw new CompilationFailedException("rustc compilation failed (exit code: 1):\nerror: boom");
        });

        assertEquals(1, run("--emit", "binary", input.toString()));
        assertTrue(err().contains("error: rustc compilation failed (exit code: 1)"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testSyntaxErrorExitsWithOne() throws IOException {
        System.out.println("--- Running test: testSyntaxErrorExitsWithOne ---");
        Path input = write("broken.crst", "int main() { return 0 }");

        assertEquals(1, run(input.toString()));
        assertTrue(err().contains("Syntax Error at 1:23"));
        assertFalse(Files.exists(tempDir.resolve("broken.rs")), "no output is written on failure");
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testSemanticErrorsAreAllPrinted() throws IOException {
        System.out.println("--- Running test: testSemanticErrorsAreAllPrinted ---");
        Path input = write("sem.crst", "void f() { a = 1; break; }");

        assertEquals(1, run(input.toString()));
        assertTrue(err().contains("error[UNDEFINED_VARIABLE]"));
        assertTrue(err().contains("error[INVALID_OPERATION]"));
        assertTrue(err().contains("error: aborting due to 2 previous error(s)"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testMissingInputAndUnsupportedLanguage() throws IOException {
        System.out.println("--- Running test: testMissingInputAndUnsupportedLanguage ---");
        assertEquals(1, run(tempDir.resolve("nope.crst").toString()));
        assertTrue(err().contains("input file not found"));

        stderr.reset();
        Path input = write("hello.crst", HELLO);
        assertEquals(1, run("--from-lang", "rust", input.toString()));
        assertTrue(err().contains("source language 'rust' is not supported"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testUsageErrorsAndHelp() {
        System.out.println("--- Running test: testUsageErrorsAndHelp ---");
        assertEquals(1, run("--bogus"));
        assertTrue(err().contains("Unknown option: --bogus"));
        assertTrue(err().contains(CliOptions.USAGE));

        assertEquals(0, run("--help"));
        assertTrue(out().contains("Usage: crustyc"));
        System.out.println("Result: Test PASSED.\n");
    }
}
