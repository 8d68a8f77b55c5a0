package org.csu.crusty.cli;

import lombok.Getter;

import java.nio.file.Path;

/**
 * @author hidyouth
 * @description: crustyc 的命令行参数
 * crustyc &lt;input&gt; [-o out] [--emit rust|crusty|ast|tokens|binary] [--from-lang crusty] [-v] [--no-compile]
 */
@Getter
public class CliOptions {

    public static final String USAGE =
            "Usage: crustyc <input> [-o <output>] [--emit rust|crusty|ast|tokens|binary] "
                    + "[--from-lang crusty] [-v|--verbose] [--no-compile]";

    private Path input;
    private Path output;
    private EmitMode emit = EmitMode.RUST;
    private String fromLang = "crusty";
    private boolean verbose;
    private boolean noCompile;
    private boolean help;

    /**
     * @throws IllegalArgumentException 参数不合法
     */
    public static CliOptions parse(String[] args) {
        CliOptions options = new CliOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-o":
                case "--output":
                    options.output = Path.of(requireValue(args, ++i, arg));
                    break;
                case "--emit":
                    options.emit = EmitMode.fromId(requireValue(args, ++i, arg));
                    break;
                case "--from-lang":
                    options.fromLang = requireValue(args, ++i, arg);
                    break;
                case "-v":
                case "--verbose":
                    options.verbose = true;
                    break;
                case "--no-compile":
                    options.noCompile = true;
                    break;
                case "-h":
                case "--help":
                    options.help = true;
                    break;
                default:
                    if (arg.startsWith("--emit=")) {
                        options.emit = EmitMode.fromId(arg.substring("--emit=".length()));
                    } else if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    } else if (options.input != null) {
                        throw new IllegalArgumentException("Only one input file is supported, got '" + arg + "'");
                    } else {
                        options.input = Path.of(arg);
                    }
            }
        }
        if (options.input == null && !options.help) {
            throw new IllegalArgumentException("No input file given");
        }
        return options;
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Option " + option + " requires a value");
        }
        return args[index];
    }

    /**
     * 没有 -o 时: rust 输出为输入文件旁的 &lt;stem&gt;.rs, binary 输出为 &lt;stem&gt;;
     * 其他模式返回 null 表示打印到标准输出
     */
    public Path resolveOutput() {
        if (output != null) {
            return output;
        }
        return switch (emit) {
            case RUST -> sibling(".rs");
            case BINARY -> sibling("");
            default -> null;
        };
    }

    /**
     * binary 模式下先写出的 Rust 源文件
     */
    public Path rustSourceForBinary() {
        Path binary = resolveOutput();
        String name = binary.getFileName().toString();
        return binary.resolveSibling(stem(name) + ".rs");
    }

    private Path sibling(String extension) {
        return input.resolveSibling(stem(input.getFileName().toString()) + extension);
    }

    private static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
