package org.csu.minic.cli;

import org.csu.minic.common.config.CompilerSettings;
import org.csu.minic.common.config.OperatorMatching;
import org.csu.minic.common.config.UnknownCharacterPolicy;
import org.csu.minic.common.exception.CompilationException;
import org.csu.minic.compiler.lexer.Token;
import org.csu.minic.compiler.parser.ast.AstPrinter;
import org.csu.minic.engine.CompileResult;
import org.csu.minic.engine.MiniCompiler;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 命令行入口：读取一个源文件（或标准输入），输出重新生成的源码。
 *
 * <pre>
 * CompilerCli [--tokens | --ast] [--first-match] [--skip-unknown] [file | -]
 * </pre>
 */
public final class CompilerCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_COMPILE_ERROR = 1;
    public static final int EXIT_USAGE = 2;

    private enum Mode { GENERATE, TOKENS, AST }

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    private final CompilerSettings settings = CompilerSettings.loadDefaults();
    private Mode mode = Mode.GENERATE;
    private String sourceFile;
    private boolean printUsage;

    public CompilerCli(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int status = new CompilerCli(System.in, System.out, System.err).run(args);
        System.exit(status);
    }

    /**
     * 解析参数并执行。
     * @return 进程退出码
     */
    public int run(String[] args) {
        try {
            parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            usage(err);
            return EXIT_USAGE;
        }
        if (printUsage) {
            usage(out);
            return EXIT_OK;
        }

        String source;
        try {
            source = readSource();
        } catch (IOException e) {
            err.println("Error: cannot read " + (sourceFile == null ? "standard input" : sourceFile)
                    + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        MiniCompiler compiler = new MiniCompiler(settings);
        try {
            switch (mode) {
                case TOKENS:
                    for (Token token : compiler.tokenize(source)) {
                        out.println(token);
                    }
                    return EXIT_OK;
                case AST:
                    out.print(AstPrinter.print(compiler.parse(source)));
                    return EXIT_OK;
                default:
                    return generate(compiler, source);
            }
        } catch (CompilationException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_COMPILE_ERROR;
        }
    }

    private int generate(MiniCompiler compiler, String source) {
        CompileResult result = compiler.compile(source);
        if (result instanceof CompileResult.Success success) {
            out.println(success.output());
            return EXIT_OK;
        }
        CompileResult.Failure failure = (CompileResult.Failure) result;
        err.println("Error: " + failure.message());
        return EXIT_COMPILE_ERROR;
    }

    void parse(String[] args) {
        int argIdx = 0;
        while (argIdx < args.length) {
            String arg = args[argIdx];
            if (arg.isEmpty()) {
                throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
            }
            if (arg.equals("-h") || arg.equals("--help")) {
                printUsage = true;
            } else if (arg.equals("--tokens")) {
                setMode(Mode.TOKENS);
            } else if (arg.equals("--ast")) {
                setMode(Mode.AST);
            } else if (arg.equals("--first-match")) {
                settings.setOperatorMatching(OperatorMatching.FIRST_MATCH);
            } else if (arg.equals("--skip-unknown")) {
                settings.setUnknownCharacterPolicy(UnknownCharacterPolicy.SKIP);
            } else if (arg.equals("-") || arg.charAt(0) != '-') {
                if (argIdx != args.length - 1) {
                    throw new IllegalArgumentException("only one source file is accepted, found '"
                            + args[argIdx + 1] + "' after '" + arg + "'");
                }
                sourceFile = arg.equals("-") ? null : arg;
            } else {
                throw new IllegalArgumentException("unknown option '" + arg + "'");
            }
            argIdx++;
        }
    }

    private void setMode(Mode newMode) {
        if (mode != Mode.GENERATE && mode != newMode) {
            throw new IllegalArgumentException("--tokens and --ast cannot be combined");
        }
        mode = newMode;
    }

    private String readSource() throws IOException {
        if (sourceFile == null) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        Path path = Paths.get(sourceFile);
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    CompilerSettings getSettings() {
        return settings;
    }

    private static void usage(PrintStream dest) {
        dest.println("Usage: CompilerCli [options] [file | -]");
        dest.println("Reads the source from the file, or from standard input when no file (or '-') is given.");
        dest.println();
        dest.println("  --tokens        print the token list instead of generated code");
        dest.println("  --ast           print the syntax tree instead of generated code");
        dest.println("  --first-match   lex '<=' and '>=' as two tokens ('<' '=')");
        dest.println("  --skip-unknown  ignore characters the lexer does not recognize");
        dest.println("  -h, --help      show this help");
    }
}
