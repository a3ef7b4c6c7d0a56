package org.csu.minic.engine;

import org.csu.minic.common.config.CompilerSettings;
import org.csu.minic.common.exception.CodeGenException;
import org.csu.minic.common.exception.CompilationException;
import org.csu.minic.common.log.CompilerLogger;
import org.csu.minic.compiler.generator.CodeGenerator;
import org.csu.minic.compiler.lexer.Lexer;
import org.csu.minic.compiler.lexer.Token;
import org.csu.minic.compiler.parser.Parser;
import org.csu.minic.compiler.parser.ast.BlockNode;
import org.slf4j.Logger;

import java.util.List;

/**
 * @author hidyouth
 * @description: 编译流水线的入口
 *
 * 词法分析 -> 语法分析 -> 代码生成，任何一个阶段出错都会立即终止。
 * 每次调用都使用独立的 Lexer 和 Parser，所以同一个实例可以被并发调用。
 */
public class MiniCompiler {

    private static final Logger LOGGER = CompilerLogger.getLogger(MiniCompiler.class);

    private final CompilerSettings settings;
    private final CodeGenerator codeGenerator;

    public MiniCompiler() {
        this(CompilerSettings.loadDefaults());
    }

    public MiniCompiler(CompilerSettings settings) {
        this(settings, new CodeGenerator());
    }

    MiniCompiler(CompilerSettings settings, CodeGenerator codeGenerator) {
        // 拷贝一份，之后外部再修改 settings 不会影响本实例
        this.settings = settings.copy();
        this.codeGenerator = codeGenerator;
    }

    public CompilerSettings getSettings() {
        return settings.copy();
    }

    public List<Token> tokenize(String source) {
        return new Lexer(source, settings).tokenize();
    }

    public BlockNode parse(String source) {
        return new Parser(tokenize(source)).parse();
    }

    /**
     * 编译一段源码。
     * @param source 源码，null 视为空程序
     * @return 成功时携带生成的源码，失败时携带错误阶段和错误信息
     */
    public CompileResult compile(String source) {
        try {
            BlockNode program = parse(source);
            return CompileResult.success(generate(program));
        } catch (CompilationException e) {
            LOGGER.debug("Compilation failed ({}): {}", e.getKind(), e.getMessage());
            return CompileResult.failure(e);
        }
    }

    // 生成器按语法树深度递归，栈耗尽时归为代码生成错误
    private String generate(BlockNode program) {
        try {
            return codeGenerator.generate(program);
        } catch (StackOverflowError e) {
            throw new CodeGenException("Program is nested too deeply to generate", e);
        }
    }
}
