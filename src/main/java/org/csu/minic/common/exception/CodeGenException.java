package org.csu.minic.common.exception;

/**
 * 代码生成阶段的异常：遇到了生成器不支持的节点。
 */
public class CodeGenException extends CompilationException {

    public CodeGenException(String message) {
        super(message);
    }

    public CodeGenException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CODEGEN;
    }
}
