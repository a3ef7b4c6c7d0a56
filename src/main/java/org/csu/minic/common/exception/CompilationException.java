package org.csu.minic.common.exception;

/**
 * @author hidyouth
 * @description: 编译流水线中所有异常的公共父类
 *
 * 上层只需要捕获这一个类型，就能统一拿到可读的错误信息；
 * 需要区分阶段时再看 {@link #getKind()}。
 */
public abstract class CompilationException extends RuntimeException {

    protected CompilationException(String message) {
        super(message);
    }

    protected CompilationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getKind();
}
