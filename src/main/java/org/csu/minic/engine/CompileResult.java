package org.csu.minic.engine;

import org.csu.minic.common.exception.CompilationException;
import org.csu.minic.common.exception.ErrorKind;

import java.util.Objects;

/**
 * 一次编译的结果：要么是生成的源码，要么是带阶段标记的错误，不存在部分输出。
 */
public sealed interface CompileResult permits CompileResult.Success, CompileResult.Failure {

    // 静态工厂方法，编译成功
    static CompileResult success(String output) {
        return new Success(output);
    }

    // 静态工厂方法，编译失败
    static CompileResult failure(CompilationException cause) {
        return new Failure(cause.getKind(), cause.getMessage(), cause);
    }

    boolean isSuccess();

    /**
     * @return 生成的源码
     * @throws CompilationException 编译失败时抛出原始异常
     */
    String getOrThrow();

    record Success(String output) implements CompileResult {

        public Success {
            Objects.requireNonNull(output, "output");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public String getOrThrow() {
            return output;
        }
    }

    record Failure(ErrorKind kind, String message, CompilationException cause) implements CompileResult {

        public Failure {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public String getOrThrow() {
            throw cause;
        }
    }
}
