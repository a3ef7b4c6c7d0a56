package org.csu.minic.common.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 获取 SLF4J Logger 的工具类，顺便屏蔽 SLF4J 自身初始化时的输出。
 */
public final class CompilerLogger {
    static {
        System.setProperty("slf4j.internal.verbosity", "WARN");
    }

    private CompilerLogger() {
        // utility class
    }

    public static Logger getLogger(Class<?> clazz) {
        return LoggerFactory.getLogger(clazz);
    }
}
