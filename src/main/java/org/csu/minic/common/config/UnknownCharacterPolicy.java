package org.csu.minic.common.config;

/**
 * 遇到无法识别的字符时词法分析器的处理方式。
 */
public enum UnknownCharacterPolicy {
    FAIL, // 抛出 LexException
    SKIP  // 直接丢弃该字符
}
