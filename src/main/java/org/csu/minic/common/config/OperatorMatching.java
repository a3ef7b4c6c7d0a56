package org.csu.minic.common.config;

/**
 * 词法分析时双字符比较运算符的匹配方式。
 */
public enum OperatorMatching {
    /**
     * "<=" 和 ">=" 识别为一个运算符。
     */
    LONGEST_MATCH,
    /**
     * 按模式表顺序先匹配先得："<" 排在 "<=" 之前，所以 "<=" 会被拆成 "<" 和 "="。
     * "==" 和 "!=" 不受影响。
     */
    FIRST_MATCH
}
