package org.csu.minic.common.exception;

/**
 * 编译失败所处的阶段。
 */
public enum ErrorKind {
    LEX,     // 词法分析
    SYNTAX,  // 语法分析
    CODEGEN  // 代码生成
}
