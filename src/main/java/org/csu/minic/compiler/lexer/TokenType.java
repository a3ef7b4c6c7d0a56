package org.csu.minic.compiler.lexer;

/**
 * @author hidyouth
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * description 用在语法错误信息里，描述“期望的是什么”。
 */
public enum TokenType {
    // ---- 关键字 (Keywords) ----
    IF("'if'"),
    ELSE("'else'"),

    // ---- 常量与标识符 ----
    NUMBER("a number"),
    IDENTIFIER("an identifier"),

    // ---- 算术运算符 ----
    PLUS("'+'"),
    MINUS("'-'"),
    MULTIPLY("'*'"),
    DIVIDE("'/'"),

    // ---- 比较运算符 ----
    EQ("'=='"),
    NEQ("'!='"),
    LT("'<'"),
    GT("'>'"),
    LE("'<='"),
    GE("'>='"),

    ASSIGN("'='"),

    // ---- 分隔符 (Delimiters) ----
    LPAREN("'('"),
    RPAREN("')'"),
    LBRACE("'{'"),
    RBRACE("'}'"),
    SEMICOLON("';'"),

    // ---- 特殊 Token ----
    EOF("end of input");

    private final String description;

    TokenType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
