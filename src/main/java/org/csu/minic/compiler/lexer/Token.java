package org.csu.minic.compiler.lexer;

/**
 * 词法分析器产出的一个 Token，位置从 1 开始计数。
 *
 * @param type   种别
 * @param lexeme 源码中的原始文本，EOF 为空串
 * @param line   首字符所在行
 * @param column 首字符所在列
 */
public record Token(TokenType type, String lexeme, int line, int column) {

    @Override
    public String toString() {
        // 类型左对齐，--tokens 输出时各列对齐
        return String.format("Token[Type=%-10s, Lexeme='%s', Position=%d:%d]",
                type, lexeme, line, column);
    }
}
