package org.csu.minic.common.exception;

/**
 * 词法分析阶段的异常：输入中出现了任何模式都无法匹配的字符。
 */
public class LexException extends CompilationException {

    private final char character;
    private final int line;
    private final int column;

    public LexException(char character, int line, int column) {
        super(String.format("Lexical Error at line %d, column %d: Unexpected character '%s'",
                line, column, character));
        this.character = character;
        this.line = line;
        this.column = column;
    }

    public char getCharacter() {
        return character;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.LEX;
    }
}
