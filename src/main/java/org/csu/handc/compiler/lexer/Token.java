package org.csu.handc.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本 (词素值)
 * @param line 所在的行号
 * @param column 所在的列号
 */
public record Token(TokenType type, String lexeme, int line, int column) {

    /**
     * 不关心位置信息时使用，主要方便测试中构造期望的Token序列。
     */
    public static Token of(TokenType type, String lexeme) {
        return new Token(type, lexeme, 0, 0);
    }

    /**
     * NUMBER 类型Token的整数值。词法分析阶段已经保证不会溢出。
     */
    public int intValue() {
        if (type != TokenType.NUMBER) {
            throw new IllegalStateException("Token " + type + " has no integer value");
        }
        return Integer.parseInt(lexeme);
    }

    /**
     * 只比较种别码和词素，忽略位置。
     */
    public boolean sameAs(Token other) {
        return other != null && type == other.type && lexeme.equals(other.lexeme);
    }

    @Override
    public String toString() {
        // 重写toString方法，方便调试和打印
        return String.format("Token[Type=%-10s, Lexeme='%s', Position=%d:%d]",
                type, lexeme, line, column);
    }
}
