package org.csu.handc.compiler.lexer;

import org.csu.handc.common.exception.LexException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * @author hidyouth
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将 hand 源程序分解为一系列的Token。
 * 按需产生Token（惰性、单遍、不可重置）；遇到无法识别的字符立即失败。
 */
public class Lexer implements Iterator<Token> {

    private final String input;
    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int column = 1;   // 当前列号

    // 关键字映射表，区分大小写
    private static final Map<String, TokenType> keywords = Map.of(
            "let", TokenType.LET,
            "loop", TokenType.LOOP,
            "print", TokenType.PRINT
    );

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 一次性执行词法分析并返回所有Token
     * @return Token列表，不含结束标记
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (hasNext()) {
            tokens.add(next());
        }
        return tokens;
    }

    /**
     * 跳过空白后判断是否还有输入。输入结束不是错误。
     */
    @Override
    public boolean hasNext() {
        skipWhitespace();
        return position < input.length();
    }

    /**
     * 获取下一个Token
     * @return 解析出的下一个Token
     */
    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more tokens");
        }

        char currentChar = peek();

        // 识别标识符或关键字
        if (Character.isAlphabetic(input.codePointAt(position))) {
            return readIdentifierOrKeyword();
        }

        // 识别数字
        if (isDigit(currentChar)) {
            return readNumber();
        }

        // 识别运算符和分隔符
        switch (currentChar) {
            case '+':
                return consumeAndReturn(TokenType.PLUS, "+");
            case '=':
                return consumeAndReturn(TokenType.EQUALS, "=");
            case ';':
                return consumeAndReturn(TokenType.SEMICOLON, ";");
            case '{':
                return consumeAndReturn(TokenType.LBRACE, "{");
            case '}':
                return consumeAndReturn(TokenType.RBRACE, "}");
            default:
                throw new LexException("Unexpected character '" + currentChar + "'", line, column);
        }
    }

    private Token readIdentifierOrKeyword() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isIdentifierPart(input.codePointAt(position))) {
            advanceCodePoint();
        }
        String text = input.substring(startPos, position);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        return new Token(type, text, line, startCol);
    }

    private Token readNumber() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isDigit(peek())) {
            advance();
        }
        String number = input.substring(startPos, position);
        try {
            Integer.parseInt(number);
        } catch (NumberFormatException e) {
            throw new LexException("Integer literal out of range: " + number, line, startCol);
        }
        return new Token(TokenType.NUMBER, number, line, startCol);
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        while (position < input.length()) {
            char ch = peek();
            if (ch == '\n') {
                line++;
                column = 0; // advance会加1，所以这里设为0
                advance();
            } else if (Character.isWhitespace(ch) || Character.isSpaceChar(ch)) {
                advance();
            } else {
                break;
            }
        }
    }

    private char peek() {
        return input.charAt(position);
    }

    private void advance() {
        position++;
        column++;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, line, column);
        advance();
        return token;
    }

    // 字母或任意数字类字符 (Nd/Nl/No)，如 x²、Ⅻ
    private boolean isIdentifierPart(int codePoint) {
        if (Character.isAlphabetic(codePoint)) {
            return true;
        }
        int type = Character.getType(codePoint);
        return type == Character.DECIMAL_DIGIT_NUMBER
                || type == Character.LETTER_NUMBER
                || type == Character.OTHER_NUMBER;
    }

    // 代理对算作一列
    private void advanceCodePoint() {
        position += Character.charCount(input.codePointAt(position));
        column++;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
