package org.csu.lambda.compiler.lexer;

import org.csu.lambda.common.exception.LexException;

import java.util.ArrayList;
import java.util.List;

/**
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的 lambda 表达式按需分解为 Token。与一次性切分不同，这里每调用一次
 * {@link #advance()} 才向前读取一个 Token，语法分析器只需要一个 Token 的前瞻。
 * 各规则的字符类互不相交 (字母 / 标点 / 空白)，所以任一位置至多只有一条规则能匹配。
 */
public class Lexer {

    private final String input;
    private int position = 0; // 当前读取的位置

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 将读取位置重置到输入开头，用于对同一段源码重新分析。
     */
    public void reset() {
        position = 0;
    }

    /**
     * 执行完整的词法分析并返回所有Token (最后一个总是 EOF)
     * @return Token列表
     */
    public List<Token> tokenize() {
        reset();
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = advance();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    /**
     * 获取下一个Token
     * @return 从当前位置开始的下一个Token；到达输入末尾时返回 offset 为输入长度的 EOF
     * @throws LexException 当前位置的字符不属于任何规则
     */
    public Token advance() {
        skipWhitespace();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, null, input.length());
        }

        char currentChar = peek();

        switch (currentChar) {
            case '\\':
                return consumeAndReturn(TokenType.LAMBDA);
            case '.':
                return consumeAndReturn(TokenType.DOT);
            case '(':
                return consumeAndReturn(TokenType.LPAREN);
            case ')':
                return consumeAndReturn(TokenType.RPAREN);
            default:
                break;
        }

        // 识别原子 (最长匹配)
        if (isLetter(currentChar)) {
            return readAtom();
        }

        throw new LexException(position);
    }

    private Token readAtom() {
        int startPos = position;
        while (position < input.length() && isLetter(peek())) {
            position++;
        }
        return new Token(TokenType.ATOM, input.substring(startPos, position), startPos);
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        while (position < input.length() && isWhitespace(peek())) {
            position++;
        }
    }

    /**
     * Unicode 空白：包括 NBSP (U+00A0)、NEL (U+0085) 等 isWhitespace 不认的字符。
     */
    private boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\u0085';
    }

    private char peek() {
        return input.charAt(position);
    }

    private Token consumeAndReturn(TokenType type) {
        Token token = new Token(type, null, position);
        position++;
        return token;
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
