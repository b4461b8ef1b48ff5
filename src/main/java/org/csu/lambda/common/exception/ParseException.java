package org.csu.lambda.common.exception;

import org.csu.lambda.compiler.lexer.Token;

/**
 * 语法分析阶段的自定义异常，offset 指向出错的那个 Token。
 */
public class ParseException extends RuntimeException {

    private final int offset;

    public ParseException(Token token, String expected) {
        super(String.format("Parsing Error: Unexpected token at position %d: Expected %s, but found %s",
                token.offset(),
                expected,
                token.lexeme() == null ? token.type() : "'" + token.lexeme() + "' (" + token.type() + ")"));
        this.offset = token.offset();
    }

    public int getOffset() {
        return offset;
    }
}
