package org.csu.lambda.common.exception;

/**
 * 词法分析阶段的自定义异常：当前位置没有任何规则能够匹配。
 */
public class LexException extends RuntimeException {

    private final int offset;

    public LexException(int offset) {
        super("Lexer Error: unexpected character at position " + offset);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
