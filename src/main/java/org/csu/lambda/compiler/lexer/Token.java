package org.csu.lambda.compiler.lexer;

/**
 * @param type   词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本，只有 ATOM 携带，结构符号为 null
 * @param offset 在输入中的起始位置 (从 0 开始)
 */
public record Token(TokenType type, String lexeme, int offset) {

    @Override
    public String toString() {
        // 重写toString方法，方便调试和打印
        return String.format("Token[Type=%-6s, Lexeme=%s, Offset=%d]",
                type, lexeme == null ? "-" : "'" + lexeme + "'", offset);
    }
}
