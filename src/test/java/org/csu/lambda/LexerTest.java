package org.csu.lambda;

import org.csu.lambda.common.exception.LexException;
import org.csu.lambda.compiler.lexer.Lexer;
import org.csu.lambda.compiler.lexer.Token;
import org.csu.lambda.compiler.lexer.TokenType;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

/**
 * @description: Lexer 类的单元测试 (使用 JUnit 4)
 */
public class LexerTest {

    @Test
    public void testSimpleApplication() {
        System.out.println("--- Running test: testSimpleApplication ---");
        String source = "(\\x.x) a";
        System.out.println("Input: " + source);

        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.tokenize();
        System.out.println("Generated Tokens: " + tokens);

        TokenType[] expectedTypes = {
                TokenType.LPAREN, TokenType.LAMBDA, TokenType.ATOM, TokenType.DOT,
                TokenType.ATOM, TokenType.RPAREN, TokenType.ATOM, TokenType.EOF
        };
        int[] expectedOffsets = {0, 1, 2, 3, 4, 5, 7, 8};

        assertEquals("Token数量不匹配", expectedTypes.length, tokens.size());
        for (int i = 0; i < expectedTypes.length; i++) {
            assertEquals("Token类型不匹配 at index " + i, expectedTypes[i], tokens.get(i).type());
            assertEquals("Token位置不匹配 at index " + i, expectedOffsets[i], tokens.get(i).offset());
        }

        // 结构符号不携带文本
        assertNull(tokens.get(1).lexeme());
        assertEquals("x", tokens.get(2).lexeme());
        assertEquals("a", tokens.get(6).lexeme());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testAtomsUseLongestMatch() {
        System.out.println("--- Running test: testAtomsUseLongestMatch ---");
        List<Token> tokens = new Lexer("\\xy Zz.abc").tokenize();
        System.out.println("Generated Tokens: " + tokens);

        assertEquals(6, tokens.size());
        assertEquals(TokenType.LAMBDA, tokens.get(0).type());
        assertEquals("xy", tokens.get(1).lexeme());
        assertEquals(1, tokens.get(1).offset());
        assertEquals("Zz", tokens.get(2).lexeme());
        assertEquals(4, tokens.get(2).offset());
        assertEquals(TokenType.DOT, tokens.get(3).type());
        assertEquals("abc", tokens.get(4).lexeme());
        assertEquals(new Token(TokenType.EOF, null, 10), tokens.get(5));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testWhitespaceIsSkipped() {
        System.out.println("--- Running test: testWhitespaceIsSkipped ---");
        List<Token> tokens = new Lexer("\t x \n  ").tokenize();

        assertEquals(2, tokens.size());
        assertEquals(new Token(TokenType.ATOM, "x", 2), tokens.get(0));
        // EOF 的位置总是输入长度
        assertEquals(new Token(TokenType.EOF, null, 7), tokens.get(1));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testUnicodeWhitespaceIsSkipped() {
        System.out.println("--- Running test: testUnicodeWhitespaceIsSkipped ---");
        // NBSP, NEL, FIGURE SPACE, NARROW NBSP, IDEOGRAPHIC SPACE
        String[] separators = {"\u00A0", "\u0085", "\u2007", "\u202F", "\u3000"};
        for (String separator : separators) {
            List<Token> tokens = new Lexer("a" + separator + "b").tokenize();
            assertEquals(3, tokens.size());
            assertEquals(new Token(TokenType.ATOM, "a", 0), tokens.get(0));
            assertEquals(new Token(TokenType.ATOM, "b", 2), tokens.get(1));
            assertEquals(new Token(TokenType.EOF, null, 3), tokens.get(2));
        }
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testEmptyInput() {
        Lexer lexer = new Lexer("");
        assertEquals(new Token(TokenType.EOF, null, 0), lexer.advance());
        // 到达末尾后继续调用仍然返回 EOF
        assertEquals(new Token(TokenType.EOF, null, 0), lexer.advance());
    }

    @Test
    public void testResetRewindsCursor() {
        Lexer lexer = new Lexer("f x");
        Token first = lexer.advance();
        lexer.advance();
        assertEquals(TokenType.EOF, lexer.advance().type());

        lexer.reset();
        assertEquals(first, lexer.advance());
        assertEquals(new Token(TokenType.ATOM, "x", 2), lexer.advance());
    }

    @Test
    public void testDigitIsIllegal() {
        System.out.println("--- Running test: testDigitIsIllegal ---");
        Lexer lexer = new Lexer("a1");
        assertEquals(new Token(TokenType.ATOM, "a", 0), lexer.advance());
        try {
            lexer.advance();
            fail("Expected a LexException");
        } catch (LexException e) {
            System.out.println("Caught: " + e.getMessage());
            assertEquals(1, e.getOffset());
            assertEquals("Lexer Error: unexpected character at position 1", e.getMessage());
        }
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testIllegalCharacterOffsets() {
        assertLexErrorAt("x_y", 1);
        assertLexErrorAt("  #", 2);
        assertLexErrorAt("\\x.λ", 3);
        assertLexErrorAt("(f 42)", 3);
    }

    private static void assertLexErrorAt(String source, int offset) {
        try {
            new Lexer(source).tokenize();
            fail("Expected a LexException for: " + source);
        } catch (LexException e) {
            assertEquals("错误位置不匹配: " + source, offset, e.getOffset());
        }
    }
}
