package org.csu.lambda.compiler.parser;

import org.csu.lambda.common.exception.ParseException;
import org.csu.lambda.compiler.lexer.Lexer;
import org.csu.lambda.compiler.lexer.Token;
import org.csu.lambda.compiler.lexer.TokenType;
import org.csu.lambda.compiler.parser.ast.AstNode;
import org.csu.lambda.compiler.parser.ast.ApplicationNode;
import org.csu.lambda.compiler.parser.ast.AtomNode;
import org.csu.lambda.compiler.parser.ast.FunctionNode;

import java.util.ArrayList;
import java.util.List;

/**
 * @description: 语法分析器
 * 采用递归下降法 (单 Token 前瞻、无回溯)，将Token流转换为抽象语法树(AST)
 *
 * <pre>
 * Program      := Statement EOF
 * Statement    := LAMBDA Binding DOT Statement | Application
 * Binding      := ATOM Binding'
 * Binding'     := ATOM Binding' | ε
 * Application  := Expression Application'
 * Application' := Expression Application' | ε
 * Expression   := ATOM | LPAREN Statement RPAREN
 * </pre>
 */
public class Parser {

    private final Lexer lexer;
    private Token current;

    public Parser(String input) {
        this(new Lexer(input));
    }

    public Parser(Lexer lexer) {
        this.lexer = lexer;
    }

    /**
     * 从头开始分析整段输入。可以重复调用，每次都会重置词法分析器。
     */
    public AstNode parse() {
        lexer.reset();
        current = lexer.advance();
        return parseProgram();
    }

    private AstNode parseProgram() {
        AstNode statement = parseStatement();
        consume(TokenType.EOF, "end of input");
        return statement;
    }

    private AstNode parseStatement() {
        if (match(TokenType.LAMBDA)) {
            List<String> params = parseBinding();
            consume(TokenType.DOT, "'.' after parameter list");
            AstNode body = parseStatement();
            return new FunctionNode(params, body);
        }
        if (check(TokenType.LPAREN) || check(TokenType.ATOM)) {
            return parseApplication();
        }
        throw new ParseException(current, "'\\', '(' or an atom");
    }

    private List<String> parseBinding() {
        List<String> params = new ArrayList<>();
        // 至少绑定一个名字
        params.add(consume(TokenType.ATOM, "parameter name").lexeme());
        while (check(TokenType.ATOM)) {
            params.add(advance().lexeme());
        }
        return params;
    }

    private AstNode parseApplication() {
        AstNode first = parseExpression();
        if (!startsExpression()) {
            // 单个表达式不包装成应用节点
            return first;
        }
        List<AstNode> items = new ArrayList<>();
        items.add(first);
        while (startsExpression()) {
            items.add(parseExpression());
        }
        return new ApplicationNode(items);
    }

    private AstNode parseExpression() {
        if (check(TokenType.ATOM)) {
            return new AtomNode(advance().lexeme());
        }
        consume(TokenType.LPAREN, "an atom or '('");
        AstNode statement = parseStatement();
        consume(TokenType.RPAREN, "')' after expression");
        return statement;
    }

    private boolean startsExpression() {
        return check(TokenType.ATOM) || check(TokenType.LPAREN);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String expected) {
        if (check(type)) return advance();
        throw new ParseException(current, expected);
    }

    private boolean check(TokenType type) {
        return current.type() == type;
    }

    /**
     * 返回当前 Token，并向词法分析器要下一个。EOF 之后不再前进。
     */
    private Token advance() {
        Token previous = current;
        if (previous.type() != TokenType.EOF) {
            current = lexer.advance();
        }
        return previous;
    }
}
