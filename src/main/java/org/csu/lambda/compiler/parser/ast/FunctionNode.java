package org.csu.lambda.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 多参数的抽象，例如 "\x y.x"。
 * 参数列表至少有一个名字 (由文法保证)，允许重名。
 */
public record FunctionNode(List<String> params, AstNode body) implements AstNode {

    public FunctionNode {
        params = List.copyOf(params);
    }

    public int arity() {
        return params.size();
    }
}
