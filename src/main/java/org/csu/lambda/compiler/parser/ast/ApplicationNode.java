package org.csu.lambda.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 从左到右的并置，例如 "f a b"。
 * 合法的树中 items 至少有两项；这里不做检查，由求值器在遇到时报错。
 */
public record ApplicationNode(List<AstNode> items) implements AstNode {

    public ApplicationNode {
        items = List.copyOf(items);
    }
}
