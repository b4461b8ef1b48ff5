package org.csu.lambda.engine;

import org.csu.lambda.compiler.parser.ast.AstNode;

/**
 * 一次归约的结果：新的树，以及对最近一次 beta 归约的文字描述。
 *
 * @param node    归约后的整棵 (子) 树
 * @param message 例如 "(\x.x) applied to [a] => a"
 */
public record Reduction(AstNode node, String message) {

    Reduction withNode(AstNode replacement) {
        return new Reduction(replacement, message);
    }
}
