package org.csu.lambda.compiler.parser.ast;

/**
 * AST 节点: 变量引用，例如 "x"。
 */
public record AtomNode(String name) implements AstNode {
}
