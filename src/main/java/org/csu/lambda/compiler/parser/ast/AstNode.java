package org.csu.lambda.compiler.parser.ast;

/**
 * 所有 AST 节点的公共接口。
 * 节点一律不可变，求值器每走一步都会产生新的树，旧的快照可以放心保留。
 */
public sealed interface AstNode permits AtomNode, FunctionNode, ApplicationNode {
}
