package org.csu.lambda.compiler.lexer;

/**
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * lambda 演算的表面语法只有这几类“单词”。空白会被识别，但从不作为 Token 交给语法分析器。
 */
public enum TokenType {
    // ---- 结构符号 ----
    LAMBDA,     // "\"
    DOT,        // "."

    // ---- 标识符 ----
    ATOM,       // 一个或多个 ASCII 字母

    // ---- 分隔符 ----
    LPAREN,     // (
    RPAREN,     // )

    // ---- 特殊 Token ----
    EOF         // End-Of-File，表示输入流结束
}
