package org.csu.lambda.common.exception;

/**
 * 求值阶段的错误种类。
 */
public enum EvalErrorKind {
    TOO_FEW_APPLICATION_ITEMS,  // 应用节点少于两项，语法分析器不会产生这种树
    INSUFFICIENT_ARGUMENTS,     // 函数后面跟随的实参不够
    UNKNOWN_NODE_KIND           // 不认识的节点类型
}
