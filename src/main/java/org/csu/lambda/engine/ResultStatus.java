package org.csu.lambda.engine;

/**
 * 一次处理的结果种类。
 */
public enum ResultStatus {
    OK,
    LEX_ERROR,
    PARSE_ERROR,
    EVAL_ERROR,
    STEP_LIMIT_REACHED
}
