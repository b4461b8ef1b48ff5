package org.csu.lambda.engine;

import org.csu.lambda.common.exception.EvalErrorKind;

import java.util.List;

/**
 * 封装一次归约处理的所有结果信息。出错时不抛异常，而是把错误种类和字段带回来。
 *
 * @param status     结果种类
 * @param output     最终 (或出错前最后一棵) 树的规范文本；词法/语法错误时为 null
 * @param steps      实际执行的归约步数
 * @param trace      每一步之后的树 (第 0 项是初始树)，只在 trace 模式下填充
 * @param offset     词法/语法错误的位置，其他情况为 -1
 * @param evalError  求值错误的种类，其他情况为 null
 * @param expected   INSUFFICIENT_ARGUMENTS 时函数的参数个数，其他情况为 -1
 * @param got        INSUFFICIENT_ARGUMENTS 时实际的实参个数，其他情况为 -1
 * @param message    给人看的描述
 */
public record ReductionResult(
        ResultStatus status,
        String output,
        int steps,
        List<String> trace,
        int offset,
        EvalErrorKind evalError,
        int expected,
        int got,
        String message
) {
    public ReductionResult {
        trace = List.copyOf(trace);
    }

    public static ReductionResult newSuccessResult(String output, int steps, List<String> trace) {
        return new ReductionResult(ResultStatus.OK, output, steps, trace, -1, null, -1, -1,
                "Normal form reached after " + steps + " step(s).");
    }

    public static ReductionResult newStepLimitResult(String output, int steps, List<String> trace) {
        return new ReductionResult(ResultStatus.STEP_LIMIT_REACHED, output, steps, trace, -1, null, -1, -1,
                "Stopped after " + steps + " step(s) without reaching a normal form.");
    }

    public static ReductionResult newLexErrorResult(int offset, String message) {
        return new ReductionResult(ResultStatus.LEX_ERROR, null, 0, List.of(), offset, null, -1, -1, message);
    }

    public static ReductionResult newParseErrorResult(int offset, String message) {
        return new ReductionResult(ResultStatus.PARSE_ERROR, null, 0, List.of(), offset, null, -1, -1, message);
    }

    public static ReductionResult newEvalErrorResult(String output, int steps, List<String> trace,
                                                     EvalErrorKind kind, int expected, int got, String message) {
        return new ReductionResult(ResultStatus.EVAL_ERROR, output, steps, trace, -1, kind, expected, got, message);
    }

    public boolean isSuccess() {
        return status == ResultStatus.OK;
    }
}
