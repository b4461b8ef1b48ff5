package org.csu.lambda.engine;

import org.csu.lambda.common.exception.EvalException;
import org.csu.lambda.common.exception.LexException;
import org.csu.lambda.common.exception.ParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * @description: 归约处理入口
 *
 * 串起 词法 -> 语法 -> 求值 三个阶段，把各阶段的异常统一转换成 {@link ReductionResult}，
 * 调用方只需要看结果的 status，不需要 try/catch。
 */
public class ReductionProcessor {

    private final int maxSteps;

    /**
     * @param maxSteps 最多归约多少步，0 表示不限制
     */
    public ReductionProcessor(int maxSteps) {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must not be negative: " + maxSteps);
        }
        this.maxSteps = maxSteps;
    }

    public ReductionProcessor() {
        this(0);
    }

    /**
     * 归约到范式，只返回最终结果。
     */
    public ReductionResult normalize(String source) {
        return run(source, false);
    }

    /**
     * 归约到范式，同时记录每一步之后的树。
     */
    public ReductionResult trace(String source) {
        return run(source, true);
    }

    private ReductionResult run(String source, boolean keepTrace) {
        Evaluator evaluator;
        try {
            evaluator = new Evaluator(source);
        } catch (LexException e) {
            return ReductionResult.newLexErrorResult(e.getOffset(), e.getMessage());
        } catch (ParseException e) {
            return ReductionResult.newParseErrorResult(e.getOffset(), e.getMessage());
        }

        List<String> trace = new ArrayList<>();
        if (keepTrace) {
            trace.add(evaluator.prettyPrint());
        }
        try {
            while (maxSteps == 0 || evaluator.getStepCount() < maxSteps) {
                if (!evaluator.reduceOnce()) {
                    return ReductionResult.newSuccessResult(evaluator.prettyPrint(), evaluator.getStepCount(), trace);
                }
                if (keepTrace) {
                    trace.add(evaluator.prettyPrint());
                }
            }
            if (evaluator.isNormalForm()) {
                return ReductionResult.newSuccessResult(evaluator.prettyPrint(), evaluator.getStepCount(), trace);
            }
            return ReductionResult.newStepLimitResult(evaluator.prettyPrint(), evaluator.getStepCount(), trace);
        } catch (EvalException e) {
            return ReductionResult.newEvalErrorResult(evaluator.prettyPrint(), evaluator.getStepCount(), trace,
                    e.getKind(), e.getExpected(), e.getGot(), e.getMessage());
        }
    }
}
