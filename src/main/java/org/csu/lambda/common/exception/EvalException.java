package org.csu.lambda.common.exception;

/**
 * @description: 求值阶段的自定义异常
 *
 * expected / got 只在 {@link EvalErrorKind#INSUFFICIENT_ARGUMENTS} 时有意义，其余情况为 -1。
 */
public class EvalException extends RuntimeException {

    private final EvalErrorKind kind;
    private final int expected;
    private final int got;

    private EvalException(EvalErrorKind kind, int expected, int got, String message) {
        super(message);
        this.kind = kind;
        this.expected = expected;
        this.got = got;
    }

    public static EvalException tooFewApplicationItems(int size) {
        return new EvalException(EvalErrorKind.TOO_FEW_APPLICATION_ITEMS, -1, -1,
                "Evaluation Error: application needs at least 2 items, found " + size);
    }

    public static EvalException insufficientArguments(int expected, int got) {
        return new EvalException(EvalErrorKind.INSUFFICIENT_ARGUMENTS, expected, got,
                String.format("Evaluation Error: function expects %d argument(s), but got %d", expected, got));
    }

    public static EvalException unknownNodeKind(Object node) {
        return new EvalException(EvalErrorKind.UNKNOWN_NODE_KIND, -1, -1,
                "Evaluation Error: unknown node kind " + (node == null ? "null" : node.getClass().getSimpleName()));
    }

    public EvalErrorKind getKind() {
        return kind;
    }

    public int getExpected() {
        return expected;
    }

    public int getGot() {
        return got;
    }
}
