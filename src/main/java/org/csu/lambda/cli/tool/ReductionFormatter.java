package org.csu.lambda.cli.tool;

import org.csu.lambda.engine.ReductionHistory;
import org.csu.lambda.engine.ReductionResult;

/**
 * 一个可重用的工具类，把归约结果和历史快照格式化成控制台文本。
 */
public class ReductionFormatter {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String RED = "\u001B[31m";
    private static final String GREEN = "\u001B[32m";
    private static final String BLUE = "\u001B[34m";

    private final boolean color;

    public ReductionFormatter(boolean color) {
        this.color = color;
    }

    /**
     * 将一次批处理的结果格式化为字符串。
     *
     * @param source 原始输入，用于在词法/语法错误下方标出出错位置
     * @param result 处理结果
     * @return 格式化后的文本 (不带结尾换行)
     */
    public String format(String source, ReductionResult result) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < result.trace().size(); i++) {
            sb.append(paint(BLUE, String.format("%4d", i))).append("  ").append(result.trace().get(i)).append('\n');
        }
        switch (result.status()) {
            case OK:
                sb.append(result.output());
                break;
            case STEP_LIMIT_REACHED:
                sb.append(result.output()).append('\n').append(paint(RED, result.message()));
                break;
            case LEX_ERROR:
            case PARSE_ERROR:
                sb.append(paint(RED, result.message())).append('\n');
                sb.append(source).append('\n');
                sb.append(" ".repeat(result.offset())).append('^');
                break;
            case EVAL_ERROR:
                sb.append(result.output()).append('\n').append(paint(RED, result.message()));
                break;
            default:
                throw new IllegalStateException("Unexpected status: " + result.status());
        }
        return sb.toString();
    }

    /**
     * 格式化历史中的一个快照，例如 "[3/5] (\x.x) applied to [a] => a"。
     */
    public String formatSnapshot(ReductionHistory history) {
        ReductionHistory.Snapshot snapshot = history.current();
        StringBuilder sb = new StringBuilder();
        sb.append(paint(BLUE, "[" + history.getCursor() + "/" + (history.size() - 1) + "]"));
        if (!snapshot.message().isEmpty()) {
            sb.append(' ').append(paint(GREEN, snapshot.message()));
        }
        return sb.toString();
    }

    public String error(String message) {
        return paint(RED, message);
    }

    private String paint(String ansi, String text) {
        return color ? ansi + text + ANSI_RESET : text;
    }
}
