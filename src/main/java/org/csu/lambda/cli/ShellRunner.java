package org.csu.lambda.cli;

import org.csu.lambda.cli.tool.ReductionFormatter;
import org.csu.lambda.common.exception.EvalException;
import org.csu.lambda.common.exception.LexException;
import org.csu.lambda.common.exception.ParseException;
import org.csu.lambda.config.LambdaProperties;
import org.csu.lambda.engine.Evaluator;
import org.csu.lambda.engine.ReductionHistory;
import org.csu.lambda.engine.ReductionProcessor;
import org.csu.lambda.engine.ReductionResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.Scanner;

/**
 * 命令行入口。
 * <p>
 * 用法: {@code lambda-stepper [-i|--interactive] "<expression>"}
 * <ul>
 *     <li>默认 (批处理): 归约到范式后打印一次；</li>
 *     <li>-i: 逐步模式，回车/n 前进一步，p 后退一步，a 归约到底，q 退出。</li>
 * </ul>
 */
@Component
public class ShellRunner implements CommandLineRunner, ExitCodeGenerator {

    static final String USAGE = "Usage: lambda-stepper [-i|--interactive] \"<expression>\"";

    private final LambdaProperties properties;
    private final ReductionProcessor processor;
    private final ReductionFormatter formatter;
    private int exitCode = 0;

    @Autowired
    public ShellRunner(LambdaProperties properties) {
        this(properties, new ReductionProcessor(properties.getMaxSteps()));
    }

    ShellRunner(LambdaProperties properties, ReductionProcessor processor) {
        this.properties = properties;
        this.processor = processor;
        this.formatter = new ReductionFormatter(properties.isColor());
    }

    @Override
    public void run(String... args) {
        exitCode = execute(args, System.in, System.out, System.err);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(String[] args, InputStream in, PrintStream out, PrintStream err) {
        boolean interactive = false;
        String expression = null;
        for (String arg : args) {
            if (arg.equals("-i") || arg.equals("--interactive")) {
                interactive = true;
            } else if (arg.startsWith("--")) {
                // Spring 自己的 --key=value 参数，忽略
                continue;
            } else if (expression == null) {
                expression = arg;
            } else {
                err.println(USAGE);
                return 2;
            }
        }
        if (expression == null) {
            err.println(USAGE);
            return 2;
        }
        return interactive ? runInteractive(expression, in, out, err) : runBatch(expression, out, err);
    }

    int runBatch(String expression, PrintStream out, PrintStream err) {
        ReductionResult result = properties.isTrace() ? processor.trace(expression) : processor.normalize(expression);
        String text = formatter.format(expression, result);
        if (result.isSuccess()) {
            out.println(text);
            return 0;
        }
        err.println(text);
        return 1;
    }

    int runInteractive(String expression, InputStream in, PrintStream out, PrintStream err) {
        Evaluator evaluator;
        try {
            evaluator = new Evaluator(expression);
        } catch (LexException | ParseException e) {
            err.println(formatter.error(e.getMessage()));
            return 1;
        }
        ReductionHistory history = new ReductionHistory(evaluator.getAst());
        out.println(formatter.formatSnapshot(history));
        out.println(evaluator.prettyPrint());

        Scanner scanner = new Scanner(in);
        while (true) {
            out.print("(n)ext (p)rev (a)ll (q)uit> ");
            if (!scanner.hasNextLine()) {
                break;
            }
            String command = scanner.nextLine().trim();
            try {
                if (command.isEmpty() || command.equals("n")) {
                    if (!history.stepForward(evaluator)) {
                        out.println("Normal form reached.");
                        continue;
                    }
                } else if (command.equals("p")) {
                    if (!history.stepBack(evaluator)) {
                        out.println("Already at the first step.");
                        continue;
                    }
                } else if (command.equals("a")) {
                    while (history.stepForward(evaluator)) {
                        // 逐步记录，之后仍可后退
                    }
                } else if (command.equals("q")) {
                    break;
                } else {
                    out.println("Unknown command: " + command);
                    continue;
                }
            } catch (EvalException e) {
                // 求值错误直接结束会话，不做恢复
                err.println(formatter.error(e.getMessage()));
                return 1;
            }
            out.println(formatter.formatSnapshot(history));
            out.println(evaluator.prettyPrint());
        }
        out.println("Bye!");
        return 0;
    }
}
