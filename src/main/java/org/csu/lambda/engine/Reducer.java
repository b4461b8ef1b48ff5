package org.csu.lambda.engine;

import org.csu.lambda.common.exception.EvalException;
import org.csu.lambda.compiler.parser.ast.AstNode;
import org.csu.lambda.compiler.parser.ast.ApplicationNode;
import org.csu.lambda.compiler.parser.ast.AtomNode;
import org.csu.lambda.compiler.parser.ast.FunctionNode;
import org.csu.lambda.compiler.printer.AstPrinter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * @description: 小步操作语义
 *
 * 最左最外归约：先归约应用中最左边可归约的项 (包括函数位置)，所有项都是范式后，
 * 若头部是函数，就一次性消耗它全部 k 个参数；多余的实参留在结果后面，等待下一步。
 * 所有方法都是纯函数，不修改传入的树。
 */
public final class Reducer {

    private Reducer() {
    }

    /**
     * 执行一步归约。
     *
     * @return 归约后的新树；若该树在此策略下已是范式 (或卡住) 则为空
     * @throws EvalException 应用项不足两个，或函数的实参不够
     */
    public static Optional<Reduction> step(AstNode node) {
        if (node instanceof AtomNode) {
            return Optional.empty();
        }
        if (node instanceof FunctionNode function) {
            return step(function.body())
                    .map(r -> r.withNode(new FunctionNode(function.params(), r.node())));
        }
        if (node instanceof ApplicationNode application) {
            return stepApplication(application);
        }
        throw EvalException.unknownNodeKind(node);
    }

    private static Optional<Reduction> stepApplication(ApplicationNode application) {
        List<AstNode> items = application.items();
        if (items.size() < 2) {
            throw EvalException.tooFewApplicationItems(items.size());
        }

        // 1. 从左到右找第一个可以归约的项，只替换这一项
        for (int i = 0; i < items.size(); i++) {
            Optional<Reduction> reduced = step(items.get(i));
            if (reduced.isPresent()) {
                List<AstNode> replaced = new ArrayList<>(items);
                replaced.set(i, reduced.get().node());
                return Optional.of(reduced.get().withNode(new ApplicationNode(replaced)));
            }
        }

        // 2. 所有项都是范式，头部不是函数 => 卡住
        if (!(items.get(0) instanceof FunctionNode function)) {
            return Optional.empty();
        }

        // 3. 头部是函数：要么一次吃掉全部参数，要么报错，绝不部分应用
        int arity = function.arity();
        int available = items.size() - 1;
        if (available < arity) {
            throw EvalException.insufficientArguments(arity, available);
        }
        List<AstNode> args = items.subList(1, 1 + arity);
        AstNode result = apply(function, args);

        List<AstNode> remaining = new ArrayList<>();
        remaining.add(result);
        remaining.addAll(items.subList(1 + arity, items.size()));
        AstNode next = remaining.size() == 1 ? result : new ApplicationNode(remaining);
        return Optional.of(new Reduction(next, describe(function, args, result)));
    }

    /**
     * 把 {@code args[i]} 同时代入函数体中所有自由出现的 {@code params[i]}。
     * <p>
     * 只处理内层函数直接重新绑定同名参数的遮蔽情况，不做 alpha 重命名：
     * 实参中的自由变量可能被内层无关的绑定捕获，这是有意保留的行为。
     */
    public static AstNode apply(FunctionNode function, List<AstNode> args) {
        if (args.size() != function.arity()) {
            throw new IllegalArgumentException("Expected " + function.arity() + " argument(s), got " + args.size());
        }
        return substitute(function.body(), function.params(), args);
    }

    private static AstNode substitute(AstNode node, List<String> params, List<AstNode> args) {
        if (node instanceof AtomNode atom) {
            int index = params.indexOf(atom.name());
            return index >= 0 ? args.get(index) : atom;
        }
        if (node instanceof FunctionNode inner) {
            // 被内层参数遮蔽的名字不再代入
            List<String> keptParams = new ArrayList<>();
            List<AstNode> keptArgs = new ArrayList<>();
            for (int i = 0; i < params.size(); i++) {
                if (!inner.params().contains(params.get(i))) {
                    keptParams.add(params.get(i));
                    keptArgs.add(args.get(i));
                }
            }
            return new FunctionNode(inner.params(), substitute(inner.body(), keptParams, keptArgs));
        }
        if (node instanceof ApplicationNode application) {
            List<AstNode> items = application.items().stream()
                    .map(item -> substitute(item, params, args))
                    .collect(Collectors.toList());
            return new ApplicationNode(items);
        }
        throw EvalException.unknownNodeKind(node);
    }

    private static String describe(FunctionNode function, List<AstNode> args, AstNode result) {
        String printedArgs = args.stream().map(AstPrinter::print).collect(Collectors.joining(", ", "[", "]"));
        return AstPrinter.print(function) + " applied to " + printedArgs + " => " + AstPrinter.print(result);
    }
}
