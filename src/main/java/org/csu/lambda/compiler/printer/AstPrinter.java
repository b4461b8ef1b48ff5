package org.csu.lambda.compiler.printer;

import org.csu.lambda.common.exception.EvalException;
import org.csu.lambda.compiler.parser.ast.AstNode;
import org.csu.lambda.compiler.parser.ast.ApplicationNode;
import org.csu.lambda.compiler.parser.ast.AtomNode;
import org.csu.lambda.compiler.parser.ast.FunctionNode;

import java.util.stream.Collectors;

/**
 * 把 AST 还原成规范的文本形式，只加必要的括号。
 * 输出总能被 {@link org.csu.lambda.compiler.parser.Parser} 重新解析成结构相同的树。
 */
public final class AstPrinter {

    private AstPrinter() {
    }

    public static String print(AstNode node) {
        return print(node, false, false);
    }

    /**
     * @param insideApplication 该节点是否直接位于某个应用节点中
     * @param functionBody      该节点是否紧跟在某个函数的 '.' 之后
     */
    private static String print(AstNode node, boolean insideApplication, boolean functionBody) {
        if (node instanceof AtomNode atom) {
            return atom.name();
        }
        if (node instanceof ApplicationNode application) {
            String joined = application.items().stream()
                    .map(item -> print(item, true, false))
                    .collect(Collectors.joining(" "));
            return insideApplication ? "(" + joined + ")" : joined;
        }
        if (node instanceof FunctionNode function) {
            String text = "\\" + String.join(" ", function.params()) + "." + print(function.body(), false, true);
            // 连续的函数体不重复加括号: \x.\y.x
            return functionBody ? text : "(" + text + ")";
        }
        throw EvalException.unknownNodeKind(node);
    }
}
