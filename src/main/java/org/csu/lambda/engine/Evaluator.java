package org.csu.lambda.engine;

import lombok.Getter;
import org.csu.lambda.compiler.parser.Parser;
import org.csu.lambda.compiler.parser.ast.AstNode;
import org.csu.lambda.compiler.printer.AstPrinter;

import java.util.Optional;

/**
 * 求值器：持有当前的树，供驱动程序一步一步地推进。
 * 每一步都替换为新的树，调用方之前拿到的快照不会被改动。
 */
public class Evaluator {

    @Getter
    private AstNode ast;
    @Getter
    private String message = "";
    /**
     * 这个求值器已提交的归约次数。用 {@link #restore} 恢复快照时会一并改成快照所在的步号。
     */
    @Getter
    private int stepCount = 0;

    /**
     * @throws org.csu.lambda.common.exception.LexException   源码中有非法字符
     * @throws org.csu.lambda.common.exception.ParseException 源码不符合文法
     */
    public Evaluator(String source) {
        this(new Parser(source).parse());
    }

    public Evaluator(AstNode ast) {
        this.ast = ast;
    }

    /**
     * 换成另一棵树。树从哪一步来不得而知，所以步数归零。
     */
    public void setAst(AstNode ast) {
        restore(ast, 0);
    }

    /**
     * 恢复到历史中第 step 步的快照。
     */
    public void restore(AstNode ast, int step) {
        this.ast = ast;
        this.message = "";
        this.stepCount = step;
    }

    /**
     * @return 是否发生了一次归约
     */
    public boolean reduceOnce() {
        Optional<Reduction> reduction = Reducer.step(ast);
        if (reduction.isEmpty()) {
            return false;
        }
        commit(reduction.get());
        return true;
    }

    /**
     * 反复归约直到范式。不限制步数，不终止的项会一直运行下去。
     */
    public AstNode reduceAll() {
        while (reduceOnce()) {
            // keep stepping
        }
        return ast;
    }

    /**
     * 当前的树是否已不能再归约。
     *
     * @throws org.csu.lambda.common.exception.EvalException 下一步会出错
     */
    public boolean isNormalForm() {
        return Reducer.step(ast).isEmpty();
    }

    public String prettyPrint() {
        return AstPrinter.print(ast);
    }

    private void commit(Reduction reduction) {
        this.ast = reduction.node();
        this.message = reduction.message();
        this.stepCount++;
    }
}
