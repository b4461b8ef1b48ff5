package org.csu.lambda.engine;

import lombok.Getter;
import org.csu.lambda.compiler.parser.ast.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * @description: 归约历史
 *
 * 只追加的快照序列，按步号寻址 (第 0 项是初始的树)。界面只需移动游标即可前进/后退，
 * 不必重新推导。树本身不可变，所以直接保存引用就是按值保存。
 */
public class ReductionHistory {

    /**
     * 一个快照：某一步之后的整棵树，以及产生它的那次归约的描述 (第 0 项为空串)。
     */
    public record Snapshot(AstNode ast, String message) {
    }

    private final List<Snapshot> snapshots = new ArrayList<>();
    @Getter
    private int cursor = 0;

    public ReductionHistory(AstNode initial) {
        snapshots.add(new Snapshot(initial, ""));
    }

    public Snapshot current() {
        return snapshots.get(cursor);
    }

    public Snapshot get(int index) {
        return snapshots.get(index);
    }

    public int size() {
        return snapshots.size();
    }

    public boolean atLatest() {
        return cursor == snapshots.size() - 1;
    }

    public List<Snapshot> snapshots() {
        return Collections.unmodifiableList(snapshots);
    }

    /**
     * 在末尾追加一个新快照并把游标移到它上面。已有的记录从不删除或覆盖。
     */
    void record(AstNode ast, String message) {
        snapshots.add(new Snapshot(ast, message));
        cursor = snapshots.size() - 1;
    }

    /**
     * @return 游标是否移动了
     */
    public boolean back() {
        if (cursor == 0) {
            return false;
        }
        cursor--;
        return true;
    }

    public boolean forward() {
        if (atLatest()) {
            return false;
        }
        cursor++;
        return true;
    }

    /**
     * 前进一步：已有记录时直接复用，否则让求值器从当前快照归约一次并记录下来。
     *
     * @return 是否前进了 (到达范式时为 false)
     * @throws org.csu.lambda.common.exception.EvalException 归约出错
     */
    public boolean stepForward(Evaluator evaluator) {
        if (forward()) {
            evaluator.restore(current().ast(), cursor);
            return true;
        }
        evaluator.restore(current().ast(), cursor);
        if (!evaluator.reduceOnce()) {
            return false;
        }
        record(evaluator.getAst(), evaluator.getMessage());
        return true;
    }

    /**
     * 后退一步，并把求值器恢复到那个快照。
     */
    public boolean stepBack(Evaluator evaluator) {
        if (!back()) {
            return false;
        }
        evaluator.restore(current().ast(), cursor);
        return true;
    }
}
