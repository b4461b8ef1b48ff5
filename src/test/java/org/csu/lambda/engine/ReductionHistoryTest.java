package org.csu.lambda.engine;

import org.csu.lambda.compiler.parser.ast.AtomNode;
import org.csu.lambda.compiler.printer.AstPrinter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ReductionHistoryTest {

    private Evaluator evaluator;
    private ReductionHistory history;

    @BeforeEach
    void setUp() {
        evaluator = new Evaluator("(\\x.x) ((\\y.y) a)");
        history = new ReductionHistory(evaluator.getAst());
    }

    @Test
    void testStepForwardRecordsEverySnapshot() {
        assertEquals(1, history.size());
        assertTrue(history.stepForward(evaluator));
        assertEquals("(\\x.x) a", evaluator.prettyPrint());
        assertTrue(history.stepForward(evaluator));
        assertEquals("a", evaluator.prettyPrint());
        assertFalse(history.stepForward(evaluator));

        assertEquals(3, history.size());
        assertEquals(2, history.getCursor());
        assertTrue(history.atLatest());
        assertEquals("", history.get(0).message());
        assertEquals("(\\y.y) applied to [a] => a", history.get(1).message());
        assertEquals("(\\x.x) applied to [a] => a", history.get(2).message());
    }

    @Test
    void testBackAndForwardReuseSnapshots() {
        history.stepForward(evaluator);
        history.stepForward(evaluator);

        assertTrue(history.stepBack(evaluator));
        assertEquals("(\\x.x) a", evaluator.prettyPrint());
        assertTrue(history.stepBack(evaluator));
        assertEquals("(\\x.x) ((\\y.y) a)", evaluator.prettyPrint());
        assertFalse(history.stepBack(evaluator));
        assertEquals(0, history.getCursor());

        // 前进时复用已有的快照，而不是重新归约
        assertTrue(history.stepForward(evaluator));
        assertSame(history.get(1).ast(), evaluator.getAst());
        assertEquals(3, history.size());
    }

    @Test
    void testRecordAlwaysAppends() {
        history.stepForward(evaluator);
        history.stepForward(evaluator);
        history.back();
        history.back();

        history.record(new AtomNode("z"), "manual");
        // 历史只追加：之前的快照全部保留，新快照排在最后
        assertEquals(4, history.size());
        assertEquals(3, history.getCursor());
        assertEquals(new AtomNode("z"), history.current().ast());
        assertEquals("(\\x.x) a", AstPrinter.print(history.get(1).ast()));
        assertEquals("a", AstPrinter.print(history.get(2).ast()));
        assertFalse(history.forward());
    }

    @Test
    void testStepCountFollowsTheCursor() {
        history.stepForward(evaluator);
        history.stepForward(evaluator);
        assertEquals(2, evaluator.getStepCount());

        history.stepBack(evaluator);
        assertEquals(1, evaluator.getStepCount());
        history.stepBack(evaluator);
        assertEquals(0, evaluator.getStepCount());

        history.stepForward(evaluator);
        assertEquals(history.getCursor(), evaluator.getStepCount());
        history.stepForward(evaluator);
        assertFalse(history.stepForward(evaluator));
        assertEquals(2, evaluator.getStepCount());
        assertEquals(3, history.size());
    }

    @Test
    void testSnapshotsViewIsReadOnly() {
        assertThrows(UnsupportedOperationException.class,
                () -> history.snapshots().add(new ReductionHistory.Snapshot(new AtomNode("q"), "")));
    }
}
