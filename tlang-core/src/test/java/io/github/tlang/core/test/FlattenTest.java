package io.github.tlang.core.test;

import io.github.tlang.core.ir.*;
import io.github.tlang.core.ir.expr.BinaryOpExpr;
import io.github.tlang.core.ir.expr.Flattener;
import io.github.tlang.core.ir.expr.IdExpr;
import io.github.tlang.core.ops.BinaryOpType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FlattenTest {
    private static LocalLoadStmt assertLoad(Stmt stmt, IdExpr local) {
        LocalLoadStmt load = assertInstanceOf(LocalLoadStmt.class, stmt);
        assertSame(local.id, load.id);
        return load;
    }

    @Test
    void testSimpleBinary() {
        IdExpr a = IdExpr.declare("a");
        IdExpr b = IdExpr.declare("b");
        VecStatement vec = Flattener.flatten(a.add(b));

        assertEquals(3, vec.size());
        LocalLoadStmt loadA = assertLoad(vec.get(0), a);
        LocalLoadStmt loadB = assertLoad(vec.get(1), b);
        BinaryOpStmt bin = assertInstanceOf(BinaryOpStmt.class, vec.get(2));
        assertEquals(BinaryOpType.ADD, bin.op);
        assertSame(loadA, bin.lhs);
        assertSame(loadB, bin.rhs);
        assertSame(bin, vec.back());
    }

    @Test
    void testLeftNested() {
        IdExpr a = IdExpr.declare("a");
        IdExpr b = IdExpr.declare("b");
        IdExpr c = IdExpr.declare("c");
        VecStatement vec = Flattener.flatten(a.add(b).add(c));

        assertEquals(5, vec.size());
        LocalLoadStmt loadA = assertLoad(vec.get(0), a);
        LocalLoadStmt loadB = assertLoad(vec.get(1), b);
        BinaryOpStmt first = assertInstanceOf(BinaryOpStmt.class, vec.get(2));
        LocalLoadStmt loadC = assertLoad(vec.get(3), c);
        BinaryOpStmt second = assertInstanceOf(BinaryOpStmt.class, vec.get(4));

        assertSame(loadA, first.lhs);
        assertSame(loadB, first.rhs);
        assertSame(first, second.lhs);
        assertSame(loadC, second.rhs);
    }

    @Test
    void testRightNestedEvaluatesLeftFirst() {
        IdExpr a = IdExpr.declare("a");
        IdExpr b = IdExpr.declare("b");
        IdExpr c = IdExpr.declare("c");
        VecStatement vec = Flattener.flatten(a.mul(b.sub(c)));

        assertEquals(5, vec.size());
        assertLoad(vec.get(0), a);
        assertLoad(vec.get(1), b);
        assertLoad(vec.get(2), c);
        BinaryOpStmt sub = assertInstanceOf(BinaryOpStmt.class, vec.get(3));
        BinaryOpStmt mul = assertInstanceOf(BinaryOpStmt.class, vec.get(4));
        assertEquals(BinaryOpType.SUB, sub.op);
        assertSame(vec.get(0), mul.lhs);
        assertSame(sub, mul.rhs);
    }

    @Test
    void testConstant() {
        IdExpr x = IdExpr.declare("x");
        VecStatement vec = Flattener.flatten(x.add(1));

        assertEquals(3, vec.size());
        ConstStmt one = assertInstanceOf(ConstStmt.class, vec.get(1));
        assertEquals(1, one.value);
        assertEquals(DataType.I32, one.type);
    }

    @Test
    void testSharedSubtreeMaterializedOnce() {
        IdExpr a = IdExpr.declare("a");
        BinaryOpExpr shared = a.add(1);
        VecStatement vec = Flattener.flatten(shared.mul(shared));

        // load a, const 1, add, mul
        assertEquals(4, vec.size());
        BinaryOpStmt mul = assertInstanceOf(BinaryOpStmt.class, vec.back());
        assertSame(vec.get(2), mul.lhs);
        assertSame(vec.get(2), mul.rhs);
    }

    @Test
    void testEqualButDistinctSubtreesNotMerged() {
        IdExpr a = IdExpr.declare("a");
        VecStatement vec = Flattener.flatten(a.add(1).mul(a.add(1)));

        // (load a, const 1, add) twice, then mul
        assertEquals(7, vec.size());
        BinaryOpStmt mul = assertInstanceOf(BinaryOpStmt.class, vec.back());
        assertNotSame(mul.lhs, mul.rhs);
    }

    @Test
    void testEachValueConsumedOnce() {
        IdExpr a = IdExpr.declare("a");
        IdExpr b = IdExpr.declare("b");
        IdExpr c = IdExpr.declare("c");
        VecStatement vec = Flattener.flatten(a.add(b).div(c.sub(2)));

        for (Stmt produced : vec) {
            int uses = 0;
            for (Stmt consumer : vec) {
                for (Stmt operand : consumer.operands()) {
                    if (operand == produced) uses++;
                }
            }
            assertEquals(produced == vec.back() ? 0 : 1, uses, () -> "uses of " + produced);
        }
    }

    @Test
    void testFlattenedStatementsAreUnowned() {
        IdExpr a = IdExpr.declare("a");
        VecStatement vec = Flattener.flatten(a.lt(500));
        for (Stmt stmt : vec) {
            assertNull(stmt.getParent());
        }
    }
}
