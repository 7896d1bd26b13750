package io.github.tlang.core.test;

import io.github.tlang.core.ext.MetadataState;
import io.github.tlang.core.ir.*;
import io.github.tlang.core.ir.expr.IdExpr;
import io.github.tlang.core.passes.form.LowerAST;
import io.github.tlang.core.passes.meta.CountHighLevelStmts;
import io.github.tlang.core.passes.meta.TypeCheck;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TypeCheckTest {
    @Test
    void testLowersFirst() {
        StmtList root = Utils.demoProgram();
        TypeCheck.run(root);

        assertEquals(0, CountHighLevelStmts.count(root));
        MetadataState state = MetadataState.of(root);
        assertTrue(state.isValid(MetadataState.LOWERED));
        assertTrue(state.isValid(MetadataState.TYPES_INFERRED));
    }

    @Test
    void testTypes() {
        IdExpr x = IdExpr.declare("x");
        IdExpr i = IdExpr.declare("i");
        StmtList root = IRBuilder.build(ib -> {
            ib.alloca(DataType.F64, x);
            ib.assign(x, x.mul(2L));
            ib.print(x.gt(0));
            ib.forRange(i, 0, 4, body -> body.print(i));
        });
        TypeCheck.run(root);

        // x * 2L
        assertEquals(DataType.F64, root.get(1).type);
        assertEquals(DataType.I64, root.get(2).type);
        assertEquals(DataType.F64, root.get(3).type);
        // x > 0
        assertEquals(DataType.I32, root.get(7).type);
        assertEquals(DataType.I32, root.get(8).type);

        ForStmt loop = (ForStmt) root.get(9);
        assertEquals(DataType.I32, loop.getBody().get(0).type);
        assertEquals(DataType.I32, loop.getBody().get(1).type);
    }

    @Test
    void testDirectEditRelowers() {
        IdExpr a = IdExpr.declare("a");
        StmtList root = IRBuilder.build(ib -> ib.alloca(DataType.I32, a));
        LowerAST.run(root);
        assertTrue(MetadataState.of(root).isValid(MetadataState.LOWERED));

        root.add(new AssignStmt(a.id, a.add(1)));
        assertFalse(MetadataState.of(root).isValid(MetadataState.LOWERED));

        TypeCheck.run(root);
        assertEquals(0, CountHighLevelStmts.count(root));
        LocalStoreStmt store = assertInstanceOf(LocalStoreStmt.class, root.get(root.size() - 1));
        assertEquals(DataType.I32, store.value.type);
    }

    @Test
    void testNestedEditInvalidates() {
        IdExpr i = IdExpr.declare("i");
        StmtList root = IRBuilder.build(ib -> ib.forRange(i, 0, 4, body -> body.print(i)));
        TypeCheck.run(root);
        MetadataState state = MetadataState.of(root);
        assertTrue(state.isValid(MetadataState.TYPES_INFERRED));

        StmtList body = ((ForStmt) root.get(0)).getBody();
        body.statements().remove(body.size() - 1);
        assertFalse(state.isValid(MetadataState.LOWERED));
        assertFalse(state.isValid(MetadataState.TYPES_INFERRED));
    }

    @Test
    void testTreeChangeInvalidates() {
        IdExpr x = IdExpr.declare("x");
        StmtList root = IRBuilder.build(ib -> ib.alloca(DataType.I32, x));
        TypeCheck.run(root);
        assertTrue(MetadataState.of(root).isValid(MetadataState.TYPES_INFERRED));

        new IRBuilder(root).print(x);
        MetadataState state = MetadataState.of(root);
        assertFalse(state.isValid(MetadataState.LOWERED));
        assertFalse(state.isValid(MetadataState.TYPES_INFERRED));
    }
}
