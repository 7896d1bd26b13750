package io.github.tlang.core.test;

import io.github.tlang.core.ir.*;
import io.github.tlang.core.ops.BinaryOpType;
import io.github.tlang.core.passes.form.LowerAST;
import io.github.tlang.core.passes.meta.VerifyIntegrity;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VerifyIntegrityTest {
    @Test
    void testValidTree() {
        StmtList root = Utils.demoProgram();
        VerifyIntegrity.INSTANCE.run(root);
        LowerAST.run(root);
        VerifyIntegrity.LOWERED.run(root);
    }

    @Test
    void testUnloweredTree() {
        StmtList root = Utils.demoProgram();
        StructuralCorruptionException e = assertThrows(StructuralCorruptionException.class,
                () -> VerifyIntegrity.LOWERED.run(root));
        assertTrue(e.getMessage().contains("survived lowering"), e.getMessage());
    }

    @Test
    void testUseBeforeDefinition() {
        StmtList root = new StmtList();
        ConstStmt lhs = new ConstStmt(1);
        ConstStmt rhs = new ConstStmt(2);
        root.add(lhs);
        root.add(new BinaryOpStmt(BinaryOpType.ADD, lhs, rhs));
        root.add(rhs);
        assertThrows(StructuralCorruptionException.class, () -> VerifyIntegrity.INSTANCE.run(root));
    }

    @Test
    void testUseFromSiblingBlock() {
        StmtList root = new StmtList();
        ConstStmt cond = root.add(new ConstStmt(1));
        StmtList trueStatements = new StmtList();
        StmtList falseStatements = new StmtList();
        root.add(new IfStmt(cond, trueStatements, falseStatements));
        ConstStmt inner = trueStatements.add(new ConstStmt(2));
        falseStatements.add(new PrintStmt(inner));
        assertThrows(StructuralCorruptionException.class, () -> VerifyIntegrity.INSTANCE.run(root));
    }

    @Test
    void testUseAfterBlock() {
        StmtList root = new StmtList();
        ConstStmt cond = root.add(new ConstStmt(1));
        StmtList trueStatements = new StmtList();
        root.add(new IfStmt(cond, trueStatements, null));
        ConstStmt inner = trueStatements.add(new ConstStmt(2));
        root.add(new PrintStmt(inner));
        assertThrows(StructuralCorruptionException.class, () -> VerifyIntegrity.INSTANCE.run(root));
    }

    @Test
    void testUseFromEnclosingBlock() {
        StmtList root = new StmtList();
        ConstStmt cond = root.add(new ConstStmt(1));
        StmtList trueStatements = new StmtList();
        root.add(new IfStmt(cond, trueStatements, null));
        trueStatements.add(new PrintStmt(cond));
        VerifyIntegrity.LOWERED.run(root);
    }

    @Test
    void testStatementRoot() {
        StmtList root = new StmtList();
        ConstStmt cond = root.add(new ConstStmt(1));
        StmtList trueStatements = new StmtList();
        IfStmt ifStmt = root.add(new IfStmt(cond, trueStatements, null));
        PrintStmt print = trueStatements.add(new PrintStmt(cond));

        VerifyIntegrity.LOWERED.run(ifStmt);
        VerifyIntegrity.LOWERED.run(trueStatements);
        VerifyIntegrity.LOWERED.run(print);
    }

    @Test
    void testStatementRootUsesLaterValue() {
        StmtList root = new StmtList();
        ConstStmt cond = root.add(new ConstStmt(1));
        StmtList trueStatements = new StmtList();
        IfStmt ifStmt = root.add(new IfStmt(cond, trueStatements, null));
        ConstStmt later = root.add(new ConstStmt(2));
        trueStatements.add(new PrintStmt(later));

        assertThrows(StructuralCorruptionException.class, () -> VerifyIntegrity.INSTANCE.run(ifStmt));
    }
}
