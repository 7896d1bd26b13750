package io.github.tlang.core.passes.meta;

import io.github.tlang.core.ir.*;
import io.github.tlang.core.passes.InPlaceIRPass;

import java.util.*;

/**
 * Checks the ownership and SSA invariants of a tree, throwing a
 * {@link StructuralCorruptionException} at the first violation:
 * <ul>
 *     <li>every statement's parent is the block it is in, and every nested block's
 *     parent is the statement it is nested in;</li>
 *     <li>no statement is in the tree twice;</li>
 *     <li>every statement a statement consumes comes before it, in the same or an enclosing block.</li>
 * </ul>
 * The root may be any node in a tree. Statements before it, in its block and the blocks
 * enclosing it, are in scope, and a statement root is checked against the block it is in.
 */
public final class VerifyIntegrity extends IRVisitor<Void> {
    /**
     * Checks the invariants above.
     */
    public static final InPlaceIRPass<IRNode> INSTANCE = root -> verify(root, false);
    /**
     * Checks the invariants above, and that no front-end statements remain.
     */
    public static final InPlaceIRPass<IRNode> LOWERED = root -> verify(root, true);

    private final boolean requireLowered;
    private final Set<Stmt> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<Stmt> visible = Collections.newSetFromMap(new IdentityHashMap<>());
    private StmtList currentBlock = null;

    private VerifyIntegrity(boolean requireLowered) {
        this.requireLowered = requireLowered;
    }

    private static void verify(IRNode root, boolean requireLowered) {
        VerifyIntegrity verifier = new VerifyIntegrity(requireLowered);
        verifier.enterScopeOf(root);
        root.accept(verifier);
    }

    private void enterScopeOf(IRNode root) {
        if (root instanceof Stmt) {
            currentBlock = ((Stmt) root).getParent();
        }
        IRNode node = root;
        IRNode parent;
        while ((parent = node.getParent()) != null) {
            if (parent instanceof StmtList) {
                for (Stmt stmt : ((StmtList) parent).statements()) {
                    if (stmt == node) break;
                    visible.add(stmt);
                }
            }
            node = parent;
        }
    }

    private void checkStmt(Stmt stmt) {
        if (stmt.getParent() != currentBlock) {
            throw new StructuralCorruptionException(String.format(
                    "statement not owned by its block" +
                            "\n  statement: %s" +
                            "\n  owner: %s" +
                            "\n  block: %s",
                    stmt,
                    stmt.getParent(),
                    currentBlock),
                    stmt);
        }
        if (!seen.add(stmt)) {
            throw new StructuralCorruptionException("statement appears in the tree twice: " + stmt, stmt);
        }
        for (Stmt operand : stmt.operands()) {
            if (!visible.contains(operand)) {
                throw new StructuralCorruptionException(String.format(
                        "statement uses a value not defined before it" +
                                "\n  statement: %s" +
                                "\n  operand: %s" +
                                "\n  operand owner: %s",
                        stmt,
                        operand,
                        operand.getParent()),
                        stmt);
            }
        }
    }

    private void checkLowered(Stmt stmt) {
        if (requireLowered) {
            throw new StructuralCorruptionException("front-end statement survived lowering: " + stmt, stmt);
        }
    }

    private Void leaf(Stmt stmt) {
        checkStmt(stmt);
        visible.add(stmt);
        return null;
    }

    private Void nested(Stmt stmt) {
        checkStmt(stmt);
        for (StmtList block : stmt.blocks()) {
            if (block.getParent() != stmt) {
                throw new StructuralCorruptionException(String.format(
                        "block not owned by its statement" +
                                "\n  block: %s" +
                                "\n  owner: %s" +
                                "\n  statement: %s",
                        block,
                        block.getParent(),
                        stmt),
                        block);
            }
            block.accept(this);
        }
        visible.add(stmt);
        return null;
    }

    @Override
    public Void visit(StmtList stmtList) {
        StmtList outer = currentBlock;
        currentBlock = stmtList;
        try {
            for (Stmt stmt : stmtList.statements()) {
                stmt.accept(this);
            }
        } finally {
            currentBlock = outer;
        }
        // values defined in a block are not visible after it
        for (Stmt stmt : stmtList.statements()) {
            visible.remove(stmt);
        }
        return null;
    }

    @Override
    public Void visit(AllocaStmt alloca) {
        return leaf(alloca);
    }

    @Override
    public Void visit(ConstStmt constStmt) {
        return leaf(constStmt);
    }

    @Override
    public Void visit(BinaryOpStmt bin) {
        return leaf(bin);
    }

    @Override
    public Void visit(LocalLoadStmt load) {
        return leaf(load);
    }

    @Override
    public Void visit(LocalStoreStmt store) {
        return leaf(store);
    }

    @Override
    public Void visit(PrintStmt print) {
        return leaf(print);
    }

    @Override
    public Void visit(IfStmt ifStmt) {
        return nested(ifStmt);
    }

    @Override
    public Void visit(ForStmt forStmt) {
        return nested(forStmt);
    }

    @Override
    public Void visit(AssignStmt assign) {
        checkLowered(assign);
        return leaf(assign);
    }

    @Override
    public Void visit(FrontendPrintStmt print) {
        checkLowered(print);
        return leaf(print);
    }

    @Override
    public Void visit(FrontendIfStmt ifStmt) {
        checkLowered(ifStmt);
        return nested(ifStmt);
    }
}
