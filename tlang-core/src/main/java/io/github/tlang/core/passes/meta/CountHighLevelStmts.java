package io.github.tlang.core.passes.meta;

import io.github.tlang.core.ir.*;

/**
 * Counts the front-end statements left in a tree.
 * <p>
 * Lowered statements don't matter here, and are skipped without handlers.
 */
public final class CountHighLevelStmts extends IRVisitor<Integer> {
    private static final CountHighLevelStmts VISITOR = new CountHighLevelStmts();

    private CountHighLevelStmts() {
        super(true);
    }

    public static int count(IRNode root) {
        return root.accept(VISITOR);
    }

    @Override
    protected Integer defaultResult() {
        return 0;
    }

    private int countBlocks(Stmt stmt) {
        int count = 0;
        for (StmtList block : stmt.blocks()) {
            count += block.accept(this);
        }
        return count;
    }

    @Override
    public Integer visit(StmtList stmtList) {
        int count = 0;
        for (Stmt stmt : stmtList.statements()) {
            count += stmt.accept(this);
        }
        return count;
    }

    @Override
    public Integer visit(IfStmt ifStmt) {
        return countBlocks(ifStmt);
    }

    @Override
    public Integer visit(ForStmt forStmt) {
        return countBlocks(forStmt);
    }

    @Override
    public Integer visit(AssignStmt assign) {
        return 1;
    }

    @Override
    public Integer visit(FrontendPrintStmt print) {
        return 1;
    }

    @Override
    public Integer visit(FrontendIfStmt ifStmt) {
        return 1 + countBlocks(ifStmt);
    }
}
