package io.github.tlang.core.ir;

import io.github.tlang.core.ir.expr.ConstExpr;
import io.github.tlang.core.ir.expr.Expr;
import io.github.tlang.core.ir.expr.IdExpr;
import org.jetbrains.annotations.Nullable;

import java.util.function.Consumer;

/**
 * A statement builder, which encapsulates a position at the end of a
 * block where statements are being inserted.
 * <p>
 * This is the shape of tree the front end produces: allocas, front-end
 * assignments and prints, and nested control flow.
 */
public class IRBuilder {
    private final StmtList block;

    /**
     * Construct a builder inserting at the end of {@code block}.
     *
     * @param block The block.
     */
    public IRBuilder(StmtList block) {
        this.block = block;
    }

    /**
     * Build a new root block.
     *
     * @param body Inserts the statements of the block.
     * @return The block.
     */
    public static StmtList build(Consumer<IRBuilder> body) {
        StmtList root = new StmtList();
        body.accept(new IRBuilder(root));
        return root;
    }

    /**
     * Get the block this builder is inserting at the end of.
     *
     * @return The block.
     */
    public StmtList getBlock() {
        return block;
    }

    /**
     * Insert a statement at the end of the block.
     *
     * @param stmt The statement.
     * @param <T>  The type of the statement.
     * @return The same statement.
     */
    public <T extends Stmt> T insert(T stmt) {
        block.add(stmt);
        return stmt;
    }

    public AllocaStmt alloca(DataType type, IdExpr local) {
        return insert(new AllocaStmt(local.id, type));
    }

    public AssignStmt assign(IdExpr local, Expr rhs) {
        return insert(new AssignStmt(local.id, rhs));
    }

    public FrontendPrintStmt print(Expr expr) {
        return insert(new FrontendPrintStmt(expr));
    }

    public FrontendIfStmt ifThen(Expr condition, Consumer<IRBuilder> then) {
        return ifThen(condition, then, null);
    }

    /**
     * Insert an if statement, then build its branches.
     *
     * @param condition The condition.
     * @param then      Builds the true branch.
     * @param otherwise Builds the false branch, or null if there is none.
     * @return The inserted statement.
     */
    public FrontendIfStmt ifThen(Expr condition, Consumer<IRBuilder> then, @Nullable Consumer<IRBuilder> otherwise) {
        StmtList trueStatements = new StmtList();
        StmtList falseStatements = otherwise == null ? null : new StmtList();
        FrontendIfStmt stmt = insert(new FrontendIfStmt(condition, trueStatements, falseStatements));
        then.accept(new IRBuilder(trueStatements));
        if (otherwise != null) {
            otherwise.accept(new IRBuilder(falseStatements));
        }
        return stmt;
    }

    /**
     * Insert a loop over {@code [begin, end)}, then build its body.
     *
     * @param loopVar The loop variable.
     * @param begin   The first value.
     * @param end     The bound, exclusive.
     * @param body    Builds the body.
     * @return The inserted statement.
     */
    public ForStmt forRange(IdExpr loopVar, Expr begin, Expr end, Consumer<IRBuilder> body) {
        StmtList bodyStatements = new StmtList();
        ForStmt stmt = insert(new ForStmt(loopVar.id, begin, end, bodyStatements));
        body.accept(new IRBuilder(bodyStatements));
        return stmt;
    }

    public ForStmt forRange(IdExpr loopVar, int begin, int end, Consumer<IRBuilder> body) {
        return forRange(loopVar, ConstExpr.of(begin), ConstExpr.of(end), body);
    }
}
