package io.github.tlang.core.ir;

import io.github.tlang.core.ir.expr.Expr;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Front-end branch on an expression. Lowering turns the condition into statements,
 * and hands both branches over to an {@link IfStmt}.
 */
public final class FrontendIfStmt extends Stmt {
    public final Expr condition;
    private @Nullable StmtList trueStatements;
    private @Nullable StmtList falseStatements;

    public FrontendIfStmt(Expr condition, @Nullable StmtList trueStatements, @Nullable StmtList falseStatements) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.trueStatements = adopt(trueStatements);
        this.falseStatements = adopt(falseStatements);
    }

    public @Nullable StmtList getTrueStatements() {
        return trueStatements;
    }

    public @Nullable StmtList getFalseStatements() {
        return falseStatements;
    }

    /**
     * Detach and return the true branch, leaving this statement without one.
     *
     * @return The branch, which is now unowned.
     */
    public @Nullable StmtList takeTrueStatements() {
        StmtList taken = release(trueStatements);
        trueStatements = null;
        return taken;
    }

    /**
     * Detach and return the false branch, leaving this statement without one.
     *
     * @return The branch, which is now unowned.
     */
    public @Nullable StmtList takeFalseStatements() {
        StmtList taken = release(falseStatements);
        falseStatements = null;
        return taken;
    }

    @Override
    public List<StmtList> blocks() {
        List<StmtList> blocks = new ArrayList<>(2);
        if (trueStatements != null) blocks.add(trueStatements);
        if (falseStatements != null) blocks.add(falseStatements);
        return blocks;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FRONTEND_IF;
    }

    @Override
    public <R> R accept(IRVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
