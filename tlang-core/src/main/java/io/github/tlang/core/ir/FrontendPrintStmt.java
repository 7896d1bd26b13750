package io.github.tlang.core.ir;

import io.github.tlang.core.ir.expr.Expr;

import java.util.Objects;

/**
 * Front-end print of an expression.
 */
public final class FrontendPrintStmt extends Stmt {
    public final Expr expr;

    public FrontendPrintStmt(Expr expr) {
        this.expr = Objects.requireNonNull(expr, "expr");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FRONTEND_PRINT;
    }

    @Override
    public <R> R accept(IRVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
