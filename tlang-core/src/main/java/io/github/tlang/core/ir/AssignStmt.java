package io.github.tlang.core.ir;

import io.github.tlang.core.ir.expr.Expr;

import java.util.Objects;

/**
 * Front-end assignment of an expression to a local: {@code id = rhs}.
 */
public final class AssignStmt extends Stmt {
    public final Identifier id;
    public final Expr rhs;

    public AssignStmt(Identifier id, Expr rhs) {
        this.id = Objects.requireNonNull(id, "id");
        this.rhs = Objects.requireNonNull(rhs, "rhs");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASSIGN;
    }

    @Override
    public <R> R accept(IRVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
