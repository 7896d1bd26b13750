package io.github.tlang.core.ir.expr;

import io.github.tlang.core.ir.BinaryOpStmt;
import io.github.tlang.core.ir.Stmt;
import io.github.tlang.core.ops.BinaryOpType;

import java.util.Objects;

public final class BinaryOpExpr extends Expr {
    public final BinaryOpType op;
    public final Expr lhs;
    public final Expr rhs;

    public BinaryOpExpr(BinaryOpType op, Expr lhs, Expr rhs) {
        this.op = Objects.requireNonNull(op, "op");
        this.lhs = Objects.requireNonNull(lhs, "lhs");
        this.rhs = Objects.requireNonNull(rhs, "rhs");
    }

    @Override
    public String serialize() {
        return "(" + lhs.serialize() + " " + op.symbol + " " + rhs.serialize() + ")";
    }

    @Override
    Stmt emit(Flattener flattener) {
        // left first, this is the evaluation order
        Stmt l = flattener.materialize(lhs);
        Stmt r = flattener.materialize(rhs);
        return flattener.push(new BinaryOpStmt(op, l, r));
    }
}
