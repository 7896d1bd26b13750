package io.github.tlang.core.ir.expr;

import io.github.tlang.core.ir.Stmt;
import io.github.tlang.core.ops.BinaryOpType;

/**
 * A front-end expression tree.
 * <p>
 * Expressions are immutable and may be shared freely between statements and
 * other expressions. They only ever reach lowered IR through {@link Flattener}.
 */
public abstract class Expr {
    /**
     * Render this expression as source-like text, e.g. {@code ((a + b) / 3)}.
     *
     * @return The text.
     */
    public abstract String serialize();

    /**
     * Emit the statements computing this expression, with its operands already materialized
     * through {@link Flattener#materialize(Expr)}.
     *
     * @param flattener The flattener to emit into.
     * @return The statement producing the value of this expression.
     */
    abstract Stmt emit(Flattener flattener);

    public BinaryOpExpr binary(BinaryOpType op, Expr rhs) {
        return new BinaryOpExpr(op, this, rhs);
    }

    public BinaryOpExpr add(Expr rhs) {
        return binary(BinaryOpType.ADD, rhs);
    }

    public BinaryOpExpr add(Number rhs) {
        return add(ConstExpr.of(rhs));
    }

    public BinaryOpExpr sub(Expr rhs) {
        return binary(BinaryOpType.SUB, rhs);
    }

    public BinaryOpExpr sub(Number rhs) {
        return sub(ConstExpr.of(rhs));
    }

    public BinaryOpExpr mul(Expr rhs) {
        return binary(BinaryOpType.MUL, rhs);
    }

    public BinaryOpExpr mul(Number rhs) {
        return mul(ConstExpr.of(rhs));
    }

    public BinaryOpExpr div(Expr rhs) {
        return binary(BinaryOpType.DIV, rhs);
    }

    public BinaryOpExpr div(Number rhs) {
        return div(ConstExpr.of(rhs));
    }

    public BinaryOpExpr lt(Expr rhs) {
        return binary(BinaryOpType.CMP_LT, rhs);
    }

    public BinaryOpExpr lt(Number rhs) {
        return lt(ConstExpr.of(rhs));
    }

    public BinaryOpExpr gt(Expr rhs) {
        return binary(BinaryOpType.CMP_GT, rhs);
    }

    public BinaryOpExpr gt(Number rhs) {
        return gt(ConstExpr.of(rhs));
    }

    @Override
    public String toString() {
        return serialize();
    }
}
