package io.github.tlang.core.ir;

import io.github.tlang.core.ops.BinaryOpType;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Computes a binary operation over the values of two earlier statements.
 */
public final class BinaryOpStmt extends Stmt {
    public final BinaryOpType op;
    public final Stmt lhs;
    public final Stmt rhs;

    public BinaryOpStmt(BinaryOpType op, Stmt lhs, Stmt rhs) {
        this.op = Objects.requireNonNull(op, "op");
        this.lhs = Objects.requireNonNull(lhs, "lhs");
        this.rhs = Objects.requireNonNull(rhs, "rhs");
    }

    @Override
    public List<Stmt> operands() {
        return Arrays.asList(lhs, rhs);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BINARY_OP;
    }

    @Override
    public <R> R accept(IRVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
