package io.github.tlang.core.ir;

import java.util.Objects;

/**
 * Materializes a literal value.
 */
public final class ConstStmt extends Stmt {
    public final Number value;

    public ConstStmt(Number value, DataType type) {
        this.value = Objects.requireNonNull(value, "value");
        this.type = Objects.requireNonNull(type, "type");
    }

    public ConstStmt(Number value) {
        this(value, DataType.of(value));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONST;
    }

    @Override
    public <R> R accept(IRVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
