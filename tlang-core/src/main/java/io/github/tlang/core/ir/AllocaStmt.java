package io.github.tlang.core.ir;

import java.util.Objects;

/**
 * Declares storage for a mutable local.
 */
public final class AllocaStmt extends Stmt {
    public final Identifier id;

    public AllocaStmt(Identifier id, DataType type) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ALLOCA;
    }

    @Override
    public <R> R accept(IRVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
