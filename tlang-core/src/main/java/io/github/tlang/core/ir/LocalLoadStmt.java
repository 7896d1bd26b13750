package io.github.tlang.core.ir;

import java.util.Objects;

/**
 * Reads the current value of a local.
 */
public final class LocalLoadStmt extends Stmt {
    public final Identifier id;

    public LocalLoadStmt(Identifier id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LOCAL_LOAD;
    }

    @Override
    public <R> R accept(IRVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
