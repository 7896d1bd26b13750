package io.github.tlang.core.ir;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Writes the value of an earlier statement into a local.
 */
public final class LocalStoreStmt extends Stmt {
    public final Identifier id;
    public final Stmt value;

    public LocalStoreStmt(Identifier id, Stmt value) {
        this.id = Objects.requireNonNull(id, "id");
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public List<Stmt> operands() {
        return Collections.singletonList(value);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LOCAL_STORE;
    }

    @Override
    public <R> R accept(IRVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
