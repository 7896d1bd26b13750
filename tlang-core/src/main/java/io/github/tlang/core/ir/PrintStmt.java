package io.github.tlang.core.ir;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class PrintStmt extends Stmt {
    public final Stmt value;

    public PrintStmt(Stmt value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public List<Stmt> operands() {
        return Collections.singletonList(value);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PRINT;
    }

    @Override
    public <R> R accept(IRVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
