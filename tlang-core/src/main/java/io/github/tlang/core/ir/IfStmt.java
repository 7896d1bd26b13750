package io.github.tlang.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Branches on the value of an earlier statement. Either branch may be absent.
 */
public final class IfStmt extends Stmt {
    public final Stmt condition;
    private final @Nullable StmtList trueStatements;
    private final @Nullable StmtList falseStatements;

    public IfStmt(Stmt condition, @Nullable StmtList trueStatements, @Nullable StmtList falseStatements) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.trueStatements = adopt(trueStatements);
        this.falseStatements = adopt(falseStatements);
    }

    public @Nullable StmtList getTrueStatements() {
        return trueStatements;
    }

    public @Nullable StmtList getFalseStatements() {
        return falseStatements;
    }

    @Override
    public List<Stmt> operands() {
        return Collections.singletonList(condition);
    }

    @Override
    public List<StmtList> blocks() {
        List<StmtList> blocks = new ArrayList<>(2);
        if (trueStatements != null) blocks.add(trueStatements);
        if (falseStatements != null) blocks.add(falseStatements);
        return blocks;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IF;
    }

    @Override
    public <R> R accept(IRVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
