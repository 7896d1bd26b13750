package io.github.tlang.core.ir;

import io.github.tlang.core.ir.expr.Expr;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Runs its body once for each value of the loop variable in {@code [begin, end)}.
 * <p>
 * The loop variable can be read in the body like any local.
 */
public final class ForStmt extends Stmt {
    public final Identifier loopVar;
    public final Expr begin;
    public final Expr end;
    private final StmtList body;

    public ForStmt(Identifier loopVar, Expr begin, Expr end, StmtList body) {
        this.loopVar = Objects.requireNonNull(loopVar, "loopVar");
        this.begin = Objects.requireNonNull(begin, "begin");
        this.end = Objects.requireNonNull(end, "end");
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public StmtList getBody() {
        return body;
    }

    @Override
    public List<StmtList> blocks() {
        return Collections.singletonList(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FOR;
    }

    @Override
    public <R> R accept(IRVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
