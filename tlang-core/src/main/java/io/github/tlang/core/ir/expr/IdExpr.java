package io.github.tlang.core.ir.expr;

import io.github.tlang.core.ir.Identifier;
import io.github.tlang.core.ir.LocalLoadStmt;
import io.github.tlang.core.ir.Stmt;

import java.util.Objects;

/**
 * A reference to a local.
 */
public final class IdExpr extends Expr {
    public final Identifier id;

    public IdExpr(Identifier id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    /**
     * Declare a fresh local and reference it.
     *
     * @param name The name of the local.
     * @return The reference.
     */
    public static IdExpr declare(String name) {
        return new IdExpr(new Identifier(name));
    }

    @Override
    public String serialize() {
        return id.name();
    }

    @Override
    Stmt emit(Flattener flattener) {
        return flattener.push(new LocalLoadStmt(id));
    }
}
