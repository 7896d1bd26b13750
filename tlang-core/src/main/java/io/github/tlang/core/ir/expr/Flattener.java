package io.github.tlang.core.ir.expr;

import io.github.tlang.core.ir.Stmt;
import io.github.tlang.core.ir.VecStatement;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Flattens an expression tree into a sequence of single-operation statements,
 * in post-order, left operands before right operands. The last statement of
 * the output produces the value of the whole expression.
 * <p>
 * An expression node reached more than once in the same flattening (a shared
 * sub-tree) is only materialized the first time, and its statement is reused after.
 * This is by node identity: structurally equal but distinct nodes are each materialized.
 */
public final class Flattener {
    private final VecStatement out;
    private final Map<Expr, Stmt> materialized = new IdentityHashMap<>();

    private Flattener(VecStatement out) {
        this.out = out;
    }

    /**
     * Flatten an expression into fresh statements.
     *
     * @param expr The expression.
     * @return The statements, none of which are owned by a block yet.
     */
    public static VecStatement flatten(Expr expr) {
        VecStatement out = new VecStatement();
        flattenInto(expr, out);
        return out;
    }

    /**
     * Flatten an expression, appending to existing statements.
     * Nodes already materialized in {@code out} by a previous call are not reused.
     *
     * @param expr The expression.
     * @param out  The statements to append to.
     * @return The statement producing the value of {@code expr}.
     */
    public static Stmt flattenInto(Expr expr, VecStatement out) {
        return new Flattener(out).materialize(expr);
    }

    /**
     * Get the statement producing the value of {@code expr}, emitting it if this is
     * the first time it is reached.
     *
     * @param expr The expression.
     * @return The statement.
     */
    public Stmt materialize(Expr expr) {
        Stmt stmt = materialized.get(expr);
        if (stmt == null) {
            stmt = expr.emit(this);
            materialized.put(expr, stmt);
        }
        return stmt;
    }

    <T extends Stmt> T push(T stmt) {
        return out.push(stmt);
    }
}
