package io.github.tlang.core.ir;

import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * A sequence of freshly created statements that are not yet part of any tree.
 * <p>
 * Splicing it into a {@link StmtList} transfers ownership of its statements
 * and leaves it empty.
 */
public final class VecStatement implements Iterable<Stmt> {
    private final List<Stmt> stmts = new ArrayList<>();

    /**
     * Append a statement.
     *
     * @param stmt The statement, which must not be owned by any block.
     * @param <T>  The statement type.
     * @return The same statement.
     */
    public <T extends Stmt> T push(T stmt) {
        if (stmt.getParent() != null) {
            throw new IllegalArgumentException("statement is already owned: " + stmt);
        }
        for (Stmt s : stmts) {
            if (s == stmt) throw new IllegalArgumentException("statement pushed twice: " + stmt);
        }
        stmts.add(stmt);
        return stmt;
    }

    /**
     * Get the last statement, which produces the value of a flattened expression.
     *
     * @return The last statement.
     * @throws NoSuchElementException If this is empty.
     */
    public Stmt back() {
        if (stmts.isEmpty()) throw new NoSuchElementException("empty statement vector");
        return stmts.get(stmts.size() - 1);
    }

    public Stmt get(int index) {
        return stmts.get(index);
    }

    public int size() {
        return stmts.size();
    }

    public boolean isEmpty() {
        return stmts.isEmpty();
    }

    List<Stmt> drain() {
        List<Stmt> drained = new ArrayList<>(stmts);
        stmts.clear();
        return drained;
    }

    @NotNull
    @Override
    public Iterator<Stmt> iterator() {
        return Collections.unmodifiableList(stmts).iterator();
    }

    @Override
    public String toString() {
        return stmts.toString();
    }
}
