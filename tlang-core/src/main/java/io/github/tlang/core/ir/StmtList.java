package io.github.tlang.core.ir;

import io.github.tlang.core.ext.CommonExts;
import io.github.tlang.core.ext.Ext;
import io.github.tlang.core.ext.MetadataState;
import io.github.tlang.core.ext.TrackedList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A lexical block: an ordered sequence of statements, each owned exclusively by this list.
 * The order of the statements is their evaluation order.
 */
public final class StmtList extends IRNode {
    private final List<Stmt> statements = new TrackedList<Stmt>(new ArrayList<>()) {
        @Override
        protected void onAdded(Stmt elt) {
            if (elt.getParent() != null) {
                throw new IllegalArgumentException(String.format(
                        "statement is already owned\n  statement: %s\n  owner: %s",
                        elt,
                        elt.getParent()));
            }
            elt.attachExt(CommonExts.OWNING_LIST, StmtList.this);
            treeChanged();
        }

        @Override
        protected void onRemoved(Stmt elt) {
            elt.removeExt(CommonExts.OWNING_LIST);
            treeChanged();
        }
    };

    private void treeChanged() {
        MetadataState state = root().getNullable(CommonExts.METADATA_STATE);
        if (state != null) {
            state.treeChanged();
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STMT_LIST;
    }

    @Override
    public <R> R accept(IRVisitor<R> visitor) {
        return visitor.visit(this);
    }

    /**
     * Get the statements of this block. Insertions and removals through
     * this list keep parent links up to date.
     *
     * @return The statements.
     */
    public List<Stmt> statements() {
        return statements;
    }

    public <T extends Stmt> T add(T stmt) {
        statements.add(stmt);
        return stmt;
    }

    public int size() {
        return statements.size();
    }

    public Stmt get(int index) {
        return statements.get(index);
    }

    /**
     * Find a statement in this block by identity.
     *
     * @param stmt The statement.
     * @return Its index, or -1 if it is not an element.
     */
    public int indexOf(Stmt stmt) {
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i) == stmt) return i;
        }
        return -1;
    }

    /**
     * Splice {@code replacement} into this block in place of {@code target}.
     * <p>
     * The statements of {@code replacement} become owned by this block, in order, and
     * the replacement is left empty. The target is removed and loses its parent.
     * If this throws, neither this block nor the replacement has been changed.
     *
     * @param target      The statement to replace.
     * @param replacement The statements to insert in its place.
     * @throws StructuralCorruptionException If {@code target} is not an element of this block.
     * @throws IllegalArgumentException      If a statement of {@code replacement} has been
     *                                       inserted into some block since it was pushed.
     */
    public void replaceWith(Stmt target, VecStatement replacement) {
        int index = indexOf(target);
        if (index < 0 || target.getParent() != this) {
            throw new StructuralCorruptionException(String.format(
                    "replacement target not found in its parent" +
                            "\n  target: %s" +
                            "\n  claimed parent: %s" +
                            "\n  searched: %s",
                    target,
                    target.getParent(),
                    this),
                    target);
        }
        for (Stmt stmt : replacement) {
            if (stmt.getParent() != null) {
                throw new IllegalArgumentException(String.format(
                        "replacement statement is already owned\n  statement: %s\n  owner: %s",
                        stmt,
                        stmt.getParent()));
            }
        }
        statements.remove(index);
        statements.addAll(index, replacement.drain());
    }

    @Override
    public String toTargetString() {
        return super.toTargetString() + "[" + statements.size() + "]";
    }

    // exts
    private Stmt owner = null;

    @Override
    public @Nullable Stmt getParent() {
        return owner;
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_STMT) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_STMT) {
            owner = (Stmt) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_STMT) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
