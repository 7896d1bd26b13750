package io.github.tlang.core.ir;

import io.github.tlang.core.ext.CommonExts;
import io.github.tlang.core.ext.Ext;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * A statement, owned by exactly one {@link StmtList}.
 */
public abstract class Stmt extends IRNode {
    /**
     * The type of the value this statement produces, if any.
     */
    public DataType type = DataType.UNKNOWN;

    /**
     * Get the statements whose values this one consumes, in evaluation order.
     *
     * @return The operands.
     */
    public List<Stmt> operands() {
        return Collections.emptyList();
    }

    /**
     * Get the blocks nested in this statement.
     *
     * @return The blocks, in visiting order.
     */
    public List<StmtList> blocks() {
        return Collections.emptyList();
    }

    /**
     * Replace this statement in its parent with the given statements.
     *
     * @param replacement The statements to splice in.
     * @see StmtList#replaceWith(Stmt, VecStatement)
     */
    public void replaceWith(VecStatement replacement) {
        StmtList parent = getParent();
        if (parent == null) {
            throw new StructuralCorruptionException("replacement target has no parent: " + this, this);
        }
        parent.replaceWith(this, replacement);
    }

    /**
     * Take ownership of a nested block.
     *
     * @param block The block, or null.
     * @return The block.
     */
    protected @Nullable StmtList adopt(@Nullable StmtList block) {
        if (block == null) return null;
        if (block.getParent() != null) {
            throw new IllegalArgumentException("block is already owned by " + block.getParent());
        }
        block.attachExt(CommonExts.OWNING_STMT, this);
        return block;
    }

    /**
     * Give up ownership of a nested block.
     *
     * @param block The block, or null.
     * @return The block.
     */
    protected @Nullable StmtList release(@Nullable StmtList block) {
        if (block != null) {
            block.removeExt(CommonExts.OWNING_STMT);
        }
        return block;
    }

    // exts
    private StmtList owner = null;

    @Override
    public @Nullable StmtList getParent() {
        return owner;
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_LIST) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_LIST) {
            owner = (StmtList) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_LIST) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
