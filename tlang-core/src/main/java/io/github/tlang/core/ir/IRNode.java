package io.github.tlang.core.ir;

import io.github.tlang.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

/**
 * A node in the IR tree.
 * <p>
 * Children are owned by their parent. The {@link #getParent() parent link} pointing
 * back up is informational, and is only ever set by the owning container.
 */
public abstract class IRNode extends ExtHolder {
    public static boolean TRACK_NODE_CREATIONS = System.getenv("TLANG_TRACK_STMT_CREATIONS") != null;

    public final Throwable created = TRACK_NODE_CREATIONS ? new Throwable("constructed") : null;

    /**
     * Get the variant of this node.
     *
     * @return The kind.
     */
    public abstract NodeKind kind();

    /**
     * Dispatch to the {@code visit} overload of {@code visitor} for this variant.
     *
     * @param visitor The visitor.
     * @param <R>     The result type of the visitor.
     * @return What the visitor returned.
     */
    public abstract <R> R accept(IRVisitor<R> visitor);

    /**
     * Get the node that owns this one, if any.
     *
     * @return The parent, or null if this is a root or not yet inserted.
     */
    public abstract @Nullable IRNode getParent();

    /**
     * Follow parent links to the root of the tree this node is in.
     *
     * @return The root, which may be this node.
     */
    public IRNode root() {
        IRNode node = this;
        IRNode parent;
        while ((parent = node.getParent()) != null) {
            node = parent;
        }
        return node;
    }

    public String toTargetString() {
        return String.format("%s@%08x", kind(), System.identityHashCode(this));
    }

    @Override
    public String toString() {
        return toTargetString();
    }
}
