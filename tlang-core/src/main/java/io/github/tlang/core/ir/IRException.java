package io.github.tlang.core.ir;

import org.jetbrains.annotations.Nullable;

/**
 * An internal compiler error in the IR. These indicate a bug in whatever built or
 * transformed the tree, and are never recovered from.
 */
public class IRException extends IllegalStateException {
    public IRException(String message) {
        super(message);
    }

    /**
     * Construct the exception, attaching where {@code node} was created, if that was tracked.
     *
     * @param message The message.
     * @param node    The offending node.
     * @see IRNode#TRACK_NODE_CREATIONS
     */
    public IRException(String message, @Nullable IRNode node) {
        super(message);
        if (node != null && node.created != null) {
            addSuppressed(node.created);
        }
    }
}
