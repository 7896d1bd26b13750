package io.github.tlang.core.passes;

/**
 * The outcome of a traversal step in a rewriting pass.
 */
public enum Traversal {
    /**
     * Nothing was changed, keep going.
     */
    CONTINUE,
    /**
     * The tree was modified, so the traversal in progress is no longer valid.
     * Unwind, and start again from the root.
     */
    RESTART,
}
