package io.github.tlang.core.ir;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a tree breaks its ownership invariants, such as a node not
 * being found in the list it claims as its parent.
 */
public class StructuralCorruptionException extends IRException {
    public StructuralCorruptionException(String message, @Nullable IRNode node) {
        super(message, node);
    }
}
