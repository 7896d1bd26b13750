package io.github.tlang.core.ir;

/**
 * Thrown when a strict {@link IRVisitor} is given a node kind it has no handler for.
 */
public class DispatchViolationException extends IRException {
    public final NodeKind kind;

    public DispatchViolationException(IRVisitor<?> visitor, IRNode node) {
        super(String.format("%s has no handler for %s", visitor.getClass().getName(), node.kind()), node);
        this.kind = node.kind();
    }
}
