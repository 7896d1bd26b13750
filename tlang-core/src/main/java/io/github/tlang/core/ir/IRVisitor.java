package io.github.tlang.core.ir;

/**
 * A visitor over IR nodes, with one {@code visit} overload per node variant.
 * <p>
 * Subclasses override the overloads for the variants they handle. What happens
 * with the rest depends on the dispatch policy chosen at construction:
 * <ul>
 *     <li>strict (the default): visiting an unhandled variant throws a
 *     {@link DispatchViolationException};</li>
 *     <li>permissive: visiting an unhandled variant does nothing, and returns
 *     {@link #defaultResult()}.</li>
 * </ul>
 * Visitors are responsible for descending into children themselves.
 *
 * @param <R> The result of visiting a node.
 */
public abstract class IRVisitor<R> {
    private final boolean allowUndefinedVisitor;

    /**
     * Construct a strict visitor.
     */
    protected IRVisitor() {
        this(false);
    }

    /**
     * Construct a visitor with the given dispatch policy.
     *
     * @param allowUndefinedVisitor Whether unhandled variants are skipped rather than fatal.
     */
    protected IRVisitor(boolean allowUndefinedVisitor) {
        this.allowUndefinedVisitor = allowUndefinedVisitor;
    }

    public boolean allowsUndefinedVisitor() {
        return allowUndefinedVisitor;
    }

    /**
     * The result of visiting an unhandled variant in a permissive visitor.
     *
     * @return The result, null by default.
     */
    protected R defaultResult() {
        return null;
    }

    protected R visitUndefined(IRNode node) {
        if (allowUndefinedVisitor) {
            return defaultResult();
        }
        throw new DispatchViolationException(this, node);
    }

    public R visit(StmtList stmtList) {
        return visitUndefined(stmtList);
    }

    public R visit(AllocaStmt alloca) {
        return visitUndefined(alloca);
    }

    public R visit(ConstStmt constStmt) {
        return visitUndefined(constStmt);
    }

    public R visit(BinaryOpStmt bin) {
        return visitUndefined(bin);
    }

    public R visit(LocalLoadStmt load) {
        return visitUndefined(load);
    }

    public R visit(LocalStoreStmt store) {
        return visitUndefined(store);
    }

    public R visit(PrintStmt print) {
        return visitUndefined(print);
    }

    public R visit(IfStmt ifStmt) {
        return visitUndefined(ifStmt);
    }

    public R visit(ForStmt forStmt) {
        return visitUndefined(forStmt);
    }

    public R visit(AssignStmt assign) {
        return visitUndefined(assign);
    }

    public R visit(FrontendPrintStmt print) {
        return visitUndefined(print);
    }

    public R visit(FrontendIfStmt ifStmt) {
        return visitUndefined(ifStmt);
    }
}
