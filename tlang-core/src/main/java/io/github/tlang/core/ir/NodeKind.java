package io.github.tlang.core.ir;

/**
 * The discriminant of every concrete {@link IRNode} variant.
 */
public enum NodeKind {
    STMT_LIST,
    ALLOCA,
    CONST,
    BINARY_OP,
    LOCAL_LOAD,
    LOCAL_STORE,
    PRINT,
    IF,
    FOR,
    // front-end only, must not survive lowering
    ASSIGN,
    FRONTEND_PRINT,
    FRONTEND_IF,
    ;

    /**
     * Whether nodes of this kind are high-level front-end statements,
     * which {@link io.github.tlang.core.passes.form.LowerAST} eliminates.
     *
     * @return The above.
     */
    public boolean isHighLevel() {
        return this == ASSIGN || this == FRONTEND_PRINT || this == FRONTEND_IF;
    }
}
