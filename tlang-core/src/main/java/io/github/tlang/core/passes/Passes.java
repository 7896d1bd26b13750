package io.github.tlang.core.passes;

import io.github.tlang.core.ir.IRNode;
import io.github.tlang.core.passes.form.LowerAST;
import io.github.tlang.core.passes.meta.TypeCheck;
import io.github.tlang.core.passes.meta.VerifyIntegrity;

public class Passes {
    /**
     * Lower a front-end tree to SSA form, and check the result.
     */
    public static final IRPass<IRNode, IRNode> LOWER =
            LowerAST.INSTANCE
                    .then(VerifyIntegrity.LOWERED);

    /**
     * {@link #LOWER}, then infer the data types of all values.
     */
    public static final IRPass<IRNode, IRNode> FULL =
            LOWER.then(TypeCheck.INSTANCE);
}
