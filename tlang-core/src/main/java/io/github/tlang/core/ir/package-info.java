/**
 * This package defines the tree IR the compiler works on.
 * <p>
 * A tree is a {@link io.github.tlang.core.ir.StmtList block} of
 * {@link io.github.tlang.core.ir.Stmt statements}, some of which nest further blocks.
 * Every node knows its parent, and no node is in two places at once.
 * <p>
 * Trees start out in front-end form, built by an {@link io.github.tlang.core.ir.IRBuilder},
 * where assignments, prints and if conditions hold whole expressions. Lowering turns these into
 * single-assignment statements, each consuming the values of statements that come before it.
 * Mutable locals stay as explicit allocas, loads and stores.
 */
package io.github.tlang.core.ir;
