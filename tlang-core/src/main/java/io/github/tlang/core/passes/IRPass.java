package io.github.tlang.core.passes;

import io.github.tlang.core.passes.misc.ChainedPass;

/**
 * A pass over IR, taking an {@code A} and producing a {@code B}.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
public interface IRPass<A, B> {
    B run(A a);

    /**
     * Whether this pass mutates its input and returns it, rather than producing something new.
     *
     * @return The above.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Compose this pass with another, run after it on its result.
     *
     * @param next The pass to run next.
     * @param <C>  The output type of the next pass.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
