package io.github.tlang.core.passes.misc;

import io.github.tlang.core.passes.IRPass;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * A pass which runs one pass, then gives its result to another.
 * <p>
 * Nested chains are run as one flat sequence, so failures can report
 * which pass of the whole chain they came from.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> firstPass;
    private final IRPass<B, C> nextPass;

    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        this.firstPass = firstPass;
        this.nextPass = nextPass;
    }

    /**
     * Get every pass in this chain, in running order.
     *
     * @return The passes.
     */
    public List<IRPass<?, ?>> passes() {
        List<IRPass<?, ?>> passes = new ArrayList<>();
        Deque<IRPass<?, ?>> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            IRPass<?, ?> pass = stack.pop();
            if (pass instanceof ChainedPass) {
                ChainedPass<?, ?, ?> chained = (ChainedPass<?, ?, ?>) pass;
                stack.push(chained.nextPass);
                stack.push(chained.firstPass);
            } else {
                passes.add(pass);
            }
        }
        return passes;
    }

    @Override
    public boolean isInPlace() {
        return firstPass.isInPlace() && nextPass.isInPlace();
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        List<IRPass<?, ?>> passes = passes();
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            IRPass<Object, Object> pass = (IRPass<Object, Object>) passes.get(i);
            try {
                acc = pass.run(acc);
            } catch (RuntimeException | Error t) {
                t.addSuppressed(new RuntimeException("running pass " + i + " in chain: " + pass));
                throw t;
            }
        }
        return (C) acc;
    }
}
