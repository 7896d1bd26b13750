package io.github.tlang.core.ext;

import io.github.tlang.core.ir.IRNode;
import io.github.tlang.core.passes.IRPass;
import io.github.tlang.core.passes.form.LowerAST;
import io.github.tlang.core.passes.meta.TypeCheck;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks which facts currently hold for a tree, so that passes can
 * require them and have them computed on demand.
 * <p>
 * It lives on the root node of a tree, see {@link #of(IRNode)}.
 */
public class MetadataState {
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        public final int id = COUNTER.getAndIncrement();
        public final String name;

        private MetaKind(String name) {
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            return this == o;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(id);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T>[] passes;

        @SafeVarargs
        private ComputableMetaKind(String name, IRPass<T, T>... passes) {
            super(name);
            this.passes = passes;
        }

        void computeFor(T t) {
            for (IRPass<T, T> pass : passes) {
                if (!pass.isInPlace()) throw new IllegalArgumentException("pass is not in-place: " + pass);
                pass.run(t);
            }
        }
    }

    /**
     * No high-level statements remain in the tree.
     */
    public static final ComputableMetaKind<IRNode> LOWERED =
            new ComputableMetaKind<>("LOWERED", LowerAST.INSTANCE);
    /**
     * Every lowered value-producing statement has its data type filled in.
     */
    public static final ComputableMetaKind<IRNode> TYPES_INFERRED =
            new ComputableMetaKind<>("TYPES_INFERRED", TypeCheck.INSTANCE);

    private final BitSet validSet = new BitSet();

    /**
     * Get the metadata state of the tree rooted at {@code root}, creating it if absent.
     *
     * @param root The root of the tree.
     * @return The state.
     */
    public static MetadataState of(IRNode root) {
        MetadataState state = root.getNullable(CommonExts.METADATA_STATE);
        if (state == null) {
            state = new MetadataState();
            root.attachExt(CommonExts.METADATA_STATE, state);
        }
        return state;
    }

    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T>... kinds) {
        for (ComputableMetaKind<T> kind : kinds) {
            if (!isValid(kind)) {
                kind.computeFor(t);
                validate(kind);
            }
        }
    }

    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, true);
        }
    }

    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, false);
        }
    }

    public void treeChanged() {
        invalidate(LOWERED, TYPES_INFERRED);
    }
}
