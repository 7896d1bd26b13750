package io.github.tlang.core.ir;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A named local. Identity matters, not the name: two identifiers
 * with the same name are different locals.
 */
public final class Identifier {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger();

    public final String name;
    public final int id = ID_COUNTER.getAndIncrement();

    public Identifier(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
