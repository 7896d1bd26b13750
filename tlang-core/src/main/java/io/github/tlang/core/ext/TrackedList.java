package io.github.tlang.core.ext;

import java.util.*;

/**
 * A list view which is notified whenever an element enters or leaves it.
 * <p>
 * Containers use this to keep the owner links of their elements up to date,
 * so that no element ever has to fix up its own owner.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed;

    public TrackedList(List<E> viewed) {
        this.viewed = viewed;
    }

    /**
     * Called before {@code elt} is inserted. Throwing leaves the list unchanged.
     *
     * @param elt The element being inserted.
     */
    protected abstract void onAdded(E elt);

    /**
     * Called after {@code elt} has been removed.
     *
     * @param elt The element that was removed.
     */
    protected abstract void onRemoved(E elt);

    @Override
    public E get(int index) {
        return viewed.get(index);
    }

    @Override
    public int size() {
        return viewed.size();
    }

    @Override
    public boolean add(E e) {
        onAdded(e);
        return viewed.add(e);
    }

    @Override
    public void add(int index, E element) {
        onAdded(element);
        viewed.add(index, element);
    }

    @Override
    public E set(int index, E element) {
        E old = viewed.get(index);
        onRemoved(old);
        try {
            onAdded(element);
        } catch (RuntimeException e) {
            onAdded(old);
            throw e;
        }
        viewed.set(index, element);
        return old;
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        onRemoved(removed);
        return removed;
    }

    @Override
    public void clear() {
        for (E e : viewed) {
            onRemoved(e);
        }
        viewed.clear();
    }

    @Override
    public boolean addAll(int index, Collection<? extends E> c) {
        List<E> added = new ArrayList<>(c.size());
        try {
            for (E e : c) {
                onAdded(e);
                added.add(e);
            }
        } catch (RuntimeException e) {
            for (E undone : added) {
                onRemoved(undone);
            }
            throw e;
        }
        return viewed.addAll(index, added);
    }

    @Override
    public boolean addAll(Collection<? extends E> c) {
        return addAll(size(), c);
    }
}
