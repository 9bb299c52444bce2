package io.github.manjago.talos.core;

import java.util.Arrays;

/**
 * Operand stack of the machine. Depth 0 is the top.
 */
public final class StackState {

    private long[] elements;
    private int size;

    public StackState() {
        this.elements = new long[32];
        this.size = 0;
    }

    /**
     * Stack holding {@code bottomToTop}, last element on top.
     */
    public StackState(long[] bottomToTop) {
        this.elements = Arrays.copyOf(bottomToTop, Math.max(32, bottomToTop.length * 2));
        this.size = bottomToTop.length;
    }

    /**
     * Copy constructor - creates independent copy of state.
     */
    public StackState(StackState other) {
        this.elements = other.elements.clone();
        this.size = other.size;
    }

    public int size() {
        return size;
    }

    public boolean has(int count) {
        return size >= count;
    }

    public void push(long value) {
        if (size == elements.length) {
            elements = Arrays.copyOf(elements, elements.length * 2);
        }
        elements[size++] = value;
    }

    public long pop() {
        return elements[--size];
    }

    public void drop(int count) {
        size -= count;
    }

    /**
     * Element at {@code depth}, 0 being the top.
     */
    public long peek(int depth) {
        return elements[size - 1 - depth];
    }

    public void swap(int depth) {
        int top = size - 1;
        int other = top - depth;
        long tmp = elements[top];
        elements[top] = elements[other];
        elements[other] = tmp;
    }

    /**
     * Move the element at {@code depth} to the top.
     */
    public void pick(int depth) {
        int from = size - 1 - depth;
        long value = elements[from];
        System.arraycopy(elements, from + 1, elements, from, depth);
        elements[size - 1] = value;
    }

    /**
     * Pop the top and insert it so that it ends at {@code depth}.
     */
    public void place(int depth) {
        long value = elements[size - 1];
        int to = size - 1 - depth;
        System.arraycopy(elements, to, elements, to + 1, depth);
        elements[to] = value;
    }

    /**
     * Contents, bottom first.
     */
    public long[] toArray() {
        return Arrays.copyOf(elements, size);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < size; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(Long.toUnsignedString(elements[i]));
        }
        return sb.append(']').toString();
    }
}
