package wordpiecefst;

import java.util.Objects;

/**
 * Growable, caller-owned buffer of token ids in one numeric representation.
 * <p>
 * The tokenizer only ever talks to a buffer in canonical ids ({@link #add(long)},
 * {@link #canonical(int)}); each subclass converts to and from its primitive storage.
 * This keeps a single segmentation algorithm for every output type without boxing.
 * </p>
 *
 * <p>
 * {@link #clear()} and {@link #truncate(int)} only move the size; the backing array keeps
 * its capacity so that a buffer reused across calls stops allocating once it is large enough.
 * </p>
 *
 * <p>Buffers are not thread-safe. Concurrent tokenizer calls must use distinct buffers.</p>
 */
public abstract class IdBuffer {
    /**
     * Number of ids currently held.
     */
    protected int size;

    /**
     * Returns the numeric representation stored by this buffer.
     *
     * @return the id kind
     */
    public abstract IdKind<?> kind();

    /**
     * Appends a canonical id, converted to this buffer's representation.
     *
     * @param canonical the canonical id
     */
    public abstract void add(long canonical);

    /**
     * Returns the id at {@code index}, converted back to its canonical form.
     *
     * @param index position in the buffer
     * @return the canonical id
     * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, size())}
     */
    public abstract long canonical(int index);

    /**
     * Tests whether the id at {@code index} equals this representation's zero.
     *
     * @param index position in the buffer
     * @return {@code true} if the stored value is zero
     */
    public abstract boolean isZero(int index);

    /**
     * Number of ids in the buffer.
     *
     * @return the size
     */
    public final int size() {
        return size;
    }

    /**
     * @return {@code true} if the buffer holds no ids
     */
    public final boolean isEmpty() {
        return size == 0;
    }

    /**
     * Removes all ids, keeping the allocated capacity.
     */
    public final void clear() {
        size = 0;
    }

    /**
     * Drops every id at or after {@code newSize}.
     *
     * @param newSize the new size, at most the current size
     * @throws IllegalArgumentException if {@code newSize} is negative or larger than {@link #size()}
     */
    public final void truncate(int newSize) {
        if (newSize < 0 || newSize > size) {
            throw new IllegalArgumentException("Cannot truncate buffer of size " + size + " to " + newSize);
        }
        size = newSize;
    }

    /**
     * Copies the buffer into a new array of canonical ids.
     *
     * @return the canonical ids, in order
     */
    public long[] toCanonicalArray() {
        long[] out = new long[size];
        for (int i = 0; i < size; i++) {
            out[i] = canonical(i);
        }
        return out;
    }

    final void checkIndex(int index) {
        Objects.checkIndex(index, size);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind()).append('[');
        for (int i = 0; i < size; i++) {
            if (i > 0) sb.append(", ");
            sb.append(Long.toUnsignedString(canonical(i)));
        }
        return sb.append(']').toString();
    }
}
