package wordpiecefst;

import org.apache.lucene.util.ArrayUtil;

import java.util.Arrays;
import java.util.Objects;

/**
 * {@link IdBuffer} backed by a {@code long[]}, used for both {@link IdKind#U64} and {@link IdKind#I64}.
 */
public final class LongIdBuffer extends IdBuffer {
    private final IdKind<Long> kind;
    private long[] ids;

    /**
     * Creates an unsigned 64-bit buffer.
     */
    public LongIdBuffer() {
        this(IdKind.U64, 16);
    }

    /**
     * Creates a buffer for a 64-bit kind with the given initial capacity.
     *
     * @param kind     {@link IdKind#U64} or {@link IdKind#I64}
     * @param capacity initial capacity
     */
    public LongIdBuffer(IdKind<Long> kind, int capacity) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.ids = new long[Math.max(capacity, 1)];
    }

    @Override
    public IdKind<Long> kind() {
        return kind;
    }

    @Override
    public void add(long canonical) {
        if (size == ids.length) {
            ids = ArrayUtil.grow(ids, size + 1);
        }
        ids[size++] = canonical;
    }

    @Override
    public long canonical(int index) {
        checkIndex(index);
        return ids[index];
    }

    @Override
    public boolean isZero(int index) {
        checkIndex(index);
        return ids[index] == 0L;
    }

    /**
     * @param index position in the buffer
     * @return the stored value
     */
    public long get(int index) {
        checkIndex(index);
        return ids[index];
    }

    /**
     * @return a copy of the stored values
     */
    public long[] toArray() {
        return Arrays.copyOf(ids, size);
    }
}
