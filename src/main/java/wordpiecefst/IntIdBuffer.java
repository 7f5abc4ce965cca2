package wordpiecefst;

import org.apache.lucene.util.ArrayUtil;

import java.util.Arrays;

/**
 * {@link IdBuffer} of signed 32-bit ids ({@link IdKind#I32}), the usual input type of
 * embedding lookups.
 */
public final class IntIdBuffer extends IdBuffer {
    private int[] ids;

    public IntIdBuffer() {
        this(16);
    }

    public IntIdBuffer(int capacity) {
        this.ids = new int[Math.max(capacity, 1)];
    }

    @Override
    public IdKind<Integer> kind() {
        return IdKind.I32;
    }

    @Override
    public void add(long canonical) {
        if (size == ids.length) {
            ids = ArrayUtil.grow(ids, size + 1);
        }
        ids[size++] = (int) canonical;
    }

    @Override
    public long canonical(int index) {
        checkIndex(index);
        return ids[index];
    }

    @Override
    public boolean isZero(int index) {
        checkIndex(index);
        return ids[index] == 0;
    }

    public int get(int index) {
        checkIndex(index);
        return ids[index];
    }

    public int[] toArray() {
        return Arrays.copyOf(ids, size);
    }
}
