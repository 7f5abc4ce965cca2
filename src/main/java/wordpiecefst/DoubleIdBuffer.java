package wordpiecefst;

import org.apache.lucene.util.ArrayUtil;

import java.util.Arrays;

/**
 * {@link IdBuffer} of double precision ids ({@link IdKind#F64}).
 * <p>
 * Mostly useful for attention masks that feed floating point tensors.
 * </p>
 */
public final class DoubleIdBuffer extends IdBuffer {
    private double[] ids;

    public DoubleIdBuffer() {
        this(16);
    }

    public DoubleIdBuffer(int capacity) {
        this.ids = new double[Math.max(capacity, 1)];
    }

    @Override
    public IdKind<Double> kind() {
        return IdKind.F64;
    }

    @Override
    public void add(long canonical) {
        if (size == ids.length) {
            ids = ArrayUtil.grow(ids, size + 1);
        }
        ids[size++] = (double) canonical;
    }

    @Override
    public long canonical(int index) {
        checkIndex(index);
        return (long) ids[index];
    }

    @Override
    public boolean isZero(int index) {
        checkIndex(index);
        return ids[index] == 0.0d;
    }

    public double get(int index) {
        checkIndex(index);
        return ids[index];
    }

    public double[] toArray() {
        return Arrays.copyOf(ids, size);
    }
}
