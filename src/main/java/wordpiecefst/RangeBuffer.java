package wordpiecefst;

import org.apache.lucene.util.ArrayUtil;

import java.util.Objects;

/**
 * Growable, caller-owned buffer of half-open integer ranges {@code [start, end)}.
 * <p>
 * The tokenizer uses it twice: for the byte range of every emitted token and, optionally,
 * for the range of token indices belonging to each input word. Starts and ends are kept in
 * two parallel {@code int[]} arrays so that filling the buffer does not allocate per range.
 * </p>
 *
 * <p>Not thread-safe.</p>
 */
public final class RangeBuffer {
    private int[] starts;
    private int[] ends;
    private int size;

    public RangeBuffer() {
        this(16);
    }

    public RangeBuffer(int capacity) {
        int c = Math.max(capacity, 1);
        this.starts = new int[c];
        this.ends = new int[c];
    }

    /**
     * Appends the range {@code [start, end)}.
     *
     * @param start inclusive start
     * @param end   exclusive end, not smaller than {@code start}
     */
    public void add(int start, int end) {
        if (end < start) {
            throw new IllegalArgumentException("Invalid range " + start + ".." + end);
        }
        if (size == starts.length) {
            starts = ArrayUtil.grow(starts, size + 1);
            ends = ArrayUtil.grow(ends, starts.length);
        }
        starts[size] = start;
        ends[size] = end;
        size++;
    }

    public int start(int index) {
        Objects.checkIndex(index, size);
        return starts[index];
    }

    public int end(int index) {
        Objects.checkIndex(index, size);
        return ends[index];
    }

    /**
     * @param index position in the buffer
     * @return {@code end(index) - start(index)}
     */
    public int length(int index) {
        Objects.checkIndex(index, size);
        return ends[index] - starts[index];
    }

    /**
     * Returns the end of the last range, or {@code 0} when the buffer is empty.
     *
     * @return the last end offset
     */
    public int lastEnd() {
        return size == 0 ? 0 : ends[size - 1];
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Removes all ranges, keeping the allocated capacity.
     */
    public void clear() {
        size = 0;
    }

    /**
     * Drops every range at or after {@code newSize}.
     *
     * @param newSize the new size, at most the current size
     */
    public void truncate(int newSize) {
        if (newSize < 0 || newSize > size) {
            throw new IllegalArgumentException("Cannot truncate buffer of size " + size + " to " + newSize);
        }
        size = newSize;
    }

    /**
     * Copies the ranges into {@code [start, end]} pairs.
     *
     * @return one two-element array per range
     */
    public int[][] toArray() {
        int[][] out = new int[size][];
        for (int i = 0; i < size; i++) {
            out[i] = new int[]{starts[i], ends[i]};
        }
        return out;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < size; i++) {
            if (i > 0) sb.append(", ");
            sb.append(starts[i]).append("..").append(ends[i]);
        }
        return sb.append(']').toString();
    }
}
