package wordpiecefst;

/**
 * Numeric representation of a token id.
 * <p>
 * Token ids are canonically unsigned 64-bit values. Downstream consumers
 * (tensor libraries, ONNX runtimes, plain Java collections) expect different
 * numeric types, so every representation provides the same small set of
 * conversions and the segmentation code never needs to know which one a caller
 * asked for.
 * </p>
 *
 * <p>The provided kinds are:</p>
 * <ul>
 *   <li>{@link #U64} – unsigned 64-bit, stored in a {@code long} (canonical)</li>
 *   <li>{@link #I64} – signed 64-bit</li>
 *   <li>{@link #I32} – signed 32-bit</li>
 *   <li>{@link #F64} – double precision floating point</li>
 * </ul>
 *
 * @param <T> the boxed Java type of the representation
 */
public interface IdKind<T> {

    /**
     * Returns the zero value of this representation.
     *
     * @return zero
     */
    T zero();

    /**
     * Converts a canonical id into this representation.
     *
     * @param canonical the canonical (unsigned 64-bit) id
     * @return the converted value
     */
    T coerce(long canonical);

    /**
     * Converts a value of this representation back into the canonical id.
     *
     * @param value the value to convert
     * @return the canonical (unsigned 64-bit) id
     */
    long restore(T value);

    /**
     * Returns the value {@code 1} in this representation.
     *
     * @return one
     */
    default T one() {
        return coerce(1L);
    }

    /**
     * Tests whether the value equals {@link #zero()}.
     *
     * @param value the value to test
     * @return {@code true} if {@code value} is zero
     */
    boolean isZero(T value);

    /**
     * Unsigned 64-bit ids, the canonical representation.
     */
    IdKind<Long> U64 = new IdKind<Long>() {
        @Override
        public Long zero() {
            return 0L;
        }

        @Override
        public Long coerce(long canonical) {
            return canonical;
        }

        @Override
        public long restore(Long value) {
            return value;
        }

        @Override
        public boolean isZero(Long value) {
            return value == 0L;
        }

        @Override
        public String toString() {
            return "u64";
        }
    };

    /**
     * Signed 64-bit ids.
     */
    IdKind<Long> I64 = new IdKind<Long>() {
        @Override
        public Long zero() {
            return 0L;
        }

        @Override
        public Long coerce(long canonical) {
            return canonical;
        }

        @Override
        public long restore(Long value) {
            return value;
        }

        @Override
        public boolean isZero(Long value) {
            return value == 0L;
        }

        @Override
        public String toString() {
            return "i64";
        }
    };

    /**
     * Signed 32-bit ids. Canonical ids above {@link Integer#MAX_VALUE} are truncated.
     */
    IdKind<Integer> I32 = new IdKind<Integer>() {
        @Override
        public Integer zero() {
            return 0;
        }

        @Override
        public Integer coerce(long canonical) {
            return (int) canonical;
        }

        @Override
        public long restore(Integer value) {
            return value;
        }

        @Override
        public boolean isZero(Integer value) {
            return value == 0;
        }

        @Override
        public String toString() {
            return "i32";
        }
    };

    /**
     * Double precision ids, for floating point tensors.
     */
    IdKind<Double> F64 = new IdKind<Double>() {
        @Override
        public Double zero() {
            return 0.0d;
        }

        @Override
        public Double coerce(long canonical) {
            return (double) canonical;
        }

        @Override
        public long restore(Double value) {
            return (long) value.doubleValue();
        }

        @Override
        public boolean isZero(Double value) {
            return value == 0.0d;
        }

        @Override
        public String toString() {
            return "f64";
        }
    };
}
