package wordpiecefst;

import java.util.Locale;

/**
 * Named output representations for token ids.
 *
 * <p>Each constant pairs an {@link IdKind} with the {@link IdBuffer} implementation that
 * stores it, so callers configured by name (for example from the command line) can
 * obtain matching buffers without knowing the concrete classes.</p>
 */
public enum IdType {

    /**
     * Unsigned 64-bit ids (canonical).
     */
    U64(IdKind.U64),

    /**
     * Signed 64-bit ids, as used by {@code int64} tensors.
     */
    I64(IdKind.I64),

    /**
     * Signed 32-bit ids.
     */
    I32(IdKind.I32),

    /**
     * Double precision ids.
     */
    F64(IdKind.F64);

    private final IdKind<?> kind;

    IdType(IdKind<?> kind) {
        this.kind = kind;
    }

    /**
     * @return the conversions of this representation
     */
    public IdKind<?> kind() {
        return kind;
    }

    /**
     * Creates an empty buffer for this representation.
     *
     * @return a new buffer
     */
    public IdBuffer newBuffer() {
        switch (this) {
            case U64:
                return new LongIdBuffer(IdKind.U64, 16);
            case I64:
                return new LongIdBuffer(IdKind.I64, 16);
            case I32:
                return new IntIdBuffer();
            case F64:
                return new DoubleIdBuffer();
            default:
                throw new IllegalStateException("Unhandled IdType: " + this);
        }
    }

    /**
     * Returns the lowercase string form of this type.
     * <p>
     * Example: {@code I32.asStr()} → {@code "i32"}.
     * </p>
     *
     * @return the lowercase name
     */
    public String asStr() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a string into an {@code IdType}, case-insensitive.
     *
     * @param value a string such as {@code "i64"} or {@code "F64"}
     * @return the matching constant
     * @throws IllegalArgumentException if {@code value} is {@code null} or unknown
     */
    public static IdType fromStr(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Id type cannot be null");
        }
        return IdType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
