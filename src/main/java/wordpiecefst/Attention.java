package wordpiecefst;

/**
 * Derives attention masks from token ids: padding (id zero) gets no attention, every other
 * token gets full attention.
 */
public final class Attention {

    private Attention() {
    }

    /**
     * Calculates the attention for one token.
     *
     * <pre>{@code
     * long pad = Attention.attention(0L, IdKind.U64, IdKind.I64);      // 0
     * double tok = Attention.attention(99, IdKind.I32, IdKind.F64);    // 1.0
     * }</pre>
     *
     * @param tokenId  the token id
     * @param idKind   representation of {@code tokenId}
     * @param maskKind representation of the result
     * @param <T>      id type
     * @param <U>      mask type
     * @return {@code maskKind.zero()} if {@code tokenId} is zero, otherwise {@code maskKind.one()}
     */
    public static <T, U> U attention(T tokenId, IdKind<T> idKind, IdKind<U> maskKind) {
        return idKind.isZero(tokenId) ? maskKind.zero() : maskKind.one();
    }

    /**
     * Clears {@code mask} and appends one attention value per id of {@code ids}, in order.
     *
     * @param ids  token ids
     * @param mask receives the attention values; may use a different representation than {@code ids}
     */
    public static void attentionsInto(IdBuffer ids, IdBuffer mask) {
        if (ids == mask) {
            throw new IllegalArgumentException("ids and mask must be different buffers");
        }
        mask.clear();
        for (int i = 0; i < ids.size(); i++) {
            mask.add(ids.isZero(i) ? 0L : 1L);
        }
    }
}
