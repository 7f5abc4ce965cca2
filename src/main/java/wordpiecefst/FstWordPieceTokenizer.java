package wordpiecefst;

import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefBuilder;
import org.apache.lucene.util.CloseableThreadLocal;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Word-piece tokenizer driven by two longest-prefix automata.
 *
 * <p>The vocabulary is split once into</p>
 * <ul>
 *   <li><b>starters</b> – every token that may begin a word, keyed by its full text</li>
 *   <li><b>followers</b> – every {@code ##} continuation token, keyed by the text after the marker</li>
 * </ul>
 * <p>and both sets are compiled into a {@link PrefixAutomaton}. Tokenization then mirrors the
 * greedy word-piece algorithm used by BERT: the text is split on whitespace, each word takes the
 * longest starter that prefixes it, then repeatedly the longest follower that prefixes the rest.
 * If a word cannot be consumed completely it is replaced by a single {@code [UNK]} token.</p>
 *
 * <p>Instances are immutable and safe to share between threads. All output goes into buffers
 * supplied by the caller, which are cleared and refilled on every call; FST walk state and the
 * UTF-8 encoding buffer are kept per thread. {@link #close()} releases that per-thread state
 * for every thread at once; an unreachable tokenizer releases it as well.</p>
 *
 * <pre>{@code
 * FstWordPieceTokenizer tokenizer = FstWordPieceTokenizer.fromVocab(Paths.get("vocab.txt"));
 * IntIdBuffer ids = new IntIdBuffer();
 * RangeBuffer ranges = new RangeBuffer();
 * tokenizer.tokensInto("Ein interessantes Beispiel", ids, ranges, null);
 * }</pre>
 */
public final class FstWordPieceTokenizer implements Closeable {
    /**
     * Internal logger used for load diagnostics.
     * Logging is disabled by default so that embedding applications stay quiet.
     */
    private static final Logger LOGGER = Logger.getLogger(FstWordPieceTokenizer.class.getName());

    static {
        LOGGER.setLevel(Level.OFF);
    }

    /**
     * Enables or disables verbose logging of vocabulary loading.
     *
     * @param enabled {@code true} to log at {@link Level#INFO}, {@code false} to silence the logger
     */
    public static void setVerboseLogging(boolean enabled) {
        LOGGER.setLevel(enabled ? Level.INFO : Level.OFF);
    }

    private final Vocabulary vocab;
    private final PrefixAutomaton starters;
    private final PrefixAutomaton followers;

    /**
     * Per-thread walk state and encoding buffer.
     */
    private final CloseableThreadLocal<Scratch> scratch = new CloseableThreadLocal<>() {
        @Override
        protected Scratch initialValue() {
            return new Scratch(FstWordPieceTokenizer.this);
        }
    };

    private volatile boolean closed;

    private FstWordPieceTokenizer(Vocabulary vocab, PrefixAutomaton starters, PrefixAutomaton followers) {
        this.vocab = vocab;
        this.starters = starters;
        this.followers = followers;
    }

    /**
     * Loads a tokenizer from a vocabulary file.
     *
     * @param vocabFile the vocabulary, one token per line
     * @return the tokenizer
     * @throws IOException if the file cannot be read, has no {@code [UNK]} token or cannot be compiled
     */
    public static FstWordPieceTokenizer fromVocab(Path vocabFile) throws IOException {
        LOGGER.info(() -> "Loading vocabulary from " + vocabFile.toAbsolutePath());
        return fromVocab(Vocabulary.load(vocabFile));
    }

    /**
     * Loads a tokenizer from a vocabulary file path.
     *
     * @param vocabFile the file path
     * @return the tokenizer
     * @throws IOException if loading fails
     */
    public static FstWordPieceTokenizer fromVocab(String vocabFile) throws IOException {
        return fromVocab(Paths.get(vocabFile));
    }

    /**
     * Loads a tokenizer from a UTF-8 vocabulary stream, for example a bundled resource.
     *
     * @param in the stream, closed on return
     * @return the tokenizer
     * @throws IOException if loading fails
     */
    public static FstWordPieceTokenizer fromVocab(InputStream in) throws IOException {
        return fromVocab(Vocabulary.load(in));
    }

    /**
     * Builds the starter and follower automata of a loaded vocabulary.
     *
     * <p>Unused slots and empty keys keep their ids but are not matchable. When the same key
     * appears more than once, the highest id wins.</p>
     *
     * @param vocab the vocabulary
     * @return the tokenizer
     * @throws VocabularyException if an automaton cannot be compiled
     */
    public static FstWordPieceTokenizer fromVocab(Vocabulary vocab) throws VocabularyException {
        final long startTime = System.nanoTime();
        final Map<BytesRef, Long> starterKeys = new HashMap<>();
        final Map<BytesRef, Long> followerKeys = new HashMap<>();

        final List<String> tokens = vocab.tokens();
        for (int id = 0; id < tokens.size(); id++) {
            final String token = tokens.get(id);
            if (token.isEmpty() || Vocabulary.isUnused(token)) continue;

            if (Vocabulary.isContinuation(token)) {
                final String piece = token.substring(Vocabulary.CONTINUATION.length());
                if (!piece.isEmpty()) followerKeys.put(new BytesRef(piece), (long) id);
            } else {
                starterKeys.put(new BytesRef(token), (long) id);
            }
        }

        final PrefixAutomaton starters;
        final PrefixAutomaton followers;
        try {
            starters = PrefixAutomaton.build(starterKeys);
            followers = PrefixAutomaton.build(followerKeys);
        } catch (IOException | IllegalArgumentException e) {
            throw new VocabularyException("Failed to compile vocabulary automata", e);
        }

        LOGGER.info(() -> String.format("Built tokenizer: %d tokens, %d starters, %d followers, %d special, %d FST bytes in %d ms",
                vocab.size(), starters.size(), followers.size(), vocab.specialCount(),
                starters.ramBytesUsed() + followers.ramBytesUsed(),
                (System.nanoTime() - startTime) / 1_000_000));
        return new FstWordPieceTokenizer(vocab, starters, followers);
    }

    /**
     * Tokenizes {@code text} into the given buffers.
     *
     * <p>All buffers are cleared first. If the vocabulary has a {@code [CLS]} token it is emitted
     * first with the empty range {@code 0..0}; if it has a {@code [SEP]} token it is emitted last
     * with an empty range at the end of the last token. Every other token carries the range of
     * UTF-8 bytes of {@code text} it was matched from.</p>
     *
     * @param text   the text; words are separated by runs of Unicode whitespace
     * @param ids    receives the token ids
     * @param ranges receives one byte range per id
     * @param words  if not {@code null}, receives for every word the range of indices into
     *               {@code ids} holding its tokens
     */
    public void tokensInto(CharSequence text, IdBuffer ids, RangeBuffer ranges, RangeBuffer words) {
        Objects.requireNonNull(text, "text");
        final Scratch s = scratch();
        s.utf8.copyChars(text);
        tokensInto(s, s.utf8.bytes(), 0, s.utf8.length(), ids, ranges, words);
    }

    /**
     * Tokenizes UTF-8 encoded text into the given buffers.
     *
     * <p>Same contract as {@link #tokensInto(CharSequence, IdBuffer, RangeBuffer, RangeBuffer)};
     * byte ranges are relative to {@code offset}. A malformed UTF-8 sequence is consumed one
     * byte at a time and never swallows the whitespace that follows it.</p>
     *
     * @param utf8   the encoded text
     * @param offset start of the text in {@code utf8}
     * @param length number of bytes of text
     * @param ids    receives the token ids
     * @param ranges receives one byte range per id
     * @param words  optional receiver of per-word token index ranges
     */
    public void tokensInto(byte[] utf8, int offset, int length,
                           IdBuffer ids, RangeBuffer ranges, RangeBuffer words) {
        Objects.checkFromIndexSize(offset, length, utf8.length);
        tokensInto(scratch(), utf8, offset, offset + length, ids, ranges, words);
    }

    private void tokensInto(Scratch s, byte[] bytes, int offset, int end,
                            IdBuffer ids, RangeBuffer ranges, RangeBuffer words) {
        ids.clear();
        ranges.clear();
        if (words != null) words.clear();

        if (vocab.prefixId() >= 0) {
            ids.add(vocab.prefixId());
            ranges.add(0, 0);
        }

        int i = offset;
        while (i < end) {
            final int ws = whitespaceLength(bytes, i, end);
            if (ws > 0) {
                i += ws;
                continue;
            }
            final int wordStart = i;
            do {
                i += sequenceLength(bytes, i, end);
            } while (i < end && whitespaceLength(bytes, i, end) == 0);

            final int firstToken = ids.size();
            tokenizeWord(s, bytes, offset, wordStart, i, ids, ranges);
            if (words != null) words.add(firstToken, ids.size());
        }

        if (vocab.suffixId() >= 0) {
            final int pos = ranges.lastEnd();
            ids.add(vocab.suffixId());
            ranges.add(pos, pos);
        }
    }

    /**
     * Segments one word, {@code bytes[start, end)}, appending its pieces.
     *
     * <p>The longest starter is taken first, then followers until the word is consumed. If some
     * suffix of the word cannot be matched, every piece appended for this word is dropped and
     * a single unknown token spanning the word is appended instead.</p>
     *
     * @param base offset that ranges are made relative to
     */
    void tokenizeWord(Scratch s, byte[] bytes, int base, int start, int end,
                      IdBuffer ids, RangeBuffer ranges) {
        final int mark = ids.size();
        int cursor = start;

        int len = starters.longestPrefix(s.starters, bytes, start, end);
        if (len > 0) {
            ids.add(s.starters.payload());
            ranges.add(start - base, start + len - base);
            cursor += len;
            while (cursor < end) {
                len = followers.longestPrefix(s.followers, bytes, cursor, end);
                if (len == 0) break;
                ids.add(s.followers.payload());
                ranges.add(cursor - base, cursor + len - base);
                cursor += len;
            }
        }

        if (cursor < end) {
            ids.truncate(mark);
            ranges.truncate(mark);
            ids.add(vocab.unkId());
            ranges.add(start - base, end - base);
        }
    }

    /**
     * Returns the per-thread scratch of this tokenizer.
     *
     * @throws AlreadyClosedException if the tokenizer was closed
     */
    Scratch scratch() {
        if (closed) {
            throw new AlreadyClosedException("this tokenizer is closed");
        }
        return scratch.get();
    }

    /**
     * Releases the per-thread walk state. Tokenizing afterwards throws
     * {@link AlreadyClosedException}; lookups keep working. Must not race with calls still
     * tokenizing on other threads.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            scratch.close();
            LOGGER.fine("Closed tokenizer");
        }
    }

    /**
     * Returns the number of bytes of the UTF-8 sequence starting at {@code i}, never running
     * past {@code end}. A malformed lead byte, or a lead byte not followed by enough
     * continuation bytes, counts as one byte.
     */
    static int sequenceLength(byte[] bytes, int i, int end) {
        final int b = bytes[i] & 0xFF;
        final int n;
        if (b < 0x80) return 1;
        else if ((b & 0xE0) == 0xC0) n = 2;
        else if ((b & 0xF0) == 0xE0) n = 3;
        else if ((b & 0xF8) == 0xF0) n = 4;
        else return 1;
        return continuations(bytes, i + 1, end, n - 1) ? n : 1;
    }

    /**
     * Tests whether {@code bytes[from, from + count)} lies before {@code end} and holds only
     * continuation bytes ({@code 10xxxxxx}).
     */
    private static boolean continuations(byte[] bytes, int from, int end, int count) {
        if (from + count > end) return false;
        for (int k = from; k < from + count; k++) {
            if ((bytes[k] & 0xC0) != 0x80) return false;
        }
        return true;
    }

    /**
     * Returns the byte length of the whitespace code point at {@code i}, or {@code 0} if the
     * code point there is not whitespace or is not well-formed.
     */
    static int whitespaceLength(byte[] bytes, int i, int end) {
        final int b = bytes[i] & 0xFF;
        if (b < 0x80) {
            return isWhitespace(b) ? 1 : 0;
        }
        final int cp;
        if ((b & 0xE0) == 0xC0 && continuations(bytes, i + 1, end, 1)) {
            cp = ((b & 0x1F) << 6) | (bytes[i + 1] & 0x3F);
            return isWhitespace(cp) ? 2 : 0;
        }
        if ((b & 0xF0) == 0xE0 && continuations(bytes, i + 1, end, 2)) {
            cp = ((b & 0x0F) << 12) | ((bytes[i + 1] & 0x3F) << 6) | (bytes[i + 2] & 0x3F);
            return isWhitespace(cp) ? 3 : 0;
        }
        // no whitespace outside the BMP
        return 0;
    }

    /**
     * Unicode {@code White_Space}: the space separators, line and paragraph separators,
     * the ASCII controls TAB through CR, and NEL.
     */
    static boolean isWhitespace(int cp) {
        return (cp >= 0x09 && cp <= 0x0D) || cp == 0x85 || Character.isSpaceChar(cp);
    }

    /**
     * @param tokenId a token id
     * @return the token text as written in the vocabulary
     * @throws IndexOutOfBoundsException if {@code tokenId} is not a valid id
     */
    public String textOf(long tokenId) {
        if (tokenId < 0 || tokenId >= vocab.size()) {
            throw new IndexOutOfBoundsException("Token id " + tokenId + " out of range [0, " + vocab.size() + ")");
        }
        return vocab.get((int) tokenId);
    }

    /**
     * @param ids token ids
     * @return the texts of the given tokens, in order
     */
    public List<String> textsOf(IdBuffer ids) {
        final List<String> texts = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            texts.add(textOf(ids.canonical(i)));
        }
        return texts;
    }

    /**
     * Determines whether a token is special, e.g. {@code [CLS]}, {@code [SEP]}, {@code [PAD]}
     * or {@code [UNK]}.
     *
     * @param tokenId a token id
     * @return {@code true} if the token is bracket-delimited and not an unused slot
     */
    public boolean isSpecial(long tokenId) {
        return vocab.isSpecial(tokenId);
    }

    /**
     * Writes the vocabulary back to a file, one token per line in id order.
     * The automata are rebuilt when the file is loaded again.
     *
     * @param vocabFile destination file
     * @return {@code vocabFile}
     * @throws IOException if the file cannot be written
     */
    public Path saveVocab(Path vocabFile) throws IOException {
        final Path saved = vocab.save(vocabFile);
        LOGGER.info(() -> "Saved " + vocab.size() + " tokens to " + saved.toAbsolutePath());
        return saved;
    }

    /**
     * @return the underlying vocabulary
     */
    public Vocabulary vocabulary() {
        return vocab;
    }

    public int vocabSize() {
        return vocab.size();
    }

    public int unkId() {
        return vocab.unkId();
    }

    /**
     * @return the id emitted before the first word, or {@code -1} if none
     */
    public int prefixId() {
        return vocab.prefixId();
    }

    /**
     * @return the id emitted after the last word, or {@code -1} if none
     */
    public int suffixId() {
        return vocab.suffixId();
    }

    PrefixAutomaton starters() {
        return starters;
    }

    PrefixAutomaton followers() {
        return followers;
    }

    /**
     * Mutable state owned by one thread: FST walkers for both automata and a reusable UTF-8 buffer.
     */
    static final class Scratch {
        final BytesRefBuilder utf8 = new BytesRefBuilder();
        final PrefixAutomaton.Walker starters;
        final PrefixAutomaton.Walker followers;

        Scratch(FstWordPieceTokenizer owner) {
            this.starters = owner.starters.newWalker();
            this.followers = owner.followers.newWalker();
        }
    }
}
