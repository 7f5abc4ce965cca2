package wordpiecefst;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Immutable word-piece vocabulary: an ordered list of token strings whose positions are the
 * token ids, plus the ids that play a structural role.
 *
 * <p>The vocabulary file format is the one shipped with BERT-style models:</p>
 * <ul>
 *   <li>UTF-8 text, one token per line, the line index is the token id</li>
 *   <li>{@code ##}-prefixed tokens are continuation pieces</li>
 *   <li>bracket-delimited tokens such as {@code [CLS]} are special tokens</li>
 *   <li>{@code [unused...]} lines reserve an id and take no further part in tokenization</li>
 * </ul>
 *
 * <p>
 * Every bracket-delimited token is <em>special</em>
 * ({@link #isSpecial(long)}), but only three literals resolve a <em>role</em>:
 * {@link #UNK} (required), {@link #CLS} (prefix) and {@link #SEP} (suffix).
 * </p>
 */
public final class Vocabulary {

    /**
     * Unknown-word token, required.
     */
    public static final String UNK = "[UNK]";
    /**
     * Classification token, emitted as prefix when present.
     */
    public static final String CLS = "[CLS]";
    /**
     * Separator token, emitted as suffix when present.
     */
    public static final String SEP = "[SEP]";
    /**
     * Padding token, conventionally id 0. Not treated specially beyond being bracketed.
     */
    public static final String PAD = "[PAD]";
    /**
     * Prefix of reserved placeholder slots.
     */
    public static final String UNUSED_PREFIX = "[unused";
    /**
     * Marker of continuation pieces.
     */
    public static final String CONTINUATION = "##";

    /**
     * Default file name used when saving a vocabulary into a folder.
     */
    public static final String FILE_NAME = "vocab.txt";

    private final List<String> tokens;
    private final BitSet special;
    private final int unkId;
    private final int prefixId;
    private final int suffixId;

    private Vocabulary(List<String> tokens, BitSet special, int unkId, int prefixId, int suffixId) {
        this.tokens = tokens;
        this.special = special;
        this.unkId = unkId;
        this.prefixId = prefixId;
        this.suffixId = suffixId;
    }

    /**
     * Builds a vocabulary from token strings, resolving special tokens and roles.
     *
     * @param tokens the tokens, in id order
     * @return the vocabulary
     * @throws VocabularyException if no {@link #UNK} token is present
     */
    public static Vocabulary of(List<String> tokens) throws VocabularyException {
        final List<String> copy = Collections.unmodifiableList(new ArrayList<>(tokens));
        final BitSet special = new BitSet(copy.size());
        int unk = -1;
        int prefix = -1;
        int suffix = -1;

        for (int id = 0; id < copy.size(); id++) {
            final String token = Objects.requireNonNull(copy.get(id), "token");
            if (isUnused(token) || !isBracketed(token)) continue;

            special.set(id);
            switch (token) {
                case UNK:
                    unk = id;
                    break;
                case CLS:
                    prefix = id;
                    break;
                case SEP:
                    suffix = id;
                    break;
                default:
                    break;
            }
        }

        if (unk < 0) {
            throw new VocabularyException("Vocabulary has no " + UNK + " token");
        }
        return new Vocabulary(copy, special, unk, prefix, suffix);
    }

    /**
     * Loads a vocabulary file.
     *
     * @param file the UTF-8 vocabulary file
     * @return the vocabulary
     * @throws IOException if the file cannot be read or has no {@link #UNK} token
     */
    public static Vocabulary load(Path file) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(br);
        }
    }

    /**
     * Loads a vocabulary from a UTF-8 stream, for example a classpath resource.
     * The stream is closed on return. Malformed UTF-8 fails the load, as it does for
     * {@link #load(Path)}.
     *
     * @param in the stream
     * @return the vocabulary
     * @throws IOException if the stream cannot be read or has no {@link #UNK} token
     */
    public static Vocabulary load(InputStream in) throws IOException {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8.newDecoder()))) {
            return load(br);
        }
    }

    /**
     * Reads one token per line. A BOM ({@code U+FEFF}) in front of the first token is stripped.
     *
     * @param br a reader supplying the vocabulary text
     * @return the vocabulary
     * @throws IOException if reading fails or no {@link #UNK} token is present
     */
    public static Vocabulary load(BufferedReader br) throws IOException {
        final List<String> tokens = new ArrayList<>();
        for (String line; (line = br.readLine()) != null; ) {
            if (tokens.isEmpty() && !line.isEmpty() && line.charAt(0) == '\uFEFF') {
                line = line.substring(1);
            }
            tokens.add(line);
        }
        return of(tokens);
    }

    /**
     * Writes the tokens back, one per line, in id order.
     *
     * @param file destination file, created or truncated
     * @return {@code file}
     * @throws IOException if the file cannot be written
     */
    public Path save(Path file) throws IOException {
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (String token : tokens) {
                w.write(token);
                w.write('\n');
            }
        }
        return file;
    }

    /**
     * @param token a vocabulary line
     * @return {@code true} for reserved {@code [unused...]} slots
     */
    public static boolean isUnused(String token) {
        return token.startsWith(UNUSED_PREFIX);
    }

    /**
     * @param token a vocabulary line
     * @return {@code true} if the token starts with {@code [} and ends with {@code ]}
     */
    public static boolean isBracketed(String token) {
        return token.length() >= 2 && token.charAt(0) == '[' && token.charAt(token.length() - 1) == ']';
    }

    /**
     * @param token a vocabulary line
     * @return {@code true} for continuation pieces ({@code ##} prefix)
     */
    public static boolean isContinuation(String token) {
        return token.startsWith(CONTINUATION);
    }

    /**
     * @return the number of tokens, including unused slots
     */
    public int size() {
        return tokens.size();
    }

    /**
     * @param id a token id
     * @return the token text as written in the vocabulary file
     * @throws IndexOutOfBoundsException if {@code id} is not a valid id
     */
    public String get(int id) {
        return tokens.get(id);
    }

    /**
     * @return the tokens in id order (unmodifiable)
     */
    public List<String> tokens() {
        return tokens;
    }

    /**
     * @param id a token id
     * @return {@code true} if the token is bracket-delimited and not an unused slot
     */
    public boolean isSpecial(long id) {
        return id >= 0 && id < tokens.size() && special.get((int) id);
    }

    /**
     * @return the number of special tokens
     */
    public int specialCount() {
        return special.cardinality();
    }

    public int unkId() {
        return unkId;
    }

    /**
     * @return the {@link #CLS} id, or {@code -1} if the vocabulary has none
     */
    public int prefixId() {
        return prefixId;
    }

    /**
     * @return the {@link #SEP} id, or {@code -1} if the vocabulary has none
     */
    public int suffixId() {
        return suffixId;
    }

    @Override
    public String toString() {
        return "<Vocabulary with " + tokens.size() + " tokens, " + specialCount() + " special>";
    }
}
