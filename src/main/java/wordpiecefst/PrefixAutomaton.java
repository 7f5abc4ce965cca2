package wordpiecefst;

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.IntsRefBuilder;
import org.apache.lucene.util.fst.FST;
import org.apache.lucene.util.fst.FSTCompiler;
import org.apache.lucene.util.fst.PositiveIntOutputs;
import org.apache.lucene.util.fst.Util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Immutable byte-keyed automaton answering longest-prefix queries.
 * <p>
 * Keys are UTF-8 byte strings mapped to non-negative {@code long} payloads. The automaton is
 * compiled once into a Lucene {@link FST} over {@link PositiveIntOutputs} and never modified
 * afterwards, so a single instance can be shared by any number of threads.
 * </p>
 *
 * <p>
 * Walking the FST needs a little mutable state (the current arc and a byte reader). That state
 * lives in a {@link Walker}, obtained from {@link #newWalker()} and owned by one thread at a time.
 * </p>
 *
 * <p>This class has no knowledge of tokens or vocabularies.</p>
 */
public final class PrefixAutomaton {

    private static final PositiveIntOutputs OUTPUTS = PositiveIntOutputs.getSingleton();

    /**
     * Compiled transducer, {@code null} when the automaton has no keys.
     */
    private final FST<Long> fst;

    /**
     * Number of distinct keys.
     */
    private final int size;

    private PrefixAutomaton(FST<Long> fst, int size) {
        this.fst = fst;
        this.size = size;
    }

    /**
     * Compiles an automaton from key/payload pairs.
     *
     * <p>The entries are sorted in unsigned byte order before compilation, as the FST
     * compiler requires. Empty keys are rejected because a longest-prefix walk can never
     * report a match of length zero.</p>
     *
     * @param entries keys and their payloads; each key appears once by construction of the map
     * @return the compiled automaton
     * @throws IOException              if the FST compiler fails
     * @throws IllegalArgumentException if a key is empty or a payload is negative
     */
    public static PrefixAutomaton build(Map<BytesRef, Long> entries) throws IOException {
        final SortedMap<BytesRef, Long> sorted = new TreeMap<>(entries);
        if (sorted.isEmpty()) {
            return new PrefixAutomaton(null, 0);
        }

        final FSTCompiler<Long> compiler = new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE1, OUTPUTS).build();
        final IntsRefBuilder scratch = new IntsRefBuilder();
        for (Map.Entry<BytesRef, Long> e : sorted.entrySet()) {
            final BytesRef key = e.getKey();
            final long payload = e.getValue();
            if (key.length == 0) {
                throw new IllegalArgumentException("Empty keys are not supported");
            }
            if (payload < 0) {
                throw new IllegalArgumentException("Negative payload " + payload + " for key " + key.utf8ToString());
            }
            compiler.add(Util.toIntsRef(key, scratch), payload);
        }
        return new PrefixAutomaton(compiler.compile(), sorted.size());
    }

    /**
     * Creates the mutable walk state for this automaton.
     *
     * @return a walker, to be used by a single thread at a time
     */
    public Walker newWalker() {
        return new Walker(this);
    }

    /**
     * Finds the longest prefix of {@code bytes[offset, end)} that is itself a key.
     *
     * <p>The walk follows one transition per input byte and stops at the first byte without a
     * transition. Every time it lands on a final state the match so far is remembered; the last
     * one remembered is the answer. A traversable path that does not end on a key is therefore
     * never reported.</p>
     *
     * <p>Arc outputs come back as boxed {@code Long}s, so the walk may allocate for payloads
     * outside the {@code Long} cache.</p>
     *
     * @param walker walk state created by {@link #newWalker()} on this automaton; on a match its
     *               {@link Walker#payload()} holds the matched key's payload
     * @param bytes  input bytes
     * @param offset first byte to consider
     * @param end    end of the input (exclusive)
     * @return the length of the longest matching key, or {@code 0} if no key is a prefix
     */
    public int longestPrefix(Walker walker, byte[] bytes, int offset, int end) {
        if (walker.owner != this) {
            throw new IllegalArgumentException("Walker belongs to a different automaton");
        }
        if (fst == null) {
            return 0;
        }

        final FST.Arc<Long> arc = fst.getFirstArc(walker.arc);
        long output = 0L;
        int matched = 0;
        try {
            for (int i = offset; i < end; i++) {
                if (fst.findTargetArc(bytes[i] & 0xFF, arc, arc, walker.reader) == null) {
                    break;
                }
                output += arc.output();
                if (arc.isFinal()) {
                    matched = i + 1 - offset;
                    walker.payload = output + arc.nextFinalOutput();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read FST arc", e);
        }
        return matched;
    }

    /**
     * Exact lookup of a key.
     *
     * @param key UTF-8 key bytes
     * @return the payload, or {@code -1} if the key is absent
     */
    public long get(BytesRef key) {
        if (fst == null || key.length == 0) {
            return -1L;
        }
        try {
            final Long value = Util.get(fst, key);
            return value == null ? -1L : value;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read FST", e);
        }
    }

    /**
     * Exact lookup of a string key, encoded as UTF-8.
     *
     * @param key the key text
     * @return the payload, or {@code -1} if the key is absent
     */
    public long get(CharSequence key) {
        return get(new BytesRef(key));
    }

    /**
     * @return the number of keys
     */
    public int size() {
        return size;
    }

    /**
     * @return heap bytes used by the compiled FST
     */
    public long ramBytesUsed() {
        return fst == null ? 0L : fst.ramBytesUsed();
    }

    /**
     * Per-thread walk state: the arc being followed, the FST byte reader and the payload of
     * the last successful match.
     */
    public static final class Walker {
        private final PrefixAutomaton owner;
        private final FST.Arc<Long> arc = new FST.Arc<>();
        private final FST.BytesReader reader;
        private long payload = -1L;

        private Walker(PrefixAutomaton owner) {
            this.owner = owner;
            this.reader = owner.fst == null ? null : owner.fst.getBytesReader();
        }

        /**
         * @return the payload of the last match reported by
         * {@link PrefixAutomaton#longestPrefix(Walker, byte[], int, int)}
         */
        public long payload() {
            return payload;
        }
    }
}
