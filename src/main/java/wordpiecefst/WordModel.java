package wordpiecefst;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Subword model seen from a tokenization pipeline that does its own normalization and
 * pre-splitting and only delegates the per-word segmentation.
 *
 * <p>Offsets are whatever unit the pipeline uses for its words; pieces inside a word are
 * positioned by their UTF-8 byte offset from the word start.</p>
 */
public interface WordModel {

    /**
     * Segments pre-split words into tokens.
     *
     * @param words the words, in order
     * @return the tokens of all words; {@link Token#getWord()} refers to the index in {@code words}
     */
    List<Token> tokenize(List<Word> words);

    /**
     * @param token token text, with the {@code ##} marker for continuation pieces
     * @return the id of the token, or empty if it is not matchable
     */
    OptionalInt tokenToId(String token);

    /**
     * @param id a token id
     * @return the token text, or empty if {@code id} is out of range
     */
    Optional<String> idToToken(int id);

    /**
     * @return the number of ids, including unused slots
     */
    int vocabSize();

    /**
     * Saves the model files into {@code folder}.
     *
     * @param folder destination folder
     * @param name   optional prefix of the file names, may be {@code null}
     * @return the written files
     * @throws IOException if writing fails
     */
    List<Path> save(Path folder, String name) throws IOException;

    /**
     * A pre-split word and its offsets in the source text.
     */
    final class Word {
        private final String text;
        private final int start;
        private final int end;

        public Word(String text, int start, int end) {
            this.text = Objects.requireNonNull(text, "text");
            if (start < 0 || end < start) {
                throw new IllegalArgumentException("Invalid offsets " + start + ".." + end);
            }
            this.start = start;
            this.end = end;
        }

        public String getText() {
            return text;
        }

        public int getStart() {
            return start;
        }

        public int getEnd() {
            return end;
        }

        @Override
        public String toString() {
            return text + "@" + start + ".." + end;
        }
    }
}
