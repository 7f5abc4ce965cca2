package wordpiecefst;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link WordModel} backed by a {@link FstWordPieceTokenizer}.
 * <p>
 * No {@code [CLS]}/{@code [SEP]} tokens are added here: framing a sequence is the pipeline's
 * post-processing step.
 * </p>
 */
public final class WordPieceModel implements WordModel {
    private static final Logger LOGGER = Logger.getLogger(WordPieceModel.class.getName());

    private final FstWordPieceTokenizer tokenizer;

    public WordPieceModel(FstWordPieceTokenizer tokenizer) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
    }

    @Override
    public List<Token> tokenize(List<Word> words) {
        // at least one token per word
        final List<Token> result = new ArrayList<>(words.size());
        final FstWordPieceTokenizer.Scratch s = tokenizer.scratch();
        final LongIdBuffer ids = new LongIdBuffer();
        final RangeBuffer ranges = new RangeBuffer();

        for (int index = 0; index < words.size(); index++) {
            final Word word = words.get(index);
            if (word.getText().isEmpty()) continue;

            s.utf8.copyChars(word.getText());
            ids.clear();
            ranges.clear();
            tokenizer.tokenizeWord(s, s.utf8.bytes(), 0, 0, s.utf8.length(), ids, ranges);

            for (int i = 0; i < ids.size(); i++) {
                final int id = (int) ids.get(i);
                final boolean unknown = id == tokenizer.unkId() && ids.size() == 1;
                result.add(unknown
                        ? new Token(id, tokenizer.textOf(id), word.getStart(), word.getEnd(), index)
                        : new Token(id, tokenizer.textOf(id),
                        word.getStart() + ranges.start(i), word.getStart() + ranges.end(i), index));
            }
        }
        return result;
    }

    @Override
    public OptionalInt tokenToId(String token) {
        final long id = Vocabulary.isContinuation(token)
                ? tokenizer.followers().get(token.substring(Vocabulary.CONTINUATION.length()))
                : tokenizer.starters().get(token);
        return id < 0 ? OptionalInt.empty() : OptionalInt.of((int) id);
    }

    @Override
    public Optional<String> idToToken(int id) {
        if (id < 0 || id >= tokenizer.vocabSize()) {
            return Optional.empty();
        }
        return Optional.of(tokenizer.textOf(id));
    }

    @Override
    public int vocabSize() {
        return tokenizer.vocabSize();
    }

    /**
     * Writes the vocabulary as {@code vocab.txt}, or {@code <name>-vocab.txt} when a name is given.
     */
    @Override
    public List<Path> save(Path folder, String name) throws IOException {
        final String fileName = (name == null) ? Vocabulary.FILE_NAME : name + "-" + Vocabulary.FILE_NAME;
        try {
            return Collections.singletonList(tokenizer.saveVocab(folder.resolve(fileName)));
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to save vocabulary into " + folder, e);
            throw e;
        }
    }
}
