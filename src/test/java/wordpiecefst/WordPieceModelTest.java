package wordpiecefst;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class WordPieceModelTest {

    private static WordPieceModel model;

    @BeforeAll
    static void setUp() throws IOException {
        model = new WordPieceModel(VocabularyFixtures.small());
    }

    @Test
    void tokenizesPreSplitWords() {
        List<Token> tokens = model.tokenize(Arrays.asList(
                new WordModel.Word("unaffable", 0, 9),
                new WordModel.Word("xyz", 10, 13)));

        assertEquals(Arrays.asList(
                new Token(6, "un", 0, 2, 0),
                new Token(7, "##aff", 2, 5, 0),
                new Token(8, "##able", 5, 9, 0),
                new Token(1, "[UNK]", 10, 13, 1)), tokens);
    }

    @Test
    void addsNoFramingTokens() {
        List<Token> tokens = model.tokenize(Collections.singletonList(new WordModel.Word("hello", 4, 9)));
        assertEquals(Collections.singletonList(new Token(9, "hello", 4, 9, 0)), tokens);
    }

    @Test
    void skipsEmptyWords() {
        List<Token> tokens = model.tokenize(Arrays.asList(
                new WordModel.Word("", 0, 0),
                new WordModel.Word("un", 1, 3)));
        assertEquals(Collections.singletonList(new Token(6, "un", 1, 3, 1)), tokens);
        assertTrue(model.tokenize(Collections.emptyList()).isEmpty());
    }

    @Test
    void rejectsInvalidWordOffsets() {
        assertThrows(IllegalArgumentException.class, () -> new WordModel.Word("a", 3, 2));
        assertThrows(IllegalArgumentException.class, () -> new WordModel.Word("a", -1, 0));
    }

    @Test
    void mapsBetweenTokensAndIds() {
        assertEquals(OptionalInt.of(6), model.tokenToId("un"));
        assertEquals(OptionalInt.of(7), model.tokenToId("##aff"));
        assertEquals(OptionalInt.of(2), model.tokenToId("[CLS]"));
        assertEquals(OptionalInt.empty(), model.tokenToId("aff"));
        assertEquals(OptionalInt.empty(), model.tokenToId("##zzz"));
        assertEquals(OptionalInt.empty(), model.tokenToId("[unused0]"));
        assertEquals(OptionalInt.empty(), model.tokenToId("##"));

        assertEquals(Optional.of("##able"), model.idToToken(8));
        assertEquals(Optional.empty(), model.idToToken(-1));
        assertEquals(Optional.empty(), model.idToToken(model.vocabSize()));
        assertEquals(VocabularyFixtures.SMALL.size(), model.vocabSize());
    }

    @Test
    void savesVocabularyIntoFolder(@TempDir Path dir) throws IOException {
        List<Path> plain = model.save(dir, null);
        List<Path> named = model.save(dir, "bert");

        assertEquals(Collections.singletonList(dir.resolve("vocab.txt")), plain);
        assertEquals(Collections.singletonList(dir.resolve("bert-vocab.txt")), named);
        assertEquals(VocabularyFixtures.SMALL, Vocabulary.load(named.get(0)).tokens());
        assertThrows(IOException.class, () -> model.save(dir.resolve("missing"), null));
    }
}
