package wordpiecefst;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class VocabularyTest {

    @Test
    void resolvesRolesAndSpecialTokens() throws IOException {
        Vocabulary vocab = Vocabulary.of(VocabularyFixtures.SMALL);

        assertEquals(VocabularyFixtures.SMALL.size(), vocab.size());
        assertEquals(1, vocab.unkId());
        assertEquals(2, vocab.prefixId());
        assertEquals(3, vocab.suffixId());
        assertEquals(5, vocab.specialCount());
        assertTrue(vocab.isSpecial(4));
        assertFalse(vocab.isSpecial(5), "unused slots are not special");
        assertFalse(vocab.isSpecial(-1));
        assertFalse(vocab.isSpecial(1000));
        assertEquals("##aff", vocab.get(7));
    }

    @Test
    void lastOccurrenceOfRoleWins() throws IOException {
        Vocabulary vocab = Vocabulary.of(Arrays.asList("[UNK]", "[SEP]", "[UNK]"));
        assertEquals(2, vocab.unkId());
        assertEquals(-1, vocab.prefixId());
        assertEquals(1, vocab.suffixId());
    }

    @Test
    void requiresUnknownToken() {
        VocabularyException e = assertThrows(VocabularyException.class,
                () -> Vocabulary.of(Arrays.asList("[PAD]", "[CLS]", "[SEP]", "hello")));
        assertTrue(e.getMessage().contains("[UNK]"));
        assertThrows(VocabularyException.class, () -> Vocabulary.of(Collections.emptyList()));
    }

    @Test
    void keepsIdsOfEmptyAndUnusedLines(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("vocab.txt");
        Files.write(file, "[PAD]\n\n[unused1]\n[UNK]\nhello\n".getBytes(StandardCharsets.UTF_8));

        Vocabulary vocab = Vocabulary.load(file);

        assertEquals(5, vocab.size());
        assertEquals("", vocab.get(1));
        assertEquals(3, vocab.unkId());
        assertEquals("hello", vocab.get(4));
    }

    @Test
    void stripsByteOrderMark(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("vocab.txt");
        Files.write(file, "\uFEFF[UNK]\nhello\n".getBytes(StandardCharsets.UTF_8));

        Vocabulary vocab = Vocabulary.load(file);

        assertEquals("[UNK]", vocab.get(0));
        assertEquals(0, vocab.unkId());
    }

    @Test
    void rejectsMalformedUtf8FromFileAndStream(@TempDir Path dir) throws IOException {
        byte[] bytes = {'[', 'U', 'N', 'K', ']', '\n', 'a', (byte) 0xFF, 'b', '\n'};
        Path file = dir.resolve("vocab.txt");
        Files.write(file, bytes);

        assertThrows(CharacterCodingException.class, () -> Vocabulary.load(file));
        assertThrows(CharacterCodingException.class, () -> Vocabulary.load(new ByteArrayInputStream(bytes)));
        assertThrows(CharacterCodingException.class,
                () -> FstWordPieceTokenizer.fromVocab(new ByteArrayInputStream(bytes)));
    }

    @Test
    void savesTokensInIdOrder(@TempDir Path dir) throws IOException {
        Vocabulary vocab = Vocabulary.of(VocabularyFixtures.SMALL);
        Path saved = vocab.save(dir.resolve("copy.txt"));

        assertEquals(VocabularyFixtures.SMALL, Files.readAllLines(saved, StandardCharsets.UTF_8));
        assertEquals(VocabularyFixtures.SMALL, Vocabulary.load(saved).tokens());
    }

    @Test
    void saveFailsForMissingFolder(@TempDir Path dir) throws IOException {
        Vocabulary vocab = Vocabulary.of(VocabularyFixtures.SMALL);
        assertThrows(IOException.class, () -> vocab.save(dir.resolve("missing").resolve("vocab.txt")));
    }

    @Test
    void tokensAreUnmodifiable() throws IOException {
        Vocabulary vocab = Vocabulary.of(VocabularyFixtures.SMALL);
        assertThrows(UnsupportedOperationException.class, () -> vocab.tokens().add("x"));
    }

    @Test
    void classifiesTokenText() {
        assertTrue(Vocabulary.isBracketed("[CLS]"));
        assertTrue(Vocabulary.isBracketed("[]"));
        assertFalse(Vocabulary.isBracketed("["));
        assertFalse(Vocabulary.isBracketed("[CLS"));
        assertTrue(Vocabulary.isUnused("[unused42]"));
        assertFalse(Vocabulary.isUnused("[UNK]"));
        assertTrue(Vocabulary.isContinuation("##ing"));
        assertFalse(Vocabulary.isContinuation("#ing"));
    }
}
