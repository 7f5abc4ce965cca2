package wordpiecefstcli;

import picocli.CommandLine.*;
import wordpiecefst.FstWordPieceTokenizer;
import wordpiecefst.WordPieceModel;

import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subcommand inspecting a vocabulary: statistics, token lookups and re-saving.
 */
@Command(name = "vocab", description = "\033[1;34mInspect or re-save a word-piece vocabulary\033[0m", mixinStandardHelpOptions = true)
public class VocabCommand implements Callable<Integer> {

    @Option(names = {"-v", "--vocab"}, paramLabel = "<file>", description = "Vocabulary file", required = true)
    private File vocab;

    @Option(names = {"-l", "--lookup"}, paramLabel = "<token>", description = "Print the id of a token (repeatable)")
    private List<String> lookups;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>", description = "Write the vocabulary back to this file")
    private File output;

    private static final Logger LOGGER = Logger.getLogger(VocabCommand.class.getName());

    @Override
    public Integer call() {
        try {
            try (FstWordPieceTokenizer tokenizer = FstWordPieceTokenizer.fromVocab(vocab.toPath())) {
                System.out.println("Vocabulary: " + vocab.getPath());
                System.out.println("  size    : " + tokenizer.vocabSize());
                System.out.println("  special : " + tokenizer.vocabulary().specialCount());
                System.out.println("  [UNK]   : " + tokenizer.unkId());
                System.out.println("  prefix  : " + roleOf(tokenizer, tokenizer.prefixId()));
                System.out.println("  suffix  : " + roleOf(tokenizer, tokenizer.suffixId()));

                if (lookups != null) {
                    WordPieceModel model = new WordPieceModel(tokenizer);
                    for (String token : lookups) {
                        OptionalInt id = model.tokenToId(token);
                        System.out.println("  " + token + " -> " + (id.isPresent() ? String.valueOf(id.getAsInt()) : "<none>"));
                    }
                }

                if (output != null) {
                    Path saved = tokenizer.saveVocab(output.toPath());
                    System.out.println("\033[1;34mVocabulary saved at: " + saved.toAbsolutePath() + "\033[0m");
                }
            }
            return 0;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error while processing vocabulary", e);
            System.err.println("❌ Exception occurred: " + e.getMessage());
            return 1;
        }
    }

    private static String roleOf(FstWordPieceTokenizer tokenizer, int id) {
        return id < 0 ? "<none>" : id + " " + tokenizer.textOf(id);
    }
}
