package wordpiecefstcli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import picocli.CommandLine.*;
import wordpiecefst.*;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subcommand tokenizing text line by line and printing one JSON object per line.
 */
@Command(name = "tokenize", description = "\033[1;34mTokenize text into word-piece ids\033[0m", mixinStandardHelpOptions = true)
public class TokenizeCommand implements Callable<Integer> {
    @Option(names = {"-v", "--vocab"}, paramLabel = "<file>", description = "Vocabulary file, one token per line", required = true)
    private File vocab;

    @Option(names = {"-i", "--input"}, paramLabel = "<file>", description = "Input file (default: stdin)")
    private File input;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>", description = "Output file (default: stdout)")
    private File output;

    @Option(names = {"-t", "--id-type"}, paramLabel = "<type>", defaultValue = "u64",
            description = "Numeric type of the ids: u64, i64, i32, f64 (default: ${DEFAULT-VALUE})")
    private String idType;

    @Option(names = "--words", description = "Include the token index range of every word")
    private boolean words;

    @Option(names = "--attention", description = "Include the attention mask")
    private boolean attention;

    @Option(names = "--pretty", description = "Pretty-print the JSON output")
    private boolean pretty;

    @Option(names = "--verbose", description = "Log vocabulary loading")
    private boolean verbose;

    private static final Logger LOGGER = Logger.getLogger(TokenizeCommand.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public Integer call() {
        try {
            FstWordPieceTokenizer.setVerboseLogging(verbose);
            IdType type = IdType.fromStr(idType);
            FstWordPieceTokenizer tokenizer = FstWordPieceTokenizer.fromVocab(vocab.toPath());

            IdBuffer ids = type.newBuffer();
            IdBuffer mask = type.newBuffer();
            RangeBuffer ranges = new RangeBuffer();
            RangeBuffer wordRanges = words ? new RangeBuffer() : null;
            ObjectWriter writer = pretty ? MAPPER.writerWithDefaultPrettyPrinter() : MAPPER.writer();

            int lines = 0;
            try (tokenizer; BufferedReader in = openInput(); Writer out = openOutput()) {
                for (String line; (line = in.readLine()) != null; ) {
                    tokenizer.tokensInto(line, ids, ranges, wordRanges);
                    ObjectNode node = MAPPER.createObjectNode();
                    node.put("text", line);
                    appendIds(node.putArray("ids"), ids);
                    appendRanges(node.putArray("ranges"), ranges);
                    ArrayNode texts = node.putArray("tokens");
                    tokenizer.textsOf(ids).forEach(texts::add);
                    if (wordRanges != null) {
                        appendRanges(node.putArray("words"), wordRanges);
                    }
                    if (attention) {
                        Attention.attentionsInto(ids, mask);
                        appendIds(node.putArray("attention"), mask);
                    }
                    out.write(writer.writeValueAsString(node));
                    out.write('\n');
                    lines++;
                }
            }

            if (System.console() != null) {
                String inFrom = (input != null) ? input.getPath() : "<stdin>";
                String outTo = (output != null) ? output.getPath() : "stdout";
                System.err.println("\033[1;34mTokenized " + lines + " line(s): " + inFrom + " → " + outTo + "\033[0m");
            }
            return 0;
        } catch (IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, "Invalid argument", e);
            System.err.println("❌ " + e.getMessage());
            return 2;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error during tokenization", e);
            System.err.println("❌ Exception occurred: " + e.getMessage());
            return 1;
        }
    }

    private BufferedReader openInput() throws IOException {
        if (input != null) {
            return Files.newBufferedReader(input.toPath(), StandardCharsets.UTF_8);
        }
        return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    }

    private Writer openOutput() throws IOException {
        if (output != null) {
            return Files.newBufferedWriter(output.toPath(), StandardCharsets.UTF_8);
        }
        // keep System.out open after the command returns
        return new FilterWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)) {
            @Override
            public void close() throws IOException {
                flush();
            }
        };
    }

    static void appendIds(ArrayNode array, IdBuffer ids) {
        for (int i = 0; i < ids.size(); i++) {
            if (ids instanceof IntIdBuffer) {
                array.add(((IntIdBuffer) ids).get(i));
            } else if (ids instanceof DoubleIdBuffer) {
                array.add(((DoubleIdBuffer) ids).get(i));
            } else {
                array.add(ids.canonical(i));
            }
        }
    }

    static void appendRanges(ArrayNode array, RangeBuffer ranges) {
        for (int i = 0; i < ranges.size(); i++) {
            array.addArray().add(ranges.start(i)).add(ranges.end(i));
        }
    }
}
