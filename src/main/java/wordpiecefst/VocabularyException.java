package wordpiecefst;

import java.io.IOException;

/**
 * Signals a vocabulary that was read successfully but cannot back a tokenizer,
 * for example because the {@code [UNK]} token is missing.
 */
public class VocabularyException extends IOException {

    public VocabularyException(String message) {
        super(message);
    }

    public VocabularyException(String message, Throwable cause) {
        super(message, cause);
    }
}
