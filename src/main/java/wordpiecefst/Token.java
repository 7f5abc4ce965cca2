package wordpiecefst;

import java.util.Objects;

/**
 * One token produced by a {@link WordModel}: its id, its text, its offsets in the source and
 * the index of the word it belongs to.
 */
public final class Token {
    private final int id;
    private final String value;
    private final int start;
    private final int end;
    private final int word;

    public Token(int id, String value, int start, int end, int word) {
        this.id = id;
        this.value = value;
        this.start = start;
        this.end = end;
        this.word = word;
    }

    public int getId() {
        return id;
    }

    /**
     * @return the token text; continuation pieces carry the {@code ##} marker
     */
    public String getValue() {
        return value;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * @return index of the source word
     */
    public int getWord() {
        return word;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return id == other.id && start == other.start && end == other.end && word == other.word
                && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, value, start, end, word);
    }

    @Override
    public String toString() {
        return "Token{id=" + id + ", value='" + value + "', offsets=" + start + ".." + end + ", word=" + word + '}';
    }
}
