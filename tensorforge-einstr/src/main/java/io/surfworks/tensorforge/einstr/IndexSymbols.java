package io.surfworks.tensorforge.einstr;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Symbol table mapping subscript letters to dense index ids.
 *
 * <p>Ids are handed out in first-seen order starting at 0. One table is shared by
 * every term of a single parse call and discarded afterwards.
 */
public final class IndexSymbols {

    /** Canonical alphabet used to render ids back to text: a-z then A-Z. */
    public static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private final Map<Character, Integer> ids = new LinkedHashMap<>();
    private final int limit;

    public IndexSymbols(int limit) {
        if (limit < 1 || limit > ALPHABET.length()) {
            throw new IllegalArgumentException(
                "Symbol limit must be between 1 and " + ALPHABET.length() + ", got " + limit);
        }
        this.limit = limit;
    }

    /**
     * Returns the id for a letter, assigning the next free id on first sight.
     */
    public int idOf(char symbol) {
        return ids.computeIfAbsent(symbol, s -> ids.size());
    }

    public int size() {
        return ids.size();
    }

    public int limit() {
        return limit;
    }

    public boolean exceedsLimit() {
        return ids.size() > limit;
    }

    /**
     * Whether a character can appear as an index symbol.
     */
    public static boolean isSymbol(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    /**
     * Renders an id with the canonical alphabet.
     *
     * @throws IllegalStateException if the id has no letter
     */
    public static char letter(int id) {
        if (id < 0 || id >= ALPHABET.length()) {
            throw new IllegalStateException("Index id " + id + " has no symbol (maximum " + ALPHABET.length() + ")");
        }
        return ALPHABET.charAt(id);
    }
}
