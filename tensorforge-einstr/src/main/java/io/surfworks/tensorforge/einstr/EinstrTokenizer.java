package io.surfworks.tensorforge.einstr;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for extended einsum subscripts.
 *
 * Recognizes:
 * - Index symbols: single ASCII letters
 * - Ellipsis: ...
 * - Punctuation: ( ) , ->
 *
 * Whitespace is skipped anywhere. Columns are 1-based positions in the raw text.
 */
public final class EinstrTokenizer {

    public enum TokenType {
        SYMBOL,     // i, j, K
        ELLIPSIS,   // ...
        LPAREN,     // (
        RPAREN,     // )
        COMMA,      // ,
        ARROW,      // ->
        EOF
    }

    public record Token(TokenType type, String value, int column) {
        public char symbol() {
            return value.charAt(0);
        }

        @Override
        public String toString() {
            return String.format("%s(%s)@%d", type, value, column);
        }
    }

    private final String input;
    private int pos;

    public EinstrTokenizer(String input) {
        this.input = input;
        this.pos = 0;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (pos < input.length()) {
            if (Character.isWhitespace(input.charAt(pos))) {
                pos++;
                continue;
            }
            tokens.add(nextToken());
        }

        tokens.add(new Token(TokenType.EOF, "", pos + 1));
        return tokens;
    }

    private Token nextToken() {
        int column = pos + 1;
        char c = input.charAt(pos);

        if (input.startsWith("->", pos)) {
            pos += 2;
            return new Token(TokenType.ARROW, "->", column);
        }
        if (input.startsWith("...", pos)) {
            pos += 3;
            return new Token(TokenType.ELLIPSIS, "...", column);
        }

        TokenType punct = switch (c) {
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case ',' -> TokenType.COMMA;
            default -> null;
        };
        if (punct != null) {
            pos++;
            return new Token(punct, String.valueOf(c), column);
        }

        if (IndexSymbols.isSymbol(c)) {
            pos++;
            return new Token(TokenType.SYMBOL, String.valueOf(c), column);
        }

        throw new EinstrSyntaxException(String.format("Unexpected character '%c'", c), input, column);
    }
}
