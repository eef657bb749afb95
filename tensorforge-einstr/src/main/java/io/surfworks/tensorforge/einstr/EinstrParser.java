package io.surfworks.tensorforge.einstr;

import io.surfworks.tensorforge.einstr.EinstrTokenizer.Token;
import io.surfworks.tensorforge.einstr.EinstrTokenizer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Parser for extended einsum subscripts.
 *
 * <pre>
 * expression := terms "->" terms
 * terms      := term ("," term)*
 * term       := (SYMBOL | "..." | group)*      group only in output terms
 * group      := "(" (SYMBOL | "...")* ")"
 * </pre>
 *
 * Every term of one expression shares a single {@link IndexSymbols} table, so a
 * letter maps to the same id wherever it appears.
 *
 * <p>Syntax errors quote the text exactly as given, so that a reported column points
 * into the quoted text. Parsed expressions carry the text with whitespace removed.
 */
public final class EinstrParser {

    private static final Logger LOG = Logger.getLogger(EinstrParser.class.getName());

    private final String text;
    private final String source;
    private final List<Token> tokens;
    private final IndexSymbols symbols;
    private int pos;

    public EinstrParser(String text, List<Token> tokens, IndexSymbols symbols) {
        this.text = text;
        this.source = stripWhitespace(text);
        this.tokens = tokens;
        this.symbols = symbols;
        this.pos = 0;
    }

    public static Expression parse(String subscripts) {
        return parse(subscripts, EinstrOptions.defaults());
    }

    public static Expression parse(String subscripts, EinstrOptions options) {
        if (subscripts == null) {
            throw new IllegalArgumentException("subscripts must not be null");
        }
        List<Token> tokens = new EinstrTokenizer(subscripts).tokenize();
        EinstrParser parser = new EinstrParser(subscripts, tokens, new IndexSymbols(options.maxIndices()));
        Expression expression = parser.parseExpression();
        LOG.fine(() -> "Parsed \"" + subscripts + "\" as " + expression);
        return expression;
    }

    // ==================== Expression Parsing ====================

    public Expression parseExpression() {
        List<InputTerm> inputs = new ArrayList<>();
        inputs.add(parseInputTerm());
        while (check(TokenType.COMMA)) {
            advance();
            inputs.add(parseInputTerm());
        }

        if (!check(TokenType.ARROW)) {
            throw new EinstrSyntaxException("invalid subscripts, expected '->'", text);
        }
        advance();

        List<OutputTerm> outputs = new ArrayList<>();
        outputs.add(parseOutputTerm());
        while (check(TokenType.COMMA)) {
            advance();
            outputs.add(parseOutputTerm());
        }

        if (check(TokenType.ARROW)) {
            throw new EinstrSyntaxException("invalid subscripts, more than one '->'", text, peek().column());
        }
        if (!check(TokenType.EOF)) {
            throw error("Unexpected token " + peek().value());
        }

        if (symbols.exceedsLimit()) {
            throw new EinstrSyntaxException(
                String.format("too many indices: %d (maximum %d)", symbols.size(), symbols.limit()), text);
        }
        return new Expression(inputs, outputs, source);
    }

    // ==================== Term Parsing ====================

    private InputTerm parseInputTerm() {
        List<Integer> indices = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        boolean foundEllipsis = false;

        while (true) {
            Token t = peek();
            switch (t.type()) {
                case SYMBOL -> indices.add(symbols.idOf(t.symbol()));
                case ELLIPSIS -> {
                    if (foundEllipsis) {
                        throw error("each term can contain at most one ellipsis");
                    }
                    foundEllipsis = true;
                    indices.add(Expression.ELLIPSIS);
                }
                case LPAREN, RPAREN -> throw error("indices fusing is not allowed in input subscripts");
                default -> {
                    return new InputTerm(indices, text.toString());
                }
            }
            text.append(advance().value());
        }
    }

    private OutputTerm parseOutputTerm() {
        List<Integer> indices = new ArrayList<>();
        List<FusingGroup> fusing = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        boolean foundEllipsis = false;
        int start = -1;

        while (true) {
            Token t = peek();
            switch (t.type()) {
                case SYMBOL -> indices.add(symbols.idOf(t.symbol()));
                case ELLIPSIS -> {
                    if (foundEllipsis) {
                        throw error("each term can contain at most one ellipsis");
                    }
                    foundEllipsis = true;
                    indices.add(Expression.ELLIPSIS);
                }
                case LPAREN -> {
                    if (start >= 0) {
                        throw error("nested parentheses are not allowed");
                    }
                    start = indices.size();
                    if (!fusing.isEmpty() && fusing.get(fusing.size() - 1).start() == start) {
                        throw error("fusing groups must start at distinct positions");
                    }
                }
                case RPAREN -> {
                    if (start < 0) {
                        throw error("unmatched parentheses");
                    }
                    fusing.add(new FusingGroup(start, indices.size()));
                    start = -1;
                }
                default -> {
                    if (start >= 0) {
                        throw new EinstrSyntaxException("unmatched parentheses", this.text);
                    }
                    return new OutputTerm(indices, fusing, text.toString());
                }
            }
            text.append(advance().value());
        }
    }

    // ==================== Helper Methods ====================

    private Token peek() {
        return tokens.get(pos);
    }

    private Token advance() {
        return tokens.get(pos++);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private EinstrSyntaxException error(String message) {
        return new EinstrSyntaxException(message, text, peek().column());
    }

    private static String stripWhitespace(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
