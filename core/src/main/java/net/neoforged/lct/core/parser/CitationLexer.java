package net.neoforged.lct.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits annotated markdown into a flat stream of {@link Token tokens}.
 * <p>
 * The scanner works in three levels over the original buffer. Plain text is scanned for {@code ^[} footnote
 * openers. The body of each footnote is scanned for citation ({@code [@key]}), cross-reference ({@code [?id]}) and
 * cite-break ({@code [$]}) markers. Each citation span is then split into reference, pincite, parenthetical and
 * closing punctuation. Tokens are spans into the input and never copies of it.
 */
public final class CitationLexer {
    /**
     * Citation signals, longest form of each family first. Each comes italicized and sentence-starting,
     * italicized and clause-starting, and plain.
     */
    private static final List<String> SIGNALS = List.of(
            "*See generally, e.g.*,", "*see generally, e.g.*,", "see generally, e.g.,",
            "*See generally*", "*see generally*", "see generally",
            "*But cf., e.g.*,", "*but cf., e.g.*,", "but cf., e.g.,",
            "*But cf.*", "*but cf.*", "but cf.",
            "*But see, e.g.*,", "*but see, e.g.*,", "but see, e.g.,",
            "*But see*", "*but see*", "but see",
            "*Contra*", "*contra*", "contra",
            "*Compare*", "*compare*", "compare",
            "*with*", "with",
            "*Cf., e.g.*,", "*cf., e.g.*,", "cf., e.g.,",
            "*Cf.*", "*cf.*", "cf.",
            "*See also, e.g.*,", "*see also, e.g.*,", "see also, e.g.,",
            "*See also*", "*see also*", "see also",
            "*See, e.g.*,", "*see, e.g.*,", "see, e.g.,",
            "*See*", "*see*", "see",
            "*Accord*", "*accord*", "accord",
            "*E.g.*", "*e.g.*", "e.g."
    );

    private static final Pattern SIGNAL = Pattern.compile(SIGNALS.stream()
            .map(Pattern::quote)
            .collect(Collectors.joining("|", "(?:", ")+\\s*$")));

    private static final Pattern PUNCTUATION = Pattern.compile("[?!:;,.]\\s*$");

    private enum Context {
        TEXT,
        ID,
        CITATION,
        CROSS_REF,
        CITE_BREAK,
        PINCITE,
        PARENTHETICAL,
        CITE_PUNCTUATION
    }

    private final String input;
    private final TextPositions positions;
    private final List<Token> tokens = new ArrayList<>();

    public CitationLexer(String input) {
        this.input = input;
        this.positions = new TextPositions(input);
    }

    public static List<Token> tokenize(String input) throws CitationSyntaxException {
        return new CitationLexer(input).tokenize();
    }

    public List<Token> tokenize() throws CitationSyntaxException {
        tokens.clear();

        int start = 0;
        int i = 0;
        while (i < input.length()) {
            if (input.charAt(i) == '^' && i + 1 < input.length() && input.charAt(i + 1) == '[') {
                int close = findFootnoteEnd(i);
                emitText(start, i);
                tokens.add(new Token(TokenType.OPEN_FOOTNOTE, i, i + 2));
                lexFootnote(i + 2, close);
                tokens.add(new Token(TokenType.CLOSE_FOOTNOTE, close, close + 1));
                i = close + 1;
                start = i;
            } else {
                i++;
            }
        }
        emitText(start, input.length());

        return List.copyOf(tokens);
    }

    /**
     * @param caret offset of the {@code ^} opening the footnote
     * @return offset of the bracket closing it
     */
    private int findFootnoteEnd(int caret) throws CitationSyntaxException {
        int depth = 0;
        for (int i = caret + 2; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        throw error("The input ends with an open footnote; check the footnote's brackets", caret);
    }

    /**
     * Lexes the body of a footnote, {@code from} inclusive to {@code to} exclusive.
     */
    private void lexFootnote(int from, int to) throws CitationSyntaxException {
        Context context = Context.TEXT;
        int start = from;
        int brackets = 0;
        int parens = 0;

        for (int i = from; i < to; i++) {
            char c = input.charAt(i);
            switch (context) {
                case TEXT -> {
                    if (c != '[' || i + 1 >= to) {
                        continue;
                    }
                    char next = input.charAt(i + 1);
                    if (next == '@') {
                        emitPreCite(start, i);
                        context = Context.CITATION;
                        start = i;
                        brackets = 1;
                        parens = 0;
                        i++; // the '@'
                    } else if (next == '?') {
                        emitText(start, i);
                        // An id marker is only an id when it opens the footnote
                        context = i == from ? Context.ID : Context.CROSS_REF;
                        start = i;
                    } else if (next == '$') {
                        emitPreCite(start, i);
                        context = Context.CITE_BREAK;
                        start = i;
                    }
                }
                case ID, CROSS_REF -> {
                    if (c == ']') {
                        tokens.add(new Token(context == Context.ID ? TokenType.FOOTNOTE_ID : TokenType.CROSS_REF, start, i + 1));
                        context = Context.TEXT;
                        start = i + 1;
                    }
                }
                case CITE_BREAK -> {
                    if (c == ']') {
                        // The break swallows one following space so that it leaves no gap behind
                        int end = i + 1 < to && input.charAt(i + 1) == ' ' ? i + 2 : i + 1;
                        tokens.add(new Token(TokenType.CITE_BREAK, start, end));
                        context = Context.TEXT;
                        start = end;
                        i = end - 1;
                    }
                }
                case CITATION -> {
                    if (brackets == 0 && parens == 0 && Character.isWhitespace(c) && endsCitation(input.charAt(i - 1))) {
                        lexCitation(start, i);
                        context = Context.TEXT;
                        start = i;
                    } else if (c == '[') {
                        brackets++;
                    } else if (c == ']' && brackets > 0) {
                        brackets--;
                    } else if (c == '(') {
                        parens++;
                    } else if (c == ')' && parens > 0) {
                        parens--;
                    }
                }
                default -> throw new IllegalStateException("Unexpected lexer context in footnote: " + context);
            }
        }

        switch (context) {
            case TEXT -> emitText(start, to);
            case CITATION -> {
                if (parens > 0) {
                    throw error("No closing parenthesis found for the parenthetical of this citation", start);
                } else if (brackets > 0) {
                    throw error("This citation has an unclosed bracket", start);
                } else if (!endsCitation(input.charAt(to - 1))) {
                    throw error("This citation does not end with '.', ',' or ';' before its footnote closes", start);
                }
                lexCitation(start, to);
            }
            default -> throw error("This marker is not closed before its footnote ends", start);
        }
    }

    /**
     * Splits a single citation, from its reference's opening bracket to and including its closing punctuation.
     */
    private void lexCitation(int start, int end) throws CitationSyntaxException {
        int punctuation = end - 1;
        int referenceEnd = input.indexOf(']', start);
        tokens.add(new Token(TokenType.REFERENCE, start, referenceEnd + 1));

        Context context = Context.PINCITE;
        int pinStart = referenceEnd + 1;
        int pinEnd = punctuation;
        int parenStart = -1;
        int parenEnd = -1;
        int parens = 0;

        for (int i = pinStart; i < punctuation; i++) {
            char c = input.charAt(i);
            switch (context) {
                case PINCITE -> {
                    // A parenthesis glued to the pincite, as in "§ 100.3[D](2)", belongs to the pincite
                    if (c == '(' && Character.isWhitespace(input.charAt(i - 1))) {
                        pinEnd = i;
                        parenStart = i;
                        parens = 0;
                        context = Context.PARENTHETICAL;
                    }
                }
                case PARENTHETICAL -> {
                    if (c == '(') {
                        parens++;
                    } else if (c == ')') {
                        if (parens > 0) {
                            parens--;
                        } else {
                            parenEnd = i + 1;
                            context = Context.CITE_PUNCTUATION;
                        }
                    }
                }
                case CITE_PUNCTUATION -> {
                    // Further parentheticals are kept together with the first
                    if (c == '(') {
                        context = Context.PARENTHETICAL;
                    }
                }
                default -> throw new IllegalStateException("Unexpected lexer context in citation: " + context);
            }
        }

        if (context == Context.PARENTHETICAL) {
            throw error("No closing parenthesis found for the parenthetical", parenStart);
        }

        if (!input.substring(pinStart, pinEnd).isBlank()) {
            tokens.add(new Token(TokenType.PINCITE, pinStart, pinEnd));
        }
        if (parenStart >= 0) {
            tokens.add(new Token(TokenType.PARENTHETICAL, parenStart, parenEnd));
        }
        tokens.add(new Token(TokenType.CITE_PUNCTUATION, punctuation, end));
    }

    /**
     * Emits the text before a citation or cite break, splitting off a trailing signal or, failing that, trailing
     * punctuation.
     */
    private void emitPreCite(int start, int end) {
        if (end <= start) {
            return;
        }

        Matcher signal = SIGNAL.matcher(input).region(start, end);
        if (signal.find()) {
            emitText(start, signal.start());
            tokens.add(new Token(TokenType.SIGNAL, signal.start(), signal.end()));
            return;
        }

        Matcher punctuation = PUNCTUATION.matcher(input).region(start, end);
        if (punctuation.find()) {
            emitText(start, punctuation.start());
            tokens.add(new Token(TokenType.PRE_CITE_PUNCTUATION, punctuation.start(), punctuation.end()));
            return;
        }

        emitText(start, end);
    }

    private void emitText(int start, int end) {
        if (end > start) {
            tokens.add(new Token(TokenType.TEXT, start, end));
        }
    }

    private static boolean endsCitation(char c) {
        return c == '.' || c == ',' || c == ';';
    }

    private CitationSyntaxException error(String message, int offset) {
        return new CitationSyntaxException(message, positions.line(offset), positions.column(offset));
    }
}
