package net.neoforged.lct.core.parser;

import net.neoforged.lct.core.tree.Branch;
import net.neoforged.lct.core.tree.Citation;
import net.neoforged.lct.core.tree.CiteBreak;
import net.neoforged.lct.core.tree.CrossRef;
import net.neoforged.lct.core.tree.Footnote;
import net.neoforged.lct.core.tree.PreCite;
import net.neoforged.lct.core.tree.Text;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the document tree from the tokens of a {@link CitationLexer}.
 */
public final class CitationParser {
    private final String input;

    public CitationParser(String input) {
        this.input = input;
    }

    /**
     * @param offset number of footnotes that precede this document; the first footnote gets {@code offset + 1}
     */
    public List<Branch> parse(List<Token> tokens, int offset) {
        List<Branch> tree = new ArrayList<>();
        int footnoteNumber = offset;
        int footnoteStart = -1;

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            switch (token.type()) {
                case OPEN_FOOTNOTE -> {
                    footnoteNumber++;
                    footnoteStart = i + 1;
                }
                case CLOSE_FOOTNOTE -> {
                    tree.add(parseFootnote(tokens.subList(footnoteStart, i), footnoteNumber));
                    footnoteStart = -1;
                }
                case TEXT -> {
                    if (footnoteStart < 0) {
                        tree.add(new Text(token.text(input)));
                    }
                }
                default -> {
                    if (footnoteStart < 0) {
                        throw new IllegalStateException("Found " + token.type() + " outside of a footnote at offset " + token.start());
                    }
                }
            }
        }

        return tree;
    }

    private Footnote parseFootnote(List<Token> tokens, int number) {
        String id = null;
        List<Branch> contents = new ArrayList<>();
        int citationStart = -1;
        boolean hasReference = false;

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            switch (token.type()) {
                case FOOTNOTE_ID -> id = token.text(input);
                case SIGNAL, PRE_CITE_PUNCTUATION -> {
                    if (citationStart < 0) {
                        citationStart = i;
                    }
                }
                case REFERENCE -> {
                    if (citationStart < 0) {
                        citationStart = i;
                    }
                    hasReference = true;
                }
                case PINCITE, PARENTHETICAL -> {
                }
                case CITE_PUNCTUATION -> {
                    contents.add(parseCitation(tokens.subList(citationStart, i + 1)));
                    citationStart = -1;
                    hasReference = false;
                }
                case TEXT, CROSS_REF, CITE_BREAK -> {
                    // A signal that ends up not leading into a citation, e.g. "*See* [$] ...", stays as text
                    if (citationStart >= 0 && !hasReference) {
                        for (Token pending : tokens.subList(citationStart, i)) {
                            contents.add(new Text(pending.text(input)));
                        }
                        citationStart = -1;
                    }
                    contents.add(switch (token.type()) {
                        case TEXT -> new Text(token.text(input));
                        case CROSS_REF -> new CrossRef(token.text(input), token.start());
                        default -> CiteBreak.INSTANCE;
                    });
                }
                default -> throw new IllegalStateException("Unexpected " + token.type() + " inside footnote " + number);
            }
        }

        return new Footnote(number, id, contents);
    }

    private Citation parseCitation(List<Token> tokens) {
        PreCite preCite = null;
        String reference = null;
        String pincite = null;
        String parenthetical = null;
        String punctuation = null;
        int offset = tokens.get(0).start();

        for (Token token : tokens) {
            switch (token.type()) {
                case SIGNAL -> preCite = PreCite.signal(token.text(input));
                case PRE_CITE_PUNCTUATION -> preCite = PreCite.punctuation(token.text(input));
                case REFERENCE -> {
                    reference = token.text(input);
                    offset = token.start();
                }
                case PINCITE -> pincite = parsePincite(token.text(input));
                case PARENTHETICAL -> parenthetical = token.text(input);
                case CITE_PUNCTUATION -> punctuation = token.text(input);
                default -> throw new IllegalStateException("Unexpected " + token.type() + " inside a citation");
            }
        }

        if (reference == null || punctuation == null) {
            throw new IllegalStateException("Incomplete citation at offset " + offset);
        }
        return new Citation(preCite, reference, pincite, parenthetical, punctuation, offset);
    }

    /**
     * Strips surrounding whitespace and a leading "at" from a pincite. Blank pincites are absent.
     */
    @Nullable
    static String parsePincite(String raw) {
        String pin = raw.strip();
        if (pin.startsWith("at") && (pin.length() == 2 || Character.isWhitespace(pin.charAt(2)))) {
            pin = pin.substring(2).strip();
        }
        return pin.isEmpty() ? null : pin;
    }
}
