package net.neoforged.lct.core.parser;

import net.neoforged.lct.core.CitationException;

/**
 * Thrown when the footnote or citation structure of a document cannot be understood.
 */
public class CitationSyntaxException extends CitationException {
    public final int line;
    public final int column;

    public CitationSyntaxException(String message, int line, int column) {
        super(line + ":" + column + ": " + message);
        this.line = line;
        this.column = column;
    }
}
