package net.neoforged.lct.core.parser;

public enum TokenType {
    TEXT,
    OPEN_FOOTNOTE,
    CLOSE_FOOTNOTE,
    FOOTNOTE_ID,
    SIGNAL,
    PRE_CITE_PUNCTUATION,
    REFERENCE,
    PINCITE,
    PARENTHETICAL,
    CITE_PUNCTUATION,
    CROSS_REF,
    CITE_BREAK
}
