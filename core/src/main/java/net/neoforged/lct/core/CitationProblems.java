package net.neoforged.lct.core;

import net.neoforged.lct.api.ProblemGroup;
import net.neoforged.lct.api.ProblemId;

/**
 * Ids of the recoverable problems reported while processing a document.
 */
public final class CitationProblems {
    public static final ProblemGroup GROUP = ProblemGroup.create("citations", "Citations");

    public static final ProblemId UNKNOWN_REFERENCE = ProblemId.create("unknown-reference", "Unknown Reference", GROUP);
    public static final ProblemId MISSING_SOURCE_TYPE = ProblemId.create("missing-source-type", "Missing Source Type", GROUP);
    public static final ProblemId UNSUPPORTED_SOURCE_TYPE = ProblemId.create("unsupported-source-type", "Unsupported Source Type", GROUP);
    public static final ProblemId MISSING_SHORT_TITLE = ProblemId.create("missing-short-title", "Missing Short Title", GROUP);
    public static final ProblemId SYNTHESIZED_JOURNAL_ABBREVIATION = ProblemId.create("synthesized-journal-abbreviation", "Synthesized Journal Abbreviation", GROUP);
    public static final ProblemId UNRESOLVED_CROSS_REFERENCE = ProblemId.create("unresolved-cross-reference", "Unresolved Cross-Reference", GROUP);
    public static final ProblemId DUPLICATE_FOOTNOTE_ID = ProblemId.create("duplicate-footnote-id", "Duplicate Footnote Id", GROUP);
    public static final ProblemId DUPLICATE_LIBRARY_ID = ProblemId.create("duplicate-library-id", "Duplicate Library Id", GROUP);

    private CitationProblems() {
    }
}
