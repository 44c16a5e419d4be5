package net.neoforged.lct.core.tree;

import java.util.Set;

/**
 * The signal or punctuation directly in front of a citation, trailing whitespace included.
 */
public record PreCite(Kind kind, String text) {
    private static final Set<String> SENTENCE_ENDINGS = Set.of(".", "!", "?");

    public enum Kind {
        SIGNAL,
        PUNCTUATION
    }

    public static PreCite signal(String text) {
        return new PreCite(Kind.SIGNAL, text);
    }

    public static PreCite punctuation(String text) {
        return new PreCite(Kind.PUNCTUATION, text);
    }

    /**
     * Whether a citation after this starts a new sentence.
     */
    public boolean startsSentence() {
        return kind == Kind.PUNCTUATION && SENTENCE_ENDINGS.contains(text.strip());
    }
}
