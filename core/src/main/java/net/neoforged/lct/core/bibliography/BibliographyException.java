package net.neoforged.lct.core.bibliography;

import net.neoforged.lct.core.CitationException;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when the library or a library entry cannot be used at all.
 */
public class BibliographyException extends CitationException {
    @Nullable
    private final String key;

    public BibliographyException(String message, @Nullable String key) {
        super(message);
        this.key = key;
    }

    public BibliographyException(String message, Throwable cause) {
        super(message, cause);
        this.key = null;
    }

    /**
     * The library id of the offending entry, if the problem concerns a single entry.
     */
    public @Nullable String key() {
        return key;
    }
}
