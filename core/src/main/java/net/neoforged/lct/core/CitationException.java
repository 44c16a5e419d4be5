package net.neoforged.lct.core;

/**
 * Base of every condition that aborts a document run.
 */
public class CitationException extends Exception {
    public CitationException(String message) {
        super(message);
    }

    public CitationException(String message, Throwable cause) {
        super(message, cause);
    }
}
