package net.neoforged.lct.api;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

/**
 * Where in a document or library a problem was found. The file is absent when the text did not come from disk.
 */
public record ProblemLocation(@Nullable Path file, @Nullable Integer line, @Nullable Integer column,
                              @Nullable Integer offset, @Nullable Integer length) {
    /**
     * @param line   1-based line number.
     * @param column 1-based column number.
     * @param offset 0-based character offset into the text.
     */
    public static ProblemLocation ofLocationInFile(@Nullable Path file, int line, int column, int offset) {
        return new ProblemLocation(file, line, column, offset, null);
    }

    /**
     * @param line   1-based line number.
     * @param column 1-based column number.
     * @param offset 0-based character offset into the text.
     * @param length number of characters covered.
     */
    public static ProblemLocation ofLocationInFile(@Nullable Path file, int line, int column, int offset, int length) {
        return new ProblemLocation(file, line, column, offset, length);
    }

    public ProblemLocation withFile(@Nullable Path file) {
        return new ProblemLocation(file, line, column, offset, length);
    }
}
