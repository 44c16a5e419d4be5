package net.neoforged.lct.core.parser;

import net.neoforged.lct.api.ProblemLocation;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.Arrays;

/**
 * Maps character offsets of a document to 1-based line and column numbers.
 */
public final class TextPositions {
    private final int[] lineStarts;

    public TextPositions(CharSequence text) {
        int[] starts = new int[16];
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
    }

    public int line(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        return (idx >= 0 ? idx : -idx - 2) + 1;
    }

    public int column(int offset) {
        return offset - lineStarts[line(offset) - 1] + 1;
    }

    public ProblemLocation locate(@Nullable Path file, int offset, int length) {
        return ProblemLocation.ofLocationInFile(file, line(offset), column(offset), offset, length);
    }
}
