package net.neoforged.lct.api;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

/**
 * @param document the file the markdown was read from, used for problem locations only
 */
public record TransformContext(Logger logger, ProblemReporter problemReporter, @Nullable Path document) {
    public TransformContext(Logger logger) {
        this(logger, ProblemReporter.NOOP, null);
    }

    public TransformContext(Logger logger, ProblemReporter problemReporter) {
        this(logger, problemReporter, null);
    }
}
