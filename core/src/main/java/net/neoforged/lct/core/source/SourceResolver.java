package net.neoforged.lct.core.source;

import net.neoforged.lct.api.ProblemId;
import net.neoforged.lct.api.ProblemSeverity;
import net.neoforged.lct.api.TransformContext;
import net.neoforged.lct.core.CitationProblems;
import net.neoforged.lct.core.bibliography.Bibliography;
import net.neoforged.lct.core.bibliography.BibliographyException;
import net.neoforged.lct.core.journal.JournalAbbreviator;
import net.neoforged.lct.core.parser.TextPositions;
import net.neoforged.lct.core.tree.Branch;
import net.neoforged.lct.core.tree.BranchVisitor;
import net.neoforged.lct.core.tree.Citation;
import net.neoforged.lct.core.tree.Footnote;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the library entry behind every citation of a document and prepares its citation forms.
 * <p>
 * Citations whose entry is missing, untyped or of an unsupported type are reported and left out of the
 * resulting map.
 */
public final class SourceResolver {
    private final Bibliography bibliography;
    private final CitationFormatter formatter;
    private final TransformContext context;
    private final TextPositions positions;

    public SourceResolver(Bibliography bibliography, JournalAbbreviator journals, TransformContext context, TextPositions positions) {
        this.bibliography = bibliography;
        this.formatter = new CitationFormatter(journals, context);
        this.context = context;
        this.positions = positions;
    }

    public SourceMap resolve(List<Branch> tree) throws BibliographyException {
        var logger = context.logger();
        logger.debug("Starting source map...");

        var sources = discover(tree);
        checkHereinafters(sources);

        for (var source : sources.sources()) {
            if (source.type() == SourceType.CASE || source.isHereinafter() || source.shortAuthor().isEmpty()) {
                source.setShortTitle(formatter.shortTitle(source.csl(), source.type()));
            }
        }

        for (var source : sources.sources()) {
            formatter.buildLongCite(source);
            logger.debug("Long cite for %s: %s", source.id(), source.longCite());
        }
        for (var source : sources.sources()) {
            formatter.buildShortCite(source);
        }

        logger.debug("Source map complete: %d sources", sources.size());
        return sources;
    }

    private SourceMap discover(List<Branch> tree) throws BibliographyException {
        var discovery = new Discovery();
        discovery.visitAll(tree);
        if (discovery.error != null) {
            throw discovery.error;
        }
        return discovery.sources;
    }

    /**
     * Sources sharing a short author need a short title in their short cites to tell them apart.
     */
    private void checkHereinafters(SourceMap sources) {
        var byAuthor = new HashMap<String, Integer>();
        for (var source : sources.sources()) {
            if (participatesInHereinafters(source)) {
                byAuthor.merge(source.shortAuthor().replace("**", ""), 1, Integer::sum);
            }
        }
        for (var source : sources.sources()) {
            if (participatesInHereinafters(source) && byAuthor.get(source.shortAuthor().replace("**", "")) > 1) {
                source.setHereinafter(true);
                context.logger().debug("%s needs a hereinafter", source.id());
            }
        }
    }

    private static boolean participatesInHereinafters(Source source) {
        return source.type() != SourceType.CASE && !source.shortAuthor().isEmpty();
    }

    private class Discovery extends BranchVisitor {
        private final SourceMap sources = new SourceMap();
        private final Set<String> skipped = new HashSet<>();
        private int footnote;
        private BibliographyException error;

        @Override
        public void visitFootnote(Footnote footnote) {
            this.footnote = footnote.number;
            super.visitFootnote(footnote);
        }

        @Override
        public void visitCitation(Citation citation) {
            if (error != null || skipped.contains(citation.reference)) {
                return;
            }

            var existing = sources.get(citation.reference);
            if (existing != null) {
                existing.addFootnote(footnote);
                return;
            }

            var key = citation.key();
            var csl = bibliography.get(key);
            if (csl == null) {
                skip(citation, CitationProblems.UNKNOWN_REFERENCE,
                        key + " was not found in the CSL JSON library; not adding to source map");
                return;
            }
            if (csl.type() == null) {
                skip(citation, CitationProblems.MISSING_SOURCE_TYPE,
                        key + " does not have a type; not adding to source map");
                return;
            }
            var type = SourceType.byCslName(csl.type());
            if (type == null) {
                skip(citation, CitationProblems.UNSUPPORTED_SOURCE_TYPE,
                        key + "'s type (" + csl.type() + ") is not supported; not adding to source map");
                return;
            }
            if (csl.title() == null) {
                context.logger().error("%s does not have a title", key);
                error = new BibliographyException(key + " does not have a title", key);
                return;
            }

            context.logger().debug("Adding source %s", key);
            sources.add(new Source(citation.reference, csl, type, formatter.shortAuthor(csl, type), footnote));
        }

        private void skip(Citation citation, ProblemId problem, String message) {
            skipped.add(citation.reference);
            context.logger().warn("%s", message);
            var location = positions.locate(context.document(), citation.offset, citation.reference.length());
            context.problemReporter().report(problem, ProblemSeverity.WARNING, location, message);
        }
    }
}
