package net.neoforged.lct.core;

import net.neoforged.lct.api.TransformContext;
import net.neoforged.lct.core.bibliography.Bibliography;
import net.neoforged.lct.core.journal.JournalAbbreviations;
import net.neoforged.lct.core.journal.JournalAbbreviator;
import net.neoforged.lct.core.parser.CitationLexer;
import net.neoforged.lct.core.parser.CitationParser;
import net.neoforged.lct.core.parser.TextPositions;
import net.neoforged.lct.core.render.CitationRenderer;
import net.neoforged.lct.core.render.CrossrefResolver;
import net.neoforged.lct.core.render.RenderOptions;
import net.neoforged.lct.core.source.SourceResolver;
import org.jetbrains.annotations.Nullable;

/**
 * Turns markdown with citation markers into markdown with formatted legal citations.
 * <p>
 * The stages run in order: lexing, parsing, source resolution, cross-reference resolution, rendering and,
 * optionally, small caps.
 */
public final class CitationPipeline {
    private final TransformContext context;

    public CitationPipeline(TransformContext context) {
        this.context = context;
    }

    /**
     * @param bibliographyJson    CSL JSON library
     * @param journalAbbreviations JSON object of user journal abbreviations, or {@code null} for none
     * @param offset              number of footnotes that precede this document
     */
    public String renderDocument(String markdown,
                                 String bibliographyJson,
                                 @Nullable String journalAbbreviations,
                                 int offset,
                                 boolean smallCaps) throws CitationException {
        return renderDocument(markdown, bibliographyJson, journalAbbreviations, new RenderOptions(offset, smallCaps));
    }

    public String renderDocument(String markdown,
                                 String bibliographyJson,
                                 @Nullable String journalAbbreviations,
                                 RenderOptions options) throws CitationException {
        var bibliography = Bibliography.loadJson(bibliographyJson, context);
        var journals = journalAbbreviations == null
                ? JournalAbbreviations.empty()
                : JournalAbbreviations.parse(journalAbbreviations);
        return renderDocument(markdown, bibliography, journals, options);
    }

    public String renderDocument(String markdown,
                                 Bibliography bibliography,
                                 JournalAbbreviations journals,
                                 RenderOptions options) throws CitationException {
        var logger = context.logger();
        var positions = new TextPositions(markdown);

        logger.debug("Lexing...");
        var tokens = CitationLexer.tokenize(markdown);
        logger.debug("Lexed %d tokens", tokens.size());

        logger.debug("Parsing...");
        var tree = new CitationParser(markdown).parse(tokens, options.footnoteOffset());
        logger.debug("Parsed %d top-level branches", tree.size());

        var abbreviator = new JournalAbbreviator(journals, context);
        var sources = new SourceResolver(bibliography, abbreviator, context, positions).resolve(tree);
        var crossrefs = new CrossrefResolver(context).resolve(tree);

        var output = new CitationRenderer(options, context, positions).render(tree, sources, crossrefs);

        if (options.smallCaps()) {
            logger.debug("Applying small caps");
            output = SmallCaps.apply(output);
        }
        return output;
    }
}
