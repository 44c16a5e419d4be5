package net.neoforged.lct.core.render;

import net.neoforged.lct.api.ProblemSeverity;
import net.neoforged.lct.api.TransformContext;
import net.neoforged.lct.core.CitationProblems;
import net.neoforged.lct.core.parser.TextPositions;
import net.neoforged.lct.core.source.SourceMap;
import net.neoforged.lct.core.tree.Branch;
import net.neoforged.lct.core.tree.BranchVisitor;
import net.neoforged.lct.core.tree.Citation;
import net.neoforged.lct.core.tree.CiteBreak;
import net.neoforged.lct.core.tree.CrossRef;
import net.neoforged.lct.core.tree.Footnote;
import net.neoforged.lct.core.tree.Text;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Writes the document tree back out as markdown, with every citation and cross-reference resolved.
 */
public final class CitationRenderer {
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?](?:\\s|$)");

    private final RenderOptions options;
    private final TransformContext context;
    private final TextPositions positions;

    public CitationRenderer(RenderOptions options, TransformContext context, TextPositions positions) {
        this.options = options;
        this.context = context;
        this.positions = positions;
    }

    public String render(List<Branch> tree, SourceMap sources, Map<String, Integer> crossrefs) {
        context.logger().debug("Beginning rendering...");
        var visitor = new RenderingVisitor(sources, crossrefs);
        visitor.visitAll(tree);
        context.logger().debug("Rendering complete");
        return visitor.output.toString();
    }

    private class RenderingVisitor extends BranchVisitor {
        private final SourceMap sources;
        private final Map<String, Integer> crossrefs;
        private StringBuilder output = new StringBuilder();
        private RenderState state = RenderState.INITIAL;

        RenderingVisitor(SourceMap sources, Map<String, Integer> crossrefs) {
            this.sources = sources;
            this.crossrefs = crossrefs;
        }

        @Override
        public void visitText(Text text) {
            output.append(text.contents);
            if (SENTENCE_END.matcher(text.contents).find()) {
                state = state.endClause();
            }
        }

        @Override
        public void visitFootnote(Footnote footnote) {
            var outer = output;
            output = new StringBuilder();
            state = state.enterFootnote(footnote.number);

            super.visitFootnote(footnote);

            outer.append("^[").append(output.toString().strip()).append(']');
            output = outer;
        }

        @Override
        public void visitCitation(Citation citation) {
            var source = sources.get(citation.reference);
            var rendered = CitationForms.render(citation, source, state, options);
            if (source != null && rendered.markCited()) {
                source.markCited();
            }
            state = rendered.nextState();
            output.append(rendered.text());
        }

        @Override
        public void visitCrossRef(CrossRef crossRef) {
            var number = crossrefs.get(crossRef.contents);
            if (number != null) {
                output.append(number);
                return;
            }

            var message = "Cross-reference " + crossRef.contents + " does not match any footnote id";
            context.logger().warn("%s", message);
            context.problemReporter().report(CitationProblems.UNRESOLVED_CROSS_REFERENCE, ProblemSeverity.WARNING,
                    positions.locate(context.document(), crossRef.offset, crossRef.contents.length()), message);
            output.append(crossRef.contents);
        }

        @Override
        public void visitCiteBreak(CiteBreak citeBreak) {
            state = state.broken();
        }
    }
}
