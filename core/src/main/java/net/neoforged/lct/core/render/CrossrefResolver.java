package net.neoforged.lct.core.render;

import net.neoforged.lct.api.ProblemSeverity;
import net.neoforged.lct.api.TransformContext;
import net.neoforged.lct.core.CitationProblems;
import net.neoforged.lct.core.tree.Branch;
import net.neoforged.lct.core.tree.BranchVisitor;
import net.neoforged.lct.core.tree.Footnote;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the id of every footnote that declares one to the footnote's number.
 */
public final class CrossrefResolver {
    private final TransformContext context;

    public CrossrefResolver(TransformContext context) {
        this.context = context;
    }

    /**
     * @return footnote numbers keyed by the id marker as written, e.g. {@code [?first]}
     */
    public Map<String, Integer> resolve(List<Branch> tree) {
        var crossrefs = new LinkedHashMap<String, Integer>();
        new BranchVisitor() {
            @Override
            public void visitFootnote(Footnote footnote) {
                if (footnote.id == null || footnote.id.isEmpty()) {
                    return;
                }
                var previous = crossrefs.putIfAbsent(footnote.id, footnote.number);
                if (previous != null) {
                    var message = "Footnote " + footnote.number + " repeats the id " + footnote.id
                                  + " of footnote " + previous + "; cross-references point to footnote " + previous;
                    context.logger().warn("%s", message);
                    context.problemReporter().report(CitationProblems.DUPLICATE_FOOTNOTE_ID, ProblemSeverity.WARNING, message);
                }
            }
        }.visitAll(tree);

        context.logger().debug("Cross-references found: %s", crossrefs);
        return Collections.unmodifiableMap(crossrefs);
    }
}
