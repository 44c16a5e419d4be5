package net.neoforged.lct.core.tree;

import java.util.List;

/**
 * Visitor for a {@link Branch}. By default, recursively visits the contents of footnotes.
 */
public abstract class BranchVisitor {
    public void visitAll(List<Branch> branches) {
        for (Branch branch : branches) {
            branch.accept(this);
        }
    }

    public void visitText(Text text) {
    }

    public void visitFootnote(Footnote footnote) {
        visitAll(footnote.contents);
    }

    public void visitCitation(Citation citation) {
    }

    public void visitCrossRef(CrossRef crossRef) {
    }

    public void visitCiteBreak(CiteBreak citeBreak) {
    }
}
