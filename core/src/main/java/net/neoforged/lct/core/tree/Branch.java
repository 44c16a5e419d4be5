package net.neoforged.lct.core.tree;

/**
 * A node of the document tree built by {@link net.neoforged.lct.core.parser.CitationParser}.
 * The set of branch kinds is closed; new kinds need a matching method on {@link BranchVisitor}.
 */
public abstract class Branch {
    Branch() {
    }

    public abstract void accept(BranchVisitor visitor);
}
