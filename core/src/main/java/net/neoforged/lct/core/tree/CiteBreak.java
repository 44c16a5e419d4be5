package net.neoforged.lct.core.tree;

/**
 * Marks that the next citation does not continue the citation history before it.
 */
public final class CiteBreak extends Branch {
    public static final CiteBreak INSTANCE = new CiteBreak();

    private CiteBreak() {
    }

    @Override
    public void accept(BranchVisitor visitor) {
        visitor.visitCiteBreak(this);
    }
}
