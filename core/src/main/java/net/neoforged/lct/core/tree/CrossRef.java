package net.neoforged.lct.core.tree;

public final class CrossRef extends Branch {
    /**
     * The marker as written, e.g. {@code [?first]}.
     */
    public final String contents;
    public final int offset;

    public CrossRef(String contents, int offset) {
        this.contents = contents;
        this.offset = offset;
    }

    @Override
    public void accept(BranchVisitor visitor) {
        visitor.visitCrossRef(this);
    }
}
