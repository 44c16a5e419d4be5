package net.neoforged.lct.core.tree;

public final class Text extends Branch {
    public final String contents;

    public Text(String contents) {
        this.contents = contents;
    }

    @Override
    public void accept(BranchVisitor visitor) {
        visitor.visitText(this);
    }
}
