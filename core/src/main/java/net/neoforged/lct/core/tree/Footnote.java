package net.neoforged.lct.core.tree;

import org.jetbrains.annotations.Nullable;

import java.util.List;

public final class Footnote extends Branch {
    /**
     * Final footnote number, counted from the caller's offset.
     */
    public final int number;
    /**
     * The {@code [?id]} marker that opened the footnote, brackets included.
     */
    @Nullable
    public final String id;
    public final List<Branch> contents;

    public Footnote(int number, @Nullable String id, List<Branch> contents) {
        this.number = number;
        this.id = id;
        this.contents = List.copyOf(contents);
    }

    @Override
    public void accept(BranchVisitor visitor) {
        visitor.visitFootnote(this);
    }
}
