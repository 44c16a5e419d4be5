package net.neoforged.lct.core.tree;

import org.jetbrains.annotations.Nullable;

public final class Citation extends Branch {
    @Nullable
    public final PreCite preCite;
    /**
     * The reference marker as written, e.g. {@code [@jones2021]}.
     */
    public final String reference;
    /**
     * The pin location, without any leading "at".
     */
    @Nullable
    public final String pincite;
    @Nullable
    public final String parenthetical;
    public final String punctuation;
    /**
     * Offset of the reference marker in the document.
     */
    public final int offset;

    public Citation(@Nullable PreCite preCite, String reference, @Nullable String pincite,
                    @Nullable String parenthetical, String punctuation, int offset) {
        this.preCite = preCite;
        this.reference = reference;
        this.pincite = pincite;
        this.parenthetical = parenthetical;
        this.punctuation = punctuation;
        this.offset = offset;
    }

    /**
     * The bibliography key inside the reference marker.
     */
    public String key() {
        if (reference.startsWith("[@") && reference.endsWith("]")) {
            return reference.substring(2, reference.length() - 1);
        }
        return reference;
    }

    @Override
    public void accept(BranchVisitor visitor) {
        visitor.visitCitation(this);
    }
}
