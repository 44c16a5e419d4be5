package net.neoforged.lct.core.source;

import net.neoforged.lct.core.bibliography.CslSource;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A library entry that the document cites, together with its prepared citation forms.
 * <p>
 * Sources are created and filled in by the {@link SourceResolver}. While rendering, only the {@link #isCited() cited}
 * flag changes.
 */
public final class Source {
    private final String reference;
    private final CslSource csl;
    private final SourceType type;
    private final String shortAuthor;
    private final List<Integer> allFootnotes = new ArrayList<>();

    private boolean hereinafter;
    private boolean cited;
    @Nullable
    private String shortTitle;
    private String longCitePrePin = "";
    private String longCitePostPin = "";
    private String shortCiteNoPin = "";
    private String shortCiteWithPin = "";

    Source(String reference, CslSource csl, SourceType type, String shortAuthor, int firstFootnote) {
        this.reference = reference;
        this.csl = csl;
        this.type = type;
        this.shortAuthor = shortAuthor;
        this.allFootnotes.add(firstFootnote);
    }

    /**
     * The reference marker this source was cited with, e.g. {@code [@jones2021]}.
     */
    public String reference() {
        return reference;
    }

    public String id() {
        return csl.id();
    }

    public CslSource csl() {
        return csl;
    }

    public SourceType type() {
        return type;
    }

    /**
     * Last names of the authors, bold for books. Empty for cases and sources without authors.
     */
    public String shortAuthor() {
        return shortAuthor;
    }

    public List<Integer> allFootnotes() {
        return Collections.unmodifiableList(allFootnotes);
    }

    public int firstFootnote() {
        return allFootnotes.get(0);
    }

    public boolean isHereinafter() {
        return hereinafter;
    }

    public boolean isCited() {
        return cited;
    }

    public void markCited() {
        cited = true;
    }

    public String longCite() {
        return longCitePrePin + longCitePostPin;
    }

    public String longCite(@Nullable String pincite) {
        if (pincite == null) {
            return longCite();
        }
        return switch (type) {
            case BOOK -> longCitePrePin + " " + pincite + longCitePostPin;
            case MANUSCRIPT -> longCitePrePin + " (manuscript at " + pincite + ")" + longCitePostPin;
            default -> longCitePrePin + ", " + pincite + longCitePostPin;
        };
    }

    public String shortCite(@Nullable String pincite) {
        if (pincite == null) {
            return shortCiteNoPin;
        }
        if (type == SourceType.CASE) {
            return shortCiteWithPin + " at " + pincite;
        }
        return shortCiteWithPin + ", at " + pincite;
    }

    @Nullable
    String shortTitle() {
        return shortTitle;
    }

    void addFootnote(int footnote) {
        allFootnotes.add(footnote);
    }

    void setHereinafter(boolean hereinafter) {
        this.hereinafter = hereinafter;
    }

    void setShortTitle(String shortTitle) {
        this.shortTitle = shortTitle;
    }

    void setLongCite(String prePin, String postPin) {
        this.longCitePrePin = prePin;
        this.longCitePostPin = postPin;
    }

    void setShortCite(String noPin, String withPin) {
        this.shortCiteNoPin = noPin;
        this.shortCiteWithPin = withPin;
    }

    @Override
    public String toString() {
        return "Source[" + reference + ", " + type + "]";
    }
}
