package net.neoforged.lct.core.render;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The citation history at a point of the document.
 * <p>
 * A clause is the run of citations up to sentence-ending punctuation or the end of a footnote. While a clause has
 * cited exactly one source, the next citation of that source may be an "Id.".
 *
 * @param footnote          the footnote being rendered
 * @param clauseSources     references cited in the current clause, in order, without repeats
 * @param clauseClosed      whether the last citation ended its sentence, so that the next citation opens a new clause
 * @param lastPincite       the pincite of the last citation
 * @param lastCitedFootnote for each reference, the footnote it was last rendered in
 */
public record RenderState(int footnote,
                          List<String> clauseSources,
                          boolean clauseClosed,
                          @Nullable String lastPincite,
                          Map<String, Integer> lastCitedFootnote) {
    private static final Set<String> SENTENCE_ENDINGS = Set.of(".", "!", "?");

    public static final RenderState INITIAL = new RenderState(0, List.of(), true, null, Map.of());

    public RenderState {
        clauseSources = List.copyOf(clauseSources);
        lastCitedFootnote = Map.copyOf(lastCitedFootnote);
    }

    /**
     * A citation sentence never runs on into the next footnote.
     */
    public RenderState enterFootnote(int number) {
        return new RenderState(number, clauseSources, true, lastPincite, lastCitedFootnote);
    }

    /**
     * Closes the current clause, e.g. when the text after a citation ends its sentence.
     * The sources of the closed clause still decide whether the next citation may be an "Id.".
     */
    public RenderState endClause() {
        return clauseClosed ? this : new RenderState(footnote, clauseSources, true, lastPincite, lastCitedFootnote);
    }

    public boolean permitsId(String reference) {
        return clauseSources.size() == 1 && clauseSources.get(0).equals(reference);
    }

    public @Nullable Integer lastCitedFootnote(String reference) {
        return lastCitedFootnote.get(reference);
    }

    public RenderState afterCitation(String reference, @Nullable String pincite, String punctuation) {
        List<String> sources;
        if (clauseClosed) {
            sources = List.of(reference);
        } else if (clauseSources.contains(reference)) {
            sources = clauseSources;
        } else {
            sources = new ArrayList<>(clauseSources);
            sources.add(reference);
        }

        var cited = new HashMap<>(lastCitedFootnote);
        cited.put(reference, footnote);

        return new RenderState(footnote, sources, SENTENCE_ENDINGS.contains(punctuation.strip()), pincite, cited);
    }

    /**
     * Forgets the current clause, so that no following citation can be an "Id.".
     */
    public RenderState broken() {
        return new RenderState(footnote, List.of(), true, null, lastCitedFootnote);
    }
}
