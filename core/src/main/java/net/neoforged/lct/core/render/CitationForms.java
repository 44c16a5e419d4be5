package net.neoforged.lct.core.render;

import net.neoforged.lct.core.source.Source;
import net.neoforged.lct.core.source.SourceType;
import net.neoforged.lct.core.tree.Citation;
import net.neoforged.lct.core.tree.PreCite;
import org.jetbrains.annotations.Nullable;

/**
 * Chooses between the "Id.", long and short forms of a citation, given what was cited before it.
 */
public final class CitationForms {
    private CitationForms() {
    }

    /**
     * @param source the resolved source, or {@code null} if the reference did not resolve
     */
    public static RenderedCitation render(Citation citation, @Nullable Source source, RenderState state, RenderOptions options) {
        var text = new StringBuilder();
        if (citation.preCite != null) {
            text.append(citation.preCite.text());
            if (citation.preCite.startsSentence()) {
                state = state.endClause();
            }
        }

        if (source == null) {
            text.append(citation.reference);
            if (citation.pincite != null) {
                text.append(" at ").append(citation.pincite);
            }
            appendParenthetical(citation, text);
            text.append(citation.punctuation);
            return new RenderedCitation(text.toString(), state.broken(), false);
        }

        boolean markCited = false;
        boolean bareId = false;
        if (state.permitsId(citation.reference)) {
            text.append(id(citation.preCite));
            if (citation.pincite != null && !citation.pincite.equals(state.lastPincite())) {
                text.append(" at ").append(citation.pincite);
            } else {
                bareId = true;
            }
        } else if (source.type() == SourceType.CASE) {
            var lastCited = state.lastCitedFootnote(citation.reference);
            if (lastCited == null || state.footnote() - lastCited > options.caseLookback()) {
                text.append(source.longCite(citation.pincite));
            } else {
                text.append(source.shortCite(citation.pincite));
            }
            markCited = !source.isCited();
        } else if (!source.isCited()) {
            text.append(source.longCite(citation.pincite));
            markCited = true;
        } else {
            text.append(source.shortCite(citation.pincite));
        }

        if (citation.parenthetical != null) {
            bareId = false;
        }
        appendParenthetical(citation, text);
        // "Id." already ends in a period
        if (!(bareId && citation.punctuation.equals("."))) {
            text.append(citation.punctuation);
        }

        var next = state.afterCitation(citation.reference, citation.pincite, citation.punctuation);
        return new RenderedCitation(text.toString(), next, markCited);
    }

    /**
     * "Id." opens a sentence, "id." continues one after a signal or clause punctuation.
     */
    static String id(@Nullable PreCite preCite) {
        return preCite == null || preCite.startsSentence() ? "*Id.*" : "*id.*";
    }

    private static void appendParenthetical(Citation citation, StringBuilder text) {
        if (citation.parenthetical != null) {
            text.append(' ').append(citation.parenthetical);
        }
    }
}
