package net.neoforged.lct.core.render;

import net.neoforged.lct.core.source.Source;

/**
 * @param markCited whether the {@link Source} has now been cited for the first time
 */
public record RenderedCitation(String text, RenderState nextState, boolean markCited) {
}
