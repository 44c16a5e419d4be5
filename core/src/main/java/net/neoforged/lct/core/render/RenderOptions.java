package net.neoforged.lct.core.render;

/**
 * @param footnoteOffset number of footnotes in earlier documents; the first footnote is numbered {@code footnoteOffset + 1}
 * @param smallCaps      whether bold spans are turned into small caps after rendering
 * @param caseLookback   how many footnotes back a case citation still permits a short form
 */
public record RenderOptions(int footnoteOffset, boolean smallCaps, int caseLookback) {
    public static final int DEFAULT_CASE_LOOKBACK = 5;

    public RenderOptions {
        if (footnoteOffset < 0) {
            throw new IllegalArgumentException("footnoteOffset must not be negative: " + footnoteOffset);
        }
        if (caseLookback < 0) {
            throw new IllegalArgumentException("caseLookback must not be negative: " + caseLookback);
        }
    }

    public RenderOptions(int footnoteOffset, boolean smallCaps) {
        this(footnoteOffset, smallCaps, DEFAULT_CASE_LOOKBACK);
    }

    public static RenderOptions defaults() {
        return new RenderOptions(0, false, DEFAULT_CASE_LOOKBACK);
    }
}
