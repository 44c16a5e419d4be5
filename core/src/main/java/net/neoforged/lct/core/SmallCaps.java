package net.neoforged.lct.core;

import java.util.regex.Pattern;

/**
 * Turns bold spans into the "True Small Caps" character style understood by pandoc's docx writer.
 */
public final class SmallCaps {
    private static final Pattern BOLD = Pattern.compile("\\*\\*(.+?)\\*\\*");

    private SmallCaps() {
    }

    public static String apply(String markdown) {
        return BOLD.matcher(markdown).replaceAll("[$1]{custom-style=\"True Small Caps\"}");
    }
}
