package net.neoforged.lct.core.source;

import java.util.regex.Pattern;

/**
 * Markdown styling of titles and names.
 */
final class TitleFormatter {
    private static final Pattern OUTER_ITALICS = Pattern.compile("^<i>|</i>$");
    private static final Pattern ITALICS_START = Pattern.compile("(\\s+?)<i>");
    private static final Pattern ITALICS_END = Pattern.compile("</i>(\\s+?)");
    private static final Pattern ITALICS_ANY = Pattern.compile("<i>|</i>");

    private TitleFormatter() {
    }

    static String bold(String text) {
        return "**" + text + "**";
    }

    static String italic(String text) {
        return "*" + text + "*";
    }

    /**
     * Italicizes a title except for the parts that the library marks with {@code <i>} tags, which become roman.
     */
    static String reverseItalicize(String title) {
        if (!title.startsWith("<i>")) {
            title = "*" + title;
        }
        if (!title.endsWith("</i>")) {
            title = title + "*";
        }

        title = OUTER_ITALICS.matcher(title).replaceAll("");
        title = ITALICS_START.matcher(title).replaceAll("*$1");
        title = ITALICS_END.matcher(title).replaceAll("$1*");
        return ITALICS_ANY.matcher(title).replaceAll("*");
    }

    /**
     * Case names are roman, except for the procedural phrases "In re" and "ex rel.".
     */
    static String caseTitle(String title) {
        return title.replace("In re ", "*In re* ").replace(" ex rel. ", " *ex. rel.* ");
    }
}
