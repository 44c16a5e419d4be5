package net.neoforged.lct.core.source;

import net.neoforged.lct.api.ProblemSeverity;
import net.neoforged.lct.api.TransformContext;
import net.neoforged.lct.core.CitationProblems;
import net.neoforged.lct.core.bibliography.CslSource;
import net.neoforged.lct.core.journal.JournalAbbreviator;

import java.util.regex.Pattern;

import static net.neoforged.lct.core.source.TitleFormatter.bold;
import static net.neoforged.lct.core.source.TitleFormatter.italic;
import static net.neoforged.lct.core.source.TitleFormatter.reverseItalicize;

/**
 * Builds the long and short citation forms of a {@link Source}.
 * <p>
 * Long forms are built in two halves so that a pincite can be placed between them.
 */
final class CitationFormatter {
    private static final String SUPREME_COURT = "U.S. Supreme Court";
    private static final Pattern TRAILING_SEPARATOR = Pattern.compile("[,\\s]+$");

    private final JournalAbbreviator journals;
    private final TransformContext context;

    CitationFormatter(JournalAbbreviator journals, TransformContext context) {
        this.journals = journals;
        this.context = context;
    }

    String shortAuthor(CslSource csl, SourceType type) {
        if (type == SourceType.CASE || !csl.hasAuthors()) {
            return "";
        }
        var names = NameFormatter.shortNames(csl.author());
        return type == SourceType.BOOK ? bold(names) : names;
    }

    /**
     * The styled short title, falling back to the full title with a warning.
     */
    String shortTitle(CslSource csl, SourceType type) {
        var title = csl.titleShort();
        if (title == null) {
            title = csl.title();
            context.logger().warn("No short title found for %s; using long title for short cites", csl.id());
            context.problemReporter().report(CitationProblems.MISSING_SHORT_TITLE, ProblemSeverity.WARNING,
                    "No short title found for " + csl.id() + "; using long title for short cites");
        }
        return switch (type) {
            case BOOK -> bold(title);
            case CASE -> italic(title);
            default -> reverseItalicize(title);
        };
    }

    void buildLongCite(Source source) {
        var csl = source.csl();
        var pre = new StringBuilder();
        var post = new StringBuilder();

        switch (source.type()) {
            case BOOK -> {
                if (csl.volume() != null) {
                    pre.append(csl.volume()).append(' ');
                }
                appendAuthors(csl, source.type(), pre);
                pre.append(bold(csl.title()));
                if (csl.edition() != null || csl.hasEditors() || csl.hasTranslators() || csl.issued() != null) {
                    appendEndParenthetical(csl, source.type(), post);
                }
                appendHereinafter(source, post);
            }
            case CHAPTER -> {
                appendAuthors(csl, source.type(), pre);
                pre.append(reverseItalicize(csl.title()));
                pre.append(", *in* ");
                if (csl.volume() != null) {
                    pre.append(csl.volume()).append(' ');
                }
                if (csl.containerTitle() != null) {
                    pre.append(bold(csl.containerTitle()));
                }
                appendFirstPage(csl, pre);
                if (csl.edition() != null || csl.hasEditors() || csl.hasTranslators() || csl.issued() != null) {
                    appendEndParenthetical(csl, source.type(), post);
                }
                appendHereinafter(source, post);
            }
            case ARTICLE -> {
                appendAuthors(csl, source.type(), pre);
                pre.append(reverseItalicize(csl.title()));
                appendVolume(csl, pre);
                appendJournal(csl, pre);
                appendFirstPage(csl, pre);
                // Journals that number their volumes by year leave the year out
                boolean yearVolume = csl.volume() != null && csl.volume().length() == 4;
                if (csl.volume() != null && !yearVolume
                    && (csl.edition() != null || csl.hasEditors() || csl.hasTranslators() || csl.issued() != null)) {
                    appendEndParenthetical(csl, source.type(), post);
                }
                appendHereinafter(source, post);
            }
            case MANUSCRIPT -> {
                appendAuthors(csl, source.type(), pre);
                pre.append(reverseItalicize(csl.title()));
                appendVolume(csl, pre);
                appendJournal(csl, pre);
                if (csl.year() != null) {
                    pre.append(" (forthcoming ").append(csl.year()).append(')');
                }
                appendHereinafter(source, post);
                if (csl.url() != null) {
                    post.append(", ").append(csl.url());
                }
            }
            case CASE -> {
                pre.append(TitleFormatter.caseTitle(csl.title()));
                appendVolume(csl, pre);
                if (csl.containerTitle() != null) {
                    pre.append(csl.containerTitle());
                }
                appendFirstPage(csl, pre);
                if (csl.authority() != null || csl.issued() != null) {
                    appendEndParenthetical(csl, source.type(), post);
                }
            }
        }

        source.setLongCite(pre.toString(), post.toString());
    }

    void buildShortCite(Source source) {
        var csl = source.csl();
        var cite = new StringBuilder();

        if (source.type() == SourceType.CASE) {
            cite.append(source.shortTitle());
            appendVolume(csl, cite);
            if (csl.containerTitle() != null) {
                cite.append(csl.containerTitle());
            }
            var withPin = cite.toString();
            var noPin = csl.page() != null ? withPin + " " + csl.page() : withPin;
            source.setShortCite(noPin, withPin);
            return;
        }

        if (source.shortAuthor().isEmpty()) {
            cite.append(source.shortTitle());
        } else {
            cite.append(source.shortAuthor());
            if (source.isHereinafter()) {
                cite.append(", ").append(source.shortTitle());
            }
        }
        cite.append(", *supra* note ").append(source.firstFootnote());
        source.setShortCite(cite.toString(), cite.toString());
    }

    private void appendAuthors(CslSource csl, SourceType type, StringBuilder cite) {
        if (csl.hasAuthors()) {
            var authors = NameFormatter.longNames(csl.author());
            cite.append(type == SourceType.BOOK ? bold(authors) : authors).append(", ");
        }
    }

    private void appendVolume(CslSource csl, StringBuilder cite) {
        if (csl.volume() != null) {
            cite.append(", ").append(csl.volume()).append(' ');
        } else if (csl.containerTitle() != null || csl.containerTitleShort() != null) {
            cite.append(", ");
        }
    }

    private void appendJournal(CslSource csl, StringBuilder cite) {
        if (csl.containerTitleShort() != null) {
            cite.append(bold(csl.containerTitleShort()));
        } else if (csl.containerTitle() != null) {
            cite.append(bold(journals.shorten(csl.containerTitle())));
        }
    }

    private static void appendFirstPage(CslSource csl, StringBuilder cite) {
        if (csl.page() != null) {
            cite.append(' ').append(csl.page());
        }
    }

    /**
     * Appends the closing parenthetical: court, edition, editors, translators and year, in that order.
     */
    private static void appendEndParenthetical(CslSource csl, SourceType type, StringBuilder cite) {
        var contents = new StringBuilder();

        if (type == SourceType.CASE && csl.authority() != null && !csl.authority().equals(SUPREME_COURT)) {
            contents.append(csl.authority()).append(' ');
        }

        if (type == SourceType.BOOK || type == SourceType.CHAPTER) {
            if (csl.edition() != null) {
                contents.append(csl.edition()).append(" ed.");
                contents.append(csl.hasEditors() || csl.hasTranslators() ? ", " : " ");
            }
            if (csl.hasEditors()) {
                contents.append(NameFormatter.longNames(csl.editor()));
                contents.append(csl.editor().size() > 1 ? " eds., " : " ed., ");
            }
            if (csl.hasTranslators()) {
                contents.append(NameFormatter.longNames(csl.translator())).append(" trans., ");
            }
        }

        var year = csl.year();
        if (year != null) {
            contents.append(year);
        }

        var text = TRAILING_SEPARATOR.matcher(contents).replaceFirst("");
        if (!text.isEmpty()) {
            cite.append(" (").append(text).append(')');
        }
    }

    private static void appendHereinafter(Source source, StringBuilder cite) {
        if (source.isHereinafter()) {
            cite.append(" [hereinafter ").append(source.shortAuthor()).append(", ").append(source.shortTitle()).append(']');
        }
    }
}
