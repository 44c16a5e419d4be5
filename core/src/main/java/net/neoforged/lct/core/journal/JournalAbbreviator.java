package net.neoforged.lct.core.journal;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import net.neoforged.lct.api.ProblemSeverity;
import net.neoforged.lct.api.TransformContext;
import net.neoforged.lct.core.CitationProblems;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the short form of a journal name: from the user's table, from the table of known journals, or by
 * abbreviating it word by word.
 */
public final class JournalAbbreviator {
    static final String TABLES_RESOURCE = "journal-abbreviations.json";

    private final JournalAbbreviations userJournals;
    private final TransformContext context;

    public JournalAbbreviator(JournalAbbreviations userJournals, TransformContext context) {
        this.userJournals = userJournals;
        this.context = context;
    }

    public String shorten(String journal) {
        var user = userJournals.get(journal);
        if (user != null) {
            return user;
        }

        var tables = Tables.get();
        var known = tables.journals().get(journal);
        if (known != null) {
            return known;
        }

        var shortJournal = synthesize(journal, tables);
        context.logger().warn("No short journal name found for %s; using %s", journal, shortJournal);
        context.problemReporter().report(CitationProblems.SYNTHESIZED_JOURNAL_ABBREVIATION, ProblemSeverity.WARNING,
                "No short journal name found for " + journal + "; using " + shortJournal);
        return shortJournal;
    }

    static String synthesize(String journal, Tables tables) {
        for (var phrase : tables.multiword()) {
            journal = journal.replace(phrase.getKey(), phrase.getValue());
        }

        var result = new StringBuilder(journal.length());
        for (var word : journal.split("\\s+")) {
            if (word.isEmpty() || tables.removals().contains(word)) {
                continue;
            }
            var replacement = tables.institutions().get(word);
            if (replacement == null) {
                replacement = tables.abbreviations().get(word);
            }
            if (replacement == null) {
                replacement = tables.geography().get(word);
            }
            result.append(replacement != null ? replacement : word).append(' ');
        }
        return result.toString().trim();
    }

    /**
     * The built-in tables, read once per JVM.
     *
     * @param multiword phrase replacements, longest phrase first
     */
    record Tables(Map<String, String> journals,
                  List<Map.Entry<String, String>> multiword,
                  Map<String, String> institutions,
                  Map<String, String> abbreviations,
                  Map<String, String> geography,
                  Set<String> removals) {
        private static final class Holder {
            private static final Tables INSTANCE = load();
        }

        static Tables get() {
            return Holder.INSTANCE;
        }

        private static Tables load() {
            var in = JournalAbbreviator.class.getResourceAsStream(TABLES_RESOURCE);
            if (in == null) {
                throw new IllegalStateException("Missing resource " + TABLES_RESOURCE);
            }

            TablesJson json;
            try (var reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                json = new Gson().fromJson(reader, TablesJson.class);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            } catch (JsonParseException e) {
                throw new IllegalStateException("Malformed resource " + TABLES_RESOURCE, e);
            }

            var multiword = new ArrayList<>(json.multiword.entrySet());
            multiword.sort(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed());

            return new Tables(
                    Map.copyOf(json.journals),
                    List.copyOf(multiword),
                    Map.copyOf(json.institutions),
                    Map.copyOf(json.abbreviations),
                    Map.copyOf(json.geography),
                    Set.copyOf(json.removals)
            );
        }
    }

    private static final class TablesJson {
        LinkedHashMap<String, String> journals = new LinkedHashMap<>();
        LinkedHashMap<String, String> multiword = new LinkedHashMap<>();
        LinkedHashMap<String, String> institutions = new LinkedHashMap<>();
        LinkedHashMap<String, String> abbreviations = new LinkedHashMap<>();
        LinkedHashMap<String, String> geography = new LinkedHashMap<>();
        List<String> removals = List.of();
    }
}
