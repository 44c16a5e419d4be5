package net.neoforged.lct.core.journal;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import net.neoforged.lct.core.bibliography.BibliographyException;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A user-supplied table of journal abbreviations, mapping the full journal name to its short form.
 * The file is a JSON object; {@code //} comments are allowed.
 */
public final class JournalAbbreviations {
    private static final Gson GSON = new GsonBuilder().setLenient().create();

    private static final JournalAbbreviations EMPTY = new JournalAbbreviations(Map.of());

    private static final String BLANK_TEMPLATE = """
            // Enter your own journal abbreviations into this file.
            // Every entry goes between the two curly brackets that start and end the file.
            // Each entry is two quoted strings separated by a colon: the full journal title, then its
            // abbreviation. Separate the entries with commas, but leave no comma after the last one.
            // For example:
            //
            // {
            //   "Journal of Stuff": "J. Stuff",
            //   "Journal of More Stuff": "J. More Stuff"
            // }
            //
            // Replace the placeholder below with your own journals.
            {
              "Full Journal Name": "Abbreviated Name"
            }
            """;

    private final Map<String, String> abbreviations;

    private JournalAbbreviations(Map<String, String> abbreviations) {
        this.abbreviations = abbreviations;
    }

    public static JournalAbbreviations empty() {
        return EMPTY;
    }

    public static JournalAbbreviations of(Map<String, String> abbreviations) {
        return new JournalAbbreviations(Collections.unmodifiableMap(new LinkedHashMap<>(abbreviations)));
    }

    public static JournalAbbreviations load(Path path) throws IOException, BibliographyException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static JournalAbbreviations parse(String json) throws BibliographyException {
        LinkedHashMap<String, String> map;
        try {
            map = GSON.fromJson(json, new TypeToken<LinkedHashMap<String, String>>() {
            }.getType());
        } catch (JsonParseException e) {
            throw new BibliographyException("Error deserializing the user journals file: " + e.getMessage(), e);
        }
        if (map == null) {
            return EMPTY;
        }
        return new JournalAbbreviations(Collections.unmodifiableMap(map));
    }

    /**
     * The commented file written by {@code new-user-journals}. It parses to a single placeholder entry.
     */
    public static String blankTemplate() {
        return BLANK_TEMPLATE;
    }

    public @Nullable String get(String journal) {
        return abbreviations.get(journal);
    }

    public int size() {
        return abbreviations.size();
    }

    public Map<String, String> asMap() {
        return abbreviations;
    }
}
