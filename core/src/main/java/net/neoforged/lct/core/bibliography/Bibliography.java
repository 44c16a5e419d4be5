package net.neoforged.lct.core.bibliography;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import net.neoforged.lct.api.ProblemSeverity;
import net.neoforged.lct.api.TransformContext;
import net.neoforged.lct.core.CitationProblems;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A CSL-JSON library, indexed by entry id.
 */
public final class Bibliography {
    private static final Gson GSON = new GsonBuilder().create();

    private final Map<String, CslSource> sources;

    private Bibliography(Map<String, CslSource> sources) {
        this.sources = Collections.unmodifiableMap(sources);
    }

    public static Bibliography loadJson(Path path, TransformContext context) throws IOException, BibliographyException {
        try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return loadJson(reader, context);
        }
    }

    public static Bibliography loadJson(String json, TransformContext context) throws BibliographyException {
        return loadJson(new StringReader(json), context);
    }

    public static Bibliography loadJson(Reader reader, TransformContext context) throws BibliographyException {
        var logger = context.logger();
        logger.debug("Starting CSL JSON parsing...");

        CslSource[] records;
        try {
            records = GSON.fromJson(reader, CslSource[].class);
        } catch (JsonParseException e) {
            throw new BibliographyException("Error deserializing the CSL JSON library: " + e.getMessage(), e);
        }
        if (records == null) {
            throw new BibliographyException("The CSL JSON library is empty", (String) null);
        }

        var sources = new LinkedHashMap<String, CslSource>(records.length);
        for (int i = 0; i < records.length; i++) {
            var record = records[i];
            if (record == null || record.id() == null) {
                throw new BibliographyException("Entry #" + (i + 1) + " of the CSL JSON library has no id", (String) null);
            }
            if (sources.putIfAbsent(record.id(), record) != null) {
                logger.warn("The library contains %s more than once; using the first entry", record.id());
                context.problemReporter().report(CitationProblems.DUPLICATE_LIBRARY_ID, ProblemSeverity.WARNING,
                        "Duplicate library id " + record.id());
            }
        }

        logger.debug("CSL JSON parsed: %d entries", sources.size());
        return new Bibliography(sources);
    }

    public @Nullable CslSource get(String id) {
        return sources.get(id);
    }

    public int size() {
        return sources.size();
    }
}
