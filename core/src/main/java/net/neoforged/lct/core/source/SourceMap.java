package net.neoforged.lct.core.source;

import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The resolved sources of a document, keyed by reference marker, in order of first citation.
 */
public final class SourceMap {
    private final Map<String, Source> sources = new LinkedHashMap<>();

    void add(Source source) {
        sources.put(source.reference(), source);
    }

    public @Nullable Source get(String reference) {
        return sources.get(reference);
    }

    public Collection<Source> sources() {
        return Collections.unmodifiableCollection(sources.values());
    }

    public int size() {
        return sources.size();
    }
}
