package com.golfdata.clubtracker.crawl.source;

import com.golfdata.clubtracker.config.PipelineProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class SourceAdapterRegistry {
    public static final String ALL = "all";

    private final Map<String, SourceAdapter> adapters = new LinkedHashMap<>();
    private final PipelineProperties properties;

    public SourceAdapterRegistry(List<SourceAdapter> adapters, PipelineProperties properties) {
        for (SourceAdapter adapter : adapters) {
            SourceAdapter previous = this.adapters.put(normalize(adapter.key()), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate source adapter key: " + adapter.key());
            }
        }
        this.properties = properties;
    }

    public SourceAdapter get(String key) {
        SourceAdapter adapter = adapters.get(normalize(key));
        if (adapter == null) {
            throw new UnknownSourceException("Unknown source: " + key + " (known: " + adapters.keySet() + ")");
        }
        if (!properties.source(adapter.key()).isEnabled()) {
            throw new UnknownSourceException("Source is disabled: " + adapter.key());
        }
        return adapter;
    }

    public List<SourceAdapter> enabled() {
        List<SourceAdapter> enabled = new ArrayList<>();
        for (SourceAdapter adapter : adapters.values()) {
            if (properties.source(adapter.key()).isEnabled()) {
                enabled.add(adapter);
            }
        }
        return enabled;
    }

    /**
     * One adapter by key, or every enabled adapter for {@code all} or a blank selector.
     */
    public List<SourceAdapter> resolve(String selector) {
        if (selector == null || selector.isBlank() || ALL.equals(normalize(selector))) {
            return enabled();
        }
        return List.of(get(selector));
    }

    public List<String> keys() {
        return List.copyOf(adapters.keySet());
    }

    private static String normalize(String key) {
        return key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
    }
}
