package com.golfdata.clubtracker.crawl.service;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps retailer category slugs and free-form type text onto catalog club type names.
 */
@Component
public class ClubTypeVocabulary {
    private static final Map<String, String> CANONICAL = new LinkedHashMap<>();

    static {
        register("Driver", "drivers", "driver");
        register("Fairway Wood", "fairway-woods", "fairway-wood", "fairway woods", "fairway wood", "fairways");
        register("Hybrid", "hybrids", "hybrid", "rescue");
        register("Iron", "irons", "iron", "iron set", "iron sets");
        register("Wedge", "wedges", "wedge");
        register("Putter", "putters", "putter");
    }

    private static void register(String name, String... aliases) {
        CANONICAL.put(name.toLowerCase(Locale.ROOT), name);
        for (String alias : aliases) {
            CANONICAL.put(alias, name);
        }
    }

    /**
     * Canonical name for known slugs, otherwise the text title-cased. Null for blank input.
     */
    public String canonicalName(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String key = raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        String known = CANONICAL.get(key);
        return known != null ? known : titleCase(key.replace('-', ' ').replace('_', ' '));
    }

    public boolean isKnown(String raw) {
        return raw != null && CANONICAL.containsKey(raw.trim().toLowerCase(Locale.ROOT));
    }


    static String titleCase(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isWhitespace(c)) {
                startOfWord = true;
                sb.append(c);
            } else if (startOfWord) {
                sb.append(Character.toUpperCase(c));
                startOfWord = false;
            } else {
                sb.append(Character.toLowerCase(c));
            }
        }
        return sb.toString().trim();
    }
}
