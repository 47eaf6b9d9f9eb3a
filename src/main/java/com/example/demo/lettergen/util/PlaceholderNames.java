package com.example.demo.lettergen.util;

import java.text.Normalizer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps spelling variants of a placeholder name onto the name the template uses.
 * "Comisión", "comisión" and "comision" all resolve to the alias registered for "comision".
 * Names without an alias are returned as given (trimmed).
 */
public class PlaceholderNames {
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private final Map<String, String> aliases;

    public PlaceholderNames(Map<String, String> aliases) {
        Map<String, String> keyed = new LinkedHashMap<>();
        if (aliases != null) {
            aliases.forEach((k, v) -> keyed.put(fold(k), v));
        }
        this.aliases = Collections.unmodifiableMap(keyed);
    }

    public String normalize(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        String alias = aliases.get(fold(trimmed));
        return alias != null ? alias : trimmed;
    }

    /**
     * Lower-cases and removes diacritics: "Órgano" becomes "organo".
     */
    public static String fold(String name) {
        String decomposed = Normalizer.normalize(name.trim(), Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
    }
}
