package in.feedconv.util;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lookup for the converter's FEEDCONV_* settings (see ConverterConfig).
 *
 * An environment variable wins over a system property of the same name, so tests and
 * embedding code can set -DFEEDCONV_SYMBOL_FILTER=ES,NQ without touching the environment.
 * Blank values count as unset.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    /**
     * Comma-separated list as a set, blanks dropped. Null if the key is not set.
     */
    public static Set<String> getSet(String key) {
        String value = get(key, null);
        if (value == null) return null;
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
    }

    private Env() {}
}
