package in.feedconv.bootstrap;

import in.feedconv.util.Env;

import java.nio.file.Path;
import java.util.Set;

/**
 * Converter settings.
 *
 * @param symbolFilter   roots to keep, or null for all (FEEDCONV_SYMBOL_FILTER, comma list)
 * @param propertiesFile symbol properties override, or null for the bundled database
 *                       (FEEDCONV_PROPERTIES_FILE)
 * @param failOnEmpty    exit with an error if a file yields no ticks (FEEDCONV_FAIL_ON_EMPTY)
 */
public record ConverterConfig(
    Set<String> symbolFilter,
    Path propertiesFile,
    boolean failOnEmpty
) {
    public static final String SYMBOL_FILTER = "FEEDCONV_SYMBOL_FILTER";
    public static final String PROPERTIES_FILE = "FEEDCONV_PROPERTIES_FILE";
    public static final String FAIL_ON_EMPTY = "FEEDCONV_FAIL_ON_EMPTY";

    public static ConverterConfig fromEnv() {
        String propertiesFile = Env.get(PROPERTIES_FILE, null);
        return new ConverterConfig(
            Env.getSet(SYMBOL_FILTER),
            propertiesFile == null ? null : Path.of(propertiesFile),
            Env.getBool(FAIL_ON_EMPTY, false));
    }
}
