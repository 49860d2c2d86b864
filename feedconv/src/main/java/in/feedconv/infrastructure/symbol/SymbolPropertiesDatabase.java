package in.feedconv.infrastructure.symbol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reference data per futures root: market, description and contract multiplier.
 *
 * JSON format:
 * <pre>
 * {
 *   "ES": { "market": "cme", "description": "E-mini S&amp;P 500", "multiplier": 1 },
 *   ...
 * }
 * </pre>
 */
public final class SymbolPropertiesDatabase {
    private static final Logger log = LoggerFactory.getLogger(SymbolPropertiesDatabase.class);

    public static final String DEFAULT_RESOURCE = "symbol-properties.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SymbolProperties(String market, String description, BigDecimal multiplier) {}

    private final Map<String, SymbolProperties> properties;

    public SymbolPropertiesDatabase(Map<String, SymbolProperties> properties) {
        this.properties = Map.copyOf(Objects.requireNonNull(properties, "properties"));
    }

    /**
     * Load the database bundled on the classpath.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static SymbolPropertiesDatabase fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static SymbolPropertiesDatabase fromClasspath(String resource) {
        try (InputStream in = SymbolPropertiesDatabase.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Symbol properties resource not found: " + resource);
            }
            return read(in, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load symbol properties from " + resource, e);
        }
    }

    public static SymbolPropertiesDatabase fromFile(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.toString());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load symbol properties from " + file, e);
        }
    }

    private static SymbolPropertiesDatabase read(InputStream in, String source) throws IOException {
        Map<String, SymbolProperties> entries = MAPPER.readValue(in, new TypeReference<LinkedHashMap<String, SymbolProperties>>() {});
        log.info("[SymbolPropertiesDatabase] Loaded {} roots from {}", entries.size(), source);
        return new SymbolPropertiesDatabase(entries);
    }

    /**
     * Market of a root, or null if the root is unknown.
     */
    public String market(String root) {
        SymbolProperties p = properties.get(root);
        return p == null ? null : p.market();
    }

    /**
     * Contract multiplier of a root, or null if the root is unknown.
     */
    public BigDecimal multiplier(String root) {
        SymbolProperties p = properties.get(root);
        return p == null ? null : p.multiplier();
    }

    public boolean contains(String root) {
        return properties.containsKey(root);
    }

    /**
     * Multiplier table for every root that declares one.
     */
    public Map<String, BigDecimal> multipliers() {
        Map<String, BigDecimal> result = new LinkedHashMap<>();
        properties.forEach((root, p) -> {
            if (p.multiplier() != null) {
                result.put(root, p.multiplier());
            }
        });
        return Map.copyOf(result);
    }

    public int size() {
        return properties.size();
    }
}
