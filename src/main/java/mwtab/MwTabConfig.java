package mwtab;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;

/**
 * Engine settings. {@link #load()} reads {@code mwtab/mwtab.yml} from the classpath; any key the
 * file leaves out keeps its default.
 */
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
@Data
public class MwTabConfig {
    public static final String RESOURCE = "mwtab/mwtab.yml";
    public static final int DEFAULT_WRAP_WIDTH = 80;
    public static final int DEFAULT_JSON_INDENT = 4;
    public static final double DEFAULT_DOMINANCE_THRESHOLD = 0.9;

    @Builder.Default
    private String version = "1.0.0";
    @Builder.Default
    private int wrapWidth = DEFAULT_WRAP_WIDTH;
    @Builder.Default
    private int jsonIndent = DEFAULT_JSON_INDENT;
    /** Share of non-null cells one value may hold before a column is reported as dominated. */
    @Builder.Default
    private double dominanceThreshold = DEFAULT_DOMINANCE_THRESHOLD;
    @Builder.Default
    private String schemaResource = "mwtab/section-schema.yml";
    @Builder.Default
    private String regexFragmentsResource = "mwtab/regex-fragments.yml";
    @Builder.Default
    private String matchersResource = "mwtab/column-matchers.yml";

    public static MwTabConfig load() {
        Map<String, Object> values = loadYaml(RESOURCE);
        MwTabConfig config = MwTabConfig.builder().build();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            Object value = entry.getValue();
            switch (entry.getKey()) {
                case "version":
                    config.setVersion(String.valueOf(value));
                    break;
                case "wrapWidth":
                    config.setWrapWidth(((Number) value).intValue());
                    break;
                case "jsonIndent":
                    config.setJsonIndent(((Number) value).intValue());
                    break;
                case "dominanceThreshold":
                    config.setDominanceThreshold(((Number) value).doubleValue());
                    break;
                case "schemaResource":
                    config.setSchemaResource(String.valueOf(value));
                    break;
                case "regexFragmentsResource":
                    config.setRegexFragmentsResource(String.valueOf(value));
                    break;
                case "matchersResource":
                    config.setMatchersResource(String.valueOf(value));
                    break;
                default:
                    throw new IllegalStateException("Unknown setting \"" + entry.getKey() + "\" in " + RESOURCE);
            }
        }
        return config;
    }

    /**
     * Loads a YAML mapping from the classpath. A missing resource is a configuration error.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> loadYaml(String resource) {
        InputStream in = MwTabConfig.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalStateException("Resource not found on the classpath: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            Object loaded = new Yaml().load(reader);
            if (loaded == null) {
                return Collections.emptyMap();
            }
            if (!(loaded instanceof Map)) {
                throw new IllegalStateException(resource + " must contain a mapping");
            }
            return (Map<String, Object>) loaded;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
