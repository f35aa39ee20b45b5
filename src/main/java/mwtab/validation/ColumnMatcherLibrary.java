package mwtab.validation;

import lombok.AllArgsConstructor;
import lombok.Getter;
import mwtab.MwTabConfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The standard METABOLITES columns, in the order they are tried.
 */
@Getter
@AllArgsConstructor
public class ColumnMatcherLibrary {
    private final List<ColumnMatcher> matchers;
    /** A column that implies others, e.g. other_id implies other_id_type. */
    private final Map<String, List<String>> impliedPairs;
    private final List<String> naValues;

    public static ColumnMatcherLibrary load(String resource, RegexFragments fragments) {
        Map<String, Object> yaml = MwTabConfig.loadYaml(resource);
        Object listed = yaml.get("matchers");
        if (!(listed instanceof List)) {
            throw new IllegalStateException(resource + " must list its matchers under \"matchers\"");
        }
        List<ColumnMatcher> matchers = new ArrayList<>();
        for (Object spec : (List<?>) listed) {
            if (!(spec instanceof Map)) {
                throw new IllegalStateException("Column matcher entries must be mappings, found " + spec);
            }
            matchers.add(ColumnMatcher.from((Map<?, ?>) spec, fragments));
        }

        Map<String, List<String>> implied = new LinkedHashMap<>();
        Object pairs = yaml.get("impliedPairs");
        if (pairs instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) pairs).entrySet()) {
                implied.put(String.valueOf(entry.getKey()), FieldRule.strings(entry.getValue()));
            }
        }
        return new ColumnMatcherLibrary(matchers, implied, FieldRule.strings(yaml.get("naValues")));
    }

    public ColumnMatcher get(String standardName) {
        for (ColumnMatcher matcher : matchers) {
            if (matcher.getStandardName().equals(standardName)) {
                return matcher;
            }
        }
        return null;
    }

    /** Standard names whose name patterns accept the column name. */
    public List<String> standardNamesFor(String columnName) {
        String normalized = normalize(columnName);
        List<String> names = new ArrayList<>();
        for (ColumnMatcher matcher : matchers) {
            if (matcher.matchesName(normalized)) {
                names.add(matcher.getStandardName());
            }
        }
        return names;
    }

    static String normalize(String columnName) {
        return columnName.toLowerCase(Locale.ROOT).strip();
    }
}
