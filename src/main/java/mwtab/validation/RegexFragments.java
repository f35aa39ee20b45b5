package mwtab.validation;

import mwtab.MwTabConfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Named regular expression fragments. Definitions are either a template, where {@code {{NAME}}}
 * refers to another fragment, or a list description ({@code element}, {@code delimiter},
 * {@code quoted}, {@code empty}).
 */
public class RegexFragments {
    private static final Pattern REFERENCE = Pattern.compile("\\{\\{([A-Z0-9_]+)}}");

    private final Map<String, Object> definitions;
    private final Map<String, String> resolved = new HashMap<>();

    public RegexFragments(Map<String, Object> definitions) {
        this.definitions = new LinkedHashMap<>(definitions);
    }

    public static RegexFragments load(String resource) {
        return new RegexFragments(MwTabConfig.loadYaml(resource));
    }

    public String get(String name) {
        return resolve(name, new ArrayList<>());
    }

    /** Replaces every {@code {{NAME}}} in the template with the named fragment. */
    public String expand(String template) {
        return expand(template, new ArrayList<>());
    }

    /**
     * Builds a regular expression for one or more elements separated by the delimiter, with
     * optional whitespace around each delimiter and an optional trailing delimiter.
     */
    public static String listRegex(String element, String delimiter, boolean quoted, boolean empty) {
        if (quoted) {
            return "(" + listRegex(element, delimiter, false, empty)
                    + "|" + listRegex("'" + element + "'", delimiter, false, empty)
                    + "|" + listRegex("\"" + element + "\"", delimiter, false, empty) + ")";
        }
        String repetition = empty ? "*" : "+";
        return "((" + element + "\\s*" + delimiter + "\\s*)" + repetition + "(" + element + "\\s*|\\s*))";
    }

    private String expand(String template, List<String> path) {
        Matcher matcher = REFERENCE.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(resolve(matcher.group(1), path)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private String resolve(String name, List<String> path) {
        String cached = resolved.get(name);
        if (cached != null) {
            return cached;
        }
        if (path.contains(name)) {
            throw new IllegalStateException("Regex fragment cycle: " + String.join(" -> ", path) + " -> " + name);
        }
        Object definition = definitions.get(name);
        if (definition == null) {
            throw new IllegalStateException("Unknown regex fragment: " + name);
        }
        path.add(name);
        String value;
        if (definition instanceof Map) {
            Map<?, ?> list = (Map<?, ?>) definition;
            Object element = list.get("element");
            if (element == null) {
                throw new IllegalStateException("List fragment " + name + " has no element");
            }
            value = listRegex(expand(String.valueOf(element), path),
                    expand(String.valueOf(list.get("delimiter") == null ? "" : list.get("delimiter")), path),
                    Boolean.TRUE.equals(list.get("quoted")),
                    Boolean.TRUE.equals(list.get("empty")));
        } else {
            value = expand(String.valueOf(definition), path);
        }
        path.remove(path.size() - 1);
        resolved.put(name, value);
        return value;
    }
}
