package mwtab.validation;

import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Value rule for one key of a section: NA rejection, a pattern searched in the value, an
 * enumerated set, an e-mail format, a forbidden pattern or a minimum length.
 */
@Getter
@Builder
public class FieldRule {
    static final String EMAIL = "email";
    static final int LONG_VALUE = 50;

    private static final String NUMBER_PATTERN = "^((\\d+)|(\\d*\\.\\d+))$";
    private static final String INTEGER_PATTERN = "^\\d+$";
    private static final String IGNORE = " Ignore this when more complicated descriptions are required.";

    private final String name;
    private final boolean notNa;
    private final Pattern pattern;
    private final String patternMessage;
    private final List<String> enumValues;
    private final String format;
    private final Pattern forbidden;
    private final String forbiddenMessage;
    private final Integer minLength;
    /** The key holds a results file composite checked against the results file rule. */
    private final boolean resultsFile;

    /**
     * Reads a rule from its YAML form. A key listed without a body is text that must not be NA.
     */
    static FieldRule from(String name, Object spec, RegexFragments fragments) {
        FieldRuleBuilder builder = FieldRule.builder().name(name);
        if (spec == null) {
            return builder.notNa(true).build();
        }
        if (!(spec instanceof Map)) {
            throw new IllegalStateException("Rule for \"" + name + "\" must be a mapping");
        }
        Map<?, ?> map = (Map<?, ?>) spec;
        builder.notNa(Boolean.TRUE.equals(map.get("notNa")));
        builder.resultsFile(Boolean.TRUE.equals(map.get("resultsFile")));

        String pattern = null;
        String message = null;
        if (map.get("units") != null) {
            List<String> units = strings(map.get("units"));
            boolean range = Boolean.TRUE.equals(map.get("range"));
            String nums = fragments.get("NUMS");
            String unitGroup = " (" + String.join("|", units) + ")$";
            pattern = range ? "^(" + fragments.get("NUM_RANGE") + "|" + nums + ")" + unitGroup : "^" + nums + unitGroup;
            message = " should be a number" + (range ? " or range (ex. \"5-6\") " : " ")
                    + "followed by a space with a unit (ex. \"5 V\") from the following list: "
                    + bracketList(units) + "." + IGNORE;
        } else if (Boolean.TRUE.equals(map.get("number"))) {
            pattern = NUMBER_PATTERN;
            message = " should be a unitless number." + IGNORE;
        } else if (Boolean.TRUE.equals(map.get("integer"))) {
            pattern = INTEGER_PATTERN;
            message = " should be a unitless number." + IGNORE;
        }
        if (map.get("pattern") != null) {
            pattern = fragments.expand(String.valueOf(map.get("pattern")));
            message = null;
        }
        if (map.get("message") != null) {
            message = String.valueOf(map.get("message"));
        }
        if (pattern != null) {
            builder.pattern(Pattern.compile(pattern));
            builder.patternMessage(message);
        }
        if (map.get("enum") != null) {
            builder.enumValues(strings(map.get("enum")));
        }
        if (map.get("format") != null) {
            builder.format(String.valueOf(map.get("format")));
        }
        if (map.get("forbidden") != null) {
            builder.forbidden(Pattern.compile(fragments.expand(String.valueOf(map.get("forbidden")))));
            builder.forbiddenMessage(String.valueOf(map.get("forbiddenMessage")));
        }
        if (map.get("minLength") != null) {
            builder.minLength(((Number) map.get("minLength")).intValue());
        }
        return builder.build();
    }

    /**
     * Checks one value.
     *
     * @param where    location phrase, e.g. {@code for the subsection, "X", in the "Y" section}
     * @param required whether the key is required, which changes the NA message
     */
    List<Finding> check(String value, String section, String where, boolean required, List<String> naValues) {
        List<Finding> findings = new ArrayList<>();
        if (value == null) {
            return findings;
        }
        if (pattern != null && !pattern.matcher(value).find()) {
            String tail = patternMessage != null ? patternMessage
                    : " does not match the regular expression pattern " + pattern.pattern();
            findings.add(Finding.error(Stage.SCHEMA, section, valueMessage(value, where, tail)));
        }
        if (enumValues != null && !enumValues.contains(value)) {
            findings.add(Finding.error(Stage.SCHEMA, section,
                    valueMessage(value, where, " is not one of " + bracketList(enumValues) + ".")));
        }
        if (EMAIL.equals(format) && !value.contains("@")) {
            findings.add(Finding.error(Stage.SCHEMA, section, valueMessage(value, where, " is not a valid email.")));
        }
        if (minLength != null && value.length() < minLength) {
            findings.add(Finding.warning(Stage.SCHEMA, section, valueMessage(value, where, " is missing a value.")));
        }
        if (notNa && naValues.contains(value)) {
            findings.add(Finding.error(Stage.SCHEMA, section, naMessage(where, required)));
        }
        if (forbidden != null) {
            if (naValues.contains(value)) {
                findings.add(Finding.error(Stage.SCHEMA, section, naMessage(where, required)));
            } else if (forbidden.matcher(value).find()) {
                findings.add(Finding.error(Stage.SCHEMA, section, valueMessage(value, where, forbiddenMessage)));
            }
        }
        return findings;
    }

    static String valueMessage(String value, String where, String tail) {
        if (value.length() < LONG_VALUE) {
            return "The value, \"" + value + "\", " + where + tail;
        }
        return "The value " + where + tail;
    }

    static String naMessage(String where, boolean required) {
        return "An empty value or a null value was detected " + where + "."
                + (required ? " A legitimate value should be provided for this required subsection."
                : " Either a legitimate value should be provided for this subsection, or it should be removed altogether.");
    }

    /** Formats values as {@code ['a', 'b']}. */
    static String bracketList(List<String> values) {
        List<String> quoted = new ArrayList<>();
        for (String value : values) {
            quoted.add("'" + value + "'");
        }
        return "[" + String.join(", ", quoted) + "]";
    }

    static List<String> strings(Object value) {
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List)) {
            return Collections.singletonList(String.valueOf(value));
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            result.add(String.valueOf(item));
        }
        return result;
    }
}
