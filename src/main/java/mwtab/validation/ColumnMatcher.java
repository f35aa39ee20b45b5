package mwtab.validation;

import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Recognizes one standard METABOLITES column by its name and checks the values found under it.
 */
@Getter
@Builder
public class ColumnMatcher {
    private static final String WRAP = "[^a-zA-Z0-9]";
    private static final Pattern NUMERIC = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    public enum ValueType {
        INTEGER,
        NUMERIC,
        NON_NUMERIC
    }

    private final String standardName;
    private final Pattern nameRegex;
    private final Pattern notNameRegex;
    private final List<Pattern> nameRegexSets;
    private final List<String> in;
    private final List<String> notIn;
    private final List<List<String>> inSets;
    private final List<String> exact;
    private final Pattern values;
    private final Pattern inverseValues;
    private final ValueType valueType;

    static ColumnMatcher from(Map<?, ?> spec, RegexFragments fragments) {
        Object name = spec.get("name");
        if (name == null) {
            throw new IllegalStateException("Column matcher without a name: " + spec);
        }
        ColumnMatcherBuilder builder = ColumnMatcher.builder()
                .standardName(String.valueOf(name))
                .nameRegex(wordRegex(FieldRule.strings(spec.get("regex"))))
                .notNameRegex(wordRegex(FieldRule.strings(spec.get("notRegex"))))
                .in(FieldRule.strings(spec.get("in")))
                .notIn(FieldRule.strings(spec.get("notIn")))
                .exact(FieldRule.strings(spec.get("exact")));

        List<Pattern> regexSets = new ArrayList<>();
        for (List<String> set : stringSets(spec.get("regexSets"))) {
            StringBuilder lookaheads = new StringBuilder();
            for (String word : set) {
                lookaheads.append("(?=.*(").append(WRAP).append("|^)").append(word).append("(").append(WRAP).append("|$))");
            }
            regexSets.add(Pattern.compile(lookaheads.toString()));
        }
        builder.nameRegexSets(regexSets);
        builder.inSets(stringSets(spec.get("inSets")));

        if (spec.get("values") != null) {
            builder.values(Pattern.compile(fragments.expand(String.valueOf(spec.get("values")))));
        }
        if (spec.get("inverseValues") != null) {
            builder.inverseValues(Pattern.compile(fragments.expand(String.valueOf(spec.get("inverseValues")))));
        }
        if (spec.get("type") != null) {
            builder.valueType(ValueType.valueOf(String.valueOf(spec.get("type")).toUpperCase().replace('-', '_')));
        }
        return builder.build();
    }

    /**
     * True when the lower-cased, stripped column name looks like this standard column.
     */
    public boolean matchesName(String name) {
        boolean hit = (nameRegex != null && nameRegex.matcher(name).find())
                || anyContained(name, in)
                || exact.contains(name);
        for (Pattern set : nameRegexSets) {
            hit = hit || set.matcher(name).find();
        }
        for (List<String> set : inSets) {
            hit = hit || allContained(name, set);
        }
        if (!hit) {
            return false;
        }
        if (notNameRegex != null && notNameRegex.matcher(name).find()) {
            return false;
        }
        return !anyContained(name, notIn);
    }

    /**
     * True when the value fits this column. NA values always fit.
     */
    public boolean matchesValue(String raw, List<String> naValues) {
        String value = raw == null ? "" : raw.strip().replace("\u200e", "");
        boolean na = naValues.contains(value);
        boolean regexMatch;
        if (values != null) {
            regexMatch = values.matcher(value).matches();
        } else if (inverseValues != null) {
            regexMatch = !inverseValues.matcher(value).matches();
        } else {
            regexMatch = true;
        }
        regexMatch = regexMatch || na;

        // Values that only became NA through the numeric conversion.
        boolean convertedNa = !NUMERIC.matcher(value).matches() ^ na;
        boolean typeMatch;
        if (valueType == null) {
            typeMatch = true;
        } else {
            switch (valueType) {
                case INTEGER:
                    typeMatch = !value.contains(".") && !convertedNa;
                    break;
                case NUMERIC:
                    typeMatch = !convertedNa;
                    break;
                default:
                    typeMatch = convertedNa || na;
                    break;
            }
        }
        return regexMatch && typeMatch;
    }

    private static Pattern wordRegex(List<String> words) {
        if (words.isEmpty()) {
            return null;
        }
        List<String> alternatives = new ArrayList<>();
        for (String word : words) {
            alternatives.add("(" + WRAP + "|^)" + word + "(" + WRAP + "|$)");
        }
        return Pattern.compile(String.join("|", alternatives));
    }

    private static boolean anyContained(String name, List<String> words) {
        for (String word : words) {
            if (name.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static boolean allContained(String name, List<String> words) {
        for (String word : words) {
            if (!name.contains(word)) {
                return false;
            }
        }
        return true;
    }

    private static List<List<String>> stringSets(Object value) {
        if (value == null) {
            return Collections.emptyList();
        }
        List<List<String>> sets = new ArrayList<>();
        for (Object set : (List<?>) value) {
            sets.add(FieldRule.strings(set));
        }
        return sets;
    }
}
