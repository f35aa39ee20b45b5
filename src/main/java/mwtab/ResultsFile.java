package mwtab;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The packed value of an MS_RESULTS_FILE or NMR_RESULTS_FILE line, e.g.
 * {@code ST000071_AN000111_Results.txt UNITS:Peak area Has m/z:Yes Has RT:Yes RT units:Minutes}.
 */
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
@Data
public class ResultsFile {
    public static final String FILENAME = "filename";
    public static final String UNITS = "UNITS";
    public static final String HAS_MZ = "Has m/z";
    public static final String HAS_RT = "Has RT";
    public static final String RT_UNITS = "RT units";

    private static final Pattern LABEL = Pattern.compile("(^|\\s)(UNITS|Has m/z|Has RT|RT units):");

    private String filename;
    private String units;
    private String hasMz;
    private String hasRt;
    private String rtUnits;

    public static ResultsFile parse(String text) {
        ResultsFile result = new ResultsFile();
        String value = StringUtils.defaultString(text);
        Matcher matcher = LABEL.matcher(value);
        List<int[]> bounds = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        while (matcher.find()) {
            bounds.add(new int[]{matcher.start(2), matcher.end()});
            labels.add(matcher.group(2));
        }
        String head = (bounds.isEmpty() ? value : value.substring(0, bounds.get(0)[0])).strip();
        if (!head.isEmpty()) {
            result.filename = head;
        }
        for (int i = 0; i < labels.size(); i++) {
            int end = i + 1 < bounds.size() ? bounds.get(i + 1)[0] : value.length();
            result.put(labels.get(i), value.substring(bounds.get(i)[1], end).strip());
        }
        return result;
    }

    /** Labelled attributes other than the filename, in their fixed output order. */
    public Map<String, String> attributes() {
        Map<String, String> attributes = new LinkedHashMap<>();
        putIfPresent(attributes, UNITS, units);
        putIfPresent(attributes, HAS_MZ, hasMz);
        putIfPresent(attributes, HAS_RT, hasRt);
        putIfPresent(attributes, RT_UNITS, rtUnits);
        return attributes;
    }

    public void put(String label, String value) {
        switch (label) {
            case FILENAME:
                filename = value;
                break;
            case UNITS:
                units = value;
                break;
            case HAS_MZ:
                hasMz = value;
                break;
            case HAS_RT:
                hasRt = value;
                break;
            case RT_UNITS:
                rtUnits = value;
                break;
            default:
                throw new IllegalArgumentException("Unknown results file attribute: " + label);
        }
    }

    public String render(String delimiter) {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, String> attribute : attributes().entrySet()) {
            parts.add(attribute.getKey() + ":" + attribute.getValue());
        }
        String pairs = String.join(delimiter, parts);
        if (filename == null) {
            return pairs;
        }
        return pairs.isEmpty() ? filename : filename + delimiter + pairs;
    }

    private static void putIfPresent(Map<String, String> target, String key, String value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
