package mwtab.validation;

import lombok.AllArgsConstructor;
import lombok.Getter;
import mwtab.MwTabConfig;
import mwtab.Section;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The section schema: which sections a document of each analysis kind holds and how their keys
 * are checked. Loaded once from YAML.
 */
@Getter
@AllArgsConstructor
public class SchemaTable {
    private final List<String> naValues;
    /** NA spellings for metabolite names; "NA" is a real metabolite abbreviation. */
    private final List<String> metaboliteNaValues;
    private final List<String> baseSections;
    /** Every known section in schema order. */
    private final Map<String, SectionRule> sections;
    /** Keyed by the analysis section name, "MS" or "NM". */
    private final Map<String, Analysis> analyses;
    private final SectionRule resultsFile;

    @Getter
    @AllArgsConstructor
    public static class Analysis {
        private final String section;
        private final List<String> required;
        private final List<String> optional;
        private final List<String> dataSections;
        private final String resultsFileKey;
        private final String missingDataMessage;
    }

    public static SchemaTable load(String resource, RegexFragments fragments) {
        Map<String, Object> yaml = MwTabConfig.loadYaml(resource);

        Map<String, SectionRule> sections = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : mapping(yaml.get("sections"), "sections").entrySet()) {
            sections.put(entry.getKey(), sectionRule(entry.getKey(), mapping(entry.getValue(), entry.getKey()), fragments));
        }

        Map<String, Analysis> analyses = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : mapping(yaml.get("analyses"), "analyses").entrySet()) {
            Map<String, Object> spec = mapping(entry.getValue(), entry.getKey());
            analyses.put(entry.getKey(), new Analysis(entry.getKey(),
                    FieldRule.strings(spec.get("required")),
                    FieldRule.strings(spec.get("optional")),
                    FieldRule.strings(spec.get("dataSections")),
                    String.valueOf(spec.get("resultsFile")),
                    String.valueOf(spec.get("missingDataMessage"))));
        }

        List<String> baseSections = FieldRule.strings(yaml.get("baseSections"));
        for (String name : baseSections) {
            if (!sections.containsKey(name)) {
                throw new IllegalStateException("Base section " + name + " has no rule in " + resource);
            }
        }
        return new SchemaTable(
                FieldRule.strings(yaml.get("naValues")),
                FieldRule.strings(yaml.get("metaboliteNaValues")),
                baseSections,
                sections,
                analyses,
                sectionRule("results file", mapping(yaml.get("resultsFile"), "resultsFile"), fragments));
    }

    public Analysis getAnalysis(String section) {
        return analyses.get(section);
    }

    public List<String> requiredSections(Analysis analysis) {
        List<String> required = new ArrayList<>(baseSections);
        required.addAll(analysis.getRequired());
        return required;
    }

    /** Sections a document of this analysis kind may hold, in schema order. */
    public List<String> allowedSections(Analysis analysis) {
        Set<String> allowed = new LinkedHashSet<>(requiredSections(analysis));
        allowed.addAll(analysis.getOptional());
        List<String> ordered = new ArrayList<>();
        for (String name : sections.keySet()) {
            if (allowed.contains(name)) {
                ordered.add(name);
            }
        }
        return ordered;
    }

    public SectionRule getSection(String name) {
        return sections.get(name);
    }

    private static SectionRule sectionRule(String name, Map<String, Object> spec, RegexFragments fragments) {
        Object kind = spec.get("kind");
        return new SectionRule(
                name,
                kind == null ? Section.Kind.ITEMS : Section.Kind.valueOf(String.valueOf(kind).toUpperCase()),
                FieldRule.strings(spec.get("required")),
                fieldRules(spec.get("fields"), name, fragments),
                FieldRule.strings(spec.get("tables")),
                fieldRules(spec.get("additionalData"), name, fragments),
                spec.containsKey("otherValues") ? FieldRule.from("value", spec.get("otherValues"), fragments) : null);
    }

    private static Map<String, FieldRule> fieldRules(Object value, String section, RegexFragments fragments) {
        if (value == null) {
            return Collections.emptyMap();
        }
        Map<String, FieldRule> rules = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : mapping(value, section).entrySet()) {
            rules.put(entry.getKey(), FieldRule.from(entry.getKey(), entry.getValue(), fragments));
        }
        return rules;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> mapping(Object value, String name) {
        if (!(value instanceof Map)) {
            throw new IllegalStateException("Schema entry \"" + name + "\" must be a mapping");
        }
        return (Map<String, Object>) value;
    }
}
