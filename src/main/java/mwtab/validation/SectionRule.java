package mwtab.validation;

import lombok.AllArgsConstructor;
import lombok.Getter;
import mwtab.Section;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Schema entry for one section: its shape, required keys and per-key value rules.
 */
@Getter
@AllArgsConstructor
public class SectionRule {
    private final String name;
    private final Section.Kind kind;
    private final List<String> required;
    /** Known keys in schema order. */
    private final Map<String, FieldRule> fields;
    /** Data tables the section may carry. */
    private final List<String> tables;
    /** Known keys of "Additional sample data" in subject/sample/factor entries. */
    private final Map<String, FieldRule> additionalData;
    /** Rule for factor values and undeclared additional data values. */
    private final FieldRule otherValues;

    public boolean isRequired(String key) {
        return required.contains(key);
    }

    public boolean isKnown(String key) {
        return fields.containsKey(key) || tables.contains(key);
    }

    public Map<String, FieldRule> getAdditionalData() {
        return additionalData == null ? Collections.emptyMap() : additionalData;
    }
}
