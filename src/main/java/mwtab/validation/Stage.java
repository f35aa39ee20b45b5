package mwtab.validation;

/**
 * Validation stages in the order they run.
 */
public enum Stage {
    SCHEMA,
    SUBJECT_SAMPLE_FACTORS,
    CROSS_REFERENCE,
    COLUMN_SEMANTICS,
    TABLE_INTEGRITY,
    POLARITY
}
