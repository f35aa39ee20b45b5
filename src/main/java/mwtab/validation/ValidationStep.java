package mwtab.validation;

import mwtab.MwTabDocument;

import java.util.List;

/**
 * One pass over a document. Steps append findings in a fixed order and never throw for document
 * content.
 */
interface ValidationStep {
    void validate(MwTabDocument document, List<Finding> findings);
}
