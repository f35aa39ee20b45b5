package mwtab.validation;

import mwtab.MwTabConfig;
import mwtab.MwTabDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Runs the validation stages in order over a copy of the document and collects their findings.
 * The schema and matcher library are loaded once, when the validator is built.
 */
public class DocumentValidator {
    private static final Logger logger = LoggerFactory.getLogger(DocumentValidator.class);

    private final MwTabConfig config;
    private final List<ValidationStep> steps;

    public DocumentValidator(MwTabConfig config) {
        this.config = config;
        RegexFragments fragments = RegexFragments.load(config.getRegexFragmentsResource());
        SchemaTable schema = SchemaTable.load(config.getSchemaResource(), fragments);
        ColumnMatcherLibrary library = ColumnMatcherLibrary.load(config.getMatchersResource(), fragments);
        this.steps = Arrays.asList(
                new SchemaValidator(schema),
                new SubjectSampleFactorValidator(),
                new CrossReferenceValidator(schema),
                new ColumnSemanticsValidator(library),
                new TableIntegrityValidator(schema.getNaValues(), config.getDominanceThreshold()),
                new PolarityValidator(library));
    }

    public ValidationReport validate(MwTabDocument document) {
        MwTabDocument copy = document.copy();
        List<Finding> findings = new ArrayList<>();
        for (ValidationStep step : steps) {
            try {
                step.validate(copy, findings);
            } catch (RuntimeException e) {
                logger.warn("{} failed on {}", step.getClass().getSimpleName(), document.getSource(), e);
                findings.add(Finding.error(null, null, "Validation could not be completed by "
                        + step.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }
        ValidationReport report = ValidationReport.builder()
                .timestamp(LocalDateTime.now().toString())
                .version(config.getVersion())
                .source(copy.getSource())
                .studyId(copy.getStudyId())
                .analysisId(copy.getAnalysisId())
                .fileFormat(copy.getInputFormat())
                .findings(Collections.unmodifiableList(findings))
                .build();
        logger.debug("Validated {}: {} errors, {} warnings", copy.getSource(),
                report.getErrors().size(), report.getWarnings().size());
        return report;
    }
}
