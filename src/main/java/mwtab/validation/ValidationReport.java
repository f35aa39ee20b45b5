package mwtab.validation;

import lombok.Builder;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered findings for one document plus the banner data printed above them.
 */
@Getter
@Builder
public class ValidationReport {
    private final String timestamp;
    private final String version;
    private final String source;
    private final String studyId;
    private final String analysisId;
    private final String fileFormat;
    @Builder.Default
    private final List<Finding> findings = Collections.emptyList();

    /** An empty report is a pass; warnings alone still fail it. */
    public boolean isPassing() {
        return findings.isEmpty();
    }

    public boolean hasErrors() {
        return !getErrors().isEmpty();
    }

    public List<Finding> getErrors() {
        return filter(Severity.ERROR);
    }

    public List<Finding> getWarnings() {
        return filter(Severity.WARNING);
    }

    public String toText() {
        StringBuilder sb = new StringBuilder();
        sb.append("Validation Log\n");
        sb.append(timestamp).append('\n');
        sb.append("mwtab engine version: ").append(version).append('\n');
        sb.append("Source:        ").append(StringUtils.defaultString(source)).append('\n');
        sb.append("Study ID:      ").append(StringUtils.defaultString(studyId, "unknown")).append('\n');
        sb.append("Analysis ID:   ").append(StringUtils.defaultString(analysisId, "unknown")).append('\n');
        sb.append("File format:   ").append(StringUtils.defaultString(fileFormat)).append('\n');
        if (isPassing()) {
            sb.append("Status: Passing\n");
            return sb.toString();
        }
        sb.append("Status: Contains Validation Errors\n");
        sb.append("Number of Errors: ").append(getErrors().size()).append('\n');
        sb.append("Number of Warnings: ").append(getWarnings().size()).append('\n');
        sb.append('\n');
        for (Finding finding : findings) {
            sb.append(finding.toText()).append('\n');
        }
        return sb.toString();
    }

    private List<Finding> filter(Severity severity) {
        List<Finding> result = new ArrayList<>();
        for (Finding finding : findings) {
            if (finding.getSeverity() == severity) {
                result.add(finding);
            }
        }
        return result;
    }
}
