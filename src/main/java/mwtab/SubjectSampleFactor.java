package mwtab;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class SubjectSampleFactor {
    public static final String SUBJECT_ID = "Subject ID";
    public static final String SAMPLE_ID = "Sample ID";
    public static final String FACTORS = "Factors";
    public static final String ADDITIONAL_DATA = "Additional sample data";

    private String subjectId;
    private String sampleId;
    @Builder.Default
    private DuplicatesMap factors = new DuplicatesMap();
    private DuplicatesMap additionalData;

    public SubjectSampleFactor copy() {
        return SubjectSampleFactor.builder()
                .subjectId(subjectId)
                .sampleId(sampleId)
                .factors(new DuplicatesMap(factors))
                .additionalData(additionalData == null ? null : new DuplicatesMap(additionalData))
                .build();
    }
}
