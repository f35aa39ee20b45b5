package mwtab;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class ListSection extends Section {
    private final List<SubjectSampleFactor> rows;

    public ListSection(String name) {
        this(name, new ArrayList<>());
    }

    public ListSection(String name, List<SubjectSampleFactor> rows) {
        super(name);
        this.rows = rows;
    }

    @Override
    public Kind getKind() {
        return Kind.SUBJECT_SAMPLE_FACTORS;
    }

    public List<String> sampleIds() {
        List<String> ids = new ArrayList<>();
        for (SubjectSampleFactor row : rows) {
            ids.add(row.getSampleId());
        }
        return ids;
    }

    @Override
    public ListSection copy() {
        List<SubjectSampleFactor> copied = new ArrayList<>();
        for (SubjectSampleFactor row : rows) {
            copied.add(row.copy());
        }
        return new ListSection(getName(), copied);
    }
}
