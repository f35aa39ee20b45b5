package mwtab;

import lombok.Getter;
import lombok.Setter;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory form of one mwTab file: named sections in file order plus the side information
 * captured while building that the serializers need to reproduce the input.
 */
public class MwTabDocument {
    public static final String HEADER = "METABOLOMICS WORKBENCH";
    public static final String SUBJECT_SAMPLE_FACTORS = "SUBJECT_SAMPLE_FACTORS";
    public static final String METABOLITES = "METABOLITES";
    public static final String MS = "MS";
    public static final String NM = "NM";
    public static final String STUDY_ID = "STUDY_ID";
    public static final String ANALYSIS_ID = "ANALYSIS_ID";
    public static final String VERSION = "VERSION";
    public static final String CREATED_ON = "CREATED_ON";

    public static final String FORMAT_MWTAB = "mwtab";
    public static final String FORMAT_JSON = "json";

    @Getter
    @Setter
    private String source;
    @Getter
    @Setter
    private String inputFormat;

    private final LinkedHashMap<String, Section> sections = new LinkedHashMap<>();
    /** Per-sample factors read from a "Factors" row of the data block, when the file had one. */
    @Getter
    @Setter
    private Map<String, DuplicatesMap> factors;
    @Getter
    private final Set<String> shortHeaders = new LinkedHashSet<>();
    @Getter
    private final Map<String, Map<String, String>> duplicateSubSections = new LinkedHashMap<>();

    public MwTabDocument(String source, String inputFormat) {
        this.source = source;
        this.inputFormat = inputFormat;
    }

    public Section getSection(String name) {
        return sections.get(name);
    }

    public ItemSection getItemSection(String name) {
        Section section = sections.get(name);
        return section instanceof ItemSection ? (ItemSection) section : null;
    }

    public boolean hasSection(String name) {
        return sections.containsKey(name);
    }

    public void putSection(Section section) {
        sections.put(section.getName(), section);
    }

    public Section removeSection(String name) {
        return sections.remove(name);
    }

    public List<String> getSectionNames() {
        return new ArrayList<>(sections.keySet());
    }

    public Collection<Section> getSections() {
        return Collections.unmodifiableCollection(sections.values());
    }

    /** Replaces the section order; used by key-order canonicalization. */
    void replaceSections(List<Section> ordered) {
        sections.clear();
        for (Section section : ordered) {
            sections.put(section.getName(), section);
        }
    }

    public ItemSection getHeaderSection() {
        return getItemSection(HEADER);
    }

    public String getStudyId() {
        return headerValue(STUDY_ID);
    }

    public void setStudyId(String studyId) {
        requireHeaderSection().put(STUDY_ID, studyId);
    }

    public String getAnalysisId() {
        return headerValue(ANALYSIS_ID);
    }

    public void setAnalysisId(String analysisId) {
        requireHeaderSection().put(ANALYSIS_ID, analysisId);
    }

    /** The {@code #METABOLOMICS WORKBENCH} line for the current header fields. */
    public String getHeader() {
        StringBuilder sb = new StringBuilder("#").append(HEADER);
        ItemSection header = getHeaderSection();
        if (header != null) {
            for (DuplicatesMap.Entry entry : header.getItems()) {
                if (!VERSION.equals(entry.getKey()) && !CREATED_ON.equals(entry.getKey())) {
                    sb.append(' ').append(entry.getKey()).append(':').append(entry.getValue());
                }
            }
        }
        return sb.toString();
    }

    /** Parses a {@code #METABOLOMICS WORKBENCH} line into the header section fields. */
    public void setHeader(String headerLine) {
        String line = StringUtils.defaultString(headerLine).strip();
        if (!line.startsWith(Tokenizer.HEADER_SENTINEL)) {
            throw new IllegalArgumentException("Header must start with \"" + Tokenizer.HEADER_SENTINEL + "\"");
        }
        ItemSection header = requireHeaderSection();
        for (String item : StringUtils.split(line.substring(Tokenizer.HEADER_SENTINEL.length()))) {
            int colon = item.indexOf(':');
            if (colon >= 0) {
                header.put(item.substring(0, colon), item.substring(colon + 1));
            }
        }
    }

    /** Name of the first data section, or null. */
    public String getDataSectionKey() {
        for (Section section : sections.values()) {
            if (section instanceof DataSection && section.getName().contains("_DATA")) {
                return section.getName();
            }
        }
        return null;
    }

    public DataSection getDataSection() {
        String key = getDataSectionKey();
        return key == null ? null : (DataSection) sections.get(key);
    }

    public List<SubjectSampleFactor> getSubjectSampleFactors() {
        Section section = sections.get(SUBJECT_SAMPLE_FACTORS);
        if (section instanceof ListSection) {
            return ((ListSection) section).getRows();
        }
        return Collections.emptyList();
    }

    /** Sample names of the data table, captured header first. */
    public List<String> getSamples() {
        DataSection data = getDataSection();
        if (data == null || data.getData() == null || data.isBinned()) {
            return Collections.emptyList();
        }
        return new ArrayList<>(data.getData().headerOrColumns());
    }

    public void recordShortHeader(String sectionName) {
        shortHeaders.add(sectionName);
    }

    public void recordDuplicateSubSection(String section, String key, String value) {
        duplicateSubSections.computeIfAbsent(section, k -> new LinkedHashMap<>()).put(key, value);
    }

    public MwTabDocument copy() {
        MwTabDocument copy = new MwTabDocument(source, inputFormat);
        for (Section section : sections.values()) {
            copy.putSection(section.copy());
        }
        if (factors != null) {
            Map<String, DuplicatesMap> copiedFactors = new LinkedHashMap<>();
            for (Map.Entry<String, DuplicatesMap> entry : factors.entrySet()) {
                copiedFactors.put(entry.getKey(), new DuplicatesMap(entry.getValue()));
            }
            copy.setFactors(copiedFactors);
        }
        copy.shortHeaders.addAll(shortHeaders);
        for (Map.Entry<String, Map<String, String>> entry : duplicateSubSections.entrySet()) {
            copy.duplicateSubSections.put(entry.getKey(), new LinkedHashMap<>(entry.getValue()));
        }
        return copy;
    }

    /**
     * True when both documents hold equal sections in the same order. Source label, input format
     * and build-time side information are not compared.
     */
    public boolean sameContent(MwTabDocument other) {
        if (other == null) {
            return false;
        }
        return new ArrayList<>(sections.entrySet()).equals(new ArrayList<>(other.sections.entrySet()));
    }

    private String headerValue(String key) {
        ItemSection header = getHeaderSection();
        return header == null ? null : header.get(key);
    }

    private ItemSection requireHeaderSection() {
        ItemSection header = getHeaderSection();
        if (header == null) {
            header = new ItemSection(HEADER);
            LinkedHashMap<String, Section> previous = new LinkedHashMap<>(sections);
            sections.clear();
            sections.put(HEADER, header);
            sections.putAll(previous);
        }
        return header;
    }
}
