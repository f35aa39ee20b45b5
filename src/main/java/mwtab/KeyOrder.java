package mwtab;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical section and key order applied before a document is written.
 */
public final class KeyOrder {

    static final List<String> SECTION_ORDER = Collections.unmodifiableList(Arrays.asList(
            MwTabDocument.HEADER,
            "PROJECT",
            "STUDY",
            "SUBJECT",
            MwTabDocument.SUBJECT_SAMPLE_FACTORS,
            "COLLECTION",
            "TREATMENT",
            "SAMPLEPREP",
            "CHROMATOGRAPHY",
            "ANALYSIS",
            MwTabDocument.MS,
            MwTabDocument.NM,
            "MS_METABOLITE_DATA",
            "NMR_METABOLITE_DATA",
            "NMR_BINNED_DATA"));

    /** Declared field order per item section; sections not listed keep their insertion order. */
    static final Map<String, List<String>> FIELD_ORDER;

    static final List<String> ROW_ORDER = Collections.singletonList(Table.LABEL);

    static {
        Map<String, List<String>> order = new LinkedHashMap<>();
        order.put(MwTabDocument.HEADER, Arrays.asList(
                MwTabDocument.STUDY_ID, MwTabDocument.ANALYSIS_ID, "PROJECT_ID",
                MwTabDocument.VERSION, MwTabDocument.CREATED_ON));
        FIELD_ORDER = Collections.unmodifiableMap(order);
    }

    private KeyOrder() {
    }

    public static void apply(MwTabDocument document) {
        List<Section> ordered = new ArrayList<>();
        for (String name : SECTION_ORDER) {
            Section section = document.getSection(name);
            if (section != null) {
                ordered.add(section);
            }
        }
        for (Section section : document.getSections()) {
            if (!SECTION_ORDER.contains(section.getName())) {
                ordered.add(section);
            }
        }
        for (Section section : ordered) {
            switch (section.getKind()) {
                case ITEMS:
                    ItemSection items = (ItemSection) section;
                    List<String> fields = FIELD_ORDER.get(section.getName());
                    if (fields != null) {
                        items.setItems(items.getItems().reorder(fields));
                    }
                    break;
                case DATA:
                    DataSection data = (DataSection) section;
                    reorderRows(data.getData());
                    reorderRows(data.getMetabolites());
                    reorderRows(data.getExtended());
                    break;
                case SUBJECT_SAMPLE_FACTORS:
                default:
                    break;
            }
        }
        document.replaceSections(ordered);
    }

    private static void reorderRows(Table table) {
        if (table == null) {
            return;
        }
        List<DuplicatesMap> rows = table.getRows();
        for (int i = 0; i < rows.size(); i++) {
            rows.set(i, rows.get(i).reorder(ROW_ORDER));
        }
    }
}
