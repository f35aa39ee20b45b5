package mwtab;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A MS_METABOLITE_DATA, NMR_METABOLITE_DATA or NMR_BINNED_DATA bundle.
 */
@Getter
@Setter
@ToString
@EqualsAndHashCode(callSuper = true)
public class DataSection extends Section {
    public static final String UNITS = "Units";
    public static final String DATA = "Data";
    public static final String METABOLITES = "Metabolites";
    public static final String EXTENDED = "Extended";

    private String units;
    private Table data = new Table();
    private Table metabolites;
    private Table extended;
    private String resultsFileKey;
    private ResultsFile resultsFile;
    /** Item lines found inside the section that are not part of the data bundle. */
    private DuplicatesMap additionalItems = new DuplicatesMap();

    public DataSection(String name) {
        super(name);
    }

    @Override
    public Kind getKind() {
        return Kind.DATA;
    }

    public boolean isBinned() {
        return getName().contains("BINNED_DATA");
    }

    public boolean isMetaboliteData() {
        return getName().contains("METABOLITE_DATA");
    }

    public void setResultsFile(String key, ResultsFile resultsFile) {
        this.resultsFileKey = key;
        this.resultsFile = resultsFile;
    }

    @Override
    public DataSection copy() {
        DataSection copy = new DataSection(getName());
        copy.setUnits(units);
        copy.setData(data == null ? null : data.copy());
        copy.setMetabolites(metabolites == null ? null : metabolites.copy());
        copy.setExtended(extended == null ? null : extended.copy());
        if (resultsFile != null) {
            copy.setResultsFile(resultsFileKey, resultsFile.toBuilder().build());
        }
        copy.setAdditionalItems(new DuplicatesMap(additionalItems));
        return copy;
    }
}
