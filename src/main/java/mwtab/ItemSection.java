package mwtab;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Plain metadata: an ordered multimap of keys to text, plus an optional results file composite.
 */
@Getter
@Setter
@ToString
@EqualsAndHashCode(callSuper = true)
public class ItemSection extends Section {
    private DuplicatesMap items;
    private String resultsFileKey;
    private ResultsFile resultsFile;

    public ItemSection(String name) {
        this(name, new DuplicatesMap());
    }

    public ItemSection(String name, DuplicatesMap items) {
        super(name);
        this.items = items;
    }

    @Override
    public Kind getKind() {
        return Kind.ITEMS;
    }

    public String get(String key) {
        return items.get(key);
    }

    public void put(String key, String value) {
        items.set(key, value);
    }

    public void setResultsFile(String key, ResultsFile resultsFile) {
        this.resultsFileKey = key;
        this.resultsFile = resultsFile;
    }

    @Override
    public ItemSection copy() {
        ItemSection copy = new ItemSection(getName(), new DuplicatesMap(items));
        if (resultsFile != null) {
            copy.setResultsFile(resultsFileKey, resultsFile.toBuilder().build());
        }
        return copy;
    }
}
