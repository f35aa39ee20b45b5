package mwtab;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A named block of a document. Concrete variants are {@link ItemSection}, {@link ListSection}
 * and {@link DataSection}; callers switch on {@link #getKind()}.
 */
@Getter
@EqualsAndHashCode
public abstract class Section {

    public enum Kind {
        ITEMS,
        SUBJECT_SAMPLE_FACTORS,
        DATA
    }

    private final String name;

    protected Section(String name) {
        this.name = name;
    }

    public abstract Kind getKind();

    public abstract Section copy();
}
