package mwtab;

import mwtab.validation.ValidationReport;

public interface MwTabService {
    MwTabDocument build(String sourceId, String text);

    byte[] serialize(MwTabDocument document, String format);

    String writeString(MwTabDocument document, String format);

    ValidationReport validate(MwTabDocument document);
}
