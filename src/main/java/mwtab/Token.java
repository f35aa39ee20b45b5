package mwtab;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

@Getter
@ToString
public final class Token {

    public enum Type {
        SECTION_START,
        END_OF_SECTION,
        KEY_VALUE,
        KEY_VALUE_LIST,
        SUBJECT_SAMPLE_FACTORS,
        DATA_START,
        DATA_END,
        END_OF_FILE
    }

    private final Type type;
    private final int lineNumber;
    private final String key;
    private final String value;
    private final List<String> values;
    private final String subjectId;
    private final String sampleId;
    private final DuplicatesMap factors;
    private final DuplicatesMap additionalData;

    private Token(Type type, int lineNumber, String key, String value, List<String> values,
                  String subjectId, String sampleId, DuplicatesMap factors, DuplicatesMap additionalData) {
        this.type = type;
        this.lineNumber = lineNumber;
        this.key = key;
        this.value = value;
        this.values = values;
        this.subjectId = subjectId;
        this.sampleId = sampleId;
        this.factors = factors;
        this.additionalData = additionalData;
    }

    public static Token sectionStart(int lineNumber, String name) {
        return new Token(Type.SECTION_START, lineNumber, name, null, null, null, null, null, null);
    }

    public static Token endOfSection(int lineNumber) {
        return new Token(Type.END_OF_SECTION, lineNumber, null, null, null, null, null, null, null);
    }

    public static Token keyValue(int lineNumber, String key, String value) {
        return new Token(Type.KEY_VALUE, lineNumber, key, value, null, null, null, null, null);
    }

    public static Token keyValueList(int lineNumber, String key, List<String> values) {
        return new Token(Type.KEY_VALUE_LIST, lineNumber, key, null,
                Collections.unmodifiableList(values), null, null, null, null);
    }

    public static Token subjectSampleFactors(int lineNumber, String subjectId, String sampleId,
                                             DuplicatesMap factors, DuplicatesMap additionalData) {
        return new Token(Type.SUBJECT_SAMPLE_FACTORS, lineNumber, null, null, null,
                subjectId, sampleId, factors, additionalData);
    }

    public static Token dataStart(int lineNumber, String blockName) {
        return new Token(Type.DATA_START, lineNumber, blockName, null, null, null, null, null, null);
    }

    public static Token dataEnd(int lineNumber, String blockName) {
        return new Token(Type.DATA_END, lineNumber, blockName, null, null, null, null, null, null);
    }

    public static Token endOfFile(int lineNumber) {
        return new Token(Type.END_OF_FILE, lineNumber, null, null, null, null, null, null, null);
    }

    /** Section or block name carried by start/end tokens. */
    public String getName() {
        return key;
    }
}
