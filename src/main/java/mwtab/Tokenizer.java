package mwtab;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

/**
 * Line scanner for the mwTab text grammar. Each instance scans its text exactly once.
 */
public final class Tokenizer implements Iterator<Token> {

    static final String HEADER_SENTINEL = "#" + MwTabDocument.HEADER;
    static final String SUBJECT_SAMPLE_FACTORS_SENTINEL = "#" + MwTabDocument.SUBJECT_SAMPLE_FACTORS + ":";
    static final String START_SUFFIX = "_START";
    static final String END_SUFFIX = "_END";
    static final String RESULTS_FILE_MARKER = "_RESULTS_FILE";
    static final String UNITS_MARKER = ":UNITS";

    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");
    private static final String FACTOR_SEPARATOR = " | ";
    private static final String ADDITIONAL_DATA_SEPARATOR = "; ";

    private final String[] lines;
    private final Deque<Token> pending = new ArrayDeque<>();
    private int position;
    private String openBlock;
    private int openBlockLine;
    private boolean exhausted;

    private Tokenizer(String text) {
        this.lines = text == null || text.isEmpty() ? new String[0] : LINE_BREAK.split(text, -1);
    }

    public static Iterator<Token> tokenize(String text) {
        return new Tokenizer(text);
    }

    public static List<Token> tokenizeAll(String text) {
        List<Token> tokens = new ArrayList<>();
        tokenize(text).forEachRemaining(tokens::add);
        return tokens;
    }

    @Override
    public boolean hasNext() {
        fill();
        return !pending.isEmpty();
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return pending.poll();
    }

    private void fill() {
        while (pending.isEmpty() && !exhausted) {
            if (position >= lines.length) {
                if (openBlock != null) {
                    throw new TokenizeException(openBlockLine, lines[openBlockLine - 1],
                            "The data block \"" + openBlock + "\" is never closed with \"" + openBlock + END_SUFFIX + "\".");
                }
                pending.add(Token.endOfSection(position));
                pending.add(Token.endOfFile(position));
                exhausted = true;
                return;
            }
            String line = lines[position++];
            if (openBlock != null) {
                scanBlockLine(line, position);
            } else {
                scanLine(line, position);
            }
        }
    }

    private void scanLine(String line, int lineNumber) {
        if (line.startsWith(HEADER_SENTINEL)) {
            pending.add(Token.sectionStart(lineNumber, MwTabDocument.HEADER));
            for (String item : StringUtils.split(line.substring(HEADER_SENTINEL.length()))) {
                int colon = item.indexOf(':');
                if (colon >= 0) {
                    pending.add(Token.keyValue(lineNumber, item.substring(0, colon), item.substring(colon + 1)));
                }
            }
        } else if (line.startsWith(SUBJECT_SAMPLE_FACTORS_SENTINEL)) {
            pending.add(Token.endOfSection(lineNumber));
            pending.add(Token.sectionStart(lineNumber, MwTabDocument.SUBJECT_SAMPLE_FACTORS));
        } else if (line.startsWith("#")) {
            pending.add(Token.endOfSection(lineNumber));
            pending.add(Token.sectionStart(lineNumber, line.strip().substring(1)));
        } else if (line.startsWith(MwTabDocument.SUBJECT_SAMPLE_FACTORS)) {
            pending.add(subjectSampleFactors(line, lineNumber));
        } else if (firstField(line).endsWith(START_SUFFIX)) {
            String marker = firstField(line);
            openBlock = marker.substring(0, marker.length() - START_SUFFIX.length());
            openBlockLine = lineNumber;
            pending.add(Token.dataStart(lineNumber, openBlock));
        } else if (line.contains(RESULTS_FILE_MARKER)) {
            String[] fields = line.split("\t", -1);
            List<String> rest = new ArrayList<>();
            for (int i = 1; i < fields.length; i++) {
                rest.add(fields[i]);
            }
            pending.add(Token.keyValue(lineNumber, withoutPrefix(fields[0].strip()), String.join("\t", rest)));
        } else if (!line.isBlank()) {
            int tab = line.indexOf('\t');
            if (tab < 0) {
                throw new TokenizeException(lineNumber, line, "Expected a tab in the line.");
            }
            String key = line.substring(0, tab);
            String value = line.substring(tab + 1);
            if (key.contains(UNITS_MARKER)) {
                pending.add(Token.keyValue(lineNumber, DataSection.UNITS, value));
            } else if (key.contains(":")) {
                pending.add(Token.keyValue(lineNumber, withoutPrefix(key.strip()), value));
            } else {
                pending.add(Token.keyValue(lineNumber, key.strip(), value.strip()));
            }
        }
    }

    private void scanBlockLine(String line, int lineNumber) {
        if (line.isBlank()) {
            return;
        }
        if (firstField(line).endsWith(END_SUFFIX)) {
            pending.add(Token.dataEnd(lineNumber, openBlock));
            openBlock = null;
            return;
        }
        String[] fields = line.split("\t", -1);
        List<String> values = new ArrayList<>(fields.length);
        for (String field : fields) {
            values.add(StringUtils.strip(field, "\" "));
        }
        pending.add(Token.keyValueList(lineNumber, values.get(0), values));
    }

    private Token subjectSampleFactors(String line, int lineNumber) {
        String[] fields = line.split("\t", -1);
        if (fields.length < 4) {
            throw new TokenizeException(lineNumber, line,
                    "Expected subject, sample and factors fields separated by tabs.");
        }
        DuplicatesMap factors = pairs(fields[3], FACTOR_SEPARATOR, ':', line, lineNumber,
                "Either a bar ('| ') separating 2 items is missing or there is an extra colon (':') in the factor key value pair, '%s'");
        DuplicatesMap additionalData = null;
        if (fields.length > 4 && !fields[4].isEmpty()) {
            additionalData = pairs(fields[4], ADDITIONAL_DATA_SEPARATOR, '=', line, lineNumber,
                    "Either a semicolon ('; ') separating 2 items is missing or there is an extra equal sign ('=') in the additional data key value pair, '%s'");
        }
        return Token.subjectSampleFactors(lineNumber, fields[1], fields[2], factors, additionalData);
    }

    private static DuplicatesMap pairs(String field, String separator, char assignment, String line,
                                       int lineNumber, String message) {
        DuplicatesMap result = new DuplicatesMap();
        if (field.isBlank()) {
            return result;
        }
        for (String pair : StringUtils.splitByWholeSeparatorPreserveAllTokens(field, separator)) {
            String[] parts = StringUtils.splitPreserveAllTokens(pair, assignment);
            if (parts.length != 2) {
                throw new TokenizeException(lineNumber, line, String.format(message, pair));
            }
            result.add(parts[0].strip(), parts[1].strip());
        }
        return result;
    }

    /** Block markers are recognized on the first tab-separated field only. */
    private static String firstField(String line) {
        int tab = line.indexOf('\t');
        return (tab < 0 ? line : line.substring(0, tab)).strip();
    }

    private static String withoutPrefix(String key) {
        int colon = key.indexOf(':');
        return colon < 0 ? key : key.substring(colon + 1);
    }
}
