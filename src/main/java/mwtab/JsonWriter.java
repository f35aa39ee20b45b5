package mwtab;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * Renders a document as mwTab JSON. Keys that occur more than once are written as repeated
 * object members, so the generator is driven directly instead of going through a tree model.
 */
public class JsonWriter {

    private final JsonFactory factory = new JsonFactory();
    private final int indent;

    public JsonWriter() {
        this(MwTabConfig.DEFAULT_JSON_INDENT);
    }

    public JsonWriter(int indent) {
        this.indent = indent;
    }

    public String write(MwTabDocument document) {
        MwTabDocument doc = document.copy();
        KeyOrder.apply(doc);
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = factory.createGenerator(out)) {
            generator.setPrettyPrinter(prettyPrinter());
            generator.writeStartObject();
            for (Section section : doc.getSections()) {
                generator.writeFieldName(section.getName());
                switch (section.getKind()) {
                    case ITEMS:
                        writeItems(generator, (ItemSection) section);
                        break;
                    case SUBJECT_SAMPLE_FACTORS:
                        writeSubjectSampleFactors(generator, (ListSection) section);
                        break;
                    case DATA:
                        writeData(generator, (DataSection) section);
                        break;
                    default:
                        throw new IllegalStateException("Unknown section kind " + section.getKind());
                }
            }
            generator.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    private DefaultPrettyPrinter prettyPrinter() {
        Separators separators = Separators.createDefaultInstance()
                .withObjectFieldValueSpacing(Separators.Spacing.AFTER);
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter().withSeparators(separators);
        DefaultIndenter indenter = new DefaultIndenter(" ".repeat(indent), "\n");
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        return printer;
    }

    private static void writeItems(JsonGenerator generator, ItemSection section) throws IOException {
        generator.writeStartObject();
        writePairs(generator, section.getItems());
        if (section.getResultsFile() != null) {
            generator.writeStringField(section.getResultsFileKey(), section.getResultsFile().render(" "));
        }
        generator.writeEndObject();
    }

    private static void writePairs(JsonGenerator generator, DuplicatesMap pairs) throws IOException {
        for (DuplicatesMap.Entry entry : pairs) {
            generator.writeStringField(entry.getKey(), entry.getValue());
        }
    }

    private static void writeSubjectSampleFactors(JsonGenerator generator, ListSection section) throws IOException {
        generator.writeStartArray();
        for (SubjectSampleFactor row : section.getRows()) {
            generator.writeStartObject();
            generator.writeStringField(SubjectSampleFactor.SUBJECT_ID, row.getSubjectId());
            generator.writeStringField(SubjectSampleFactor.SAMPLE_ID, row.getSampleId());
            generator.writeObjectFieldStart(SubjectSampleFactor.FACTORS);
            if (row.getFactors() != null) {
                writePairs(generator, row.getFactors());
            }
            generator.writeEndObject();
            if (row.getAdditionalData() != null && !row.getAdditionalData().isEmpty()) {
                generator.writeObjectFieldStart(SubjectSampleFactor.ADDITIONAL_DATA);
                writePairs(generator, row.getAdditionalData());
                generator.writeEndObject();
            }
            generator.writeEndObject();
        }
        generator.writeEndArray();
    }

    private static void writeData(JsonGenerator generator, DataSection section) throws IOException {
        generator.writeStartObject();
        if (section.getUnits() != null) {
            generator.writeStringField(DataSection.UNITS, section.getUnits());
        }
        if (section.getData() != null) {
            writeTable(generator, DataSection.DATA, section.getData(), section.isBinned());
        }
        if (section.getMetabolites() != null) {
            writeTable(generator, DataSection.METABOLITES, section.getMetabolites(), false);
        }
        if (section.getExtended() != null) {
            writeTable(generator, DataSection.EXTENDED, section.getExtended(), false);
        }
        if (section.getResultsFile() != null) {
            generator.writeStringField(section.getResultsFileKey(), section.getResultsFile().render(" "));
        }
        writePairs(generator, section.getAdditionalItems());
        generator.writeEndObject();
    }

    private static void writeTable(JsonGenerator generator, String name, Table table, boolean binned)
            throws IOException {
        generator.writeArrayFieldStart(name);
        for (DuplicatesMap row : table.getRows()) {
            generator.writeStartObject();
            for (DuplicatesMap.Entry entry : row) {
                String key = binned && Table.LABEL.equals(entry.getKey()) ? Table.BIN_RANGE : entry.getKey();
                generator.writeStringField(key, entry.getValue());
            }
            generator.writeEndObject();
        }
        generator.writeEndArray();
    }
}
