package mwtab;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads mwTab JSON into a {@link MwTabDocument}. The streaming parser is used so that repeated
 * member names inside sections, factors and rows survive.
 */
public class JsonReader {
    private static final Logger logger = LoggerFactory.getLogger(JsonReader.class);

    private static final List<String> TABLES =
            Arrays.asList(DataSection.DATA, DataSection.METABOLITES, DataSection.EXTENDED);

    private final ObjectMapper mapper = new ObjectMapper();

    public MwTabDocument read(String sourceId, String json) {
        MwTabDocument document = new MwTabDocument(sourceId, MwTabDocument.FORMAT_JSON);
        try (JsonParser parser = mapper.getFactory().createParser(json)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new BuildException("The JSON document must be an object of sections");
            }
            Set<String> seen = new HashSet<>();
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String name = parser.getCurrentName();
                if (!seen.add(name)) {
                    throw new BuildException("Section \"" + name + "\" appears more than once");
                }
                JsonToken value = parser.nextToken();
                if (value == JsonToken.START_ARRAY && MwTabDocument.SUBJECT_SAMPLE_FACTORS.equals(name)) {
                    document.putSection(new ListSection(name, readSubjectSampleFactors(parser)));
                } else if (value == JsonToken.START_OBJECT) {
                    document.putSection(readSection(parser, name));
                } else {
                    throw new BuildException("Section \"" + name + "\" must be a JSON object, found " + value);
                }
            }
            if (parser.nextToken() != null) {
                throw new BuildException("Unexpected content after the JSON document");
            }
        } catch (JsonProcessingException e) {
            throw new BuildException("Malformed JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new BuildException("Unable to read JSON: " + e.getMessage(), e);
        }
        if (document.getHeaderSection() == null) {
            throw new BuildException("No \"" + MwTabDocument.HEADER + "\" section was found in the JSON document");
        }
        logger.debug("Read {} sections from {}", document.getSectionNames().size(), sourceId);
        return document;
    }

    private List<SubjectSampleFactor> readSubjectSampleFactors(JsonParser parser) throws IOException {
        List<SubjectSampleFactor> rows = new ArrayList<>();
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            if (parser.currentToken() != JsonToken.START_OBJECT) {
                throw new BuildException("Each SUBJECT_SAMPLE_FACTORS entry must be an object");
            }
            SubjectSampleFactor row = new SubjectSampleFactor();
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String key = parser.getCurrentName();
                JsonToken value = parser.nextToken();
                switch (key) {
                    case SubjectSampleFactor.SUBJECT_ID:
                        row.setSubjectId(scalar(parser, key));
                        break;
                    case SubjectSampleFactor.SAMPLE_ID:
                        row.setSampleId(scalar(parser, key));
                        break;
                    case SubjectSampleFactor.FACTORS:
                        row.setFactors(readPairs(parser, value, key));
                        break;
                    case SubjectSampleFactor.ADDITIONAL_DATA:
                        DuplicatesMap additionalData = readPairs(parser, value, key);
                        row.setAdditionalData(additionalData.isEmpty() ? null : additionalData);
                        break;
                    default:
                        throw new BuildException("Unknown SUBJECT_SAMPLE_FACTORS member \"" + key + "\"");
                }
            }
            rows.add(row);
        }
        return rows;
    }

    private DuplicatesMap readPairs(JsonParser parser, JsonToken value, String name) throws IOException {
        if (value != JsonToken.START_OBJECT) {
            throw new BuildException("\"" + name + "\" must be an object");
        }
        DuplicatesMap pairs = new DuplicatesMap();
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String key = parser.getCurrentName();
            parser.nextToken();
            pairs.add(key, scalar(parser, key));
        }
        return pairs;
    }

    private Section readSection(JsonParser parser, String name) throws IOException {
        DuplicatesMap items = new DuplicatesMap();
        Map<String, Table> tables = new LinkedHashMap<>();
        String resultsFileKey = null;
        ResultsFile resultsFile = null;
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String key = parser.getCurrentName();
            JsonToken value = parser.nextToken();
            if (value == JsonToken.START_ARRAY) {
                if (!name.endsWith("_DATA") || !TABLES.contains(key)) {
                    throw new BuildException("Unexpected array \"" + key + "\" in the \"" + name + "\" section; only "
                            + "data sections hold the " + String.join(", ", TABLES) + " tables");
                }
                if (tables.containsKey(key)) {
                    throw new BuildException("Table \"" + key + "\" appears more than once in the \"" + name + "\" section");
                }
                tables.put(key, readTable(parser, key));
            } else if (key.endsWith(Tokenizer.RESULTS_FILE_MARKER)) {
                resultsFileKey = key;
                resultsFile = readResultsFile(parser);
            } else {
                items.add(key, scalar(parser, key));
            }
        }

        boolean data = name.endsWith("_DATA") || !tables.isEmpty() || items.containsKey(DataSection.UNITS);
        if (!data) {
            ItemSection section = new ItemSection(name, items);
            if (resultsFile != null) {
                section.setResultsFile(resultsFileKey, resultsFile);
            }
            return section;
        }
        DataSection section = new DataSection(name);
        section.setUnits(items.get(DataSection.UNITS));
        items.remove(DataSection.UNITS);
        section.setAdditionalItems(items);
        section.setData(tables.get(DataSection.DATA));
        section.setMetabolites(tables.get(DataSection.METABOLITES));
        section.setExtended(tables.get(DataSection.EXTENDED));
        if (resultsFile != null) {
            section.setResultsFile(resultsFileKey, resultsFile);
        }
        return section;
    }

    /** The results file is normally one packed string; an object of its attributes is accepted too. */
    private ResultsFile readResultsFile(JsonParser parser) throws IOException {
        if (parser.currentToken() != JsonToken.START_OBJECT) {
            return ResultsFile.parse(scalar(parser, "results file"));
        }
        JsonNode node = parser.readValueAsTree();
        ResultsFile resultsFile = new ResultsFile();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            try {
                resultsFile.put(field.getKey(), field.getValue().asText());
            } catch (IllegalArgumentException e) {
                throw new BuildException(e.getMessage(), e);
            }
        }
        return resultsFile;
    }

    private Table readTable(JsonParser parser, String name) throws IOException {
        Table table = new Table();
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            if (parser.currentToken() != JsonToken.START_OBJECT) {
                throw new BuildException("Rows of \"" + name + "\" must be objects");
            }
            DuplicatesMap row = new DuplicatesMap();
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String key = parser.getCurrentName();
                parser.nextToken();
                row.add(Table.BIN_RANGE.equals(key) ? Table.LABEL : key, scalar(parser, key));
            }
            table.getRows().add(row);
        }
        List<String> columns = table.columns();
        table.setHeader(new ArrayList<>(columns.subList(Math.min(1, columns.size()), columns.size())));
        return table;
    }

    private static String scalar(JsonParser parser, String key) throws IOException {
        JsonToken token = parser.currentToken();
        if (token == JsonToken.VALUE_NULL) {
            return "";
        }
        if (token == null || !token.isScalarValue()) {
            throw new BuildException("\"" + key + "\" must hold a text value, found " + token);
        }
        return parser.getText();
    }
}
