package mwtab;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.Getter;
import mwtab.validation.DocumentValidator;
import mwtab.validation.ValidationReport;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point: reads mwTab text or JSON, writes either form and validates documents.
 */
public class MwTab implements MwTabService {
    private static final Logger logger = LoggerFactory.getLogger(MwTab.class);

    public static final String FORMAT_TXT = "txt";

    @Getter
    private final MwTabConfig config;
    private final DocumentBuilder builder = new DocumentBuilder();
    private final JsonReader jsonReader = new JsonReader();
    private final TextWriter textWriter;
    private final JsonWriter jsonWriter;
    private final DocumentValidator validator;

    public MwTab() {
        this(MwTabConfig.load());
    }

    public MwTab(MwTabConfig config) {
        this.config = config;
        this.textWriter = new TextWriter(config.getWrapWidth());
        this.jsonWriter = new JsonWriter(config.getJsonIndent());
        this.validator = new DocumentValidator(config);
    }

    @Override
    public MwTabDocument build(String sourceId, String text) {
        String normalized = normalize(text);
        String content = normalized.strip();
        if (content.isEmpty()) {
            throw new UnknownFormatException("Unknown file format");
        }
        if (content.startsWith(Tokenizer.HEADER_SENTINEL)) {
            logger.debug("Reading {} as mwTab text", sourceId);
            return builder.build(sourceId, Tokenizer.tokenize(normalized));
        }
        if (content.startsWith("{")) {
            logger.debug("Reading {} as JSON", sourceId);
            try {
                return jsonReader.read(sourceId, normalized);
            } catch (BuildException e) {
                if (e.getCause() instanceof JsonProcessingException) {
                    throw new UnknownFormatException("Unknown file format", e);
                }
                throw e;
            }
        }
        throw new UnknownFormatException("Unknown file format");
    }

    @Override
    public byte[] serialize(MwTabDocument document, String format) {
        return writeString(document, format).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String writeString(MwTabDocument document, String format) {
        String value = StringUtils.defaultString(format);
        switch (value) {
            case MwTabDocument.FORMAT_MWTAB:
            case FORMAT_TXT:
                return textWriter.write(document);
            case MwTabDocument.FORMAT_JSON:
                return jsonWriter.write(document);
            default:
                throw new UnknownFormatException("Unknown file format: \"" + value + "\"");
        }
    }

    @Override
    public ValidationReport validate(MwTabDocument document) {
        return validator.validate(document);
    }

    /**
     * Unifies line endings and empties whitespace-only lines. Blank lines stay in place so that
     * tokenizer line numbers refer to the caller's text.
     */
    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        for (String line : text.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1)) {
            lines.add(line.isBlank() ? "" : line);
        }
        return String.join("\n", lines);
    }
}
