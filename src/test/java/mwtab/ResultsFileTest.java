package mwtab;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ResultsFileTest {

    @Test
    void parse_splitsFilenameAndLabelledAttributes() {
        var resultsFile = ResultsFile.parse("ST000071_AN000111_Results.txt UNITS:Peak area Has m/z:Yes Has RT:Yes RT units:Minutes");

        assertEquals("ST000071_AN000111_Results.txt", resultsFile.getFilename());
        assertEquals("Peak area", resultsFile.getUnits());
        assertEquals("Yes", resultsFile.getHasMz());
        assertEquals("Yes", resultsFile.getHasRt());
        assertEquals("Minutes", resultsFile.getRtUnits());
    }

    @Test
    void parse_tabSeparated_readsTheSameAttributes() {
        var resultsFile = ResultsFile.parse("results.txt\tUNITS:ppm");

        assertEquals("results.txt", resultsFile.getFilename());
        assertEquals("ppm", resultsFile.getUnits());
        assertNull(resultsFile.getHasMz());
    }

    @Test
    void render_keepsFixedAttributeOrder() {
        var resultsFile = ResultsFile.builder().filename("r.txt").rtUnits("Seconds").units("Counts").build();

        assertEquals(List.of(ResultsFile.UNITS, ResultsFile.RT_UNITS), List.copyOf(resultsFile.attributes().keySet()));
        assertEquals("r.txt\tUNITS:Counts\tRT units:Seconds", resultsFile.render("\t"));
    }

    @Test
    void put_unknownLabel_throws() {
        assertThrows(IllegalArgumentException.class, () -> new ResultsFile().put("Has MS", "Yes"));
    }
}
