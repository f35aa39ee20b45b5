package mwtab.validation;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegexFragmentsTest {

    @Test
    void expand_resolvesNestedReferences() {
        Map<String, Object> definitions = new LinkedHashMap<>();
        definitions.put("DIGITS", "\\d+");
        definitions.put("CODE", "C{{DIGITS}}");

        var fragments = new RegexFragments(definitions);

        assertEquals("^C\\d+$", fragments.expand("^{{CODE}}$"));
        assertEquals("no references", fragments.expand("no references"));
    }

    @Test
    void get_listDefinition_buildsDelimitedList() {
        Map<String, Object> list = new LinkedHashMap<>();
        list.put("element", "{{DIGITS}}");
        list.put("delimiter", ",");
        Map<String, Object> definitions = new LinkedHashMap<>();
        definitions.put("DIGITS", "\\d+");
        definitions.put("IDS", list);

        var ids = Pattern.compile(new RegexFragments(definitions).get("IDS"));

        assertTrue(ids.matcher("1, 22,333").matches());
        assertTrue(ids.matcher("1,").matches());
        assertFalse(ids.matcher("1").matches());
        assertFalse(ids.matcher("a, b").matches());
    }

    @Test
    void listRegex_emptyAllowsSingleElement() {
        var single = Pattern.compile(RegexFragments.listRegex("\\d+", ";", false, true));

        assertTrue(single.matcher("42").matches());
        assertTrue(single.matcher("1;2").matches());
    }

    @Test
    void listRegex_quotedAcceptsUniformQuotes() {
        var quoted = Pattern.compile(RegexFragments.listRegex("\\d+", ",", true, false));

        assertTrue(quoted.matcher("'1', '2'").matches());
        assertTrue(quoted.matcher("\"1\",\"2\"").matches());
        assertTrue(quoted.matcher("1,2").matches());
    }

    @Test
    void get_cycle_throws() {
        Map<String, Object> definitions = new LinkedHashMap<>();
        definitions.put("A", "x{{B}}");
        definitions.put("B", "y{{A}}");

        var e = assertThrows(IllegalStateException.class, () -> new RegexFragments(definitions).get("A"));
        assertTrue(e.getMessage().contains("A -> B -> A"));
    }

    @Test
    void expand_unknownFragment_throws() {
        var fragments = new RegexFragments(new LinkedHashMap<>());

        assertThrows(IllegalStateException.class, () -> fragments.expand("{{MISSING}}"));
    }

    @Test
    void load_bundledFragments_allResolveToValidPatterns() {
        var fragments = RegexFragments.load("mwtab/regex-fragments.yml");

        var taxonomy = Pattern.compile(fragments.get("LIST_OF_TAXONOMY_IDS"));

        assertTrue(taxonomy.matcher("10090").matches());
        assertTrue(taxonomy.matcher("9606; 10090").matches());
        assertTrue(Pattern.compile("^" + fragments.get("NUM_RANGE") + "$").matcher("5-6").matches());
    }
}
