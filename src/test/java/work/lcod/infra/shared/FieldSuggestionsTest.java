package work.lcod.infra.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.List;
import org.junit.jupiter.api.Test;

class FieldSuggestionsTest {
    @Test
    void listsClosestNamesFirst() {
        var suggestions = FieldSuggestions.forProperties("bucket", List.of("arn", "name", "size", "tags"));

        assertEquals("nmae does not exist on bucket.", suggestions.summary("nmae"));
        assertEquals("Existing properties are: name, size, arn, tags", suggestions.detail("nmae"));
        assertEquals("name", suggestions.closest("nmae"));
    }

    @Test
    void breaksTiesAlphabetically() {
        var suggestions = FieldSuggestions.forFields("config", List.of("zz", "aa", "mm"));

        assertEquals("Existing fields are: aa, mm, zz", suggestions.detail("xy"));
    }

    @Test
    void truncatesLongLists() {
        var suggestions = FieldSuggestions.forProperties("obj", List.of("a", "b", "c", "d", "e", "f", "g"));

        assertEquals("Existing properties are: a, b, c, d, e and 2 others", suggestions.detail("a"));
    }

    @Test
    void reportsEmptyParents() {
        var suggestions = FieldSuggestions.forProperties("obj", List.of());

        assertEquals("obj has no properties", suggestions.detail("x"));
        assertNull(suggestions.closest("x"));
    }

    @Test
    void computesEditDistance() {
        assertEquals(0, FieldSuggestions.editDistance("same", "same"));
        assertEquals(3, FieldSuggestions.editDistance("kitten", "sitting"));
        assertEquals(4, FieldSuggestions.editDistance("", "four"));
    }
}
