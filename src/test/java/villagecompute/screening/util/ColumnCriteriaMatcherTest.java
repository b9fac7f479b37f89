package villagecompute.screening.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import villagecompute.screening.api.types.AdvancedQueryResultType;
import villagecompute.screening.api.types.ColumnOptionsType;
import villagecompute.screening.api.types.ColumnResultType;

/**
 * Unit tests for {@link ColumnCriteriaMatcher}.
 */
class ColumnCriteriaMatcherTest {

    private static final String FIRST = "NameAlias_FirstName";
    private static final String LAST = "NameAlias_LastName";

    private static final List<Map<String, String>> ROWS = List.of(Map.of(FIRST, "John", LAST, "Smith"),
            Map.of(FIRST, "Johnny", LAST, "Smithers"), Map.of(FIRST, "Jane", LAST, "Doe"));

    @Test
    void testMatches_substringIgnoringCaseByDefault() {
        assertTrue(ColumnCriteriaMatcher.matches("Johnny", "john", ColumnOptionsType.DEFAULTS));
        assertFalse(ColumnCriteriaMatcher.matches("Jane", "john", ColumnOptionsType.DEFAULTS));
    }

    @Test
    void testMatches_wholeWordRequiresEquality() {
        ColumnOptionsType wholeWord = new ColumnOptionsType(true, false);
        assertTrue(ColumnCriteriaMatcher.matches("JOHN", "john", wholeWord));
        assertFalse(ColumnCriteriaMatcher.matches("Johnny", "john", wholeWord));
    }

    @Test
    void testMatches_matchCase() {
        ColumnOptionsType matchCase = new ColumnOptionsType(false, true);
        assertTrue(ColumnCriteriaMatcher.matches("Johnny", "John", matchCase));
        assertFalse(ColumnCriteriaMatcher.matches("Johnny", "john", matchCase));
    }

    @Test
    void testMatches_emptyInputsNeverMatch() {
        assertFalse(ColumnCriteriaMatcher.matches(null, "john", ColumnOptionsType.DEFAULTS));
        assertFalse(ColumnCriteriaMatcher.matches("John", "", ColumnOptionsType.DEFAULTS));
    }

    @Test
    void testSearch_countsPerColumnWithOptions() {
        Map<String, ColumnOptionsType> options = Map.of(LAST, new ColumnOptionsType(true, false));
        List<Map<String, String>> queries = List.of(Map.of("no", "7", FIRST, "john", LAST, "smith"));

        List<AdvancedQueryResultType> results = ColumnCriteriaMatcher.search(List.of(FIRST, LAST), options, queries,
                ROWS);

        assertEquals(1, results.size());
        AdvancedQueryResultType result = results.get(0);
        assertEquals(7, result.queryNo());
        assertEquals("john smith", result.queryName());
        assertEquals(new ColumnResultType(true, 2, "john"), result.columnResults().get(FIRST));
        assertEquals(new ColumnResultType(true, 1, "smith"), result.columnResults().get(LAST));
        assertTrue(result.anyFound());
    }

    @Test
    void testSearch_missingTermGivesEmptyColumnResult() {
        List<Map<String, String>> queries = List.of(Map.of(FIRST, "Zed"));

        AdvancedQueryResultType result = ColumnCriteriaMatcher
                .search(List.of(FIRST, LAST), Map.of(), queries, ROWS).get(0);

        assertEquals(0, result.queryNo());
        assertEquals("Zed", result.queryName());
        assertEquals(new ColumnResultType(false, 0, "Zed"), result.columnResults().get(FIRST));
        assertEquals(ColumnResultType.empty(), result.columnResults().get(LAST));
        assertFalse(result.anyFound());
        assertEquals(List.of(FIRST, LAST), List.copyOf(result.columnResults().keySet()));
    }
}
