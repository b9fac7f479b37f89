package villagecompute.screening.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import villagecompute.screening.api.types.AdvancedQueryResultType;
import villagecompute.screening.api.types.ColumnOptionsType;
import villagecompute.screening.api.types.ColumnResultType;

/**
 * Exact and substring matching used by advanced searches.
 *
 * <p>
 * For every query row and every requested column the matcher counts dataset rows whose column value matches the row's
 * search term. {@code whole_word} requires the whole cell to equal the term, otherwise the term only has to occur in
 * the cell. {@code match_case} switches off case folding.
 */
public final class ColumnCriteriaMatcher {

    static final String QUERY_NO_KEY = "no";

    private ColumnCriteriaMatcher() {
    }

    public static boolean matches(String cellValue, String searchTerm, ColumnOptionsType options) {
        if (cellValue == null || cellValue.isEmpty() || searchTerm == null || searchTerm.isEmpty()) {
            return false;
        }
        String cell = options.matchCase() ? cellValue : cellValue.toLowerCase(Locale.ROOT);
        String term = options.matchCase() ? searchTerm : searchTerm.toLowerCase(Locale.ROOT);
        return options.wholeWord() ? cell.equals(term) : cell.contains(term);
    }

    public static List<AdvancedQueryResultType> search(List<String> columns, Map<String, ColumnOptionsType> options,
            List<Map<String, String>> queryRows, List<Map<String, String>> rows) {
        List<AdvancedQueryResultType> results = new ArrayList<>(queryRows.size());
        for (Map<String, String> queryRow : queryRows) {
            results.add(searchRow(columns, options, queryRow, rows));
        }
        return results;
    }

    static AdvancedQueryResultType searchRow(List<String> columns, Map<String, ColumnOptionsType> options,
            Map<String, String> queryRow, List<Map<String, String>> rows) {
        List<String> nameParts = new ArrayList<>();
        Map<String, ColumnResultType> columnResults = new LinkedHashMap<>();

        for (String column : columns) {
            String term = queryRow.get(column);
            if (term == null || term.isEmpty()) {
                columnResults.put(column, ColumnResultType.empty());
                continue;
            }
            nameParts.add(term);

            ColumnOptionsType columnOptions = options.getOrDefault(column, ColumnOptionsType.DEFAULTS);
            int count = 0;
            for (Map<String, String> row : rows) {
                if (matches(row.get(column), term, columnOptions)) {
                    count++;
                }
            }
            columnResults.put(column, new ColumnResultType(count > 0, count, term));
        }
        return new AdvancedQueryResultType(parseQueryNo(queryRow.get(QUERY_NO_KEY)), String.join(" ", nameParts),
                columnResults);
    }

    private static int parseQueryNo(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
