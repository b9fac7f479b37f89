package villagecompute.screening.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

import villagecompute.screening.api.types.BulkMatchResultType;
import villagecompute.screening.api.types.BulkSearchResultType;
import villagecompute.screening.api.types.MatchedRecordType;
import villagecompute.screening.api.types.SearchSummaryType;

/**
 * Fuzzy name matching over dataset rows.
 *
 * <p>
 * <b>Normalisation:</b> lowercase, drop every character that is neither a Unicode word character nor whitespace,
 * collapse whitespace runs to one space, trim. Applying it twice gives the same string.
 *
 * <p>
 * <b>Scoring:</b> the confidence of a pair is the maximum of four measures over the normalised strings, each in
 * [0, 100]:
 * <ul>
 * <li><b>ratio</b> - indel similarity, {@code 200 * lcs / (len1 + len2)}</li>
 * <li><b>partial ratio</b> - best ratio of the shorter string against any equally long window of the longer one</li>
 * <li><b>token sort ratio</b> - ratio after sorting whitespace separated tokens</li>
 * <li><b>token set ratio</b> - ratio over the shared tokens plus each side's remainder</li>
 * </ul>
 * Either side normalising to the empty string scores 0.
 *
 * <p>
 * <b>Thread Safety:</b> instances are immutable; search jobs call them from the scoring pool.
 */
public final class FuzzyMatcher {

    public static final String DEFAULT_ENTITY_REF_COLUMN = "Entity_LogicalId";

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Comparator<MatchedRecordType> BY_CONFIDENCE_DESC = Comparator
            .comparingDouble(MatchedRecordType::confidence).reversed();

    private final String entityRefColumn;

    public FuzzyMatcher() {
        this(DEFAULT_ENTITY_REF_COLUMN);
    }

    public FuzzyMatcher(String entityRefColumn) {
        this.entityRefColumn = entityRefColumn;
    }

    /**
     * Normalises text for comparison. Anything that is not a {@link CharSequence} normalises to the empty string.
     */
    public static String normalize(Object text) {
        if (!(text instanceof CharSequence)) {
            return "";
        }
        String s = text.toString().toLowerCase(Locale.ROOT);
        s = PUNCTUATION.matcher(s).replaceAll("");
        s = WHITESPACE.matcher(s).replaceAll(" ");
        return s.trim();
    }

    /**
     * Confidence in [0, 100] that {@code target} names the same thing as {@code query}.
     */
    public static double score(String query, String target) {
        String q = normalize(query);
        String t = normalize(target);
        if (q.isEmpty() || t.isEmpty()) {
            return 0.0;
        }
        double best = ratio(q, t);
        if (best >= 100.0) {
            return 100.0;
        }
        best = Math.max(best, partialRatio(q, t));
        best = Math.max(best, tokenSortRatio(q, t));
        best = Math.max(best, tokenSetRatio(q, t));
        return clamp(best);
    }

    /**
     * Every (row, column) whose non-empty value scores at least {@code threshold}, highest confidence first. Equal
     * confidences keep row order.
     */
    public List<MatchedRecordType> searchSingle(String query, List<String> columns, List<Map<String, String>> rows,
            double threshold) {
        List<MatchedRecordType> matches = new ArrayList<>();
        for (Map<String, String> row : rows) {
            for (String column : columns) {
                String value = row.get(column);
                if (value == null || value.isEmpty()) {
                    continue;
                }
                double confidence = score(query, value);
                if (confidence >= threshold) {
                    matches.add(new MatchedRecordType(query, confidence, column, value, row.get(entityRefColumn),
                            row));
                }
            }
        }
        // List.sort is stable
        matches.sort(BY_CONFIDENCE_DESC);
        return matches;
    }

    /**
     * Best match of a single query, or a not-found result.
     */
    public BulkMatchResultType bestMatch(String query, List<String> columns, List<Map<String, String>> rows,
            double threshold) {
        List<MatchedRecordType> matches = searchSingle(query, columns, rows, threshold);
        if (matches.isEmpty()) {
            return BulkMatchResultType.notFound(query);
        }
        MatchedRecordType best = matches.get(0);
        return new BulkMatchResultType(query, best.confidence(), true, best);
    }

    /**
     * Runs each query independently and keeps its best match. Results follow the order of {@code queries}.
     */
    public BulkSearchResultType searchBulk(List<String> queries, List<String> columns, List<Map<String, String>> rows,
            int threshold) {
        List<BulkMatchResultType> results = new ArrayList<>(queries.size());
        for (String query : queries) {
            results.add(bestMatch(query, columns, rows, threshold));
        }
        return new BulkSearchResultType(results, summarize(results, threshold));
    }

    /**
     * Aggregates per-query results into the search summary.
     */
    public static SearchSummaryType summarize(List<BulkMatchResultType> results, int threshold) {
        int found = 0;
        int aboveThreshold = 0;
        double max = 0.0;
        double sum = 0.0;
        for (BulkMatchResultType result : results) {
            if (result.found()) {
                found++;
                if (result.matched() >= threshold) {
                    aboveThreshold++;
                }
            }
            max = Math.max(max, result.matched());
            sum += result.matched();
        }
        double average = results.isEmpty() ? 0.0 : sum / results.size();
        return new SearchSummaryType(results.size(), found, aboveThreshold, max, average, threshold);
    }

    public String getEntityRefColumn() {
        return entityRefColumn;
    }

    // Similarity measures. Inputs are already normalised.

    static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 100.0;
        }
        return 200.0 * longestCommonSubsequence(a, b) / total;
    }

    static double partialRatio(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        int len1 = shorter.length();
        int len2 = longer.length();
        if (len1 == 0) {
            return len2 == 0 ? 100.0 : 0.0;
        }

        Set<Character> needleChars = new HashSet<>();
        for (int i = 0; i < len1; i++) {
            needleChars.add(shorter.charAt(i));
        }

        double best = 0.0;
        // windows anchored at the start of the longer string
        for (int i = 1; i < len1; i++) {
            if (!needleChars.contains(longer.charAt(i - 1))) {
                continue;
            }
            best = Math.max(best, ratio(shorter, longer.substring(0, i)));
        }
        // full length windows
        for (int i = 0; i <= len2 - len1; i++) {
            if (!needleChars.contains(longer.charAt(i + len1 - 1)) && !needleChars.contains(longer.charAt(i))) {
                continue;
            }
            best = Math.max(best, ratio(shorter, longer.substring(i, i + len1)));
            if (best >= 100.0) {
                return 100.0;
            }
        }
        // windows anchored at the end
        for (int i = len2 - len1 + 1; i < len2; i++) {
            if (!needleChars.contains(longer.charAt(i))) {
                continue;
            }
            best = Math.max(best, ratio(shorter, longer.substring(i)));
        }
        return best;
    }

    static double tokenSortRatio(String a, String b) {
        return ratio(sortedTokens(a), sortedTokens(b));
    }

    static double tokenSetRatio(String a, String b) {
        TreeSet<String> tokensA = new TreeSet<>(tokens(a));
        TreeSet<String> tokensB = new TreeSet<>(tokens(b));
        if (tokensA.isEmpty() || tokensB.isEmpty()) {
            return 0.0;
        }

        TreeSet<String> intersection = new TreeSet<>(tokensA);
        intersection.retainAll(tokensB);
        TreeSet<String> onlyA = new TreeSet<>(tokensA);
        onlyA.removeAll(tokensB);
        TreeSet<String> onlyB = new TreeSet<>(tokensB);
        onlyB.removeAll(tokensA);

        // one side is a token subset of the other
        if (!intersection.isEmpty() && (onlyA.isEmpty() || onlyB.isEmpty())) {
            return 100.0;
        }

        String sect = String.join(" ", intersection);
        String combinedA = join(sect, String.join(" ", onlyA));
        String combinedB = join(sect, String.join(" ", onlyB));

        double best = ratio(combinedA, combinedB);
        if (!sect.isEmpty()) {
            best = Math.max(best, ratio(sect, combinedA));
            best = Math.max(best, ratio(sect, combinedB));
        }
        return best;
    }

    static int longestCommonSubsequence(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (ca == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private static List<String> tokens(String s) {
        if (s.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(s.split(" "));
    }

    private static String sortedTokens(String s) {
        List<String> sorted = new ArrayList<>(tokens(s));
        sorted.sort(Comparator.naturalOrder());
        return String.join(" ", sorted);
    }

    private static String join(String left, String right) {
        if (left.isEmpty()) {
            return right;
        }
        if (right.isEmpty()) {
            return left;
        }
        return left + " " + right;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
