package villagecompute.screening.util;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.jboss.logging.Logger;

import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import villagecompute.screening.exceptions.ParseFailureException;

/**
 * Field delimiter detection for uploaded CSV sources.
 *
 * <p>
 * <b>Detection Strategy:</b>
 * <ol>
 * <li>Read the first {@value #SAMPLE_SIZE} bytes of the source without consuming them</li>
 * <li>Sniff: a candidate qualifies when it occurs the same, non-zero number of times (outside quotes) on every complete
 * sample line; the most frequent qualifying candidate wins</li>
 * <li>If sniffing fails, parse the sample with each candidate and keep the one yielding the most header columns</li>
 * <li>If no candidate parses, fail with {@link ParseFailureException}</li>
 * </ol>
 *
 * <p>
 * Candidates in preference order: comma, semicolon, tab, pipe.
 */
public final class DelimiterDetector {

    private static final Logger LOG = Logger.getLogger(DelimiterDetector.class);

    public static final int SAMPLE_SIZE = 1024;

    static final char[] CANDIDATES = {',', ';', '\t', '|'};

    private static final char BOM = '\uFEFF';
    private static final int MAX_SNIFF_LINES = 10;

    private DelimiterDetector() {
    }

    /**
     * Reads up to {@value #SAMPLE_SIZE} bytes and rewinds the stream so the parser sees the whole source.
     */
    public static String readSample(BufferedInputStream in) throws IOException {
        in.mark(SAMPLE_SIZE + 1);
        byte[] bytes = in.readNBytes(SAMPLE_SIZE);
        in.reset();
        return stripBom(new String(bytes, StandardCharsets.UTF_8));
    }

    /**
     * Sniffs first and falls back to the column count comparison.
     *
     * @throws ParseFailureException
     *             if the sample is empty or no candidate parses
     */
    public static char detect(String sample) {
        try {
            return sniff(sample);
        } catch (ParseFailureException e) {
            LOG.debugf("Delimiter sniffing failed (%s), comparing column counts", e.getMessage());
            return byColumnCount(sample);
        }
    }

    static char sniff(String sample) {
        List<String> lines = completeLines(sample);
        if (lines.isEmpty()) {
            throw new ParseFailureException("Could not determine delimiter: empty sample");
        }

        char best = 0;
        int bestCount = 0;
        for (char candidate : CANDIDATES) {
            int count = consistentCount(lines, candidate);
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        if (bestCount == 0) {
            throw new ParseFailureException("Could not determine delimiter");
        }
        return best;
    }

    static char byColumnCount(String sample) {
        if (sample.isBlank()) {
            throw new ParseFailureException("CSV source is empty");
        }

        char best = 0;
        int bestColumns = 0;
        for (char candidate : CANDIDATES) {
            int columns = headerColumns(sample, candidate);
            if (columns > bestColumns) {
                best = candidate;
                bestColumns = columns;
            }
        }
        if (bestColumns == 0) {
            throw new ParseFailureException("Could not parse CSV with any of the delimiters , ; \\t |");
        }
        return best;
    }

    public static String stripBom(String value) {
        if (value != null && !value.isEmpty() && value.charAt(0) == BOM) {
            return value.substring(1);
        }
        return value;
    }

    private static int headerColumns(String sample, char delimiter) {
        CSVParser parser = new CSVParserBuilder().withSeparator(delimiter).build();
        try (CSVReader reader = new CSVReaderBuilder(new StringReader(completeText(sample))).withCSVParser(parser)
                .build()) {
            String[] header = reader.readNext();
            return header == null ? 0 : header.length;
        } catch (IOException | CsvValidationException e) {
            LOG.debugf("Delimiter '%s' does not parse the sample: %s", printable(delimiter), e.getMessage());
            return 0;
        }
    }

    /**
     * Occurrences of {@code delimiter} per line when equal on every line, else 0.
     */
    private static int consistentCount(List<String> lines, char delimiter) {
        int expected = -1;
        for (String line : lines) {
            int count = countOutsideQuotes(line, delimiter);
            if (expected == -1) {
                expected = count;
            } else if (count != expected) {
                return 0;
            }
        }
        return Math.max(expected, 0);
    }

    private static int countOutsideQuotes(String line, char delimiter) {
        int count = 0;
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == delimiter && !quoted) {
                count++;
            }
        }
        return count;
    }

    /**
     * Sample lines, dropping the last one when the sample ends mid-line.
     */
    private static List<String> completeLines(String sample) {
        List<String> lines = new ArrayList<>();
        String text = completeText(sample);
        for (String line : text.split("\\r?\\n")) {
            if (!line.isBlank()) {
                lines.add(line);
            }
            if (lines.size() == MAX_SNIFF_LINES) {
                break;
            }
        }
        return lines;
    }

    private static String completeText(String sample) {
        int lastNewline = sample.lastIndexOf('\n');
        return lastNewline > 0 ? sample.substring(0, lastNewline) : sample;
    }

    private static String printable(char delimiter) {
        return delimiter == '\t' ? "\\t" : String.valueOf(delimiter);
    }
}
