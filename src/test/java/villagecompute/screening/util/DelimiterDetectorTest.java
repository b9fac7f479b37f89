package villagecompute.screening.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import villagecompute.screening.exceptions.ParseFailureException;

/**
 * Unit tests for {@link DelimiterDetector}.
 */
class DelimiterDetectorTest {

    @Test
    void testDetect_comma() {
        assertEquals(',', DelimiterDetector.detect("name,ref,type\nJohn Smith,1,P\nJane Doe,2,P\n"));
    }

    @Test
    void testDetect_semicolon() {
        assertEquals(';', DelimiterDetector.detect("name;ref;type\nJohn Smith;1;P\nJane Doe;2;P\n"));
    }

    @Test
    void testDetect_tab() {
        assertEquals('\t', DelimiterDetector.detect("name\tref\nJohn Smith\t1\n"));
    }

    @Test
    void testDetect_pipe() {
        assertEquals('|', DelimiterDetector.detect("name|ref|type\nJohn Smith|1|P\n"));
    }

    @Test
    void testDetect_ignoresDelimitersInsideQuotes() {
        String sample = "name;ref\n\"Smith, John\";1\n\"Doe, Jane\";2\n";
        assertEquals(';', DelimiterDetector.detect(sample));
    }

    @Test
    void testDetect_fallsBackToColumnCountWhenLinesDisagree() {
        // comma counts differ per line, so sniffing fails; the header still splits best on commas
        String sample = "a,b,c\n1,2\n";
        assertEquals(',', DelimiterDetector.detect(sample));
    }

    @Test
    void testDetect_emptySampleFails() {
        ParseFailureException e = assertThrows(ParseFailureException.class, () -> DelimiterDetector.detect("  \n"));
        assertEquals("CSV source is empty", e.getMessage());
    }

    @Test
    void testSniff_failsWithoutAnyCandidate() {
        assertThrows(ParseFailureException.class, () -> DelimiterDetector.sniff("single\ncolumn\n"));
    }

    @Test
    void testByColumnCount_singleColumnStillParses() {
        assertEquals(',', DelimiterDetector.byColumnCount("single\ncolumn\n"));
    }

    @Test
    void testReadSample_stripsBomAndRewinds() throws Exception {
        byte[] bytes = "\uFEFFname,ref\nJohn,1\n".getBytes(StandardCharsets.UTF_8);
        BufferedInputStream in = new BufferedInputStream(new ByteArrayInputStream(bytes));

        String sample = DelimiterDetector.readSample(in);

        assertEquals("name,ref\nJohn,1\n", sample);
        assertEquals(bytes.length, in.readAllBytes().length);
    }

    @Test
    void testStripBom() {
        assertEquals("name", DelimiterDetector.stripBom("\uFEFFname"));
        assertEquals("name", DelimiterDetector.stripBom("name"));
        assertEquals("", DelimiterDetector.stripBom(""));
    }
}
