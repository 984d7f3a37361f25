package com.ledgerlens.backend.services.imports.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class DelimitedTextExtractorTest {

    private final DelimitedTextExtractor extractor = new DelimitedTextExtractor();

    @Test
    void parsesCommaSeparatedWithQuotedFields() {
        String csv = "Date,Description,Amount\n"
                + "15/02/2024,\"SWIGGY, BANGALORE\",-450.00\n"
                + "16/02/2024,Salary,50000\n";

        List<Map<String, Object>> rows = extractor.extract(csv.getBytes(StandardCharsets.UTF_8), null);

        assertEquals(2, rows.size());
        assertEquals("15/02/2024", rows.get(0).get("Date"));
        assertEquals("SWIGGY, BANGALORE", rows.get(0).get("Description"));
        assertEquals("-450.00", rows.get(0).get("Amount"));
    }

    @Test
    void sniffsSemicolonAndPipe() {
        assertEquals(';', DelimitedTextExtractor.sniffDelimiter("date;description;amount"));
        assertEquals('|', DelimitedTextExtractor.sniffDelimiter("date|description|amount"));
        assertEquals('\t', DelimitedTextExtractor.sniffDelimiter("date\tdescription\tamount"));
    }

    @Test
    void tieGoesToCommaAsFirstCandidate() {
        assertEquals(',', DelimitedTextExtractor.sniffDelimiter("date,desc;amount"));
        assertEquals(',', DelimitedTextExtractor.sniffDelimiter("singlecolumn"));
    }

    @Test
    void stripsBomAndSkipsBlankLines() {
        String csv = "\uFEFFDate;Amount\n\n   \n01/01/2024;100\n";

        List<Map<String, Object>> rows = extractor.extract(csv.getBytes(StandardCharsets.UTF_8), null);

        assertEquals(1, rows.size());
        assertEquals("01/01/2024", rows.get(0).get("Date"));
        assertEquals("100", rows.get(0).get("Amount"));
    }

    @Test
    void shortRowsAreFilledWithEmptyStrings() {
        List<Map<String, Object>> rows = extractor.extractText("a|b|c\n1|2\n");

        assertEquals("1", rows.get(0).get("a"));
        assertEquals("2", rows.get(0).get("b"));
        assertEquals("", rows.get(0).get("c"));
    }

    @Test
    void duplicateHeaderKeepsLastValue() {
        List<Map<String, Object>> rows = extractor.extractText("amount,amount\n1,2\n");

        assertEquals(1, rows.get(0).size());
        assertEquals("2", rows.get(0).get("amount"));
    }

    @Test
    void emptyInputHasNoRows() {
        assertTrue(extractor.extract(new byte[0], null).isEmpty());
        assertTrue(extractor.extractText("\n\n").isEmpty());
    }
}
