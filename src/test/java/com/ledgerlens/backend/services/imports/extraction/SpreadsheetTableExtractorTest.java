package com.ledgerlens.backend.services.imports.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

class SpreadsheetTableExtractorTest {

    private final SpreadsheetTableExtractor extractor = new SpreadsheetTableExtractor();

    @Test
    void readsFirstSheetWithPlainHeader() throws IOException {
        byte[] xlsx = workbook(
                new String[]{"Date", "Description", "Amount"},
                new String[]{"15/02/2024", "Zomato", "-250"});

        List<Map<String, Object>> rows = extractor.extract(xlsx, null);

        assertEquals(1, rows.size());
        assertEquals("15/02/2024", rows.get(0).get("Date"));
        assertEquals("Zomato", rows.get(0).get("Description"));
        assertEquals("-250", rows.get(0).get("Amount"));
    }

    @Test
    void findsHeaderBelowAccountMetadata() throws IOException {
        byte[] xlsx = workbook(
                new String[]{"Account Name", "MR TEST USER", ""},
                new String[]{"Account Number", "XXXX1234", ""},
                new String[]{"", "", ""},
                new String[]{"Txn Date", "Narration", "Withdrawal Amt"},
                new String[]{"01/03/2024", "ATM WDL ATM CASH 1957", "2000"},
                new String[]{"02/03/2024", "POS ATM PURCH", "150"});

        List<Map<String, Object>> rows = extractor.extract(xlsx, null);

        assertEquals(2, rows.size());
        assertEquals("01/03/2024", rows.get(0).get("Txn Date"));
        assertEquals("ATM WDL ATM CASH 1957", rows.get(0).get("Narration"));
        assertEquals("2000", rows.get(0).get("Withdrawal Amt"));
    }

    @Test
    void blankAndDuplicateHeaderCellsGetLibraryNames() {
        List<Map<String, Object>> rows = SpreadsheetTableExtractor.toLibraryRows(List.of(
                List.of("", "Amount", "", "Amount"),
                List.of("a", "1", "b", "2")));

        assertEquals(List.of("__EMPTY", "Amount", "__EMPTY_1", "Amount_1"), List.copyOf(rows.get(0).keySet()));
    }

    @Test
    void headerRepairUsesFirstRowWhenEverythingIsSyntheticAndNoKeywordRow() {
        List<Map<String, Object>> rows = SpreadsheetTableExtractor.toLibraryRows(List.of(
                List.of("", ""),
                List.of("foo", "bar"),
                List.of("1", "2")));

        List<Map<String, Object>> repaired = SpreadsheetHeaderRepair.repair(rows);

        assertEquals(1, repaired.size());
        assertEquals("1", repaired.get(0).get("foo"));
        assertEquals("2", repaired.get(0).get("bar"));
    }

    @Test
    void headerRepairNamesBlankHeaderCells() {
        List<Map<String, Object>> rows = SpreadsheetTableExtractor.toLibraryRows(List.of(
                List.of("Statement", "", ""),
                List.of("Date", "", "Amount"),
                List.of("01/01/2024", "x", "10")));

        List<Map<String, Object>> repaired = SpreadsheetHeaderRepair.repair(rows);

        assertEquals(List.of("Date", "column_2", "Amount"), List.copyOf(repaired.get(0).keySet()));
    }

    private static byte[] workbook(String[]... rows) throws IOException {
        try (XSSFWorkbook wb = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = wb.createSheet("Statement");
            for (int r = 0; r < rows.length; r++) {
                Row row = sheet.createRow(r);
                for (int c = 0; c < rows[r].length; c++) {
                    if (!rows[r][c].isEmpty()) row.createCell(c).setCellValue(rows[r][c]);
                }
            }
            wb.write(out);
            return out.toByteArray();
        }
    }
}
