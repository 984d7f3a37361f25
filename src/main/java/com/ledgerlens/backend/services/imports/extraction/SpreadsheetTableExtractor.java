package com.ledgerlens.backend.services.imports.extraction;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import com.ledgerlens.backend.enums.ImportFileKind;
import com.ledgerlens.backend.exceptions.EncryptionException;
import com.ledgerlens.backend.exceptions.StatementFormatException;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads the first sheet of an xls/xlsx workbook as formatted cell text. Expects already decrypted bytes.
 */
@Slf4j
@Component
public class SpreadsheetTableExtractor implements StatementTableExtractor {

    static final String EMPTY_HEADER = "__EMPTY";

    @Override
    public boolean supports(ImportFileKind kind) {
        return kind == ImportFileKind.EXCEL;
    }

    @Override
    public List<Map<String, Object>> extract(byte[] content, String password) {
        if (content == null || content.length == 0) return List.of();

        List<List<String>> grid;
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            if (workbook.getNumberOfSheets() == 0) return List.of();
            grid = readGrid(workbook);
        } catch (EncryptedDocumentException e) {
            throw EncryptionException.passwordRequired();
        } catch (IOException | RuntimeException e) {
            throw new StatementFormatException("Could not read spreadsheet: " + e.getMessage(), e);
        }

        List<Map<String, Object>> rows = toLibraryRows(grid);
        List<Map<String, Object>> repaired = SpreadsheetHeaderRepair.repair(rows);
        if (ImportDebug.isEnabled()) {
            log.info("[Spreadsheet] {} raw rows, {} after header repair", rows.size(), repaired.size());
        }
        return repaired;
    }

    private static List<List<String>> readGrid(Workbook workbook) {
        Sheet sheet = workbook.getSheetAt(0);
        DataFormatter formatter = new DataFormatter();
        FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

        int width = 0;
        for (Row row : sheet) {
            width = Math.max(width, Math.max(0, row.getLastCellNum()));
        }

        List<List<String>> grid = new ArrayList<>();
        for (Row row : sheet) {
            List<String> values = new ArrayList<>(width);
            boolean blank = true;
            for (int c = 0; c < width; c++) {
                Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
                String text = cell == null ? "" : formatter.formatCellValue(cell, evaluator).trim();
                if (!text.isEmpty()) blank = false;
                values.add(text);
            }
            if (!blank) grid.add(values);
        }
        return grid;
    }

    /**
     * First row becomes the header; blank header cells get synthetic names
     * ({@code __EMPTY}, {@code __EMPTY_1}, ...) and repeated names get a numeric suffix.
     */
    static List<Map<String, Object>> toLibraryRows(List<List<String>> grid) {
        if (grid.isEmpty()) return List.of();

        List<String> headerCells = grid.get(0);
        List<String> headers = new ArrayList<>(headerCells.size());
        Map<String, Integer> seen = new LinkedHashMap<>();
        int emptyCount = 0;
        for (String cell : headerCells) {
            String name;
            if (cell == null || cell.isBlank()) {
                name = emptyCount == 0 ? EMPTY_HEADER : EMPTY_HEADER + "_" + emptyCount;
                emptyCount++;
            } else {
                name = cell;
                int dup = seen.merge(name, 1, Integer::sum) - 1;
                if (dup > 0) name = name + "_" + dup;
            }
            headers.add(name);
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (int r = 1; r < grid.size(); r++) {
            List<String> cells = grid.get(r);
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 0; c < headers.size(); c++) {
                row.put(headers.get(c), c < cells.size() ? cells.get(c) : "");
            }
            rows.add(row);
        }
        return rows;
    }
}
