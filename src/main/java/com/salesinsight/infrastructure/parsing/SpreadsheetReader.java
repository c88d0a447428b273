package com.salesinsight.infrastructure.parsing;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads an uploaded .xlsx, .xls or .csv file into header-keyed rows.
 *
 * The first row is the header. Fully blank rows are dropped; they are not
 * counted towards a job's total. Only the first sheet of a workbook is read.
 */
@Slf4j
@Component
public class SpreadsheetReader {

    public List<RawRow> read(InputStream in, String filename) throws IOException {
        String name = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv")) {
            return readCsv(in);
        }
        if (name.endsWith(".xlsx") || name.endsWith(".xls")) {
            return readWorkbook(in);
        }
        throw new IOException("Unsupported file type: " + filename);
    }

    List<RawRow> readCsv(InputStream in) throws IOException {
        String content;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            content = reader.lines().collect(Collectors.joining("\n"));
        }
        if (content.startsWith("\uFEFF")) {
            content = content.substring(1);
        }

        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setDelimiter(detectDelimiter(content))
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .build();

        List<RawRow> rows = new ArrayList<>();
        try (Reader reader = new StringReader(content); CSVParser parser = csvFormat.parse(reader)) {
            List<String> headers = null;
            for (CSVRecord record : parser) {
                if (headers == null) {
                    headers = new ArrayList<>();
                    for (String header : record) {
                        headers.add(RawRow.normalizeHeader(header));
                    }
                    continue;
                }

                Map<String, Object> values = new LinkedHashMap<>();
                for (int i = 0; i < headers.size(); i++) {
                    values.putIfAbsent(headers.get(i), i < record.size() ? record.get(i) : null);
                }
                addIfNotBlank(rows, new RawRow((int) record.getRecordNumber(), values));
            }
        }

        log.debug("Read {} CSV rows", rows.size());
        return rows;
    }

    List<RawRow> readWorkbook(InputStream in) throws IOException {
        List<RawRow> rows = new ArrayList<>();

        try (Workbook workbook = WorkbookFactory.create(in)) {
            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                return rows;
            }

            List<String> headers = new ArrayList<>();
            for (int j = 0; j < headerRow.getLastCellNum(); j++) {
                Cell cell = headerRow.getCell(j);
                headers.add(cell == null ? "" : RawRow.normalizeHeader(cell.toString()));
            }

            for (int i = headerRow.getRowNum() + 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) {
                    continue;
                }
                Map<String, Object> values = new LinkedHashMap<>();
                for (int j = 0; j < headers.size(); j++) {
                    values.putIfAbsent(headers.get(j), cellValue(row.getCell(j)));
                }
                addIfNotBlank(rows, new RawRow(i + 1, values));
            }
        } catch (RuntimeException e) {
            // POI reports corrupt or encrypted files with unchecked exceptions
            throw new IOException("Unreadable spreadsheet: " + e.getMessage(), e);
        }

        log.debug("Read {} spreadsheet rows", rows.size());
        return rows;
    }

    private static Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case STRING:
                return cell.getStringCellValue().trim();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toLocalDate();
                }
                return cell.getNumericCellValue();
            case BOOLEAN:
                return cell.getBooleanCellValue();
            default:
                return null;
        }
    }

    private static void addIfNotBlank(List<RawRow> rows, RawRow row) {
        if (!row.isBlank()) {
            rows.add(row);
        }
    }

    /**
     * Semicolon when the header line has more semicolons than commas
     * (spreadsheet exports in comma-decimal locales), comma otherwise.
     */
    static char detectDelimiter(String content) {
        int end = content.indexOf('\n');
        String header = end >= 0 ? content.substring(0, end) : content;
        long semicolons = header.chars().filter(c -> c == ';').count();
        long commas = header.chars().filter(c -> c == ',').count();
        return semicolons > commas ? ';' : ',';
    }
}
