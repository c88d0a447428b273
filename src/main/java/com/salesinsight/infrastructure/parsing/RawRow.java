package com.salesinsight.infrastructure.parsing;

import lombok.Getter;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;

/**
 * One data row of an uploaded file, keyed by normalized header.
 *
 * Values are whatever the reader produced: String for CSV and text cells,
 * Double for numeric cells, LocalDate for date-formatted cells, Boolean.
 */
@Getter
public class RawRow {

    // 1-based, as the user sees it in the spreadsheet (the header is row 1)
    private final int rowNumber;
    private final Map<String, Object> values;

    public RawRow(int rowNumber, Map<String, Object> values) {
        this.rowNumber = rowNumber;
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * First non-blank value among the given header aliases, or null.
     */
    public Object get(String... aliases) {
        for (String alias : aliases) {
            Object value = values.get(alias);
            if (value instanceof String && ((String) value).isBlank()) {
                continue;
            }
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public String getString(String... aliases) {
        Object value = get(aliases);
        if (value == null) {
            return null;
        }
        if (value instanceof Double && ((Double) value) % 1 == 0) {
            // numeric cell holding a code such as 1001
            return String.valueOf(((Double) value).longValue());
        }
        return value.toString().trim();
    }

    public boolean isBlank() {
        for (Object value : values.values()) {
            if (value instanceof String ? !((String) value).isBlank() : value != null) {
                return false;
            }
        }
        return true;
    }

    /**
     * Header normalization: trimmed, lower case, inner whitespace as underscores.
     */
    public static String normalizeHeader(String header) {
        if (header == null) {
            return "";
        }
        String trimmed = header.replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
        return trimmed.replaceAll("\\s+", "_");
    }
}
