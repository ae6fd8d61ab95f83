package io.xaio.config;

import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Typed field-to-column table for a spreadsheet-like intake export. Columns are zero-based; the letter form
 * ("A", "B", ..., "AA") is what operators write in configuration.
 */
public record IntakeColumnMapping(int urlColumn, int statusColumn, int itemIdColumn) {
    public static final String FIELD_URL = "url";
    public static final String FIELD_STATUS = "status";
    public static final String FIELD_ITEM_ID = "item_id";
    private static final Set<String> KNOWN_FIELDS = Set.of(FIELD_URL, FIELD_STATUS, FIELD_ITEM_ID);

    public IntakeColumnMapping {
        if (urlColumn < 0 || statusColumn < 0) {
            throw new IllegalArgumentException("intake mapping requires url and status columns");
        }
        Set<Integer> seen = new HashSet<>();
        seen.add(urlColumn);
        if (!seen.add(statusColumn) || (itemIdColumn >= 0 && !seen.add(itemIdColumn))) {
            throw new IllegalArgumentException("intake mapping columns must be distinct");
        }
    }

    public static IntakeColumnMapping defaults() {
        return new IntakeColumnMapping(0, 1, 2);
    }

    public static IntakeColumnMapping fromLetters(Map<String, String> columns) {
        if (columns == null || columns.isEmpty()) {
            return defaults();
        }
        for (String field : columns.keySet()) {
            if (!KNOWN_FIELDS.contains(field)) {
                throw new IllegalArgumentException("Unknown intake column field: " + field);
            }
        }
        String url = columns.get(FIELD_URL);
        String status = columns.get(FIELD_STATUS);
        if (url == null || status == null) {
            throw new IllegalArgumentException("intake.columns must define '" + FIELD_URL + "' and '" + FIELD_STATUS + "'");
        }
        String itemId = columns.get(FIELD_ITEM_ID);
        return new IntakeColumnMapping(
                letterToIndex(url),
                letterToIndex(status),
                itemId == null ? -1 : letterToIndex(itemId)
        );
    }

    public int width() {
        return Math.max(urlColumn, Math.max(statusColumn, itemIdColumn)) + 1;
    }

    static int letterToIndex(String letter) {
        if (letter == null || letter.isBlank()) {
            throw new IllegalArgumentException("column letter must not be blank");
        }
        String v = letter.trim().toUpperCase(Locale.ROOT);
        int n = 0;
        for (int i = 0; i < v.length(); i++) {
            char ch = v.charAt(i);
            if (ch < 'A' || ch > 'Z') {
                throw new IllegalArgumentException("Invalid column letter: " + letter);
            }
            n = n * 26 + (ch - 'A' + 1);
        }
        return n - 1;
    }
}
