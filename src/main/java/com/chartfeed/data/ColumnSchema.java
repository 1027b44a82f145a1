package com.chartfeed.data;

import com.chartfeed.model.Bar;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a series file header onto the canonical columns.
 * Aliases are tried in order and resolved once per file, not per row.
 */
public final class ColumnSchema {

    public enum Field {
        DATE(List.of("date", "Date", "DATE", "날짜", "일자", "timestamp", "time")),
        OPEN(List.of("open", "Open", "OPEN", "시가")),
        HIGH(List.of("high", "High", "HIGH", "고가")),
        LOW(List.of("low", "Low", "LOW", "저가")),
        CLOSE(List.of("close", "Close", "CLOSE", "종가")),
        VOLUME(List.of("volume", "Volume", "VOLUME", "거래량"));

        private final List<String> aliases;

        Field(List<String> aliases) {
            this.aliases = aliases;
        }

        public List<String> aliases() {
            return aliases;
        }
    }

    public static final String CANONICAL_HEADER = "date,open,high,low,close,volume";

    private static final DateTimeFormatter BASIC_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final Map<Field, Integer> indices;

    private ColumnSchema(Map<Field, Integer> indices) {
        this.indices = indices;
    }

    /**
     * Resolve column positions from a header line.
     * Missing columns resolve to -1.
     */
    public static ColumnSchema resolve(String headerLine) {
        String[] columns = splitLine(headerLine);
        for (int i = 0; i < columns.length; i++) {
            columns[i] = stripQuotes(columns[i].replace("\uFEFF", "").trim());
        }

        Map<Field, Integer> indices = new EnumMap<>(Field.class);
        for (Field field : Field.values()) {
            indices.put(field, findColumn(columns, field.aliases()));
        }
        return new ColumnSchema(indices);
    }

    private static int findColumn(String[] columns, List<String> aliases) {
        for (String alias : aliases) {
            for (int i = 0; i < columns.length; i++) {
                if (columns[i].equals(alias)) {
                    return i;
                }
            }
        }
        return -1;
    }

    public int indexOf(Field field) {
        return indices.get(field);
    }

    public boolean has(Field field) {
        return indices.get(field) >= 0;
    }

    /**
     * Parse one data line.
     *
     * @return the bar, or null if the date or any OHLC value is missing or not numeric,
     *         or the volume is negative
     */
    public Bar parseRow(String line) {
        String[] parts = splitLine(line);

        LocalDate date = parseDate(cell(parts, Field.DATE));
        double open = parseNumber(cell(parts, Field.OPEN));
        double high = parseNumber(cell(parts, Field.HIGH));
        double low = parseNumber(cell(parts, Field.LOW));
        double close = parseNumber(cell(parts, Field.CLOSE));
        if (date == null || Double.isNaN(open) || Double.isNaN(high) || Double.isNaN(low) || Double.isNaN(close)) {
            return null;
        }

        // Missing or non-numeric volume counts as no trading
        double volume = parseNumber(cell(parts, Field.VOLUME));
        if (Double.isNaN(volume)) {
            volume = 0;
        }
        if (volume < 0) {
            return null;
        }
        return new Bar(date, open, high, low, close, volume);
    }

    private String cell(String[] parts, Field field) {
        int index = indices.get(field);
        if (index < 0 || index >= parts.length) {
            return null;
        }
        return stripQuotes(parts[index].trim());
    }

    /**
     * Accepts "2024-01-02", "2024-01-02 09:00:00", "2024-01-02T09:00:00" and "20240102".
     * Any time of day is discarded.
     */
    static LocalDate parseDate(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        try {
            if (text.length() >= 10 && text.charAt(4) == '-') {
                return LocalDate.parse(text.substring(0, 10));
            }
            if (text.length() == 8) {
                return LocalDate.parse(text, BASIC_DATE);
            }
        } catch (DateTimeParseException e) {
            return null;
        }
        return null;
    }

    /**
     * Split a CSV line on commas outside double quotes. Quotes stay on the cell.
     */
    static String[] splitLine(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                quoted = !quoted;
                current.append(c);
            } else if (c == ',' && !quoted) {
                cells.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        cells.add(current.toString());
        return cells.toArray(new String[0]);
    }

    /**
     * Thousands separators ("1,234.5") are accepted.
     *
     * @return the value, or NaN if missing, non-numeric or non-finite
     */
    static double parseNumber(String text) {
        if (text == null || text.isEmpty()) {
            return Double.NaN;
        }
        try {
            double value = Double.parseDouble(text.replace(",", ""));
            return Double.isFinite(value) ? value : Double.NaN;
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static String stripQuotes(String text) {
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }
}
