package com.alphacheck.loader;

import com.alphacheck.domain.TradingTime;
import com.alphacheck.exception.DataContractException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Raw rows of one pipe-delimited file, addressed by header name.
 *
 * <p>Cell accessors convert and raise {@link DataContractException} naming the file, the
 * 1-based data line and the column when a required value is blank or malformed. Numeric
 * cells must be finite; {@code nan} and blank read as absent.
 */
class CsvTable {

    private final String fileName;
    private final Map<String, Integer> columns;
    private final List<String[]> rows;

    CsvTable(String fileName, String[] header, List<String[]> rows) {
        this.fileName = fileName;
        this.columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            columns.put(header[i].trim(), i);
        }
        this.rows = rows;
    }

    void requireColumns(List<String> required) {
        Set<String> missing = new LinkedHashSet<>(required);
        missing.removeAll(columns.keySet());
        if (!missing.isEmpty()) {
            throw new DataContractException(
                    String.format("%s missing required columns: %s", fileName, missing),
                    Map.of("file", fileName, "missingColumns", new ArrayList<>(missing)));
        }
    }

    int size() {
        return rows.size();
    }

    String text(int row, String column) {
        String value = cell(row, column);
        if (value.isEmpty()) {
            throw invalid(row, column, "blank value");
        }
        return value;
    }

    long time(int row, String column) {
        String value = cell(row, column);
        try {
            return TradingTime.parse(value);
        } catch (NumberFormatException e) {
            throw new DataContractException(describe(row, column, "time out of range: '" + value + "'"), e);
        }
    }

    double number(int row, String column) {
        Double value = optionalNumber(row, column);
        if (value == null) {
            throw invalid(row, column, "blank value");
        }
        return value;
    }

    /** Null for a blank cell or a column the file does not carry. */
    Double optionalNumber(int row, String column) {
        String value = cell(row, column);
        if (value.isEmpty() || value.equalsIgnoreCase("nan")) {
            return null;
        }
        double parsed;
        try {
            parsed = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new DataContractException(describe(row, column, "not a number: '" + value + "'"), e);
        }
        if (!Double.isFinite(parsed)) {
            throw invalid(row, column, "not a finite number: '" + value + "'");
        }
        return parsed;
    }

    BigDecimal optionalDecimal(int row, String column) {
        if (optionalNumber(row, column) == null) {
            return null;
        }
        String value = cell(row, column);
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            // hex floats and type suffixes parse as doubles but not as decimals
            throw new DataContractException(describe(row, column, "not a decimal: '" + value + "'"), e);
        }
    }

    private String cell(int row, String column) {
        Integer index = columns.get(column);
        String[] values = rows.get(row);
        if (index == null || index >= values.length || values[index] == null) {
            return "";
        }
        return values[index].trim();
    }

    private DataContractException invalid(int row, String column, String reason) {
        return new DataContractException(describe(row, column, reason));
    }

    private String describe(int row, String column, String reason) {
        return String.format("%s line %d column %s: %s", fileName, row + 2, column, reason);
    }

    @Override
    public String toString() {
        return fileName + " " + Arrays.toString(columns.keySet().toArray()) + " (" + rows.size() + " rows)";
    }
}
