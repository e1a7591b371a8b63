package com.raditha.tokenizer.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * A single row of a delimited file: column names mapped to values in header order.
 * <p>
 * The column set is fixed at construction. Only values can change, so a record
 * written back out always has the same shape as the one that was read.
 */
public final class TabularRecord {

    private final long recordNumber;
    private final LinkedHashMap<String, String> values;

    private TabularRecord(long recordNumber, LinkedHashMap<String, String> values) {
        this.recordNumber = recordNumber;
        this.values = values;
    }

    /**
     * Pair header names with row values. Missing trailing values become empty
     * strings.
     *
     * @param recordNumber 1-based position of the row after the header
     * @param header       column names in file order
     * @param fields       raw field values in file order
     * @throws IllegalArgumentException if there are more fields than columns
     */
    public static TabularRecord of(long recordNumber, List<String> header, List<String> fields) {
        if (fields.size() > header.size()) {
            throw new IllegalArgumentException("Record " + recordNumber + " has " + fields.size()
                    + " fields but only " + header.size() + " columns");
        }
        LinkedHashMap<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < header.size(); i++) {
            values.put(header.get(i), i < fields.size() ? fields.get(i) : "");
        }
        return new TabularRecord(recordNumber, values);
    }

    public long recordNumber() {
        return recordNumber;
    }

    public String get(String column) {
        return values.get(column);
    }

    /**
     * Replace the value of an existing column.
     *
     * @throws IllegalArgumentException if the column is not part of this record
     */
    public void set(String column, String value) {
        if (!values.containsKey(column)) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        values.put(column, value);
    }

    public List<String> columns() {
        return List.copyOf(values.keySet());
    }

    /**
     * Values in column order, ready to be printed.
     */
    public List<String> values() {
        return new ArrayList<>(values.values());
    }

    @Override
    public String toString() {
        return "TabularRecord#" + recordNumber + values;
    }
}
