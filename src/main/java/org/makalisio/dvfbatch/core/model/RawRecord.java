// org.makalisio.dvfbatch.core.model.RawRecord
package org.makalisio.dvfbatch.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One untyped source row: column name to raw text, as read from a DVF file.
 * Nothing downstream of the record parser sees this type.
 *
 * @author Makalisio
 * @since 0.0.1
 */
public class RawRecord {

    private final Map<String, String> values = new LinkedHashMap<>();
    private final int lineNumber;

    /**
     * Creates an empty record that does not come from a file line.
     */
    public RawRecord() {
        this(0);
    }

    /**
     * @param lineNumber 1-based line number in the source file (0 if unknown)
     */
    public RawRecord(int lineNumber) {
        this.lineNumber = lineNumber;
    }

    /**
     * Constructor with initial values.
     *
     * @param lineNumber    line number in the source file
     * @param initialValues map of column names to raw text
     */
    public RawRecord(int lineNumber, Map<String, String> initialValues) {
        this(lineNumber);
        if (initialValues != null) {
            initialValues.forEach(this::put);
        }
    }

    /**
     * Puts a raw value in the record.
     *
     * @param column the column name
     * @param value  the raw text, may be {@code null}
     * @throws IllegalArgumentException if column is null or blank
     */
    public void put(String column, String value) {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be null or blank");
        }
        values.put(column, value);
    }

    /**
     * Gets the raw value of a column, untouched.
     *
     * @param column the column name
     * @return the raw text, or null if the column is not present
     */
    public String get(String column) {
        return values.get(column);
    }

    /**
     * Gets the trimmed value of a column. Empty or whitespace-only text is
     * reported as absent.
     *
     * @param column the column name
     * @return the trimmed text, or null if the column is absent or blank
     */
    public String getText(String column) {
        String value = values.get(column);
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Checks if the record carries a column, blank or not.
     *
     * @param column the column name
     * @return true if the column exists
     */
    public boolean containsKey(String column) {
        return values.containsKey(column);
    }

    /**
     * Returns an unmodifiable view of the values map.
     *
     * @return unmodifiable map of raw values
     */
    public Map<String, String> getValues() {
        return Collections.unmodifiableMap(values);
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return "RawRecord[line=" + lineNumber + "]" + values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RawRecord that = (RawRecord) o;
        return lineNumber == that.lineNumber && Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values, lineNumber);
    }
}
