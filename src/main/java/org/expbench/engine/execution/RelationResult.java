package org.expbench.engine.execution;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rectangular query result with named columns.
 */
public record RelationResult(
        List<Column> columns,
        List<Row> rows) {

    public RelationResult {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    /**
     * Creates a RelationResult from a JDBC ResultSet.
     * Column names are normalized to lower case so results from both engines align.
     */
    public static RelationResult fromResultSet(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();

        List<Column> columns = new ArrayList<>();
        for (int i = 1; i <= columnCount; i++) {
            columns.add(new Column(
                    meta.getColumnLabel(i).toLowerCase(Locale.ROOT),
                    meta.getColumnTypeName(i)));
        }

        List<Row> rows = new ArrayList<>();
        while (rs.next()) {
            List<Object> values = new ArrayList<>();
            for (int i = 1; i <= columnCount; i++) {
                values.add(rs.getObject(i));
            }
            rows.add(new Row(values));
        }

        return new RelationResult(columns, rows);
    }

    public static RelationResult empty() {
        return new RelationResult(List.of(), List.of());
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean hasColumn(String columnName) {
        return indexOf(columnName) >= 0;
    }

    public List<String> columnNames() {
        return columns.stream().map(Column::name).toList();
    }

    /**
     * Gets a value at the specified row and column.
     */
    public Object getValue(int rowIndex, int columnIndex) {
        return rows.get(rowIndex).values().get(columnIndex);
    }

    /**
     * Gets a value at the specified row by column name.
     */
    public Object getValue(int rowIndex, String columnName) {
        int index = indexOf(columnName);
        if (index < 0) {
            throw new IllegalArgumentException("Column not found: " + columnName);
        }
        return rows.get(rowIndex).values().get(index);
    }

    /**
     * Gets a numeric value as a double, or null for SQL NULL.
     */
    public Double getDouble(int rowIndex, String columnName) {
        return toDouble(getValue(rowIndex, columnName));
    }

    /**
     * Rows as column-name keyed maps, in column order.
     */
    public List<Map<String, Object>> toMaps() {
        List<Map<String, Object>> maps = new ArrayList<>(rows.size());
        for (Row row : rows) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                map.put(columns.get(i).name(), row.get(i));
            }
            maps.add(map);
        }
        return maps;
    }

    private int indexOf(String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equalsIgnoreCase(columnName)) {
                return i;
            }
        }
        return -1;
    }

    static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        if (value instanceof BigInteger integer) {
            return integer.doubleValue();
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalArgumentException("Not a numeric value: " + value + " (" + value.getClass().getSimpleName() + ")");
    }

    /**
     * Column metadata.
     */
    public record Column(String name, String sqlType) {
    }

    /**
     * A row of values.
     */
    public record Row(List<Object> values) {
        public Row {
            // values may contain SQL NULLs
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        public Object get(int index) {
            return values.get(index);
        }
    }
}
