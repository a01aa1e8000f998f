package io.intellixity.polystage.jdbc;

import io.intellixity.polystage.jdbc.dialect.JdbcDialect;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads a whole result set into column-label keyed rows of plain Java values. */
final class JdbcRowReader {
  private JdbcRowReader() {}

  static List<Map<String, Object>> readAll(ResultSet rs, JdbcDialect dialect) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    String[] labels = new String[n];
    for (int i = 1; i <= n; i++) labels[i - 1] = md.getColumnLabel(i);

    List<Map<String, Object>> rows = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>(n * 2);
      for (int i = 1; i <= n; i++) row.put(labels[i - 1], dialect.fromDriver(rs.getObject(i)));
      rows.add(row);
    }
    return rows;
  }
}
