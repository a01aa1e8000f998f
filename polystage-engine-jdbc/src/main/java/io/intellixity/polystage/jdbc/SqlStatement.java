package io.intellixity.polystage.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** JDBC SQL with positional '?' binds, in bind order. Binds may contain nulls. */
public record SqlStatement(String sql, List<Object> binds) {
  public SqlStatement {
    binds = (binds == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(binds));
  }
}
