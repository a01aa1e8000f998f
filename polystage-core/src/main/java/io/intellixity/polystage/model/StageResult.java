package io.intellixity.polystage.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Rows produced by one stage, tagged with the backend that produced them. Rows are deeply unmodifiable. */
public record StageResult(int stageIndex, BackendKind backend, List<Map<String, Object>> rows) {
  public StageResult {
    Objects.requireNonNull(backend, "backend");
    rows = Rows.freeze(rows);
  }

  public int size() { return rows.size(); }

  public boolean isEmpty() { return rows.isEmpty(); }
}
