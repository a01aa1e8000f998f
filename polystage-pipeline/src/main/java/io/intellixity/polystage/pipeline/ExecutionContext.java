package io.intellixity.polystage.pipeline;

import io.intellixity.polystage.model.StageResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Stage results of one execution, keyed by stage index. Never shared between executions. */
public final class ExecutionContext {
  private final Map<Integer, StageResult> results = new LinkedHashMap<>();

  public void put(StageResult result) {
    Objects.requireNonNull(result, "result");
    if (results.putIfAbsent(result.stageIndex(), result) != null) {
      throw new IllegalStateException("Stage " + result.stageIndex() + " already has a result");
    }
  }

  public Optional<StageResult> get(int stageIndex) {
    return Optional.ofNullable(results.get(stageIndex));
  }

  public boolean contains(int stageIndex) {
    return results.containsKey(stageIndex);
  }

  public Map<Integer, StageResult> results() {
    return Collections.unmodifiableMap(results);
  }
}
