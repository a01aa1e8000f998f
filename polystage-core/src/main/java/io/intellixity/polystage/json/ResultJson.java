package io.intellixity.polystage.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.intellixity.polystage.model.PipelineResult;

/** Writes {@code label -> rows} for a {@link PipelineResult}; warnings are not part of the output. */
public final class ResultJson {
  private ResultJson() {}

  public static String write(PipelineResult result) {
    return write(result, false);
  }

  public static String write(PipelineResult result, boolean pretty) {
    try {
      return pretty
          ? Json.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(result.outputs())
          : Json.mapper().writeValueAsString(result.outputs());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Result is not JSON-serializable", e);
    }
  }
}
