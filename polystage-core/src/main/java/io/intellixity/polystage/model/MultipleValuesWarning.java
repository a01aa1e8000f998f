package io.intellixity.polystage.model;

/**
 * Recorded when a placeholder without an explicit policy referenced several distinct values and
 * the default {@link AggregationPolicy#FIRST} kept only the first one.
 */
public record MultipleValuesWarning(int stageIndex, int sourceStage, String field, int distinctValues, Object chosen) {
  public String message() {
    return "Stage " + stageIndex + " placeholder {{" + sourceStage + "." + field + "}} matched "
        + distinctValues + " distinct values; using the first (declare |list or |distinct-list to keep all)";
  }
}
