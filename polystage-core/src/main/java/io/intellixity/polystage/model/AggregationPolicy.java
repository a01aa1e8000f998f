package io.intellixity.polystage.model;

import java.util.Locale;

/** How a placeholder collapses a multi-row reference into one bound value. */
public enum AggregationPolicy {
  FIRST("first"),
  LIST("list"),
  DISTINCT_LIST("distinct-list");

  private final String token;

  AggregationPolicy(String token) {
    this.token = token;
  }

  public String token() { return token; }

  public static AggregationPolicy fromToken(String token) {
    String t = token.trim().toLowerCase(Locale.ROOT);
    if ("distinct".equals(t)) return DISTINCT_LIST;
    for (AggregationPolicy p : values()) {
      if (p.token.equals(t)) return p;
    }
    throw new IllegalArgumentException("Unknown aggregation policy: " + token);
  }
}
