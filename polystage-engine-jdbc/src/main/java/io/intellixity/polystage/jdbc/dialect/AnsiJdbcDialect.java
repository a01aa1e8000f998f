package io.intellixity.polystage.jdbc.dialect;

/** Fallback dialect when no vendor dialect is on the classpath. */
public final class AnsiJdbcDialect extends AbstractJdbcDialect {
  @Override public String id() { return "ansi"; }
}
