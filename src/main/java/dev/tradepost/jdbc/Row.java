/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.jdbc;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/** One result row keyed by lower-cased column label. */
public final class Row {
  private final Map<String, Object> values;

  Row(Map<String, Object> values) {
    this.values = Map.copyOf(values);
  }

  /**
   * Builds a row from column/value pairs. Mostly useful for tests.
   *
   * @param values column label to value; {@code null} values are not allowed
   * @return row
   */
  public static Row of(Map<String, Object> values) {
    HashMap<String, Object> lowered = new HashMap<>();
    values.forEach((k, v) -> lowered.put(k.toLowerCase(Locale.ROOT), v));
    return new Row(lowered);
  }

  public boolean has(String column) {
    return values.containsKey(column.toLowerCase(Locale.ROOT));
  }

  public long getLong(String column) {
    Object v = require(column);
    if (v instanceof Number n) {
      return n.longValue();
    }
    return Long.parseLong(v.toString());
  }

  public int getInt(String column) {
    return Math.toIntExact(getLong(column));
  }

  public String getString(String column) {
    return require(column).toString();
  }

  private Object require(String column) {
    Object v = values.get(column.toLowerCase(Locale.ROOT));
    if (v == null) {
      throw new IllegalArgumentException("no value for column " + column);
    }
    return v;
  }

  @Override
  public String toString() {
    return "Row" + values;
  }
}
