/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.jdbc;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single parameterised SQL statement.
 *
 * @param sql SQL text with {@code ?} placeholders
 * @param params positional parameters (may contain {@code null})
 * @param read whether the statement is side-effect free and may be retried
 */
public record SqlStatement(String sql, List<Object> params, boolean read) {

  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    params =
        params == null
            ? List.of()
            : Collections.unmodifiableList(Arrays.asList(params.toArray()));
  }

  /** Side-effect free statement; retried on transient store errors. */
  public static SqlStatement read(String sql, Object... params) {
    return new SqlStatement(sql, Arrays.asList(params), true);
  }

  /** Mutating statement; never retried by the gateway. */
  public static SqlStatement write(String sql, Object... params) {
    return new SqlStatement(sql, Arrays.asList(params), false);
  }
}
