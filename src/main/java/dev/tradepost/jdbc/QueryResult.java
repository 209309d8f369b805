/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.jdbc;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one successful statement.
 *
 * @param rows rows returned by a query (empty for updates)
 * @param updateCount affected rows for updates, {@code -1} for queries
 */
public record QueryResult(List<Row> rows, int updateCount) {

  public QueryResult {
    rows = rows == null ? List.of() : List.copyOf(rows);
  }

  public Optional<Row> first() {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }
}
