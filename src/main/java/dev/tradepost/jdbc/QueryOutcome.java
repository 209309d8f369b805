/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.jdbc;

/**
 * Completion of a single-statement request: exactly one of {@code result} or {@code error} is set.
 *
 * @param result statement result on success
 * @param error failure detail otherwise
 */
public record QueryOutcome(QueryResult result, GatewayError error) {

  public QueryOutcome {
    if ((result == null) == (error == null)) {
      throw new IllegalArgumentException("exactly one of result or error must be set");
    }
  }

  public static QueryOutcome success(QueryResult result) {
    return new QueryOutcome(result, null);
  }

  public static QueryOutcome failure(GatewayError error) {
    return new QueryOutcome(null, error);
  }

  public boolean ok() {
    return result != null;
  }
}
