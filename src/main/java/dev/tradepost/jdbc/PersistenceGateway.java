/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.jdbc;

import java.util.List;
import java.util.function.Consumer;

/**
 * Asynchronous access to the backing store.
 *
 * <p>Every request is tagged with an ordering lane; requests on the same lane execute and complete
 * in issue order while different lanes proceed concurrently. Continuations run exactly once on the
 * server loop thread, never on the caller's stack.
 */
public interface PersistenceGateway extends AutoCloseable {

  /**
   * Issues one statement.
   *
   * @param lane ordering lane (the durable identity for session traffic)
   * @param statement statement to run
   * @param onComplete receives the result or the classified failure
   * @return correlation id of the request
   * @throws IllegalStateException if the gateway is closed
   */
  long query(String lane, SqlStatement statement, Consumer<QueryOutcome> onComplete);

  /**
   * Issues an all-or-nothing transaction. Exactly one of the callbacks runs, once.
   *
   * @param lane ordering lane
   * @param statements statements executed in order
   * @param onSuccess receives one result per statement after commit
   * @param onFailure receives the failure after rollback
   * @return correlation id of the request
   * @throws IllegalStateException if the gateway is closed
   */
  long runTransaction(
      String lane,
      List<SqlStatement> statements,
      Consumer<List<QueryResult>> onSuccess,
      Consumer<GatewayError> onFailure);

  /** Number of issued requests whose continuation has not run yet. */
  int pending();

  /**
   * Stops accepting work, waits for in-flight work within the shutdown budget and aborts the rest.
   */
  @Override
  void close();
}
