/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.api;

/**
 * Canonical error/result codes produced by Tradepost subsystems.
 *
 * <p>Codes are used for API results, log lines and metrics. Each one belongs to exactly one {@link
 * ErrorKind}.
 */
public enum ErrorCode {
  /** Argument failed validation (blank key, negative price, overflow). */
  INVALID_ARGUMENT(ErrorKind.VALIDATION),

  /** Category key already registered, or item key already registered in its category. */
  DUPLICATE_KEY(ErrorKind.VALIDATION),

  /** Category handle is unknown or the category has been deactivated. */
  INVALID_CATEGORY(ErrorKind.VALIDATION),

  /** Handle or key does not resolve to a registered entity. */
  NOT_FOUND(ErrorKind.VALIDATION),

  /** Session token does not belong to a live session. */
  UNKNOWN_SESSION(ErrorKind.VALIDATION),

  /** Item or its category has been deactivated. */
  ITEM_NOT_PURCHASABLE(ErrorKind.STATE),

  /** Item has no sell price. */
  ITEM_NOT_SELLABLE(ErrorKind.STATE),

  /** Session is still loading, flushing, or already gone. */
  SESSION_NOT_ACTIVE(ErrorKind.STATE),

  /** Balance would drop below the configured floor. */
  INSUFFICIENT_FUNDS(ErrorKind.STATE),

  /** Balance would rise above the configured ceiling. */
  BALANCE_LIMIT(ErrorKind.STATE),

  /** Item is already in the session's inventory. */
  ALREADY_OWNED(ErrorKind.STATE),

  /** Item is not in the session's inventory. */
  NOT_OWNED(ErrorKind.STATE),

  /** Database connection dropped or could not be borrowed. */
  CONNECTION_LOST(ErrorKind.TRANSIENT_STORE),

  /** Deadlock, lock wait timeout or busy database. */
  DEADLOCK_RETRY_EXHAUSTED(ErrorKind.TRANSIENT_STORE),

  /** Statement violated a constraint; the enclosing transaction was rolled back. */
  INTEGRITY_VIOLATION(ErrorKind.INTEGRITY),

  /** Non-transient store failure (bad SQL, missing table). */
  STORE_FAILURE(ErrorKind.FATAL),

  /** Reads kept failing after every retry. */
  STORE_UNAVAILABLE(ErrorKind.FATAL),

  /** Session load did not complete within the configured wait. */
  LOAD_TIMEOUT(ErrorKind.FATAL),

  /** Final session write did not complete within the configured wait. */
  FLUSH_TIMEOUT(ErrorKind.FATAL),

  /** Request was pending when the gateway shut down. */
  ABORTED(ErrorKind.ABORTED);

  private final ErrorKind kind;

  ErrorCode(ErrorKind kind) {
    this.kind = kind;
  }

  /**
   * Taxonomy bucket for this code.
   *
   * @return error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Whether a read failing with this code may be retried.
   *
   * @return {@code true} for transient store failures
   */
  public boolean transientStore() {
    return kind == ErrorKind.TRANSIENT_STORE;
  }
}
