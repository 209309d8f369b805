/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.api;

/** Lifecycle of a cached player session. */
public enum SessionState {
  /** Load request issued; balance and inventory not yet known. */
  LOADING,
  /** Loaded; accepts mutations. */
  ACTIVE,
  /** Player left; final write in flight. */
  FLUSHING,
  /** Final write confirmed; record released. */
  RETIRED,
  /** Load or final write failed or timed out; record released. */
  FAILED;

  /**
   * Whether the session has left memory.
   *
   * @return {@code true} for {@link #RETIRED} and {@link #FAILED}
   */
  public boolean terminal() {
    return this == RETIRED || this == FAILED;
  }
}
