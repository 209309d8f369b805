/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.api;

/** Coarse failure taxonomy used to decide whether a failure is retried, surfaced, or fatal. */
public enum ErrorKind {
  /** Bad handle, duplicate key, out-of-range value. Rejected synchronously, no side effect. */
  VALIDATION,

  /** Operation not allowed in the current session state (includes insufficient funds). */
  STATE,

  /** Connection drop, deadlock or timeout; reads are retried, writes are surfaced. */
  TRANSIENT_STORE,

  /** A transaction was rolled back as a unit. */
  INTEGRITY,

  /** Store unreachable past the retry budget or a bounded wait elapsed. */
  FATAL,

  /** Work drained while the gateway was shutting down. */
  ABORTED
}
