/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.api;

import java.util.Objects;

/** Indicates that a registry or session operation was rejected without side effects. */
public final class EconomyException extends RuntimeException {
  private final ErrorCode errorCode;

  public EconomyException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
  }

  public ErrorCode errorCode() {
    return errorCode;
  }
}
