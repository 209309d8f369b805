/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.jdbc;

import dev.tradepost.api.ErrorCode;
import java.util.Objects;

/**
 * Failure delivered to a gateway continuation in place of an exception.
 *
 * @param code classified error code
 * @param message human readable detail
 * @param cause underlying exception, if any
 */
public record GatewayError(ErrorCode code, String message, Throwable cause) {

  public GatewayError {
    Objects.requireNonNull(code, "code");
  }

  static GatewayError aborted(String message) {
    return new GatewayError(ErrorCode.ABORTED, message, null);
  }
}
