/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.api;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Typed outcome returned by the extensibility API instead of throwing.
 *
 * @param ok whether the operation succeeded
 * @param value result value on success (may be {@code null} for void operations)
 * @param code error code on failure, {@code null} on success
 * @param message optional human-readable message
 * @param <T> value type
 */
public record Result<T>(boolean ok, T value, ErrorCode code, String message) {

  /**
   * Canonical constructor enforcing invariant checks.
   *
   * @param ok whether the operation succeeded
   * @param value value on success
   * @param code error code (required on failure)
   * @param message optional message
   */
  public Result {
    if (!ok && code == null) {
      throw new IllegalArgumentException("failure results require an error code");
    }
  }

  /**
   * Creates a success result.
   *
   * @param value value to carry
   * @param <T> value type
   * @return success outcome
   */
  public static <T> Result<T> success(T value) {
    return new Result<>(true, value, null, null);
  }

  /**
   * Creates a failure result.
   *
   * @param code canonical error code
   * @param message optional message
   * @param <T> value type
   * @return failure outcome
   */
  public static <T> Result<T> failure(ErrorCode code, String message) {
    return new Result<>(false, null, Objects.requireNonNull(code, "code"), message);
  }

  /**
   * Runs {@code work} and converts an {@link EconomyException} into a failure result.
   *
   * @param work operation to run
   * @param <T> value type
   * @return outcome of the operation
   */
  public static <T> Result<T> capture(Supplier<T> work) {
    try {
      return success(work.get());
    } catch (EconomyException e) {
      return failure(e.errorCode(), e.getMessage());
    }
  }

  /**
   * Returns the value or rethrows the failure.
   *
   * @return value on success
   * @throws EconomyException when this result is a failure
   */
  public T orElseThrow() {
    if (!ok) {
      throw new EconomyException(code, message == null ? code.name() : message);
    }
    return value;
  }
}
