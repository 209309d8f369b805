/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.jdbc;

import dev.tradepost.api.ErrorCode;
import java.sql.SQLException;
import java.util.Locale;

/** Utility that maps JDBC {@link SQLException} instances to Tradepost {@link ErrorCode}s. */
public final class SqlErrorCodes {

  private SqlErrorCodes() {}

  /**
   * Classifies a SQL exception into one of the canonical {@link ErrorCode} values.
   *
   * <p>SQLState class wins, then MariaDB/SQLite vendor codes, then message heuristics.
   *
   * @param e SQL exception thrown by MariaDB/MySQL or SQLite
   * @return mapped {@link ErrorCode}, defaulting to {@link ErrorCode#CONNECTION_LOST}
   */
  public static ErrorCode classify(SQLException e) {
    if (e == null) {
      return ErrorCode.CONNECTION_LOST;
    }
    String state = e.getSQLState();
    if (state != null && state.length() >= 2) {
      switch (state.substring(0, 2)) {
        case "40":
        case "41":
          return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
        case "23":
          return ErrorCode.INTEGRITY_VIOLATION;
        case "08":
        case "28":
          return ErrorCode.CONNECTION_LOST;
        case "42":
          return ErrorCode.STORE_FAILURE;
        default:
          break;
      }
    }

    int vendor = e.getErrorCode();
    if (vendor == 1213 || vendor == 1205) {
      return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
    }
    if (isConstraintVendorCode(vendor)) {
      return ErrorCode.INTEGRITY_VIOLATION;
    }
    // SQLITE_BUSY / SQLITE_LOCKED
    if (vendor == 5 || vendor == 6) {
      return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
    }
    // SQLITE_CONSTRAINT
    if (vendor == 19) {
      return ErrorCode.INTEGRITY_VIOLATION;
    }

    String message = e.getMessage();
    if (message != null) {
      String lower = message.toLowerCase(Locale.ROOT);
      if (lower.contains("deadlock")
          || lower.contains("lock wait timeout")
          || lower.contains("database is locked")) {
        return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
      }
      if (looksLikeConstraint(lower)) {
        return ErrorCode.INTEGRITY_VIOLATION;
      }
      if (lower.contains("no such table") || lower.contains("syntax error")) {
        return ErrorCode.STORE_FAILURE;
      }
    }
    return ErrorCode.CONNECTION_LOST;
  }

  private static boolean isConstraintVendorCode(int vendor) {
    return vendor == 1022
        || vendor == 1062
        || vendor == 1216
        || vendor == 1217
        || vendor == 1451
        || vendor == 1452
        || vendor == 1586
        || vendor == 1761;
  }

  private static boolean looksLikeConstraint(String lowerMessage) {
    return lowerMessage.contains("duplicate")
        || lowerMessage.contains("unique constraint")
        || lowerMessage.contains("constraint failed")
        || lowerMessage.contains("foreign key")
        || lowerMessage.contains("primary key");
  }
}
