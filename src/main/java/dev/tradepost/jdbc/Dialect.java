/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.jdbc;

import java.util.List;
import java.util.Locale;

/** SQL differences between the supported backends. */
public enum Dialect {
  MARIADB {
    @Override
    List<String> createTables(String p) {
      return List.of(
          "CREATE TABLE IF NOT EXISTS "
              + p
              + "schema_version ("
              + "version INT NOT NULL PRIMARY KEY,"
              + "applied_at_s BIGINT UNSIGNED NOT NULL"
              + ") ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 COLLATE=utf8mb4_bin",
          "CREATE TABLE IF NOT EXISTS "
              + p
              + "users ("
              + "identity VARCHAR(64) NOT NULL PRIMARY KEY,"
              + "balance BIGINT NOT NULL,"
              + "created_at_s BIGINT UNSIGNED NOT NULL,"
              + "updated_at_s BIGINT UNSIGNED NOT NULL"
              + ") ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 COLLATE=utf8mb4_bin",
          "CREATE TABLE IF NOT EXISTS "
              + p
              + "inventory ("
              + "identity VARCHAR(64) NOT NULL,"
              + "category_key VARCHAR(64) NOT NULL,"
              + "item_key VARCHAR(64) NOT NULL,"
              + "acquired_at_s BIGINT UNSIGNED NOT NULL,"
              + "price_paid BIGINT NOT NULL,"
              + "expires_at_s BIGINT NOT NULL DEFAULT 0,"
              + "PRIMARY KEY (identity, category_key, item_key),"
              + "KEY idx_"
              + p
              + "inventory_expiry (expires_at_s)"
              + ") ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 COLLATE=utf8mb4_bin");
    }

    @Override
    String insertIgnore(String table, String columns, String placeholders) {
      return "INSERT IGNORE INTO " + table + " (" + columns + ") VALUES (" + placeholders + ")";
    }

    @Override
    String upsertUser(String p) {
      return "INSERT INTO "
          + p
          + "users (identity, balance, created_at_s, updated_at_s) VALUES (?, ?, ?, ?) "
          + "ON DUPLICATE KEY UPDATE balance=VALUES(balance), updated_at_s=VALUES(updated_at_s)";
    }
  },

  SQLITE {
    @Override
    List<String> createTables(String p) {
      return List.of(
          "CREATE TABLE IF NOT EXISTS "
              + p
              + "schema_version ("
              + "version INTEGER NOT NULL PRIMARY KEY,"
              + "applied_at_s INTEGER NOT NULL)",
          "CREATE TABLE IF NOT EXISTS "
              + p
              + "users ("
              + "identity TEXT NOT NULL PRIMARY KEY,"
              + "balance INTEGER NOT NULL,"
              + "created_at_s INTEGER NOT NULL,"
              + "updated_at_s INTEGER NOT NULL)",
          "CREATE TABLE IF NOT EXISTS "
              + p
              + "inventory ("
              + "identity TEXT NOT NULL,"
              + "category_key TEXT NOT NULL,"
              + "item_key TEXT NOT NULL,"
              + "acquired_at_s INTEGER NOT NULL,"
              + "price_paid INTEGER NOT NULL,"
              + "expires_at_s INTEGER NOT NULL DEFAULT 0,"
              + "PRIMARY KEY (identity, category_key, item_key))",
          "CREATE INDEX IF NOT EXISTS idx_"
              + p
              + "inventory_expiry ON "
              + p
              + "inventory (expires_at_s)");
    }

    @Override
    String insertIgnore(String table, String columns, String placeholders) {
      return "INSERT OR IGNORE INTO " + table + " (" + columns + ") VALUES (" + placeholders + ")";
    }

    @Override
    String upsertUser(String p) {
      return "INSERT INTO "
          + p
          + "users (identity, balance, created_at_s, updated_at_s) VALUES (?, ?, ?, ?) "
          + "ON CONFLICT(identity) DO UPDATE SET balance=excluded.balance, "
          + "updated_at_s=excluded.updated_at_s";
    }
  };

  /** Idempotent DDL for every table, in creation order. */
  abstract List<String> createTables(String prefix);

  /** Insert that silently keeps an existing row with the same key. */
  abstract String insertIgnore(String table, String columns, String placeholders);

  /** Insert-or-update of a user row; parameters are identity, balance, created, updated. */
  abstract String upsertUser(String prefix);

  /**
   * Parses the {@code core.db.backend} value.
   *
   * @param raw configured value
   * @return dialect
   * @throws IllegalStateException for unknown backends
   */
  public static Dialect from(String raw) {
    if (raw == null) {
      return MARIADB;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "mariadb", "mysql" -> MARIADB;
      case "sqlite" -> SQLITE;
      default -> throw new IllegalStateException("core.db.backend must be mariadb or sqlite");
    };
  }
}
