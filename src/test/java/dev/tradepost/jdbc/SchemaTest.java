/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SchemaTest {

  @Test
  void prefixIsAppliedToEveryTable() {
    Schema schema = new Schema(Dialect.MARIADB, "srv1_");

    assertEquals("srv1_users", schema.users());
    assertEquals("srv1_inventory", schema.inventory());
    assertEquals("srv1_schema_version", schema.schemaVersion());
    assertTrue(schema.upsertUser().startsWith("INSERT INTO srv1_users"));
    assertTrue(schema.insertUserIfAbsent().startsWith("INSERT IGNORE INTO srv1_users"));
  }

  @Test
  void dialectsUseTheirOwnUpsertForms() {
    assertTrue(new Schema(Dialect.MARIADB, "").upsertUser().contains("ON DUPLICATE KEY UPDATE"));
    assertTrue(new Schema(Dialect.SQLITE, "").upsertUser().contains("ON CONFLICT(identity)"));
    assertTrue(
        new Schema(Dialect.SQLITE, "").insertUserIfAbsent().startsWith("INSERT OR IGNORE INTO"));
  }

  @Test
  void unsafePrefixIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new Schema(Dialect.SQLITE, "x; DROP"));
    assertThrows(IllegalArgumentException.class, () -> new Schema(Dialect.SQLITE, "a".repeat(33)));
  }

  @Test
  void backendNamesAreParsedLeniently() {
    assertEquals(Dialect.MARIADB, Dialect.from("MariaDB"));
    assertEquals(Dialect.MARIADB, Dialect.from("mysql"));
    assertEquals(Dialect.SQLITE, Dialect.from(" sqlite "));
    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> Dialect.from("postgres"));
    assertEquals("core.db.backend must be mariadb or sqlite", e.getMessage());
  }
}
