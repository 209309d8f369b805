/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.tradepost.jdbc.Dialect;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigTest {

  private static String sqliteConfig(String economy) {
    return """
        // test config
        {
          core: {
            db: {
              backend: "sqlite",
              sqlite: { file: "./data/test.db" }, // trailing comment
              tablePrefix: "tp_",
            },
            economy: %s,
            log: { level: "warn" },
          },
        }
        """
        .formatted(economy);
  }

  @Test
  void templateParsesWithDefaults() {
    Config cfg = Config.parse(Config.TEMPLATE, Map.of());

    assertEquals(Dialect.MARIADB, cfg.db().backend());
    assertEquals("tp_", cfg.db().tablePrefix());
    assertEquals(4, cfg.gateway().ioThreads());
    assertEquals(3, cfg.gateway().readRetries());
    assertEquals(60, cfg.sessions().flushIntervalS());
    assertEquals(1_000_000_000L, cfg.economy().creditCeiling());
    assertEquals(
        "jdbc:mariadb://127.0.0.1:3306/tradepost?useUnicode=true&characterEncoding=utf8mb4"
            + "&serverTimezone=UTC&sslMode=disable",
        cfg.db().jdbcUrl());
  }

  @Test
  void sqliteBackendSkipsServerFields() {
    Config cfg =
        Config.parse(
            sqliteConfig("{ startingBalance: 2000, creditFloor: 0, creditCeiling: 5000 }"),
            Map.of());

    assertEquals(Dialect.SQLITE, cfg.db().backend());
    assertEquals("jdbc:sqlite:./data/test.db", cfg.db().jdbcUrl());
    assertEquals(2000, cfg.economy().startingBalance());
    assertEquals("warn", cfg.log().level());
  }

  @Test
  void creditBoundsMustContainStartingBalance() {
    IllegalStateException floor =
        assertThrows(
            IllegalStateException.class,
            () ->
                Config.parse(
                    sqliteConfig("{ startingBalance: 10, creditFloor: 20, creditCeiling: 50 }"),
                    Map.of()));
    assertEquals("core.economy.creditFloor must be <= startingBalance", floor.getMessage());

    IllegalStateException ceiling =
        assertThrows(
            IllegalStateException.class,
            () ->
                Config.parse(
                    sqliteConfig("{ startingBalance: 100, creditFloor: 0, creditCeiling: 50 }"),
                    Map.of()));
    assertEquals("core.economy.creditCeiling must be >= startingBalance", ceiling.getMessage());
  }

  @Test
  void rangeViolationsNameTheKey() {
    String badThreads = Config.TEMPLATE.replace("ioThreads: 4", "ioThreads: 0");
    String badPrefix = Config.TEMPLATE.replace("tablePrefix: \"tp_\"", "tablePrefix: \"tp-\"");
    String badLevel = Config.TEMPLATE.replace("level: \"INFO\"", "level: \"LOUD\"");

    assertEquals(
        "core.gateway.ioThreads must be between 1 and 64",
        assertThrows(IllegalStateException.class, () -> Config.parse(badThreads, Map.of()))
            .getMessage());
    assertEquals(
        "core.db.tablePrefix must match [A-Za-z0-9_]{0,32}",
        assertThrows(IllegalStateException.class, () -> Config.parse(badPrefix, Map.of()))
            .getMessage());
    assertEquals(
        "core.log.level must be TRACE, DEBUG, INFO, WARN, or ERROR",
        assertThrows(IllegalStateException.class, () -> Config.parse(badLevel, Map.of()))
            .getMessage());
  }

  @Test
  void environmentOverridesConnection() {
    Config cfg =
        Config.parse(
            Config.TEMPLATE,
            Map.of(
                "TRADEPOST_DB_HOST", "db.internal",
                "TRADEPOST_DB_PORT", "3307",
                "TRADEPOST_DB_PASSWORD", "s3cret"));

    assertEquals("db.internal", cfg.db().host());
    assertEquals(3307, cfg.db().port());
    assertEquals("s3cret", cfg.db().password());

    Config sqlite = Config.parse(Config.TEMPLATE, Map.of("TRADEPOST_DB_BACKEND", "sqlite"));
    assertEquals(Dialect.SQLITE, sqlite.db().backend());

    IllegalStateException badPort =
        assertThrows(
            IllegalStateException.class,
            () -> Config.parse(Config.TEMPLATE, Map.of("TRADEPOST_DB_PORT", "abc")));
    assertEquals("TRADEPOST_DB_PORT must be a number", badPort.getMessage());
  }

  @Test
  void missingCoreBlockAndBrokenSyntaxAreReported() {
    assertEquals(
        "config missing core{} block",
        assertThrows(IllegalStateException.class, () -> Config.parse("{ other: {} }", Map.of()))
            .getMessage());
    assertTrue(
        assertThrows(IllegalStateException.class, () -> Config.parse("{ core: ", Map.of()))
            .getMessage()
            .startsWith("config is not valid JSON5"));
  }

  @Test
  void stripJson5KeepsCommentMarkersInsideStrings() {
    String raw =
        """
        {
          "user": "tradepost//primary", // comment
          "password": "pa/*ss*/word", /* block */
          "url": 'https://example.com/a,b',
        }
        """;

    String stripped = Config.stripJson5(raw);

    assertTrue(stripped.contains("\"tradepost//primary\""));
    assertTrue(stripped.contains("\"pa/*ss*/word\""));
    assertTrue(stripped.contains("'https://example.com/a,b'"));
    assertFalse(stripped.contains("comment"));
    assertFalse(stripped.contains("block"));
    assertFalse(stripped.replaceAll("\\s", "").contains(",}"));
  }

  @Test
  void firstLoadWritesTemplateAndExample(@TempDir Path tempDir) throws IOException {
    Path configPath = tempDir.resolve("config").resolve("tradepost.json5");

    Config cfg = Config.loadOrWriteDefault(configPath, Map.of());

    assertTrue(Files.exists(configPath));
    assertEquals(Config.TEMPLATE, Files.readString(configPath, StandardCharsets.UTF_8));
    assertTrue(Files.exists(configPath.resolveSibling("tradepost.json5.example")));
    assertEquals(Dialect.MARIADB, cfg.db().backend());
  }

  @Test
  void existingFileIsNotOverwritten(@TempDir Path tempDir) throws IOException {
    Path configPath = tempDir.resolve("tradepost.json5");
    String custom =
        sqliteConfig("{ startingBalance: 5, creditFloor: 0, creditCeiling: 10 }");
    Files.writeString(configPath, custom, StandardCharsets.UTF_8);

    Config cfg = Config.loadOrWriteDefault(configPath, Map.of());

    assertEquals(5, cfg.economy().startingBalance());
    assertEquals(custom, Files.readString(configPath, StandardCharsets.UTF_8));
  }
}
