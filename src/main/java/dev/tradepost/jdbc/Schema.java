/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Table names and boot-time DDL for the configured prefix.
 *
 * <p>{@link #apply(DataSource)} runs synchronously during startup before the server loop begins;
 * it is the only blocking store access in the core.
 */
public final class Schema {
  private static final Logger LOG = LoggerFactory.getLogger("tradepost");
  private static final Pattern PREFIX = Pattern.compile("[A-Za-z0-9_]{0,32}");

  /** Current schema version recorded in {@code <prefix>schema_version}. */
  public static final int VERSION = 1;

  private final Dialect dialect;
  private final String prefix;

  /**
   * Creates a schema descriptor.
   *
   * @param dialect backend dialect
   * @param prefix table prefix, {@code [A-Za-z0-9_]{0,32}}
   */
  public Schema(Dialect dialect, String prefix) {
    String p = prefix == null ? "" : prefix;
    if (!PREFIX.matcher(p).matches()) {
      throw new IllegalArgumentException("table prefix must match [A-Za-z0-9_]{0,32}: " + prefix);
    }
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.prefix = p;
  }

  public Dialect dialect() {
    return dialect;
  }

  public String users() {
    return prefix + "users";
  }

  public String inventory() {
    return prefix + "inventory";
  }

  public String schemaVersion() {
    return prefix + "schema_version";
  }

  /** Upsert of a user row: identity, balance, createdAtS, updatedAtS. */
  public String upsertUser() {
    return dialect.upsertUser(prefix);
  }

  /** Insert of a default user row that keeps any existing row. */
  public String insertUserIfAbsent() {
    return dialect.insertIgnore(
        users(), "identity, balance, created_at_s, updated_at_s", "?, ?, ?, ?");
  }

  /**
   * Creates missing tables and records the schema version.
   *
   * @param ds datasource
   * @throws SQLException if DDL fails
   */
  public void apply(DataSource ds) throws SQLException {
    try (Connection c = ds.getConnection()) {
      try (Statement st = c.createStatement()) {
        for (String ddl : dialect.createTables(prefix)) {
          st.execute(ddl);
        }
      }
      String sql = dialect.insertIgnore(schemaVersion(), "version, applied_at_s", "?, ?");
      try (PreparedStatement ps = c.prepareStatement(sql)) {
        ps.setInt(1, VERSION);
        ps.setLong(2, System.currentTimeMillis() / 1000L);
        ps.executeUpdate();
      }
    }
    LOG.info(
        "(tradepost) schema ready backend={} prefix={} version={}",
        dialect.name().toLowerCase(Locale.ROOT),
        prefix,
        VERSION);
  }
}
