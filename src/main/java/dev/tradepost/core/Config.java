/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.core;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;
import dev.tradepost.jdbc.Dialect;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runtime configuration loaded from {@code config/tradepost.json5}.
 *
 * <ul>
 *   <li>Writes a commented template on first boot.
 *   <li>Emits a {@code tradepost.json5.example} snapshot for ops tooling.
 *   <li>Supports environment overrides for the DB connection ({@code TRADEPOST_DB_*}).
 *   <li>Parses the database, gateway, economy, session and logging blocks.
 * </ul>
 */
public final class Config {

  static final String TEMPLATE =
      """
      // Tradepost v1.0.0 configuration (JSON5 with comments)
      // Drop into config/tradepost.json5.
      // Environment overrides: TRADEPOST_DB_BACKEND|HOST|PORT|DATABASE|USER|PASSWORD.
      {
        core: {
          db: {
            backend: "mariadb",          // mariadb | sqlite
            host: "127.0.0.1",
            port: 3306,
            database: "tradepost",
            user: "tradepost",
            password: "change-me",
            tls: { enabled: false },
            sqlite: { file: "./data/tradepost.db" },
            tablePrefix: "tp_",
            pool: {
              maxPoolSize: 10,
              minimumIdle: 2,
              connectionTimeoutMs: 10000,
              idleTimeoutMs: 600000,
              maxLifetimeMs: 1700000,
              startupAttempts: 3
            }
          },
          gateway: {
            ioThreads: 4,
            readRetries: 3,
            retryBackoffMs: 50,
            shutdownTimeoutS: 10
          },
          economy: {
            startingBalance: 0,
            creditFloor: 0,
            creditCeiling: 1000000000
          },
          sessions: {
            flushIntervalS: 60,
            loadTimeoutS: 15,
            flushTimeoutS: 30,
            maxFlushAttempts: 3
          },
          log: {
            json: false,
            slowQueryMs: 250,
            level: "INFO"
          }
        }
      }
      """;

  private final Db db;
  private final Gateway gateway;
  private final Economy economy;
  private final Sessions sessions;
  private final Log log;

  private Config(Db db, Gateway gateway, Economy economy, Sessions sessions, Log log) {
    this.db = db;
    this.gateway = gateway;
    this.economy = economy;
    this.sessions = sessions;
    this.log = log;
  }

  /**
   * Database connection block.
   *
   * @return database settings
   */
  public Db db() {
    return db;
  }

  /**
   * Persistence gateway tuning.
   *
   * @return gateway settings
   */
  public Gateway gateway() {
    return gateway;
  }

  public Economy economy() {
    return economy;
  }

  public Sessions sessions() {
    return sessions;
  }

  /**
   * Logging configuration.
   *
   * @return logging configuration block
   */
  public Log log() {
    return log;
  }

  /**
   * Loads configuration, writing a default file if it does not exist and always refreshing the
   * commented example alongside it.
   *
   * @param path config path
   * @return parsed config
   */
  public static Config loadOrWriteDefault(Path path) {
    return loadOrWriteDefault(path, System.getenv());
  }

  static Config loadOrWriteDefault(Path path, Map<String, String> env) {
    try {
      Path configDir = path.getParent();
      Path exampleDir = configDir != null ? configDir : Path.of(".");
      ConfigTemplateWriter.writeExample(exampleDir.resolve("tradepost.json5.example"), TEMPLATE);

      if (!Files.exists(path)) {
        if (configDir != null) {
          Files.createDirectories(configDir);
        }
        Files.writeString(path, TEMPLATE, StandardCharsets.UTF_8);
      }
      return parse(Files.readString(path, StandardCharsets.UTF_8), env);
    } catch (IOException e) {
      throw new RuntimeException("Failed to read config: " + path, e);
    }
  }

  /**
   * Parses and validates configuration text.
   *
   * @param raw JSON5 text
   * @param env environment used for {@code TRADEPOST_DB_*} overrides
   * @return parsed config
   * @throws IllegalStateException naming the offending key when validation fails
   */
  static Config parse(String raw, Map<String, String> env) {
    JsonObject root;
    try {
      root = JsonParser.parseString(stripJson5(raw)).getAsJsonObject();
    } catch (JsonSyntaxException | IllegalStateException e) {
      throw new IllegalStateException("config is not valid JSON5: " + e.getMessage(), e);
    }
    JsonObject core = optObject(root, "core");
    if (core == null) {
      throw new IllegalStateException("config missing core{} block");
    }
    Config config =
        new Config(
            parseDb(optObject(core, "db"), env),
            parseGateway(optObject(core, "gateway")),
            parseEconomy(optObject(core, "economy")),
            parseSessions(optObject(core, "sessions")),
            parseLog(optObject(core, "log")));
    validate(config);
    return config;
  }

  /** Removes comments and trailing commas, leaving string literals untouched. */
  static String stripJson5(String raw) {
    return dropTrailingCommas(dropComments(raw));
  }

  private static String dropComments(String raw) {
    StringBuilder out = new StringBuilder(raw.length());
    int i = 0;
    int n = raw.length();
    while (i < n) {
      char c = raw.charAt(i);
      if (c == '"' || c == '\'') {
        int end = skipString(raw, i);
        out.append(raw, i, end);
        i = end;
      } else if (c == '/' && i + 1 < n && raw.charAt(i + 1) == '/') {
        while (i < n && raw.charAt(i) != '\n') {
          i++;
        }
      } else if (c == '/' && i + 1 < n && raw.charAt(i + 1) == '*') {
        int close = raw.indexOf("*/", i + 2);
        i = close < 0 ? n : close + 2;
      } else {
        out.append(c);
        i++;
      }
    }
    return out.toString();
  }

  private static String dropTrailingCommas(String raw) {
    StringBuilder out = new StringBuilder(raw.length());
    int i = 0;
    int n = raw.length();
    while (i < n) {
      char c = raw.charAt(i);
      if (c == '"' || c == '\'') {
        int end = skipString(raw, i);
        out.append(raw, i, end);
        i = end;
        continue;
      }
      if (c == ',') {
        int next = i + 1;
        while (next < n && Character.isWhitespace(raw.charAt(next))) {
          next++;
        }
        if (next < n && (raw.charAt(next) == '}' || raw.charAt(next) == ']')) {
          i++;
          continue;
        }
      }
      out.append(c);
      i++;
    }
    return out.toString();
  }

  private static int skipString(String raw, int start) {
    char quote = raw.charAt(start);
    int end = start + 1;
    while (end < raw.length() && raw.charAt(end) != quote) {
      end += raw.charAt(end) == '\\' ? 2 : 1;
    }
    return Math.min(end + 1, raw.length());
  }

  private static Db parseDb(JsonObject db, Map<String, String> env) {
    if (db == null) {
      throw new IllegalStateException("config missing core.db{}");
    }
    String envBackend = env.get("TRADEPOST_DB_BACKEND");
    String envHost = env.get("TRADEPOST_DB_HOST");
    String envPort = env.get("TRADEPOST_DB_PORT");
    String envDatabase = env.get("TRADEPOST_DB_DATABASE");
    String envUser = env.get("TRADEPOST_DB_USER");
    String envPassword = env.get("TRADEPOST_DB_PASSWORD");

    String backendRaw = envBackend != null ? envBackend : optString(db, "backend", "mariadb");
    Dialect backend = Dialect.from(backendRaw);
    String host = envHost != null ? envHost : optString(db, "host", "127.0.0.1");
    int port;
    try {
      port = envPort != null ? Integer.parseInt(envPort.trim()) : optInt(db, "port", 3306);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("TRADEPOST_DB_PORT must be a number", e);
    }
    String database = envDatabase != null ? envDatabase : optString(db, "database", "tradepost");
    String user = envUser != null ? envUser : optString(db, "user", "tradepost");
    String password = envPassword != null ? envPassword : optString(db, "password", "");

    JsonObject tlsObj = optObject(db, "tls");
    boolean tls = tlsObj != null && optBoolean(tlsObj, "enabled", false);

    JsonObject sqliteObj = optObject(db, "sqlite");
    String sqliteFile = optString(sqliteObj, "file", "./data/tradepost.db");
    String prefix = optString(db, "tablePrefix", "tp_");

    JsonObject poolObj = optObject(db, "pool");
    int maxPool = optInt(poolObj, "maxPoolSize", 10);
    int minIdle = optInt(poolObj, "minimumIdle", 2);
    long connTimeout = optLong(poolObj, "connectionTimeoutMs", 10_000L);
    long idleTimeout = optLong(poolObj, "idleTimeoutMs", 600_000L);
    long maxLifetime = optLong(poolObj, "maxLifetimeMs", 1_700_000L);
    int startupAttempts = optInt(poolObj, "startupAttempts", 3);

    return new Db(
        backend,
        host,
        port,
        database,
        user,
        password,
        tls,
        sqliteFile,
        prefix,
        new Pool(maxPool, minIdle, connTimeout, idleTimeout, maxLifetime, startupAttempts));
  }

  private static Gateway parseGateway(JsonObject gateway) {
    return new Gateway(
        optInt(gateway, "ioThreads", 4),
        optInt(gateway, "readRetries", 3),
        optLong(gateway, "retryBackoffMs", 50L),
        optLong(gateway, "shutdownTimeoutS", 10L));
  }

  private static Economy parseEconomy(JsonObject economy) {
    return new Economy(
        optLong(economy, "startingBalance", 0L),
        optLong(economy, "creditFloor", 0L),
        optLong(economy, "creditCeiling", 1_000_000_000L));
  }

  private static Sessions parseSessions(JsonObject sessions) {
    return new Sessions(
        optLong(sessions, "flushIntervalS", 60L),
        optLong(sessions, "loadTimeoutS", 15L),
        optLong(sessions, "flushTimeoutS", 30L),
        optInt(sessions, "maxFlushAttempts", 3));
  }

  private static Log parseLog(JsonObject log) {
    if (log == null) {
      return new Log(false, 250L, "INFO");
    }
    boolean json = optBoolean(log, "json", false);
    long slow = optLong(log, "slowQueryMs", 250L);
    String level = optString(log, "level", "INFO");
    return new Log(json, slow, level);
  }

  private static JsonObject optObject(JsonObject parent, String key) {
    return parent != null && parent.has(key) && parent.get(key).isJsonObject()
        ? parent.getAsJsonObject(key)
        : null;
  }

  private static boolean optBoolean(JsonObject obj, String key, boolean def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsBoolean() : def;
  }

  private static int optInt(JsonObject obj, String key, int def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsInt() : def;
  }

  private static long optLong(JsonObject obj, String key, long def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsLong() : def;
  }

  private static String optString(JsonObject obj, String key, String def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsString() : def;
  }

  private static void validate(Config cfg) {
    validateDb(cfg.db());
    validateGateway(cfg.gateway());
    validateEconomy(cfg.economy());
    validateSessions(cfg.sessions());
    validateLog(cfg.log());
  }

  private static void validateDb(Db db) {
    if (!db.tablePrefix().matches("[A-Za-z0-9_]{0,32}")) {
      throw new IllegalStateException("core.db.tablePrefix must match [A-Za-z0-9_]{0,32}");
    }
    if (db.backend() == Dialect.SQLITE) {
      requireNonBlank(db.sqliteFile(), "core.db.sqlite.file");
      try {
        Path.of(db.sqliteFile());
      } catch (Exception e) {
        throw new IllegalStateException("core.db.sqlite.file must be a valid file system path", e);
      }
    } else {
      requireNonBlank(db.host(), "core.db.host");
      requireNonBlank(db.database(), "core.db.database");
      requireNonBlank(db.user(), "core.db.user");
      requireNonBlank(db.password(), "core.db.password");
      if (db.port() <= 0 || db.port() > 65535) {
        throw new IllegalStateException("core.db.port must be between 1 and 65535");
      }
      if (db.host().contains(" ")) {
        throw new IllegalStateException("core.db.host must not contain spaces");
      }
      if (!db.database().matches("[A-Za-z0-9_]+")) {
        throw new IllegalStateException("core.db.database must match [A-Za-z0-9_]+");
      }
    }
    int maxPool = db.pool().maxPoolSize();
    if (maxPool < 1 || maxPool > 50) {
      throw new IllegalStateException("core.db.pool.maxPoolSize must be between 1 and 50");
    }
    int minIdle = db.pool().minimumIdle();
    if (minIdle < 0 || minIdle > maxPool) {
      throw new IllegalStateException("core.db.pool.minimumIdle must be between 0 and maxPoolSize");
    }
    long connectionTimeout = db.pool().connectionTimeoutMs();
    if (connectionTimeout < 1_000 || connectionTimeout > 120_000) {
      throw new IllegalStateException(
          "core.db.pool.connectionTimeoutMs must be between 1000 and 120000");
    }
    long idleTimeout = db.pool().idleTimeoutMs();
    if (idleTimeout < 10_000 || idleTimeout > 3_600_000) {
      throw new IllegalStateException(
          "core.db.pool.idleTimeoutMs must be between 10000 and 3600000");
    }
    long maxLifetime = db.pool().maxLifetimeMs();
    if (maxLifetime < 30_000L || maxLifetime > 3_600_000L) {
      throw new IllegalStateException(
          "core.db.pool.maxLifetimeMs must be between 30000 and 3600000");
    }
    int attempts = db.pool().startupAttempts();
    if (attempts < 1 || attempts > 10) {
      throw new IllegalStateException("core.db.pool.startupAttempts must be between 1 and 10");
    }
    if (idleTimeout >= maxLifetime) {
      throw new IllegalStateException("core.db.pool.idleTimeoutMs must be less than maxLifetimeMs");
    }
  }

  private static void validateGateway(Gateway gateway) {
    if (gateway.ioThreads() < 1 || gateway.ioThreads() > 64) {
      throw new IllegalStateException("core.gateway.ioThreads must be between 1 and 64");
    }
    if (gateway.readRetries() < 0 || gateway.readRetries() > 10) {
      throw new IllegalStateException("core.gateway.readRetries must be between 0 and 10");
    }
    if (gateway.retryBackoffMs() < 0 || gateway.retryBackoffMs() > 10_000) {
      throw new IllegalStateException("core.gateway.retryBackoffMs must be between 0 and 10000");
    }
    if (gateway.shutdownTimeoutS() < 1 || gateway.shutdownTimeoutS() > 300) {
      throw new IllegalStateException("core.gateway.shutdownTimeoutS must be between 1 and 300");
    }
  }

  private static void validateEconomy(Economy economy) {
    if (economy.creditFloor() > economy.startingBalance()) {
      throw new IllegalStateException("core.economy.creditFloor must be <= startingBalance");
    }
    if (economy.startingBalance() > economy.creditCeiling()) {
      throw new IllegalStateException("core.economy.creditCeiling must be >= startingBalance");
    }
  }

  private static void validateSessions(Sessions sessions) {
    if (sessions.flushIntervalS() < 1 || sessions.flushIntervalS() > 3600) {
      throw new IllegalStateException("core.sessions.flushIntervalS must be between 1 and 3600");
    }
    if (sessions.loadTimeoutS() < 1 || sessions.loadTimeoutS() > 600) {
      throw new IllegalStateException("core.sessions.loadTimeoutS must be between 1 and 600");
    }
    if (sessions.flushTimeoutS() < 1 || sessions.flushTimeoutS() > 600) {
      throw new IllegalStateException("core.sessions.flushTimeoutS must be between 1 and 600");
    }
    if (sessions.maxFlushAttempts() < 1 || sessions.maxFlushAttempts() > 20) {
      throw new IllegalStateException("core.sessions.maxFlushAttempts must be between 1 and 20");
    }
  }

  private static void validateLog(Log log) {
    if (log.slowQueryMs() < 0) {
      throw new IllegalStateException("core.log.slowQueryMs must be >= 0");
    }
    requireNonBlank(log.level(), "core.log.level");
    String normalized = log.level().toUpperCase(Locale.ROOT);
    if (!List.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR").contains(normalized)) {
      throw new IllegalStateException("core.log.level must be TRACE, DEBUG, INFO, WARN, or ERROR");
    }
  }

  private static void requireNonBlank(String value, String field) {
    if (value == null || value.trim().isEmpty()) {
      throw new IllegalStateException(field + " must be provided");
    }
  }

  /**
   * Database settings parsed from {@code core.db}.
   *
   * @param backend store backend
   * @param host hostname or IP for the MariaDB/MySQL server
   * @param port TCP port for the database service
   * @param database schema name to use when connecting
   * @param user database user with least-privilege grants
   * @param password password for the configured {@code user}
   * @param tlsEnabled whether to request TLS/SSL when connecting
   * @param sqliteFile database file for the SQLite backend
   * @param tablePrefix prefix applied to every table name
   * @param pool pool tuning overrides applied to HikariCP
   */
  public record Db(
      Dialect backend,
      String host,
      int port,
      String database,
      String user,
      String password,
      boolean tlsEnabled,
      String sqliteFile,
      String tablePrefix,
      Pool pool) {

    /**
     * Fully formed JDBC URL for the configured backend.
     *
     * @return JDBC URL string
     */
    public String jdbcUrl() {
      if (backend == Dialect.SQLITE) {
        return "jdbc:sqlite:" + sqliteFile;
      }
      StringBuilder url =
          new StringBuilder("jdbc:mariadb://")
              .append(host)
              .append(':')
              .append(port)
              .append('/')
              .append(database)
              .append("?useUnicode=true&characterEncoding=utf8mb4&serverTimezone=UTC");
      if (tlsEnabled) {
        url.append("&sslMode=verify-full");
      } else {
        url.append("&sslMode=disable");
      }
      return url.toString();
    }
  }

  /**
   * Connection pool tuning.
   *
   * @param maxPoolSize maximum number of pooled connections
   * @param minimumIdle minimum number of idle connections to retain
   * @param connectionTimeoutMs wait time when borrowing a connection
   * @param idleTimeoutMs idle connection eviction threshold
   * @param maxLifetimeMs maximum lifetime of each connection
   * @param startupAttempts retry count when initializing the pool
   */
  public record Pool(
      int maxPoolSize,
      int minimumIdle,
      long connectionTimeoutMs,
      long idleTimeoutMs,
      long maxLifetimeMs,
      int startupAttempts) {}

  /**
   * Persistence gateway tuning.
   *
   * @param ioThreads blocking I/O threads
   * @param readRetries extra attempts for reads failing transiently
   * @param retryBackoffMs base backoff, multiplied by the attempt number
   * @param shutdownTimeoutS wait for in-flight work at shutdown
   */
  public record Gateway(
      int ioThreads, int readRetries, long retryBackoffMs, long shutdownTimeoutS) {}

  /**
   * Balance rules.
   *
   * @param startingBalance balance of a newly created account
   * @param creditFloor lowest permitted balance
   * @param creditCeiling highest permitted balance
   */
  public record Economy(long startingBalance, long creditFloor, long creditCeiling) {}

  /**
   * Session cache timing.
   *
   * @param flushIntervalS seconds between periodic writes of dirty sessions
   * @param loadTimeoutS seconds a load may take
   * @param flushTimeoutS seconds a leaving session waits for its final write
   * @param maxFlushAttempts failed final writes tolerated before giving up
   */
  public record Sessions(
      long flushIntervalS, long loadTimeoutS, long flushTimeoutS, int maxFlushAttempts) {}

  /**
   * Logging block.
   *
   * @param json whether to emit structured JSON logs
   * @param slowQueryMs threshold for slow-query warnings
   * @param level textual log level for the console logger
   */
  public record Log(boolean json, long slowQueryMs, String level) {}
}
