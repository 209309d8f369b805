/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.core;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import dev.tradepost.api.Accounts;
import dev.tradepost.api.Catalog;
import dev.tradepost.api.events.EconomyEvents;
import dev.tradepost.jdbc.Dialect;
import dev.tradepost.jdbc.JdbcGateway;
import dev.tradepost.jdbc.MainThread;
import dev.tradepost.jdbc.Schema;
import dev.tradepost.registry.CatalogRegistry;
import dev.tradepost.session.SessionCache;
import dev.tradepost.session.SqlAccountStore;
import java.sql.SQLException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires together the registry, session cache and persistence gateway and manages the shared
 * resources (Hikari pool, scheduler, metrics).
 */
public final class CoreServices implements Services, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("tradepost");
  private static final long MAINTAIN_PERIOD_S = 1L;

  private final CatalogRegistry registry;
  private final SessionCache cache;
  private final JdbcGateway gateway;
  private final EventBus events;
  private final Metrics metrics;
  private final ScheduledExecutorService scheduler;
  private final Catalog catalog;
  private final Accounts accounts;
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  private CoreServices(
      CatalogRegistry registry,
      SessionCache cache,
      JdbcGateway gateway,
      EventBus events,
      Metrics metrics,
      ScheduledExecutorService scheduler) {
    this.registry = registry;
    this.cache = cache;
    this.gateway = gateway;
    this.events = events;
    this.metrics = metrics;
    this.scheduler = scheduler;
    this.catalog = new CatalogImpl(registry);
    this.accounts = new AccountsImpl(cache);
  }

  /**
   * Starts core services: configures logging, opens the pool, applies the schema and schedules
   * session maintenance on the loop-thread mailbox.
   *
   * @param cfg runtime configuration
   * @param mainThread mailbox pumped by the host tick
   * @param clockS wall clock in epoch seconds
   * @return service container
   */
  public static CoreServices start(Config cfg, MainThread mainThread, LongSupplier clockS) {
    LoggingConfigurator.configure(cfg.log());

    HikariDataSource ds = openPool(cfg.db());
    Schema schema = new Schema(cfg.db().backend(), cfg.db().tablePrefix());
    try {
      schema.apply(ds);
    } catch (SQLException e) {
      ds.close();
      throw new IllegalStateException("Unable to apply schema: " + e.getMessage(), e);
    }

    Metrics metrics = new Metrics();
    EventBus events = new EventBus();
    Config.Gateway g = cfg.gateway();
    JdbcGateway gateway =
        new JdbcGateway(
            ds,
            mainThread,
            metrics,
            new JdbcGateway.Settings(
                g.ioThreads(),
                g.readRetries(),
                g.retryBackoffMs(),
                g.shutdownTimeoutS(),
                cfg.log().slowQueryMs()));

    Config.Economy eco = cfg.economy();
    Config.Sessions ses = cfg.sessions();
    CatalogRegistry registry = new CatalogRegistry();
    SessionCache cache =
        new SessionCache(
            new SqlAccountStore(gateway, schema),
            registry,
            events,
            metrics,
            new SessionCache.Settings(
                eco.startingBalance(),
                eco.creditFloor(),
                eco.creditCeiling(),
                ses.flushIntervalS(),
                ses.loadTimeoutS(),
                ses.flushTimeoutS(),
                ses.maxFlushAttempts()),
            clockS);

    ScheduledExecutorService scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "tradepost-scheduler");
              t.setDaemon(true);
              return t;
            });
    AtomicBoolean queued = new AtomicBoolean(false);
    scheduler.scheduleAtFixedRate(
        () -> {
          // one maintenance pass in the mailbox at a time, even if the loop thread stalls
          if (queued.compareAndSet(false, true)) {
            mainThread.execute(
                () -> {
                  queued.set(false);
                  cache.maintain();
                });
          }
        },
        MAINTAIN_PERIOD_S,
        MAINTAIN_PERIOD_S,
        TimeUnit.SECONDS);

    LOG.info(
        "(tradepost) core started backend={} prefix={} ioThreads={}",
        cfg.db().backend(),
        cfg.db().tablePrefix(),
        g.ioThreads());
    return new CoreServices(registry, cache, gateway, events, metrics, scheduler);
  }

  private static HikariDataSource openPool(Config.Db db) {
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(db.jdbcUrl());
    if (db.backend() == Dialect.MARIADB) {
      hc.setUsername(db.user());
      hc.setPassword(db.password());
      hc.setMaximumPoolSize(db.pool().maxPoolSize());
      hc.setMinimumIdle(Math.min(db.pool().minimumIdle(), db.pool().maxPoolSize()));
      warnInsecure(db);
    } else {
      // SQLite serialises writers; more connections only add SQLITE_BUSY errors
      hc.setMaximumPoolSize(1);
      hc.setMinimumIdle(1);
    }
    hc.setConnectionTimeout(db.pool().connectionTimeoutMs());
    hc.setIdleTimeout(db.pool().idleTimeoutMs());
    hc.setMaxLifetime(db.pool().maxLifetimeMs());
    hc.setAutoCommit(true);
    hc.setPoolName("tradepost-hikari");
    hc.setInitializationFailTimeout(-1);

    RuntimeException last = null;
    int attempts = Math.max(1, db.pool().startupAttempts());
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        return new HikariDataSource(hc);
      } catch (RuntimeException ex) {
        last = ex;
        LOG.warn(
            "(tradepost) failed to start Hikari (attempt {}/{}): {}",
            attempt,
            attempts,
            ex.getMessage());
        try {
          Thread.sleep(250L * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          break;
        }
      }
    }
    throw new IllegalStateException("Unable to start datasource", last);
  }

  private static void warnInsecure(Config.Db db) {
    if (!db.tlsEnabled() && !isLocalHost(db.host())) {
      LOG.warn(
          "(tradepost) code={} op={} message={}",
          "DB_TLS_DISABLED",
          "config",
          "TLS is disabled for a non-local database host; enable core.db.tls.enabled for security");
    }
    if ("change-me".equals(db.password())) {
      LOG.warn(
          "(tradepost) code={} op={} message={}",
          "DB_PASSWORD_DEFAULT",
          "config",
          "database password is still the default 'change-me'; update before production use");
    }
  }

  @Override
  public Catalog catalog() {
    return catalog;
  }

  @Override
  public Accounts accounts() {
    return accounts;
  }

  @Override
  public EconomyEvents events() {
    return events;
  }

  @Override
  public ScheduledExecutorService scheduler() {
    return scheduler;
  }

  @Override
  public Metrics metrics() {
    return metrics;
  }

  /**
   * Session cache driven by the host's join and leave hooks.
   *
   * @return session cache
   */
  public SessionCache sessions() {
    return cache;
  }

  /**
   * Registry backing {@link #catalog()}.
   *
   * @return catalog registry
   */
  public CatalogRegistry registry() {
    return registry;
  }

  /**
   * Stops maintenance, leaves every session and closes the gateway, which waits for the final
   * writes and aborts whatever is still pending. Idempotent.
   */
  @Override
  public void shutdown() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    scheduler.shutdownNow();
    cache.shutdown();
    gateway.close();
    if (cache.size() > 0) {
      LOG.warn("(tradepost) {} session(s) still held after gateway shutdown", cache.size());
    }
    try {
      events.close();
    } catch (Exception e) {
      LOG.debug("(tradepost) event bus shutdown issue", e);
    }
    metrics.close();
    LOG.info("(tradepost) core stopped");
  }

  /** Alias for {@link #shutdown()}. */
  @Override
  public void close() {
    shutdown();
  }

  private static boolean isLocalHost(String host) {
    if (host == null) {
      return false;
    }
    String normalized = host.trim();
    if (normalized.isEmpty()) {
      return false;
    }
    return normalized.equalsIgnoreCase("localhost")
        || normalized.equals("127.0.0.1")
        || normalized.equals("::1")
        || normalized.equalsIgnoreCase("[::1]");
  }
}
