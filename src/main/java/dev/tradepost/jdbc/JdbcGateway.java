/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.jdbc;

import dev.tradepost.api.ErrorCode;
import dev.tradepost.core.Metrics;
import dev.tradepost.util.WarnLimiter;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PersistenceGateway} over a pooled JDBC {@link DataSource}.
 *
 * <p>Each lane has a dedicated serial queue drained on the I/O pool, so requests on one lane run
 * one after another while different lanes proceed concurrently. Completions are posted to the
 * loop-thread executor and guarded so each continuation runs at most once.
 */
public final class JdbcGateway implements PersistenceGateway {
  private static final Logger LOG = LoggerFactory.getLogger("tradepost");

  /**
   * Gateway tuning.
   *
   * @param ioThreads size of the blocking I/O pool
   * @param readRetries extra attempts for reads failing with a transient store error
   * @param retryBackoffMs base backoff, multiplied by the attempt number
   * @param shutdownTimeoutS wait for in-flight work during {@link #close()}
   * @param slowQueryMs statements slower than this are logged, {@code 0} disables
   */
  public record Settings(
      int ioThreads,
      int readRetries,
      long retryBackoffMs,
      long shutdownTimeoutS,
      long slowQueryMs) {}

  private enum Lifecycle {
    OPEN,
    CLOSING,
    CLOSED
  }

  private final DataSource ds;
  private final Executor mainThread;
  private final Metrics metrics;
  private final Settings settings;
  private final ExecutorService io;
  private final AtomicLong nextId = new AtomicLong(1);
  private final Map<Long, Request> pending = new ConcurrentHashMap<>();
  private final Map<String, LaneQueue> lanes = new ConcurrentHashMap<>();
  private final WarnLimiter slowLog = new WarnLimiter(5, Duration.ofSeconds(10));
  private volatile Lifecycle lifecycle = Lifecycle.OPEN;

  /**
   * Creates a gateway. The gateway takes ownership of {@code ds} and closes it on {@link #close()}
   * when it is {@link AutoCloseable}.
   *
   * @param ds pooled datasource
   * @param mainThread loop-thread executor receiving every continuation
   * @param metrics metrics registry, may be {@code null}
   * @param settings tuning
   */
  public JdbcGateway(DataSource ds, Executor mainThread, Metrics metrics, Settings settings) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.mainThread = Objects.requireNonNull(mainThread, "mainThread");
    this.metrics = metrics;
    this.settings = Objects.requireNonNull(settings, "settings");
    this.io = createExecutor(settings.ioThreads());
  }

  private static ExecutorService createExecutor(int threads) {
    AtomicInteger seq = new AtomicInteger();
    ThreadFactory factory =
        r -> {
          Thread t = new Thread(r, "tradepost-io-" + seq.incrementAndGet());
          t.setDaemon(true);
          return t;
        };
    return Executors.newFixedThreadPool(Math.max(1, threads), factory);
  }

  @Override
  public long query(String lane, SqlStatement statement, Consumer<QueryOutcome> onComplete) {
    Objects.requireNonNull(statement, "statement");
    Objects.requireNonNull(onComplete, "onComplete");
    Request request = register(lane, err -> onComplete.accept(QueryOutcome.failure(err)));
    if (request == null) {
      throw new IllegalStateException("gateway closed");
    }
    submit(request, () -> runQuery(request, statement, onComplete));
    return request.id;
  }

  @Override
  public long runTransaction(
      String lane,
      List<SqlStatement> statements,
      Consumer<List<QueryResult>> onSuccess,
      Consumer<GatewayError> onFailure) {
    Objects.requireNonNull(statements, "statements");
    Objects.requireNonNull(onSuccess, "onSuccess");
    Objects.requireNonNull(onFailure, "onFailure");
    List<SqlStatement> batch = List.copyOf(statements);
    Request request = register(lane, onFailure);
    if (request == null) {
      throw new IllegalStateException("gateway closed");
    }
    submit(request, () -> runTransaction(request, batch, onSuccess, onFailure));
    return request.id;
  }

  @Override
  public int pending() {
    return pending.size();
  }

  /**
   * Stops accepting work and drains the gateway.
   *
   * <p>Requests issued from now on are aborted. In-flight and queued work gets {@code
   * shutdownTimeoutS} to finish; completions that arrived are delivered, then every request still
   * pending is completed with {@link ErrorCode#ABORTED}. No continuation runs after this returns.
   * Must be called on the loop thread since it pumps the mailbox when it is a {@link MainThread}.
   */
  @Override
  public void close() {
    if (lifecycle != Lifecycle.OPEN) {
      return;
    }
    lifecycle = Lifecycle.CLOSING;
    io.shutdown();
    try {
      if (!io.awaitTermination(settings.shutdownTimeoutS(), TimeUnit.SECONDS)) {
        LOG.warn(
            "(tradepost) code={} op={} message={}",
            "GATEWAY_SHUTDOWN_TIMEOUT",
            "gateway.close",
            "in-flight work did not finish within " + settings.shutdownTimeoutS() + "s");
        io.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      io.shutdownNow();
    }
    if (mainThread instanceof MainThread mailbox) {
      mailbox.drainAll();
    }
    int aborted = 0;
    while (!pending.isEmpty()) {
      for (Request request : new ArrayList<>(pending.values())) {
        pending.remove(request.id);
        if (!request.claim()) {
          continue;
        }
        aborted++;
        if (metrics != null) {
          metrics.recordAborted();
        }
        try {
          request.onAbort.accept(GatewayError.aborted("gateway closed"));
        } catch (RuntimeException e) {
          LOG.warn("(tradepost) abort continuation failed lane={}", request.lane, e);
        }
      }
    }
    lifecycle = Lifecycle.CLOSED;
    lanes.clear();
    if (aborted > 0) {
      LOG.warn("(tradepost) gateway closed; aborted {} pending request(s)", aborted);
    }
    if (ds instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        LOG.warn("(tradepost) failed to close datasource: {}", e.getMessage(), e);
      }
    }
  }

  private Request register(String lane, Consumer<GatewayError> onAbort) {
    Lifecycle state = lifecycle;
    if (state == Lifecycle.CLOSED) {
      return null;
    }
    Request request = new Request(nextId.getAndIncrement(), lane == null ? "" : lane, onAbort);
    pending.put(request.id, request);
    return request;
  }

  private void submit(Request request, Runnable work) {
    if (lifecycle != Lifecycle.OPEN) {
      abortLater(request);
      return;
    }
    boolean[] start = new boolean[1];
    LaneQueue queue =
        lanes.compute(
            request.lane,
            (lane, existing) -> {
              LaneQueue q = existing != null ? existing : new LaneQueue();
              q.tasks.add(work);
              if (!q.draining) {
                q.draining = true;
                start[0] = true;
              }
              return q;
            });
    if (start[0]) {
      try {
        io.execute(() -> drain(request.lane, queue));
      } catch (RejectedExecutionException e) {
        LOG.debug("(tradepost) io pool rejected lane={}; request left for abort", request.lane);
      }
    }
  }

  private void abortLater(Request request) {
    deliver(
        request,
        () -> {
          if (metrics != null) {
            metrics.recordAborted();
          }
          request.onAbort.accept(GatewayError.aborted("gateway is closing"));
        });
  }

  private void drain(String lane, LaneQueue queue) {
    while (true) {
      Runnable next = queue.tasks.poll();
      if (next == null) {
        lanes.compute(
            lane,
            (l, current) -> {
              if (queue.tasks.isEmpty()) {
                queue.draining = false;
                // the lane may already be gone after close()
                return current == queue ? null : current;
              }
              return current;
            });
        if (!queue.draining) {
          return;
        }
        continue;
      }
      try {
        next.run();
      } catch (RuntimeException e) {
        LOG.warn("(tradepost) gateway task failed lane={}", lane, e);
      }
    }
  }

  private void runQuery(
      Request request, SqlStatement statement, Consumer<QueryOutcome> onComplete) {
    int attempt = 0;
    while (true) {
      attempt++;
      try (Connection c = ds.getConnection()) {
        QueryResult result = execute(c, statement, request.lane);
        if (metrics != null) {
          metrics.recordStatement(statement.read(), true, null);
        }
        deliver(request, () -> onComplete.accept(QueryOutcome.success(result)));
        return;
      } catch (SQLException e) {
        ErrorCode code = SqlErrorCodes.classify(e);
        boolean retryable = statement.read() && code.transientStore();
        if (retryable && attempt <= settings.readRetries() && lifecycle == Lifecycle.OPEN) {
          if (metrics != null) {
            metrics.recordReadRetry();
          }
          LOG.debug(
              "(tradepost) code={} op={} lane={} attempt={} message={}",
              code,
              "gateway.read.retry",
              request.lane,
              attempt,
              e.getMessage());
          if (sleep(settings.retryBackoffMs() * attempt)) {
            continue;
          }
        }
        ErrorCode surfaced = retryable ? ErrorCode.STORE_UNAVAILABLE : code;
        if (metrics != null) {
          metrics.recordStatement(statement.read(), false, surfaced);
        }
        LOG.warn(
            "(tradepost) code={} op={} lane={} attempts={} message={} sqlState={} vendor={}",
            surfaced,
            statement.read() ? "gateway.read" : "gateway.write",
            request.lane,
            attempt,
            e.getMessage(),
            e.getSQLState(),
            e.getErrorCode());
        GatewayError error = new GatewayError(surfaced, e.getMessage(), e);
        deliver(request, () -> onComplete.accept(QueryOutcome.failure(error)));
        return;
      }
    }
  }

  private void runTransaction(
      Request request,
      List<SqlStatement> statements,
      Consumer<List<QueryResult>> onSuccess,
      Consumer<GatewayError> onFailure) {
    try (Connection c = ds.getConnection()) {
      boolean autoCommit = c.getAutoCommit();
      c.setAutoCommit(false);
      List<QueryResult> results = new ArrayList<>(statements.size());
      try {
        for (SqlStatement statement : statements) {
          results.add(execute(c, statement, request.lane));
        }
        c.commit();
      } catch (SQLException e) {
        rollbackQuietly(c, request.lane);
        throw e;
      } finally {
        try {
          c.setAutoCommit(autoCommit);
        } catch (SQLException e) {
          LOG.debug("(tradepost) failed to restore autocommit lane={}", request.lane, e);
        }
      }
      if (metrics != null) {
        metrics.recordTransaction(true, null);
      }
      List<QueryResult> committed = List.copyOf(results);
      deliver(request, () -> onSuccess.accept(committed));
    } catch (SQLException e) {
      ErrorCode code = SqlErrorCodes.classify(e);
      if (metrics != null) {
        metrics.recordTransaction(false, code);
      }
      LOG.warn(
          "(tradepost) code={} op={} lane={} message={} sqlState={} vendor={}",
          code,
          "gateway.transaction",
          request.lane,
          e.getMessage(),
          e.getSQLState(),
          e.getErrorCode());
      GatewayError error = new GatewayError(code, e.getMessage(), e);
      deliver(request, () -> onFailure.accept(error));
    }
  }

  private QueryResult execute(Connection c, SqlStatement statement, String lane)
      throws SQLException {
    long start = System.nanoTime();
    try (PreparedStatement ps = c.prepareStatement(statement.sql())) {
      List<Object> params = statement.params();
      for (int i = 0; i < params.size(); i++) {
        ps.setObject(i + 1, params.get(i));
      }
      if (ps.execute()) {
        try (ResultSet rs = ps.getResultSet()) {
          return new QueryResult(readRows(rs), -1);
        }
      }
      return new QueryResult(List.of(), ps.getUpdateCount());
    } finally {
      checkSlow(statement, lane, start);
    }
  }

  private static List<Row> readRows(ResultSet rs) throws SQLException {
    List<Row> rows = new ArrayList<>();
    if (rs == null) {
      return rows;
    }
    ResultSetMetaData meta = rs.getMetaData();
    int columns = meta.getColumnCount();
    while (rs.next()) {
      Map<String, Object> values = new HashMap<>();
      for (int i = 1; i <= columns; i++) {
        Object value = rs.getObject(i);
        if (value != null) {
          values.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), value);
        }
      }
      rows.add(new Row(values));
    }
    return rows;
  }

  private void checkSlow(SqlStatement statement, String lane, long startNanos) {
    long threshold = settings.slowQueryMs();
    if (threshold <= 0) {
      return;
    }
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    if (elapsedMs < threshold) {
      return;
    }
    long suppressed = slowLog.tryAcquire("DB_SLOW_QUERY");
    if (suppressed >= 0) {
      LOG.warn(
          "(tradepost) code={} op={} lane={} elapsedMs={} thresholdMs={} suppressed={} sql={}",
          "DB_SLOW_QUERY",
          statement.read() ? "gateway.read" : "gateway.write",
          lane,
          elapsedMs,
          threshold,
          suppressed,
          statement.sql());
    }
  }

  private void deliver(Request request, Runnable continuation) {
    mainThread.execute(
        () -> {
          if (request.claim()) {
            pending.remove(request.id);
            continuation.run();
          }
        });
  }

  private static void rollbackQuietly(Connection c, String lane) {
    try {
      c.rollback();
    } catch (SQLException e) {
      LOG.warn("(tradepost) rollback failed lane={}: {}", lane, e.getMessage());
    }
  }

  private static boolean sleep(long millis) {
    try {
      Thread.sleep(Math.max(0L, millis));
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static final class Request {
    final long id;
    final String lane;
    final Consumer<GatewayError> onAbort;
    private final AtomicBoolean done = new AtomicBoolean(false);

    Request(long id, String lane, Consumer<GatewayError> onAbort) {
      this.id = id;
      this.lane = lane;
      this.onAbort = onAbort;
    }

    boolean claim() {
      return done.compareAndSet(false, true);
    }
  }

  private static final class LaneQueue {
    final ConcurrentLinkedQueue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    // guarded by lanes.compute
    volatile boolean draining;
  }
}
