/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.core;

import dev.tradepost.api.ErrorCode;
import java.lang.management.ManagementFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import javax.management.InstanceAlreadyExistsException;
import javax.management.MBeanRegistrationException;
import javax.management.MBeanServer;
import javax.management.MalformedObjectNameException;
import javax.management.NotCompliantMBeanException;
import javax.management.ObjectName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple metrics registry that exposes core counters via JMX.
 *
 * <p>Counts gateway statements and transactions, read retries, aborted requests, session loads and
 * flushes, lost writes, purchases and sales. The last observed gateway and session error codes are
 * kept for quick diagnostics.
 */
public final class Metrics implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("tradepost");
  private static final String MBEAN_NAME = "dev.tradepost:type=TradepostMetrics";

  private final AtomicLong readSuccess = new AtomicLong();
  private final AtomicLong readFailure = new AtomicLong();
  private final AtomicLong writeSuccess = new AtomicLong();
  private final AtomicLong writeFailure = new AtomicLong();
  private final AtomicLong transactionSuccess = new AtomicLong();
  private final AtomicLong transactionFailure = new AtomicLong();
  private final AtomicLong readRetries = new AtomicLong();
  private final AtomicLong abortedRequests = new AtomicLong();
  private final AtomicLong sessionLoadSuccess = new AtomicLong();
  private final AtomicLong sessionLoadFailure = new AtomicLong();
  private final AtomicLong flushSuccess = new AtomicLong();
  private final AtomicLong flushFailure = new AtomicLong();
  private final AtomicLong lostWrites = new AtomicLong();
  private final AtomicLong purchases = new AtomicLong();
  private final AtomicLong sales = new AtomicLong();

  private final AtomicReference<String> lastGatewayErrorCode = new AtomicReference<>("NONE");
  private final AtomicReference<String> lastSessionErrorCode = new AtomicReference<>("NONE");

  private final MBeanServer server;
  private final ObjectName objectName;

  /** Creates and registers the Tradepost metrics MBean. */
  public Metrics() {
    this.server = ManagementFactory.getPlatformMBeanServer();
    this.objectName = createObjectName();
    registerMBean();
  }

  /**
   * Records the outcome of a single gateway statement.
   *
   * @param read whether the statement was a read
   * @param ok whether it succeeded
   * @param code failure code, ignored on success
   */
  public void recordStatement(boolean read, boolean ok, ErrorCode code) {
    if (read) {
      (ok ? readSuccess : readFailure).incrementAndGet();
    } else {
      (ok ? writeSuccess : writeFailure).incrementAndGet();
    }
    if (!ok && code != null) {
      lastGatewayErrorCode.set(code.name());
    }
  }

  /** Records a gateway transaction outcome. */
  public void recordTransaction(boolean ok, ErrorCode code) {
    (ok ? transactionSuccess : transactionFailure).incrementAndGet();
    if (!ok && code != null) {
      lastGatewayErrorCode.set(code.name());
    }
  }

  public void recordReadRetry() {
    readRetries.incrementAndGet();
  }

  public void recordAborted() {
    abortedRequests.incrementAndGet();
  }

  /** Records a completed or failed session load. */
  public void recordSessionLoad(boolean ok, ErrorCode code) {
    (ok ? sessionLoadSuccess : sessionLoadFailure).incrementAndGet();
    if (!ok && code != null) {
      lastSessionErrorCode.set(code.name());
    }
  }

  /** Records a session flush outcome. */
  public void recordFlush(boolean ok, ErrorCode code) {
    (ok ? flushSuccess : flushFailure).incrementAndGet();
    if (!ok && code != null) {
      lastSessionErrorCode.set(code.name());
    }
  }

  public void recordLostWrite() {
    lostWrites.incrementAndGet();
  }

  public void recordPurchase() {
    purchases.incrementAndGet();
  }

  public void recordSale() {
    sales.incrementAndGet();
  }

  private ObjectName createObjectName() {
    try {
      return new ObjectName(MBEAN_NAME);
    } catch (MalformedObjectNameException e) {
      throw new IllegalStateException("Invalid metrics object name", e);
    }
  }

  private void registerMBean() {
    try {
      if (server.isRegistered(objectName)) {
        server.unregisterMBean(objectName);
      }
      server.registerMBean(new Bean(), objectName);
    } catch (InstanceAlreadyExistsException
        | MBeanRegistrationException
        | NotCompliantMBeanException e) {
      LOG.warn("(tradepost) metrics registration failed", e);
    } catch (Exception e) {
      LOG.warn("(tradepost) metrics registration unexpected failure", e);
    }
  }

  @Override
  public void close() {
    try {
      if (server.isRegistered(objectName)) {
        server.unregisterMBean(objectName);
      }
    } catch (Exception e) {
      LOG.debug("(tradepost) metrics unregister failed", e);
    }
  }

  private final class Bean implements TradepostMetricsMBean {
    @Override
    public long getReadSuccess() {
      return readSuccess.get();
    }

    @Override
    public long getReadFailure() {
      return readFailure.get();
    }

    @Override
    public long getWriteSuccess() {
      return writeSuccess.get();
    }

    @Override
    public long getWriteFailure() {
      return writeFailure.get();
    }

    @Override
    public long getTransactionSuccess() {
      return transactionSuccess.get();
    }

    @Override
    public long getTransactionFailure() {
      return transactionFailure.get();
    }

    @Override
    public long getReadRetries() {
      return readRetries.get();
    }

    @Override
    public long getAbortedRequests() {
      return abortedRequests.get();
    }

    @Override
    public long getSessionLoadSuccess() {
      return sessionLoadSuccess.get();
    }

    @Override
    public long getSessionLoadFailure() {
      return sessionLoadFailure.get();
    }

    @Override
    public long getFlushSuccess() {
      return flushSuccess.get();
    }

    @Override
    public long getFlushFailure() {
      return flushFailure.get();
    }

    @Override
    public long getLostWrites() {
      return lostWrites.get();
    }

    @Override
    public long getPurchases() {
      return purchases.get();
    }

    @Override
    public long getSales() {
      return sales.get();
    }

    @Override
    public String getLastGatewayErrorCode() {
      return lastGatewayErrorCode.get();
    }

    @Override
    public String getLastSessionErrorCode() {
      return lastSessionErrorCode.get();
    }
  }

  /** JMX view of the metrics registry. */
  public interface TradepostMetricsMBean {
    /**
     * Returns gateway reads that completed successfully.
     *
     * @return successful reads
     */
    long getReadSuccess();

    /**
     * Returns gateway reads that failed after retries.
     *
     * @return failed reads
     */
    long getReadFailure();

    /** Successful single-statement writes. */
    long getWriteSuccess();

    /** Failed single-statement writes. */
    long getWriteFailure();

    /** Committed transactions. */
    long getTransactionSuccess();

    /** Rolled back transactions. */
    long getTransactionFailure();

    /** Read attempts repeated after a transient failure. */
    long getReadRetries();

    /** Requests completed with ABORTED at shutdown. */
    long getAbortedRequests();

    /** Sessions that finished loading. */
    long getSessionLoadSuccess();

    /** Sessions whose load failed or timed out. */
    long getSessionLoadFailure();

    /** Session writes confirmed by the store. */
    long getFlushSuccess();

    /** Session writes that failed. */
    long getFlushFailure();

    /** Sessions retired without a confirmed final write. */
    long getLostWrites();

    /** Completed purchases. */
    long getPurchases();

    /** Completed sales. */
    long getSales();

    /** Last observed gateway error code. */
    String getLastGatewayErrorCode();

    /** Last observed session error code. */
    String getLastSessionErrorCode();
  }
}
