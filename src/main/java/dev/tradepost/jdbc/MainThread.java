/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.jdbc;

import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mailbox for work that must run on the server loop thread.
 *
 * <p>Any thread may post; tasks only run when the host pumps {@link #runPending()} from its tick.
 * A failing task is logged and does not stop the others.
 */
public final class MainThread implements Executor {
  private static final Logger LOG = LoggerFactory.getLogger("tradepost");

  private final ConcurrentLinkedQueue<Runnable> tasks = new ConcurrentLinkedQueue<>();

  @Override
  public void execute(Runnable task) {
    tasks.add(Objects.requireNonNull(task, "task"));
  }

  /**
   * Runs the tasks queued at the time of the call. Tasks posted while running wait for the next
   * pump so one tick cannot starve the loop.
   *
   * @return number of tasks run
   */
  public int runPending() {
    int budget = tasks.size();
    int ran = 0;
    while (ran < budget) {
      Runnable next = tasks.poll();
      if (next == null) {
        break;
      }
      runSafely(next);
      ran++;
    }
    return ran;
  }

  /**
   * Runs tasks until the mailbox is empty, including ones posted meanwhile. Used at shutdown.
   *
   * @return number of tasks run
   */
  public int drainAll() {
    int ran = 0;
    Runnable next;
    while ((next = tasks.poll()) != null) {
      runSafely(next);
      ran++;
    }
    return ran;
  }

  public int pending() {
    return tasks.size();
  }

  private static void runSafely(Runnable task) {
    try {
      task.run();
    } catch (RuntimeException e) {
      LOG.warn(
          "(tradepost) code={} op={} message={}", "TASK_FAILED", "mainThread", e.getMessage(), e);
    }
  }
}
