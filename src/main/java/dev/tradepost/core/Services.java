/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.core;

import dev.tradepost.api.Accounts;
import dev.tradepost.api.Catalog;
import dev.tradepost.api.events.EconomyEvents;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Service locator for the Tradepost subsystems.
 *
 * <p>Implementations are created once at server boot and exposed to collaborator modules through
 * {@code dev.tradepost.api.TradepostApi}. Each accessor returns a singleton owned by the core. Call
 * {@link #shutdown()} during server stop to write back live sessions and release the gateway.
 */
public interface Services {

  /**
   * Category and item registry.
   *
   * @return the catalog service singleton
   */
  Catalog catalog();

  /**
   * Per-session balances and inventories.
   *
   * @return the accounts service singleton
   */
  Accounts accounts();

  /**
   * Event bus surface for economy events.
   *
   * @return the event bus facade singleton
   */
  EconomyEvents events();

  /**
   * Background scheduler owned by the core (daemon threads). Tasks that touch sessions must be
   * posted to the loop-thread mailbox rather than run here.
   *
   * @return the scheduled executor service used by Tradepost
   */
  ScheduledExecutorService scheduler();

  /**
   * Internal metrics registry.
   *
   * @return metrics registry or {@code null} when unavailable
   */
  default Metrics metrics() {
    return null;
  }

  /**
   * Leaves every live session, waits for their final writes within the gateway shutdown budget
   * and closes the connection pool. Must be called on the loop thread.
   *
   * <p>After this call the accessor methods are no longer guaranteed to be usable.
   */
  void shutdown();
}
