/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.api;

import dev.tradepost.api.events.EconomyEvents;

/**
 * Static accessors for the Tradepost extensibility surface consumed by collaborator modules
 * (commands, menus, admin tools).
 *
 * <p><strong>Lifecycle</strong>
 *
 * <ol>
 *   <li>The core constructs its {@code Services} container and calls {@link
 *       #bootstrap(dev.tradepost.core.Services)} exactly once.
 *   <li>On shutdown the core calls {@link #clear()}; accessors then throw.
 * </ol>
 *
 * <p>Collaborators must not reach past these handles into registry, session or gateway internals.
 */
public final class TradepostApi {
  /** Contract version; bumped on incompatible changes to {@link Catalog} or {@link Accounts}. */
  public static final int API_VERSION = 1;

  private static volatile dev.tradepost.core.Services services;

  private TradepostApi() {}

  /**
   * Wire core services into the static API. Call once during boot.
   *
   * @param s service container
   * @throws IllegalStateException if called more than once
   */
  public static synchronized void bootstrap(dev.tradepost.core.Services s) {
    if (services != null) {
      throw new IllegalStateException("TradepostApi already bootstrapped");
    }
    services = s;
  }

  /** Drops the published services during shutdown. */
  public static synchronized void clear() {
    services = null;
  }

  /**
   * Gets the catalog service.
   *
   * @return catalog singleton
   */
  public static Catalog catalog() {
    return require().catalog();
  }

  /**
   * Gets the per-session account service.
   *
   * @return accounts singleton
   */
  public static Accounts accounts() {
    return require().accounts();
  }

  /**
   * Gets the economy event bus facade.
   *
   * @return event bus facade
   */
  public static EconomyEvents events() {
    return require().events();
  }

  private static dev.tradepost.core.Services require() {
    dev.tradepost.core.Services s = services;
    if (s == null) {
      throw new IllegalStateException("TradepostApi not bootstrapped");
    }
    return s;
  }
}
