/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost;

import dev.tradepost.api.EconomyException;
import dev.tradepost.api.SessionToken;
import dev.tradepost.api.TradepostApi;
import dev.tradepost.core.Config;
import dev.tradepost.core.CoreServices;
import dev.tradepost.jdbc.MainThread;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Host bootstrap. The game server creates one instance, forwards its connection hooks and pumps
 * {@link #tick()} from the main loop.
 *
 * <p>Boot sequence:
 *
 * <ol>
 *   <li>Load config (writes default JSON5 if missing)
 *   <li>Start services (logging, Hikari pool, schema, gateway, session cache)
 *   <li>Expose services through {@link TradepostApi}
 * </ol>
 *
 * <p>Every method must be called on the server loop thread.
 */
public final class Tradepost {
  /** Logger and config namespace. */
  public static final String ID = "tradepost";

  private static final Logger LOG = LoggerFactory.getLogger(ID);

  private final MainThread mainThread = new MainThread();
  private final LongSupplier clockS;
  private CoreServices services;

  /** Creates a host using the system clock. */
  public Tradepost() {
    this(() -> Instant.now().getEpochSecond());
  }

  /**
   * Creates a host with an explicit clock.
   *
   * @param clockS wall clock in epoch seconds
   */
  public Tradepost(LongSupplier clockS) {
    this.clockS = clockS;
  }

  /**
   * Boots the core from {@code configPath} and publishes the API.
   *
   * @param configPath path of {@code tradepost.json5}
   * @return started services
   * @throws IllegalStateException when already booted or the config is invalid
   */
  public CoreServices boot(Path configPath) {
    if (services != null) {
      throw new IllegalStateException("tradepost already booted");
    }
    LOG.info("(tradepost) booting Tradepost 1.0.0 (api v{})", TradepostApi.API_VERSION);
    Config cfg = Config.loadOrWriteDefault(configPath);
    CoreServices started = CoreServices.start(cfg, mainThread, clockS);
    try {
      TradepostApi.bootstrap(started);
    } catch (IllegalStateException e) {
      started.shutdown();
      throw e;
    }
    services = started;
    LOG.info("(tradepost) initialized");
    return started;
  }

  /**
   * Connection hook: a player with {@code identity} took {@code slot}.
   *
   * @param slot host connection slot
   * @param identity durable player identity
   * @return session token, or empty when the identity was rejected
   */
  public Optional<SessionToken> playerJoined(int slot, String identity) {
    try {
      return Optional.of(require().sessions().onJoin(slot, identity));
    } catch (EconomyException e) {
      LOG.warn(
          "(tradepost) code={} op={} slot={} message={}",
          e.errorCode(),
          "session.join",
          slot,
          e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Disconnect hook for {@code slot}.
   *
   * @param slot host connection slot
   */
  public void playerLeft(int slot) {
    require().sessions().onDisconnect(slot);
  }

  /**
   * Runs the gateway continuations and maintenance posted since the previous tick.
   *
   * @return number of tasks run
   */
  public int tick() {
    return mainThread.runPending();
  }

  /** Writes back every session, closes the pool and withdraws the API. Idempotent. */
  public void stop() {
    CoreServices s = services;
    if (s == null) {
      return;
    }
    services = null;
    TradepostApi.clear();
    try {
      s.shutdown();
    } catch (RuntimeException e) {
      LOG.warn("(tradepost) shutdown error", e);
    }
  }

  private CoreServices require() {
    if (services == null) {
      throw new IllegalStateException("tradepost not booted");
    }
    return services;
  }
}
