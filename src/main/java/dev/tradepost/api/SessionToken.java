/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.api;

/**
 * Identifies one connection instance of a player. Tokens increase monotonically and are never
 * reused, even when the host hands the same connection slot to another player.
 *
 * @param value token value
 */
public record SessionToken(long value) {
  @Override
  public String toString() {
    return "session#" + value;
  }
}
