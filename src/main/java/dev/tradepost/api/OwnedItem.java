/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.api;

/**
 * One inventory entry of a session.
 *
 * @param item owned item
 * @param acquiredAtS acquisition time (epoch seconds)
 * @param pricePaid credits paid, {@code 0} for grants
 * @param expiresAtS expiry time (epoch seconds), {@code 0} when permanent
 */
public record OwnedItem(ItemHandle item, long acquiredAtS, long pricePaid, long expiresAtS) {

  /**
   * Whether the entry has expired at {@code nowS}.
   *
   * @param nowS current epoch seconds
   * @return {@code true} once past the expiry time
   */
  public boolean expiredAt(long nowS) {
    return expiresAtS > 0 && expiresAtS <= nowS;
  }
}
