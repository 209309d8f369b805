/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.api;

/**
 * Immutable snapshot of a published item.
 *
 * @param handle stable handle
 * @param category owning category
 * @param categoryKey key of the owning category
 * @param key key, unique within the category
 * @param name display name
 * @param price purchase price in credits (non-negative)
 * @param sellPrice refund when sold, or {@code -1} when the item cannot be sold
 * @param typeTag free-form type tag interpreted by collaborator modules
 * @param durationSeconds ownership duration; {@code 0} means permanent
 * @param hidden whether presentation listings should skip the item
 * @param active {@code false} once deactivated
 */
public record ItemView(
    ItemHandle handle,
    CategoryHandle category,
    String categoryKey,
    String key,
    String name,
    long price,
    long sellPrice,
    String typeTag,
    long durationSeconds,
    boolean hidden,
    boolean active) {

  /**
   * Whether the item can be sold back.
   *
   * @return {@code true} when a sell price is set
   */
  public boolean sellable() {
    return sellPrice >= 0;
  }
}
