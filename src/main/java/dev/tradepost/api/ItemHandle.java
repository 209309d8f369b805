/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.api;

/**
 * Opaque, process-stable reference to a registered item. Ids are never reused.
 *
 * @param id registry-assigned id
 */
public record ItemHandle(int id) {
  @Override
  public String toString() {
    return "item#" + id;
  }
}
