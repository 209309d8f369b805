/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.api;

/**
 * Opaque, process-stable reference to a registered category. Ids are never reused.
 *
 * @param id registry-assigned id
 */
public record CategoryHandle(int id) {
  @Override
  public String toString() {
    return "category#" + id;
  }
}
