/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.api;

import java.util.List;

/**
 * Immutable snapshot of a category definition.
 *
 * @param handle stable handle
 * @param key unique key (case-sensitive)
 * @param name display name
 * @param description free-form description
 * @param items item handles in registration order
 * @param active {@code false} once deactivated
 */
public record CategoryView(
    CategoryHandle handle,
    String key,
    String name,
    String description,
    List<ItemHandle> items,
    boolean active) {

  public CategoryView {
    items = List.copyOf(items);
  }
}
