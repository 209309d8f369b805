/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.api;

import java.util.List;

/**
 * Catalog surface for collaborator modules: registration, lookup and enumeration of categories and
 * items.
 *
 * <p>Registration normally happens at startup. Every call validates its handles and returns a
 * typed {@link Result} rather than throwing on stale or foreign handles.
 */
public interface Catalog {
  /**
   * Registers a category.
   *
   * @param key unique key (case-sensitive, at most 64 chars)
   * @param name display name
   * @param description free-form description
   * @return new handle, or {@link ErrorCode#DUPLICATE_KEY} / {@link ErrorCode#INVALID_ARGUMENT}
   */
  Result<CategoryHandle> registerCategory(String key, String name, String description);

  /**
   * Registers a permanent, non-sellable item with default metadata.
   *
   * @param category owning category
   * @param key item key, unique within the category
   * @param name display name
   * @param price price in credits (must be &gt;= 0)
   * @return new handle or the validation failure
   */
  Result<ItemHandle> registerItem(CategoryHandle category, String key, String name, long price);

  /**
   * Registers an item from a draft; the draft is sealed on success.
   *
   * @param category owning category
   * @param definition item draft
   * @return new handle or the validation failure
   */
  Result<ItemHandle> registerItem(CategoryHandle category, ItemDefinition definition);

  Result<CategoryView> category(CategoryHandle handle);

  Result<ItemView> item(ItemHandle handle);

  Result<CategoryHandle> lookupCategory(String key);

  Result<ItemHandle> lookupItem(String categoryKey, String itemKey);

  /**
   * Lists categories in registration order.
   *
   * @param includeInactive whether deactivated categories are included
   * @return immutable list of snapshots
   */
  List<CategoryView> categories(boolean includeInactive);

  /**
   * Lists the items of a category in registration order.
   *
   * @param category category handle
   * @param includeHidden whether hidden and deactivated items are included
   * @return immutable list of snapshots; empty for unknown handles
   */
  List<ItemView> items(CategoryHandle category, boolean includeHidden);

  /**
   * Whether the item and its category are both active.
   *
   * @param item item handle
   * @return {@code false} for unknown handles
   */
  boolean purchasable(ItemHandle item);

  /**
   * Changes the price of a published item. Purchases already validated keep their price.
   *
   * @param item item handle
   * @param price new price (must be &gt;= 0 and &gt;= the sell price)
   * @return updated snapshot or the validation failure
   */
  Result<ItemView> setPrice(ItemHandle item, long price);

  Result<ItemView> setName(ItemHandle item, String name);

  Result<ItemView> setSellPrice(ItemHandle item, long sellPrice);

  Result<CategoryView> deactivateCategory(CategoryHandle category);

  Result<ItemView> deactivateItem(ItemHandle item);
}
