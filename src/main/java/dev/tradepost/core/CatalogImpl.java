/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.core;

import dev.tradepost.api.Catalog;
import dev.tradepost.api.CategoryHandle;
import dev.tradepost.api.CategoryView;
import dev.tradepost.api.ErrorCode;
import dev.tradepost.api.ItemDefinition;
import dev.tradepost.api.ItemHandle;
import dev.tradepost.api.ItemView;
import dev.tradepost.api.Result;
import dev.tradepost.registry.CatalogRegistry;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** {@link Catalog} backed by the in-memory {@link CatalogRegistry}. */
final class CatalogImpl implements Catalog {
  private final CatalogRegistry registry;

  CatalogImpl(CatalogRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  @Override
  public Result<CategoryHandle> registerCategory(String key, String name, String description) {
    return Result.capture(() -> registry.registerCategory(key, name, description));
  }

  @Override
  public Result<ItemHandle> registerItem(
      CategoryHandle category, String key, String name, long price) {
    return Result.capture(() -> registry.registerItem(category, key, name, price));
  }

  @Override
  public Result<ItemHandle> registerItem(CategoryHandle category, ItemDefinition definition) {
    return Result.capture(() -> registry.registerItem(category, definition));
  }

  @Override
  public Result<CategoryView> category(CategoryHandle handle) {
    return found(registry.category(handle), "category " + handle);
  }

  @Override
  public Result<ItemView> item(ItemHandle handle) {
    return found(registry.item(handle), "item " + handle);
  }

  @Override
  public Result<CategoryHandle> lookupCategory(String key) {
    return found(registry.lookupCategory(key), "category key " + key);
  }

  @Override
  public Result<ItemHandle> lookupItem(String categoryKey, String itemKey) {
    return found(registry.lookupByKey(categoryKey, itemKey), "item " + categoryKey + "/" + itemKey);
  }

  @Override
  public List<CategoryView> categories(boolean includeInactive) {
    List<CategoryView> all = registry.categories();
    if (includeInactive) {
      return all;
    }
    return all.stream().filter(CategoryView::active).toList();
  }

  @Override
  public List<ItemView> items(CategoryHandle category, boolean includeHidden) {
    List<ItemView> all = registry.items(category);
    if (includeHidden) {
      return all;
    }
    return all.stream().filter(v -> v.active() && !v.hidden()).toList();
  }

  @Override
  public boolean purchasable(ItemHandle item) {
    return registry.purchasable(item);
  }

  @Override
  public Result<ItemView> setPrice(ItemHandle item, long price) {
    return Result.capture(() -> registry.setPrice(item, price));
  }

  @Override
  public Result<ItemView> setName(ItemHandle item, String name) {
    return Result.capture(() -> registry.setName(item, name));
  }

  @Override
  public Result<ItemView> setSellPrice(ItemHandle item, long sellPrice) {
    return Result.capture(() -> registry.setSellPrice(item, sellPrice));
  }

  @Override
  public Result<CategoryView> deactivateCategory(CategoryHandle category) {
    return Result.capture(() -> registry.deactivateCategory(category));
  }

  @Override
  public Result<ItemView> deactivateItem(ItemHandle item) {
    return Result.capture(() -> registry.deactivateItem(item));
  }

  private static <T> Result<T> found(Optional<T> value, String what) {
    return value
        .map(Result::success)
        .orElseGet(() -> Result.failure(ErrorCode.NOT_FOUND, what + " not found"));
  }
}
