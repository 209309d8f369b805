/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.registry;

import dev.tradepost.api.CategoryHandle;
import dev.tradepost.api.CategoryView;
import dev.tradepost.api.EconomyException;
import dev.tradepost.api.ErrorCode;
import dev.tradepost.api.ItemDefinition;
import dev.tradepost.api.ItemHandle;
import dev.tradepost.api.ItemView;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-lifetime catalog of categories and items.
 *
 * <p>Definitions are never deleted; deactivation keeps handles resolving to the same entity.
 * Handle ids are allocated from monotonic counters and never reused. Mutations are serialized on a
 * single lock and either fully apply or throw {@link EconomyException} with nothing changed;
 * lookups read concurrent maps holding immutable snapshots and never block.
 */
public final class CatalogRegistry {
  private static final Logger LOG = LoggerFactory.getLogger("tradepost");

  /** Maximum length of category keys, item keys and display names. */
  public static final int MAX_KEY_LENGTH = 64;

  private final Object lock = new Object();
  private final AtomicInteger nextCategoryId = new AtomicInteger(1);
  private final AtomicInteger nextItemId = new AtomicInteger(1);

  private final Map<Integer, CategoryView> categories = new ConcurrentHashMap<>();
  private final Map<Integer, ItemView> items = new ConcurrentHashMap<>();
  private final Map<String, CategoryHandle> categoryKeys = new ConcurrentHashMap<>();
  private final Map<ItemKey, ItemHandle> itemKeys = new ConcurrentHashMap<>();
  private final List<CategoryHandle> categoryOrder = new CopyOnWriteArrayList<>();

  /**
   * Registers a new category.
   *
   * @param key unique, case-sensitive key
   * @param name display name
   * @param description free-form description ({@code null} treated as empty)
   * @return newly allocated handle
   * @throws EconomyException {@link ErrorCode#INVALID_ARGUMENT} or {@link ErrorCode#DUPLICATE_KEY}
   */
  public CategoryHandle registerCategory(String key, String name, String description) {
    requireKey(key, "category key");
    requireName(name, "category name");
    synchronized (lock) {
      if (categoryKeys.containsKey(key)) {
        throw new EconomyException(ErrorCode.DUPLICATE_KEY, "category '" + key + "' exists");
      }
      CategoryHandle handle = new CategoryHandle(nextCategoryId.getAndIncrement());
      CategoryView view =
          new CategoryView(
              handle, key, name, description == null ? "" : description, List.of(), true);
      categories.put(handle.id(), view);
      categoryKeys.put(key, handle);
      categoryOrder.add(handle);
      LOG.debug("(tradepost) registered category {} as {}", key, handle);
      return handle;
    }
  }

  /**
   * Registers an item from a draft and seals the draft.
   *
   * @param category owning category
   * @param def item draft
   * @return newly allocated handle
   * @throws EconomyException {@link ErrorCode#INVALID_CATEGORY}, {@link ErrorCode#DUPLICATE_KEY}
   *     or {@link ErrorCode#INVALID_ARGUMENT}
   */
  public ItemHandle registerItem(CategoryHandle category, ItemDefinition def) {
    if (def == null) {
      throw new EconomyException(ErrorCode.INVALID_ARGUMENT, "item definition is required");
    }
    if (def.sealed()) {
      throw new EconomyException(
          ErrorCode.INVALID_ARGUMENT, "item definition '" + def.key() + "' already registered");
    }
    // snapshot the draft once; it stays mutable until sealed
    String key = def.key();
    String name = def.name();
    long price = def.price();
    long sellPrice = def.sellPrice();
    String typeTag = def.typeTag();
    long durationSeconds = def.durationSeconds();
    boolean hidden = def.hidden();
    requireKey(key, "item key");
    requireName(name, "item name");
    validatePricing(price, sellPrice);
    if (durationSeconds < 0) {
      throw new EconomyException(ErrorCode.INVALID_ARGUMENT, "durationSeconds must be >= 0");
    }
    synchronized (lock) {
      CategoryView owner = category == null ? null : categories.get(category.id());
      if (owner == null || !owner.active()) {
        throw new EconomyException(
            ErrorCode.INVALID_CATEGORY, "unknown or retired category " + category);
      }
      ItemKey itemKey = new ItemKey(owner.handle().id(), key);
      if (itemKeys.containsKey(itemKey)) {
        throw new EconomyException(
            ErrorCode.DUPLICATE_KEY, "item '" + owner.key() + "/" + key + "' exists");
      }
      ItemHandle handle = new ItemHandle(nextItemId.getAndIncrement());
      ItemView view =
          new ItemView(
              handle,
              owner.handle(),
              owner.key(),
              key,
              name,
              price,
              sellPrice,
              typeTag,
              durationSeconds,
              hidden,
              true);
      List<ItemHandle> members = new ArrayList<>(owner.items());
      members.add(handle);
      items.put(handle.id(), view);
      itemKeys.put(itemKey, handle);
      categories.put(
          owner.handle().id(),
          new CategoryView(
              owner.handle(),
              owner.key(),
              owner.name(),
              owner.description(),
              members,
              owner.active()));
      def.seal();
      LOG.debug("(tradepost) registered item {}/{} as {}", owner.key(), key, handle);
      return handle;
    }
  }

  /** Convenience form of {@link #registerItem(CategoryHandle, ItemDefinition)}. */
  public ItemHandle registerItem(CategoryHandle category, String key, String name, long price) {
    return registerItem(category, ItemDefinition.of(key).name(name).price(price));
  }

  public Optional<CategoryView> category(CategoryHandle handle) {
    return handle == null ? Optional.empty() : Optional.ofNullable(categories.get(handle.id()));
  }

  public Optional<ItemView> item(ItemHandle handle) {
    return handle == null ? Optional.empty() : Optional.ofNullable(items.get(handle.id()));
  }

  public Optional<CategoryHandle> lookupCategory(String key) {
    return key == null ? Optional.empty() : Optional.ofNullable(categoryKeys.get(key));
  }

  /**
   * Resolves an item by its category and item keys.
   *
   * @param categoryKey category key
   * @param itemKey item key within that category
   * @return handle when both keys resolve
   */
  public Optional<ItemHandle> lookupByKey(String categoryKey, String itemKey) {
    if (itemKey == null) {
      return Optional.empty();
    }
    return lookupCategory(categoryKey)
        .map(c -> itemKeys.get(new ItemKey(c.id(), itemKey)));
  }

  /**
   * Enumerates categories in registration order.
   *
   * @return immutable snapshot list
   */
  public List<CategoryView> categories() {
    List<CategoryView> out = new ArrayList<>(categoryOrder.size());
    for (CategoryHandle handle : categoryOrder) {
      out.add(categories.get(handle.id()));
    }
    return List.copyOf(out);
  }

  /**
   * Enumerates the items of a category in registration order.
   *
   * @param category category handle
   * @return immutable snapshot list, empty for unknown handles
   */
  public List<ItemView> items(CategoryHandle category) {
    CategoryView view = category == null ? null : categories.get(category.id());
    if (view == null) {
      return List.of();
    }
    List<ItemView> out = new ArrayList<>(view.items().size());
    for (ItemHandle handle : view.items()) {
      out.add(items.get(handle.id()));
    }
    return List.copyOf(out);
  }

  /**
   * Whether an item can currently be bought: both the item and its category are active.
   *
   * @param handle item handle
   * @return {@code false} for unknown handles
   */
  public boolean purchasable(ItemHandle handle) {
    ItemView view = handle == null ? null : items.get(handle.id());
    if (view == null || !view.active()) {
      return false;
    }
    CategoryView owner = categories.get(view.category().id());
    return owner != null && owner.active();
  }

  /**
   * Administrative price change, visible to every holder of the handle immediately.
   *
   * @param handle item handle
   * @param price new price
   * @return updated snapshot
   */
  public ItemView setPrice(ItemHandle handle, long price) {
    synchronized (lock) {
      ItemView current = requireItem(handle);
      validatePricing(price, current.sellPrice());
      ItemView next =
          rebuild(current, current.name(), price, current.sellPrice(), current.active());
      items.put(handle.id(), next);
      LOG.info(
          "(tradepost) admin op=setPrice item={}/{} old={} new={}",
          current.categoryKey(),
          current.key(),
          current.price(),
          price);
      return next;
    }
  }

  public ItemView setName(ItemHandle handle, String name) {
    requireName(name, "item name");
    synchronized (lock) {
      ItemView current = requireItem(handle);
      ItemView next =
          rebuild(current, name, current.price(), current.sellPrice(), current.active());
      items.put(handle.id(), next);
      LOG.info(
          "(tradepost) admin op=setName item={}/{} old={} new={}",
          current.categoryKey(),
          current.key(),
          current.name(),
          name);
      return next;
    }
  }

  public ItemView setSellPrice(ItemHandle handle, long sellPrice) {
    synchronized (lock) {
      ItemView current = requireItem(handle);
      validatePricing(current.price(), sellPrice);
      ItemView next =
          rebuild(current, current.name(), current.price(), sellPrice, current.active());
      items.put(handle.id(), next);
      LOG.info(
          "(tradepost) admin op=setSellPrice item={}/{} old={} new={}",
          current.categoryKey(),
          current.key(),
          current.sellPrice(),
          sellPrice);
      return next;
    }
  }

  /**
   * Retires a category. Its items stop being purchasable and no items can be added to it.
   *
   * @param handle category handle
   * @return updated snapshot
   */
  public CategoryView deactivateCategory(CategoryHandle handle) {
    synchronized (lock) {
      CategoryView current = handle == null ? null : categories.get(handle.id());
      if (current == null) {
        throw new EconomyException(ErrorCode.NOT_FOUND, "unknown category " + handle);
      }
      if (!current.active()) {
        return current;
      }
      CategoryView next =
          new CategoryView(
              current.handle(),
              current.key(),
              current.name(),
              current.description(),
              current.items(),
              false);
      categories.put(handle.id(), next);
      LOG.info("(tradepost) admin op=deactivateCategory category={}", current.key());
      return next;
    }
  }

  public ItemView deactivateItem(ItemHandle handle) {
    synchronized (lock) {
      ItemView current = requireItem(handle);
      if (!current.active()) {
        return current;
      }
      ItemView next =
          rebuild(current, current.name(), current.price(), current.sellPrice(), false);
      items.put(handle.id(), next);
      LOG.info(
          "(tradepost) admin op=deactivateItem item={}/{}", current.categoryKey(), current.key());
      return next;
    }
  }

  private ItemView requireItem(ItemHandle handle) {
    ItemView current = handle == null ? null : items.get(handle.id());
    if (current == null) {
      throw new EconomyException(ErrorCode.NOT_FOUND, "unknown item " + handle);
    }
    return current;
  }

  private static ItemView rebuild(
      ItemView v, String name, long price, long sellPrice, boolean active) {
    return new ItemView(
        v.handle(),
        v.category(),
        v.categoryKey(),
        v.key(),
        name,
        price,
        sellPrice,
        v.typeTag(),
        v.durationSeconds(),
        v.hidden(),
        active);
  }

  private static void validatePricing(long price, long sellPrice) {
    if (price < 0) {
      throw new EconomyException(ErrorCode.INVALID_ARGUMENT, "price must be >= 0");
    }
    if (sellPrice < -1 || sellPrice > price) {
      throw new EconomyException(
          ErrorCode.INVALID_ARGUMENT, "sellPrice must be -1 or between 0 and price");
    }
  }

  private static void requireKey(String key, String field) {
    requireName(key, field);
    if (!key.equals(key.trim())) {
      throw new EconomyException(
          ErrorCode.INVALID_ARGUMENT, field + " must not have surrounding whitespace");
    }
  }

  private static void requireName(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new EconomyException(ErrorCode.INVALID_ARGUMENT, field + " must be provided");
    }
    if (value.length() > MAX_KEY_LENGTH) {
      throw new EconomyException(
          ErrorCode.INVALID_ARGUMENT, field + " must be at most " + MAX_KEY_LENGTH + " chars");
    }
  }

  private record ItemKey(int categoryId, String key) {}
}
