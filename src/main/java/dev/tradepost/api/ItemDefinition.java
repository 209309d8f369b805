/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.api;

/**
 * Draft of an item before registration.
 *
 * <p>All fields are freely settable until the draft is handed to the registry, which seals it.
 * After that, price and name change only through the administrative registry setters.
 */
public final class ItemDefinition {
  private final String key;
  private String name;
  private long price;
  private long sellPrice = -1L;
  private String typeTag = "";
  private long durationSeconds;
  private boolean hidden;
  private boolean sealed;

  private ItemDefinition(String key) {
    this.key = key;
    this.name = key;
  }

  /**
   * Starts a draft for the given key. The display name defaults to the key.
   *
   * @param key item key, unique within its category
   * @return new draft
   */
  public static ItemDefinition of(String key) {
    return new ItemDefinition(key);
  }

  public ItemDefinition name(String name) {
    checkOpen();
    this.name = name;
    return this;
  }

  public ItemDefinition price(long price) {
    checkOpen();
    this.price = price;
    return this;
  }

  /**
   * Sets the refund paid when the item is sold; {@code -1} disables selling.
   *
   * @param sellPrice refund in credits
   * @return this draft
   */
  public ItemDefinition sellPrice(long sellPrice) {
    checkOpen();
    this.sellPrice = sellPrice;
    return this;
  }

  public ItemDefinition typeTag(String typeTag) {
    checkOpen();
    this.typeTag = typeTag == null ? "" : typeTag;
    return this;
  }

  /**
   * Limits how long a purchase stays in the inventory; {@code 0} keeps it forever.
   *
   * @param durationSeconds ownership duration
   * @return this draft
   */
  public ItemDefinition durationSeconds(long durationSeconds) {
    checkOpen();
    this.durationSeconds = durationSeconds;
    return this;
  }

  public ItemDefinition hidden(boolean hidden) {
    checkOpen();
    this.hidden = hidden;
    return this;
  }

  public String key() {
    return key;
  }

  public String name() {
    return name;
  }

  public long price() {
    return price;
  }

  public long sellPrice() {
    return sellPrice;
  }

  public String typeTag() {
    return typeTag;
  }

  public long durationSeconds() {
    return durationSeconds;
  }

  public boolean hidden() {
    return hidden;
  }

  /**
   * Whether the draft was already registered.
   *
   * @return {@code true} after registration
   */
  public boolean sealed() {
    return sealed;
  }

  /** Marks the draft as registered; called by the registry. */
  public void seal() {
    sealed = true;
  }

  private void checkOpen() {
    if (sealed) {
      throw new IllegalStateException("item '" + key + "' is already registered");
    }
  }
}
