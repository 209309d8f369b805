/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.api.events;

import dev.tradepost.api.ItemHandle;
import dev.tradepost.api.SessionState;
import dev.tradepost.api.SessionToken;
import java.util.function.Consumer;

/**
 * In-process event surface for economy changes.
 *
 * <p>Handlers run synchronously on the server loop thread that applied the change. Keep them
 * short; a failing handler is logged and does not affect other handlers.
 */
public interface EconomyEvents {
  AutoCloseable onCreditsChanged(Consumer<CreditsChangedEvent> h);

  AutoCloseable onItemPurchased(Consumer<ItemPurchasedEvent> h);

  AutoCloseable onItemSold(Consumer<ItemSoldEvent> h);

  AutoCloseable onSessionStateChanged(Consumer<SessionStateChangedEvent> h);

  /**
   * Emitted after a balance change.
   *
   * @param session session token
   * @param identity durable player identity
   * @param oldBalance balance before
   * @param newBalance balance after
   * @param reason short reason
   */
  record CreditsChangedEvent(
      SessionToken session, String identity, long oldBalance, long newBalance, String reason) {}

  /**
   * Emitted after a purchase.
   *
   * @param session buyer
   * @param identity durable player identity
   * @param item purchased item
   * @param price price paid
   * @param balanceAfter balance after the debit
   */
  record ItemPurchasedEvent(
      SessionToken session, String identity, ItemHandle item, long price, long balanceAfter) {}

  /**
   * Emitted after a sale.
   *
   * @param session seller
   * @param identity durable player identity
   * @param item sold item
   * @param refund credits paid back
   * @param balanceAfter balance after the credit
   */
  record ItemSoldEvent(
      SessionToken session, String identity, ItemHandle item, long refund, long balanceAfter) {}

  /**
   * Emitted on every session lifecycle transition.
   *
   * @param session session token
   * @param identity durable player identity
   * @param from previous state ({@code null} on creation)
   * @param to new state
   */
  record SessionStateChangedEvent(
      SessionToken session, String identity, SessionState from, SessionState to) {}
}
