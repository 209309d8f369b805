/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.api;

import java.util.List;

/**
 * Per-session economic state keyed by {@link SessionToken}.
 *
 * <p>Mutations apply synchronously to the in-memory session and are persisted asynchronously.
 * They are only accepted while the session is {@link SessionState#ACTIVE}; reads are also served
 * while the final write is in flight.
 */
public interface Accounts {
  Result<SessionState> state(SessionToken session);

  Result<Long> balance(SessionToken session);

  /**
   * Adds {@code delta} credits (negative to debit).
   *
   * @param session session token
   * @param delta signed amount
   * @param reason short reason for logs and events
   * @return new balance, or {@link ErrorCode#INSUFFICIENT_FUNDS} / {@link ErrorCode#BALANCE_LIMIT}
   */
  Result<Long> adjustCredits(SessionToken session, long delta, String reason);

  /**
   * Sets the balance to an absolute amount within the configured bounds.
   *
   * @param session session token
   * @param amount new balance
   * @param reason short reason
   * @return new balance or the failure
   */
  Result<Long> setCredits(SessionToken session, long amount, String reason);

  /**
   * Moves credits between two active sessions; both sides change or neither does.
   *
   * @param from paying session
   * @param to receiving session
   * @param amount credits (must be &gt; 0)
   * @param reason short reason
   * @return payer balance after the transfer or the failure
   */
  Result<Long> transfer(SessionToken from, SessionToken to, long amount, String reason);

  Result<OwnedItem> grantItem(SessionToken session, ItemHandle item);

  Result<OwnedItem> revokeItem(SessionToken session, ItemHandle item);

  Result<List<OwnedItem>> ownedItems(SessionToken session);

  Result<Boolean> owns(SessionToken session, ItemHandle item);

  /**
   * Debits the current item price and grants the item as one step.
   *
   * @param session buyer
   * @param item item to buy
   * @return receipt or the failure; on failure neither balance nor inventory changed
   */
  Result<Receipt> purchase(SessionToken session, ItemHandle item);

  /**
   * Removes an owned item and credits its sell price as one step.
   *
   * @param session seller
   * @param item item to sell
   * @return receipt or the failure
   */
  Result<Receipt> sell(SessionToken session, ItemHandle item);
}
