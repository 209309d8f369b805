/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.core;

import dev.tradepost.api.Accounts;
import dev.tradepost.api.ItemHandle;
import dev.tradepost.api.OwnedItem;
import dev.tradepost.api.Receipt;
import dev.tradepost.api.Result;
import dev.tradepost.api.SessionState;
import dev.tradepost.api.SessionToken;
import dev.tradepost.session.SessionCache;
import java.util.List;
import java.util.Objects;

/**
 * {@link Accounts} backed by the {@link SessionCache}. Calls must come from the loop thread, like
 * every other session access.
 */
final class AccountsImpl implements Accounts {
  private final SessionCache cache;

  AccountsImpl(SessionCache cache) {
    this.cache = Objects.requireNonNull(cache, "cache");
  }

  @Override
  public Result<SessionState> state(SessionToken session) {
    return Result.capture(() -> cache.state(session));
  }

  @Override
  public Result<Long> balance(SessionToken session) {
    return Result.capture(() -> cache.balance(session));
  }

  @Override
  public Result<Long> adjustCredits(SessionToken session, long delta, String reason) {
    return Result.capture(() -> cache.adjustCredits(session, delta, reason));
  }

  @Override
  public Result<Long> setCredits(SessionToken session, long amount, String reason) {
    return Result.capture(() -> cache.setCredits(session, amount, reason));
  }

  @Override
  public Result<Long> transfer(SessionToken from, SessionToken to, long amount, String reason) {
    return Result.capture(() -> cache.transfer(from, to, amount, reason));
  }

  @Override
  public Result<OwnedItem> grantItem(SessionToken session, ItemHandle item) {
    return Result.capture(() -> cache.grantItem(session, item));
  }

  @Override
  public Result<OwnedItem> revokeItem(SessionToken session, ItemHandle item) {
    return Result.capture(() -> cache.revokeItem(session, item));
  }

  @Override
  public Result<List<OwnedItem>> ownedItems(SessionToken session) {
    return Result.capture(() -> cache.ownedItems(session));
  }

  @Override
  public Result<Boolean> owns(SessionToken session, ItemHandle item) {
    return Result.capture(() -> cache.owns(session, item));
  }

  @Override
  public Result<Receipt> purchase(SessionToken session, ItemHandle item) {
    return Result.capture(() -> cache.purchase(session, item));
  }

  @Override
  public Result<Receipt> sell(SessionToken session, ItemHandle item) {
    return Result.capture(() -> cache.sell(session, item));
  }
}
