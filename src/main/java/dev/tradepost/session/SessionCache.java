/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.session;

import dev.tradepost.api.EconomyException;
import dev.tradepost.api.ErrorCode;
import dev.tradepost.api.ItemHandle;
import dev.tradepost.api.ItemView;
import dev.tradepost.api.OwnedItem;
import dev.tradepost.api.Receipt;
import dev.tradepost.api.SessionState;
import dev.tradepost.api.SessionToken;
import dev.tradepost.api.events.EconomyEvents.CreditsChangedEvent;
import dev.tradepost.api.events.EconomyEvents.ItemPurchasedEvent;
import dev.tradepost.api.events.EconomyEvents.ItemSoldEvent;
import dev.tradepost.api.events.EconomyEvents.SessionStateChangedEvent;
import dev.tradepost.core.EventBus;
import dev.tradepost.core.Metrics;
import dev.tradepost.jdbc.GatewayError;
import dev.tradepost.registry.CatalogRegistry;
import dev.tradepost.session.AccountStore.AccountSnapshot;
import dev.tradepost.session.AccountStore.InventoryRow;
import dev.tradepost.session.AccountStore.StoredAccount;
import dev.tradepost.util.WarnLimiter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-player economic state for connected players.
 *
 * <p>Lifecycle: {@code LOADING -> ACTIVE -> FLUSHING -> RETIRED}, with {@code FAILED} reachable
 * from {@code LOADING} and {@code FLUSHING}. Mutations apply synchronously in memory and mark the
 * session dirty; dirty state is written as a full snapshot periodically and when the player
 * leaves.
 *
 * <p>All methods must be called on the server loop thread; store callbacks are delivered there as
 * well. Continuations capture the {@link SessionToken}, never the connection slot, so a slot
 * reused by another player cannot receive a stale completion.
 *
 * <p>At most one write per session is in flight. Mutations made while a write is outstanding only
 * bump the session version; when the write completes the newest snapshot is written if it is still
 * ahead of what was persisted.
 */
public final class SessionCache {
  private static final Logger LOG = LoggerFactory.getLogger("tradepost");
  private static final int MAX_IDENTITY_LENGTH = 64;
  private static final int FINISHED_HISTORY = 1024;

  /**
   * Session tuning.
   *
   * @param startingBalance balance of a newly created account
   * @param creditFloor lowest permitted balance
   * @param creditCeiling highest permitted balance
   * @param flushIntervalS seconds between periodic writes of dirty sessions
   * @param loadTimeoutS seconds a load may take before the session fails
   * @param flushTimeoutS seconds a leaving session waits for its final write
   * @param maxFlushAttempts failed final writes tolerated before the session fails
   */
  public record Settings(
      long startingBalance,
      long creditFloor,
      long creditCeiling,
      long flushIntervalS,
      long loadTimeoutS,
      long flushTimeoutS,
      int maxFlushAttempts) {

    public Settings {
      if (creditFloor > startingBalance || startingBalance > creditCeiling) {
        throw new IllegalArgumentException("creditFloor <= startingBalance <= creditCeiling");
      }
    }
  }

  private final AccountStore store;
  private final CatalogRegistry registry;
  private final EventBus events;
  private final Metrics metrics;
  private final Settings settings;
  private final LongSupplier clockS;
  private final WarnLimiter warnLimiter = new WarnLimiter(5, Duration.ofSeconds(30));

  private final Map<SessionToken, Session> sessions = new LinkedHashMap<>();
  private final Map<Integer, SessionToken> slots = new HashMap<>();
  private final Map<String, Session> byIdentity = new HashMap<>();
  private final Map<SessionToken, SessionState> finished =
      new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<SessionToken, SessionState> eldest) {
          return size() > FINISHED_HISTORY;
        }
      };
  private long nextToken = 1L;
  private long lastPeriodicFlushS;

  /**
   * Creates a session cache.
   *
   * @param store durable account store
   * @param registry item catalog
   * @param events event bus, may be {@code null}
   * @param metrics metrics registry, may be {@code null}
   * @param settings tuning
   * @param clockS wall clock in epoch seconds
   */
  public SessionCache(
      AccountStore store,
      CatalogRegistry registry,
      EventBus events,
      Metrics metrics,
      Settings settings,
      LongSupplier clockS) {
    this.store = Objects.requireNonNull(store, "store");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.events = events;
    this.metrics = metrics;
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clockS = Objects.requireNonNull(clockS, "clockS");
    this.lastPeriodicFlushS = clockS.getAsLong();
  }

  // --- lifecycle ---------------------------------------------------------------------------

  /**
   * Starts a session for a player who connected on {@code slot}. Returns immediately; the session
   * stays {@code LOADING} until the store answers.
   *
   * <p>If the slot still maps to a live session (a missed disconnect), or the identity already has
   * a live session, that session is left first and the new load waits until it has finished
   * writing, so the new session never reads state older than what the previous one wrote.
   *
   * @param slot host connection slot, only used to route {@link #onDisconnect(int)}
   * @param identity durable player identity
   * @return new session token
   * @throws EconomyException {@link ErrorCode#INVALID_ARGUMENT} for a blank or oversized identity
   */
  public SessionToken onJoin(int slot, String identity) {
    if (identity == null || identity.isBlank() || identity.length() > MAX_IDENTITY_LENGTH) {
      throw new EconomyException(
          ErrorCode.INVALID_ARGUMENT, "identity must be 1.." + MAX_IDENTITY_LENGTH + " chars");
    }
    SessionToken stale = slots.get(slot);
    if (stale != null) {
      Session previous = sessions.get(stale);
      if (previous != null) {
        LOG.warn(
            "(tradepost) code={} op={} slot={} token={} message={}",
            "SLOT_REUSED",
            "session.join",
            slot,
            stale,
            "slot reused before disconnect; leaving previous session");
        leave(previous);
      }
    }
    Session prior = byIdentity.get(identity);
    if (prior != null && prior.state.terminal()) {
      prior = null;
    }
    if (prior != null) {
      LOG.info(
          "(tradepost) identity {} joined again while {} is {}; waiting for it",
          identity,
          prior.token,
          prior.state);
      leave(prior);
    }

    Session s = new Session(new SessionToken(nextToken++), identity, slot);
    sessions.put(s.token, s);
    slots.put(slot, s.token);
    byIdentity.put(identity, s);
    s.since = now();
    fireState(s, null, SessionState.LOADING);
    if (prior != null && !prior.state.terminal()) {
      prior.waiter = s;
    } else {
      startLoad(s);
    }
    return s.token;
  }

  /**
   * Starts the final write of a session. Unknown or finished tokens are ignored.
   *
   * @param token session token
   */
  public void onLeave(SessionToken token) {
    Session s = token == null ? null : sessions.get(token);
    if (s != null) {
      leave(s);
    }
  }

  /**
   * Leaves whichever session is currently mapped to {@code slot}.
   *
   * @param slot host connection slot
   */
  public void onDisconnect(int slot) {
    SessionToken token = slots.get(slot);
    if (token != null) {
      onLeave(token);
    }
  }

  /** Leaves every live session; final writes are queued before the gateway drains. */
  public void shutdown() {
    for (Session s : new ArrayList<>(sessions.values())) {
      leave(s);
    }
  }

  /**
   * Periodic housekeeping, called about once a second on the loop thread: prunes expired items,
   * fails overdue loads, gives up on overdue final writes, retries failed final writes and runs the
   * periodic flush.
   */
  public void maintain() {
    long now = now();
    for (Session s : new ArrayList<>(sessions.values())) {
      switch (s.state) {
        case ACTIVE -> pruneExpired(s, now);
        case LOADING -> {
          if (s.loadIssued && now - s.since >= settings.loadTimeoutS()) {
            LOG.warn(
                "(tradepost) code={} op={} identity={} token={} waitedS={}",
                ErrorCode.LOAD_TIMEOUT,
                "session.load",
                s.identity,
                s.token,
                now - s.since);
            if (metrics != null) {
              metrics.recordSessionLoad(false, ErrorCode.LOAD_TIMEOUT);
            }
            finish(s, SessionState.FAILED);
          }
        }
        case FLUSHING -> {
          if (now - s.since >= settings.flushTimeoutS()) {
            giveUp(s, ErrorCode.FLUSH_TIMEOUT, "final write not confirmed in time");
          } else if (!s.flushInFlight) {
            requestFlush(s);
          }
        }
        default -> {}
      }
    }
    if (now - lastPeriodicFlushS >= settings.flushIntervalS()) {
      lastPeriodicFlushS = now;
      flushDirty();
    }
  }

  /**
   * Writes every dirty active session that has no write in flight.
   *
   * @return number of writes issued
   */
  public int flushDirty() {
    int issued = 0;
    for (Session s : new ArrayList<>(sessions.values())) {
      if (s.state == SessionState.ACTIVE && s.dirty() && !s.flushInFlight) {
        requestFlush(s);
        issued++;
      }
    }
    return issued;
  }

  // --- queries -----------------------------------------------------------------------------

  public Optional<SessionToken> sessionForSlot(int slot) {
    return Optional.ofNullable(slots.get(slot));
  }

  /**
   * Current state of a session, including recently finished ones.
   *
   * @param token session token
   * @return state
   * @throws EconomyException {@link ErrorCode#UNKNOWN_SESSION}
   */
  public SessionState state(SessionToken token) {
    Session s = token == null ? null : sessions.get(token);
    if (s != null) {
      return s.state;
    }
    SessionState done = token == null ? null : finished.get(token);
    if (done == null) {
      throw new EconomyException(ErrorCode.UNKNOWN_SESSION, "unknown session " + token);
    }
    return done;
  }

  public long balance(SessionToken token) {
    return readable(token).balance;
  }

  /**
   * Owned, unexpired items in acquisition order.
   *
   * @param token session token
   * @return immutable list
   */
  public List<OwnedItem> ownedItems(SessionToken token) {
    Session s = readable(token);
    long now = now();
    List<OwnedItem> out = new ArrayList<>(s.owned.size());
    for (OwnedItem owned : s.owned.values()) {
      if (!owned.expiredAt(now)) {
        out.add(owned);
      }
    }
    return List.copyOf(out);
  }

  public boolean owns(SessionToken token, ItemHandle item) {
    Session s = readable(token);
    OwnedItem owned = item == null ? null : s.owned.get(item);
    return owned != null && !owned.expiredAt(now());
  }

  /** Number of sessions held in memory, in any state. */
  public int size() {
    return sessions.size();
  }

  // --- mutations ---------------------------------------------------------------------------

  /**
   * Adds a signed amount to the balance.
   *
   * @param token session token
   * @param delta credits to add, negative to debit
   * @param reason short reason for logs and events
   * @return new balance
   * @throws EconomyException {@link ErrorCode#INSUFFICIENT_FUNDS}, {@link ErrorCode#BALANCE_LIMIT},
   *     {@link ErrorCode#INVALID_ARGUMENT} on overflow, or a session error
   */
  public long adjustCredits(SessionToken token, long delta, String reason) {
    Session s = active(token);
    if (delta == 0) {
      return s.balance;
    }
    long next;
    try {
      next = Math.addExact(s.balance, delta);
    } catch (ArithmeticException e) {
      throw new EconomyException(ErrorCode.INVALID_ARGUMENT, "balance overflow");
    }
    if (delta < 0 && next < settings.creditFloor()) {
      throw new EconomyException(
          ErrorCode.INSUFFICIENT_FUNDS, "balance " + s.balance + " cannot cover " + (-delta));
    }
    if (delta > 0 && next > settings.creditCeiling()) {
      throw new EconomyException(
          ErrorCode.BALANCE_LIMIT, "balance would exceed " + settings.creditCeiling());
    }
    setBalance(s, next, reason);
    return next;
  }

  /**
   * Administrative absolute balance change.
   *
   * @param token session token
   * @param amount new balance within floor and ceiling
   * @param reason short reason
   * @return new balance
   */
  public long setCredits(SessionToken token, long amount, String reason) {
    Session s = active(token);
    if (amount < settings.creditFloor() || amount > settings.creditCeiling()) {
      throw new EconomyException(
          ErrorCode.INVALID_ARGUMENT,
          "amount must be between " + settings.creditFloor() + " and " + settings.creditCeiling());
    }
    if (amount == s.balance) {
      return amount;
    }
    LOG.info(
        "(tradepost) admin op=setCredits identity={} old={} new={} reason={}",
        s.identity,
        s.balance,
        amount,
        reason);
    setBalance(s, amount, reason);
    return amount;
  }

  /**
   * Moves credits between two active sessions. Both balances change or neither does.
   *
   * @param from paying session
   * @param to receiving session
   * @param amount credits, must be positive
   * @param reason short reason
   * @return payer balance after the transfer
   */
  public long transfer(SessionToken from, SessionToken to, long amount, String reason) {
    if (amount <= 0) {
      throw new EconomyException(ErrorCode.INVALID_ARGUMENT, "amount must be > 0");
    }
    if (Objects.equals(from, to)) {
      throw new EconomyException(ErrorCode.INVALID_ARGUMENT, "cannot transfer to self");
    }
    Session payer = active(from);
    Session payee = active(to);
    long payerNext = payer.balance - amount;
    if (payerNext < settings.creditFloor() || payerNext > payer.balance) {
      throw new EconomyException(
          ErrorCode.INSUFFICIENT_FUNDS, "balance " + payer.balance + " cannot cover " + amount);
    }
    long payeeNext;
    try {
      payeeNext = Math.addExact(payee.balance, amount);
    } catch (ArithmeticException e) {
      throw new EconomyException(ErrorCode.BALANCE_LIMIT, "recipient balance overflow");
    }
    if (payeeNext > settings.creditCeiling()) {
      throw new EconomyException(
          ErrorCode.BALANCE_LIMIT, "recipient balance would exceed " + settings.creditCeiling());
    }
    String why = reason == null ? "transfer" : reason;
    setBalance(payer, payerNext, why);
    setBalance(payee, payeeNext, why);
    return payerNext;
  }

  /**
   * Grants an item without charging for it.
   *
   * @param token session token
   * @param item item handle
   * @return ownership record
   */
  public OwnedItem grantItem(SessionToken token, ItemHandle item) {
    Session s = active(token);
    ItemView view = requireItem(item);
    long now = now();
    pruneExpired(s, now);
    if (s.owned.containsKey(item)) {
      throw new EconomyException(ErrorCode.ALREADY_OWNED, "already owns " + describe(view));
    }
    OwnedItem owned = new OwnedItem(item, now, 0L, expiryFor(view, now));
    s.owned.put(item, owned);
    s.touch();
    return owned;
  }

  /**
   * Removes an item without refunding it.
   *
   * @param token session token
   * @param item item handle
   * @return removed ownership record
   */
  public OwnedItem revokeItem(SessionToken token, ItemHandle item) {
    Session s = active(token);
    ItemView view = requireItem(item);
    pruneExpired(s, now());
    OwnedItem removed = s.owned.remove(item);
    if (removed == null) {
      throw new EconomyException(ErrorCode.NOT_OWNED, "does not own " + describe(view));
    }
    s.touch();
    return removed;
  }

  /**
   * Debits the item price and grants the item in one step.
   *
   * <p>The price is read once, when the purchase is validated; a later price change does not
   * affect it. Funds are checked before ownership.
   *
   * @param token buyer
   * @param item item to buy
   * @return receipt
   * @throws EconomyException {@link ErrorCode#NOT_FOUND}, {@link ErrorCode#ITEM_NOT_PURCHASABLE},
   *     {@link ErrorCode#INSUFFICIENT_FUNDS}, {@link ErrorCode#ALREADY_OWNED} or a session error
   */
  public Receipt purchase(SessionToken token, ItemHandle item) {
    Session s = active(token);
    ItemView view = requireItem(item);
    if (!registry.purchasable(item)) {
      throw new EconomyException(
          ErrorCode.ITEM_NOT_PURCHASABLE, describe(view) + " is not purchasable");
    }
    long price = view.price();
    long now = now();
    pruneExpired(s, now);
    long next;
    try {
      next = Math.subtractExact(s.balance, price);
    } catch (ArithmeticException e) {
      throw new EconomyException(
          ErrorCode.INSUFFICIENT_FUNDS, "balance " + s.balance + " cannot cover " + price);
    }
    if (next < settings.creditFloor()) {
      throw new EconomyException(
          ErrorCode.INSUFFICIENT_FUNDS, "balance " + s.balance + " cannot cover " + price);
    }
    if (s.owned.containsKey(item)) {
      throw new EconomyException(ErrorCode.ALREADY_OWNED, "already owns " + describe(view));
    }
    long old = s.balance;
    s.balance = next;
    s.owned.put(item, new OwnedItem(item, now, price, expiryFor(view, now)));
    s.touch();
    if (metrics != null) {
      metrics.recordPurchase();
    }
    LOG.debug(
        "(tradepost) purchase identity={} item={} price={}", s.identity, describe(view), price);
    if (events != null) {
      events.fireCreditsChanged(
          new CreditsChangedEvent(s.token, s.identity, old, next, "purchase:" + describe(view)));
      events.fireItemPurchased(new ItemPurchasedEvent(s.token, s.identity, item, price, next));
    }
    return new Receipt(s.token, item, price, next, now);
  }

  /**
   * Removes an owned item and credits its sell price in one step.
   *
   * @param token seller
   * @param item item to sell
   * @return receipt
   * @throws EconomyException {@link ErrorCode#ITEM_NOT_SELLABLE}, {@link ErrorCode#NOT_OWNED},
   *     {@link ErrorCode#BALANCE_LIMIT} or a session error
   */
  public Receipt sell(SessionToken token, ItemHandle item) {
    Session s = active(token);
    ItemView view = requireItem(item);
    if (!view.sellable()) {
      throw new EconomyException(ErrorCode.ITEM_NOT_SELLABLE, describe(view) + " cannot be sold");
    }
    long now = now();
    pruneExpired(s, now);
    if (!s.owned.containsKey(item)) {
      throw new EconomyException(ErrorCode.NOT_OWNED, "does not own " + describe(view));
    }
    long refund = view.sellPrice();
    long next;
    try {
      next = Math.addExact(s.balance, refund);
    } catch (ArithmeticException e) {
      throw new EconomyException(ErrorCode.BALANCE_LIMIT, "balance overflow");
    }
    if (next > settings.creditCeiling()) {
      throw new EconomyException(
          ErrorCode.BALANCE_LIMIT, "balance would exceed " + settings.creditCeiling());
    }
    long old = s.balance;
    s.owned.remove(item);
    s.balance = next;
    s.touch();
    if (metrics != null) {
      metrics.recordSale();
    }
    if (events != null) {
      events.fireCreditsChanged(
          new CreditsChangedEvent(s.token, s.identity, old, next, "sell:" + describe(view)));
      events.fireItemSold(new ItemSoldEvent(s.token, s.identity, item, refund, next));
    }
    return new Receipt(s.token, item, refund, next, now);
  }

  // --- internals ---------------------------------------------------------------------------

  private void startLoad(Session s) {
    s.loadIssued = true;
    s.since = now();
    SessionToken token = s.token;
    store.load(
        s.identity,
        settings.startingBalance(),
        s.since,
        account -> onLoaded(token, account),
        error -> onLoadFailed(token, error));
  }

  private void onLoaded(SessionToken token, StoredAccount account) {
    Session s = sessions.get(token);
    if (s == null || s.state != SessionState.LOADING) {
      LOG.debug("(tradepost) discarding late load for {}", token);
      return;
    }
    long now = now();
    s.balance = account.balance();
    s.createdAtS = account.createdAtS();
    for (InventoryRow row : account.inventory()) {
      Optional<ItemHandle> handle = registry.lookupByKey(row.categoryKey(), row.itemKey());
      if (handle.isEmpty()) {
        // Not registered in this run; keep the row so the next write does not drop it.
        s.orphans.add(row);
        continue;
      }
      OwnedItem owned =
          new OwnedItem(handle.get(), row.acquiredAtS(), row.pricePaid(), row.expiresAtS());
      if (owned.expiredAt(now)) {
        s.version++;
        continue;
      }
      s.owned.put(handle.get(), owned);
    }
    if (!s.orphans.isEmpty()) {
      LOG.info(
          "(tradepost) identity={} keeps {} inventory row(s) for unregistered items",
          s.identity,
          s.orphans.size());
    }
    if (metrics != null) {
      metrics.recordSessionLoad(true, null);
    }
    transition(s, SessionState.ACTIVE);
    if (s.leaving) {
      beginFinalFlush(s);
    }
  }

  private void onLoadFailed(SessionToken token, GatewayError error) {
    Session s = sessions.get(token);
    if (s == null || s.state != SessionState.LOADING) {
      return;
    }
    LOG.warn(
        "(tradepost) code={} op={} identity={} token={} message={}",
        error.code(),
        "session.load",
        s.identity,
        token,
        error.message());
    if (metrics != null) {
      metrics.recordSessionLoad(false, error.code());
    }
    finish(s, SessionState.FAILED);
  }

  private void leave(Session s) {
    releaseSlot(s);
    switch (s.state) {
      // A waiting session retires on its turn; a loading one writes once the load lands.
      case LOADING -> s.leaving = true;
      case ACTIVE -> beginFinalFlush(s);
      default -> {}
    }
  }

  private void beginFinalFlush(Session s) {
    s.since = now();
    transition(s, SessionState.FLUSHING);
    if (!s.flushInFlight) {
      requestFlush(s);
    }
  }

  private void requestFlush(Session s) {
    if (s.flushInFlight) {
      return;
    }
    AccountSnapshot snapshot = snapshot(s);
    s.flushInFlight = true;
    SessionToken token = s.token;
    long version = snapshot.version();
    store.save(
        snapshot,
        () -> onFlushed(token, version),
        error -> onFlushFailed(token, version, error));
  }

  private void onFlushed(SessionToken token, long version) {
    if (metrics != null) {
      metrics.recordFlush(true, null);
    }
    Session s = sessions.get(token);
    if (s == null) {
      LOG.info("(tradepost) write for {} confirmed after the session was released", token);
      return;
    }
    s.flushInFlight = false;
    s.flushFailures = 0;
    s.persistedVersion = Math.max(s.persistedVersion, version);
    if (s.dirty()) {
      if (s.state == SessionState.FLUSHING || s.state == SessionState.ACTIVE) {
        requestFlush(s);
      }
      return;
    }
    if (s.state == SessionState.FLUSHING) {
      finish(s, SessionState.RETIRED);
    }
  }

  private void onFlushFailed(SessionToken token, long version, GatewayError error) {
    if (metrics != null) {
      metrics.recordFlush(false, error.code());
    }
    Session s = sessions.get(token);
    if (s == null) {
      return;
    }
    s.flushInFlight = false;
    long suppressed = warnLimiter.tryAcquire("FLUSH_FAILED");
    if (suppressed >= 0) {
      LOG.warn(
          "(tradepost) code={} op={} identity={} token={} version={} suppressed={} message={}",
          error.code(),
          "session.flush",
          s.identity,
          token,
          version,
          suppressed,
          error.message());
    }
    if (s.state != SessionState.FLUSHING) {
      // Still active: the next periodic flush writes the newest state.
      return;
    }
    s.flushFailures++;
    if (error.code() == ErrorCode.ABORTED || s.flushFailures >= settings.maxFlushAttempts()) {
      giveUp(s, error.code(), error.message());
    }
    // Otherwise maintain() issues a fresh full-state write on its next pass.
  }

  private void giveUp(Session s, ErrorCode code, String why) {
    if (s.dirty()) {
      LOG.error(
          "(tradepost) code={} op={} identity={} token={} balance={} items={} cause={} message={}",
          "LOST_WRITE",
          "session.flush",
          s.identity,
          s.token,
          s.balance,
          s.owned.size(),
          code,
          why);
      if (metrics != null) {
        metrics.recordLostWrite();
      }
      finish(s, SessionState.FAILED);
    } else {
      LOG.warn(
          "(tradepost) code={} op={} identity={} token={} message={}",
          code,
          "session.flush",
          s.identity,
          s.token,
          "final write not confirmed but nothing was unsaved");
      finish(s, SessionState.RETIRED);
    }
  }

  private void finish(Session s, SessionState terminal) {
    transition(s, terminal);
    sessions.remove(s.token);
    finished.put(s.token, terminal);
    releaseSlot(s);
    if (byIdentity.get(s.identity) == s) {
      byIdentity.remove(s.identity);
    }
    Session next = s.waiter;
    s.waiter = null;
    if (next != null && sessions.get(next.token) == next) {
      if (next.leaving) {
        finish(next, SessionState.RETIRED);
      } else {
        startLoad(next);
      }
    }
  }

  private void transition(Session s, SessionState to) {
    SessionState from = s.state;
    s.state = to;
    LOG.debug("(tradepost) session {} {} -> {}", s.token, from, to);
    fireState(s, from, to);
  }

  private void fireState(Session s, SessionState from, SessionState to) {
    if (events != null) {
      events.fireSessionStateChanged(new SessionStateChangedEvent(s.token, s.identity, from, to));
    }
  }

  private void releaseSlot(Session s) {
    slots.remove(s.slot, s.token);
  }

  private void setBalance(Session s, long next, String reason) {
    long old = s.balance;
    s.balance = next;
    s.touch();
    if (events != null) {
      events.fireCreditsChanged(new CreditsChangedEvent(s.token, s.identity, old, next, reason));
    }
  }

  private void pruneExpired(Session s, long now) {
    if (s.owned.values().removeIf(owned -> owned.expiredAt(now))) {
      s.touch();
    }
  }

  private AccountSnapshot snapshot(Session s) {
    List<InventoryRow> rows = new ArrayList<>(s.owned.size() + s.orphans.size());
    for (OwnedItem owned : s.owned.values()) {
      ItemView view = registry.item(owned.item()).orElseThrow();
      rows.add(
          new InventoryRow(
              view.categoryKey(),
              view.key(),
              owned.acquiredAtS(),
              owned.pricePaid(),
              owned.expiresAtS()));
    }
    rows.addAll(s.orphans);
    return new AccountSnapshot(s.identity, s.balance, s.createdAtS, now(), rows, s.version);
  }

  private Session active(SessionToken token) {
    Session s = token == null ? null : sessions.get(token);
    if (s == null) {
      throw new EconomyException(ErrorCode.UNKNOWN_SESSION, "unknown session " + token);
    }
    if (s.state != SessionState.ACTIVE) {
      throw new EconomyException(
          ErrorCode.SESSION_NOT_ACTIVE, "session " + token + " is " + s.state);
    }
    return s;
  }

  private Session readable(SessionToken token) {
    Session s = token == null ? null : sessions.get(token);
    if (s == null) {
      throw new EconomyException(ErrorCode.UNKNOWN_SESSION, "unknown session " + token);
    }
    if (s.state != SessionState.ACTIVE && s.state != SessionState.FLUSHING) {
      throw new EconomyException(
          ErrorCode.SESSION_NOT_ACTIVE, "session " + token + " is " + s.state);
    }
    return s;
  }

  private ItemView requireItem(ItemHandle item) {
    return registry
        .item(item)
        .orElseThrow(() -> new EconomyException(ErrorCode.NOT_FOUND, "unknown item " + item));
  }

  private static long expiryFor(ItemView view, long now) {
    return view.durationSeconds() > 0 ? now + view.durationSeconds() : 0L;
  }

  private static String describe(ItemView view) {
    return view.categoryKey() + "/" + view.key();
  }

  private long now() {
    return clockS.getAsLong();
  }

  private static final class Session {
    final SessionToken token;
    final String identity;
    final int slot;
    final Map<ItemHandle, OwnedItem> owned = new LinkedHashMap<>();
    final List<InventoryRow> orphans = new ArrayList<>();
    SessionState state = SessionState.LOADING;
    long balance;
    long createdAtS;
    long version;
    long persistedVersion;
    long since;
    boolean loadIssued;
    boolean leaving;
    boolean flushInFlight;
    int flushFailures;
    Session waiter;

    Session(SessionToken token, String identity, int slot) {
      this.token = token;
      this.identity = identity;
      this.slot = slot;
    }

    boolean dirty() {
      return version > persistedVersion;
    }

    void touch() {
      version++;
    }
  }
}
