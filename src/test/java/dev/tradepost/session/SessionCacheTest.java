/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.tradepost.api.CategoryHandle;
import dev.tradepost.api.EconomyException;
import dev.tradepost.api.ErrorCode;
import dev.tradepost.api.ItemDefinition;
import dev.tradepost.api.ItemHandle;
import dev.tradepost.api.Receipt;
import dev.tradepost.api.SessionState;
import dev.tradepost.api.SessionToken;
import dev.tradepost.api.events.EconomyEvents.CreditsChangedEvent;
import dev.tradepost.api.events.EconomyEvents.SessionStateChangedEvent;
import dev.tradepost.core.EventBus;
import dev.tradepost.registry.CatalogRegistry;
import dev.tradepost.session.AccountStore.AccountSnapshot;
import dev.tradepost.session.AccountStore.InventoryRow;
import dev.tradepost.session.AccountStore.StoredAccount;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

final class SessionCacheTest {
  private static final SessionCache.Settings SETTINGS =
      new SessionCache.Settings(2000, 0, 1_000_000, 30, 10, 20, 3);

  private final AtomicLong clock = new AtomicLong(1_000);
  private final ScriptedAccountStore store = new ScriptedAccountStore();
  private final CatalogRegistry registry = new CatalogRegistry();
  private final EventBus events = new EventBus();
  private SessionCache cache;
  private ItemHandle ak47;
  private ItemHandle helmet;
  private ItemHandle pass;

  @BeforeEach
  void setUp() {
    CategoryHandle weapons = registry.registerCategory("weapons", "Weapons", "");
    ak47 = registry.registerItem(weapons, "ak47", "AK-47", 1500);
    CategoryHandle gear = registry.registerCategory("gear", "Gear", "");
    helmet = registry.registerItem(gear, ItemDefinition.of("helmet").price(100).sellPrice(40));
    pass = registry.registerItem(gear, ItemDefinition.of("pass").price(100).durationSeconds(60));
    cache = newCache();
  }

  private SessionCache newCache() {
    return new SessionCache(store, registry, events, null, SETTINGS, clock::get);
  }

  private SessionToken activeSession(int slot, String identity) {
    SessionToken token = cache.onJoin(slot, identity);
    store.completeLoad(identity);
    assertEquals(SessionState.ACTIVE, cache.state(token));
    return token;
  }

  private static void assertCode(ErrorCode expected, Executable call) {
    assertEquals(expected, assertThrows(EconomyException.class, call).errorCode());
  }

  @Test
  void buyingTheAk47SpendsFifteenHundredAndSurvivesRejoin() {
    SessionToken token = activeSession(1, "alice");
    assertEquals(2000, cache.balance(token));

    Receipt receipt = cache.purchase(token, ak47);

    assertEquals(1500, receipt.amount());
    assertEquals(500, receipt.balanceAfter());
    assertEquals(500, cache.balance(token));
    assertTrue(cache.owns(token, ak47));
    assertCode(ErrorCode.INSUFFICIENT_FUNDS, () -> cache.purchase(token, ak47));
    assertEquals(500, cache.balance(token));

    cache.onDisconnect(1);
    assertEquals(SessionState.FLUSHING, cache.state(token));
    AccountSnapshot snapshot = store.pendingSave("alice");
    assertEquals(500, snapshot.balance());
    assertEquals(1, snapshot.inventory().size());
    InventoryRow row = snapshot.inventory().get(0);
    assertEquals("weapons", row.categoryKey());
    assertEquals("ak47", row.itemKey());
    assertEquals(1500, row.pricePaid());

    store.completeSave("alice");
    assertEquals(SessionState.RETIRED, cache.state(token));
    assertEquals(0, cache.size());

    SessionToken again = activeSession(1, "alice");
    assertEquals(500, cache.balance(again));
    assertTrue(cache.owns(again, ak47));
  }

  @Test
  void crashBeforeWriteConfirmationLosesOnlyUnconfirmedChanges() {
    SessionToken token = activeSession(1, "alice");
    cache.purchase(token, ak47);
    cache.onLeave(token);
    assertEquals(1, store.pendingSaves("alice"));

    // process dies with the write unconfirmed; a fresh cache reads the durable state
    store.saves.clear();
    cache = newCache();
    SessionToken after = activeSession(1, "alice");

    assertEquals(2000, cache.balance(after));
    assertFalse(cache.owns(after, ak47));
  }

  @Test
  void mutationsAreRejectedWhileLoading() {
    SessionToken token = cache.onJoin(1, "alice");

    assertEquals(SessionState.LOADING, cache.state(token));
    assertCode(ErrorCode.SESSION_NOT_ACTIVE, () -> cache.adjustCredits(token, 10, "test"));
    assertCode(ErrorCode.SESSION_NOT_ACTIVE, () -> cache.purchase(token, ak47));
    assertCode(ErrorCode.SESSION_NOT_ACTIVE, () -> cache.balance(token));
  }

  @Test
  void unknownTokensAndBadIdentitiesAreRejected() {
    assertCode(ErrorCode.UNKNOWN_SESSION, () -> cache.balance(new SessionToken(999)));
    assertCode(ErrorCode.UNKNOWN_SESSION, () -> cache.state(new SessionToken(999)));
    assertCode(ErrorCode.INVALID_ARGUMENT, () -> cache.onJoin(1, " "));
    assertCode(ErrorCode.INVALID_ARGUMENT, () -> cache.onJoin(1, "x".repeat(65)));
  }

  @Test
  void leavingWhileLoadingWritesOnceTheLoadLands() {
    SessionToken token = cache.onJoin(1, "alice");
    cache.onDisconnect(1);
    assertEquals(SessionState.LOADING, cache.state(token));
    assertEquals(0, store.pendingSaves("alice"));

    store.completeLoad("alice");

    assertEquals(SessionState.FLUSHING, cache.state(token));
    store.completeSave("alice");
    assertEquals(SessionState.RETIRED, cache.state(token));
  }

  @Test
  void loadsMayCompleteOutOfOrder() {
    SessionToken alice = cache.onJoin(1, "alice");
    SessionToken bob = cache.onJoin(2, "bob");
    store.durable.put("alice", new StoredAccount("alice", 10, 1, List.of()));
    store.durable.put("bob", new StoredAccount("bob", 20, 1, List.of()));

    store.completeLoad("bob");
    assertEquals(SessionState.LOADING, cache.state(alice));
    assertEquals(20, cache.balance(bob));

    store.completeLoad("alice");
    assertEquals(10, cache.balance(alice));
  }

  @Test
  void reusedSlotLeavesThePreviousSession() {
    SessionToken alice = activeSession(1, "alice");

    SessionToken bob = cache.onJoin(1, "bob");

    assertEquals(SessionState.FLUSHING, cache.state(alice));
    assertEquals(bob, cache.sessionForSlot(1).orElseThrow());
    store.completeSave("alice");
    assertEquals(SessionState.RETIRED, cache.state(alice));
    assertEquals(bob, cache.sessionForSlot(1).orElseThrow());
  }

  @Test
  void rejoinWaitsForThePreviousSessionToFinishWriting() {
    SessionToken first = activeSession(1, "alice");
    cache.adjustCredits(first, 100, "bonus");

    SessionToken second = cache.onJoin(2, "alice");

    assertEquals(SessionState.FLUSHING, cache.state(first));
    assertEquals(SessionState.LOADING, cache.state(second));
    assertEquals(0, store.pendingLoads("alice"));

    store.completeSave("alice");

    assertEquals(SessionState.RETIRED, cache.state(first));
    assertEquals(1, store.pendingLoads("alice"));
    store.completeLoad("alice");
    assertEquals(2100, cache.balance(second));
  }

  @Test
  void loadTimeoutFailsTheSessionAndLateResultIsDiscarded() {
    SessionToken token = cache.onJoin(1, "alice");

    clock.addAndGet(10);
    cache.maintain();

    assertEquals(SessionState.FAILED, cache.state(token));
    assertTrue(cache.sessionForSlot(1).isEmpty());
    store.completeLoad("alice");
    assertEquals(SessionState.FAILED, cache.state(token));
    assertEquals(0, cache.size());
  }

  @Test
  void lateLoadForTimedOutSessionLeavesTheSlotsNewOwnerAlone() {
    SessionToken alice = cache.onJoin(1, "alice");
    clock.addAndGet(10);
    cache.maintain();
    assertEquals(SessionState.FAILED, cache.state(alice));

    SessionToken bob = activeSession(1, "bob");
    cache.adjustCredits(bob, 25, "bonus");
    store.completeLoad("alice");

    assertEquals(SessionState.FAILED, cache.state(alice));
    assertEquals(bob, cache.sessionForSlot(1).orElseThrow());
    assertEquals(2025, cache.balance(bob));
    assertEquals(SessionState.ACTIVE, cache.state(bob));
    assertEquals(1, cache.size());
  }

  @Test
  void lateWriteForTimedOutSessionLeavesTheSlotsNewOwnerAlone() {
    SessionToken alice = activeSession(1, "alice");
    cache.adjustCredits(alice, 5, "a");
    cache.onLeave(alice);
    clock.addAndGet(20);
    cache.maintain();
    assertEquals(SessionState.FAILED, cache.state(alice));

    SessionToken bob = activeSession(1, "bob");
    cache.adjustCredits(bob, 25, "bonus");
    store.completeSave("alice");

    assertEquals(SessionState.FAILED, cache.state(alice));
    assertEquals(bob, cache.sessionForSlot(1).orElseThrow());
    assertEquals(2025, cache.balance(bob));
    assertEquals(SessionState.ACTIVE, cache.state(bob));
    assertEquals(1, cache.size());
  }

  @Test
  void loadFailureFailsTheSession() {
    SessionToken token = cache.onJoin(1, "alice");

    store.failLoad("alice", ErrorCode.STORE_UNAVAILABLE);

    assertEquals(SessionState.FAILED, cache.state(token));
    assertCode(ErrorCode.UNKNOWN_SESSION, () -> cache.balance(token));
  }

  @Test
  void flushesCoalesceToTheLatestSnapshot() {
    SessionToken token = activeSession(1, "alice");
    cache.adjustCredits(token, 1, "a");
    assertEquals(1, cache.flushDirty());

    cache.adjustCredits(token, 2, "b");
    cache.adjustCredits(token, 3, "c");
    assertEquals(0, cache.flushDirty());

    store.completeSave("alice");

    assertEquals(2, store.savesIssued);
    assertEquals(2006, store.pendingSave("alice").balance());
    store.completeSave("alice");
    assertEquals(0, cache.flushDirty());
    assertEquals(2006, store.durable.get("alice").balance());
  }

  @Test
  void periodicFlushWritesDirtySessions() {
    SessionToken token = activeSession(1, "alice");
    cache.adjustCredits(token, 5, "a");

    clock.addAndGet(29);
    cache.maintain();
    assertEquals(0, store.pendingSaves("alice"));

    clock.addAndGet(1);
    cache.maintain();
    assertEquals(1, store.pendingSaves("alice"));
  }

  @Test
  void finalWriteTimeoutWithUnsavedChangesIsALostWrite() {
    SessionToken token = activeSession(1, "alice");
    cache.adjustCredits(token, 5, "a");
    cache.onLeave(token);

    clock.addAndGet(20);
    cache.maintain();

    assertEquals(SessionState.FAILED, cache.state(token));
    store.completeSave("alice");
    assertEquals(SessionState.FAILED, cache.state(token));
  }

  @Test
  void abortedWriteOfCleanSessionRetires() {
    SessionToken token = activeSession(1, "alice");
    cache.onLeave(token);

    store.failSave("alice", ErrorCode.ABORTED);

    assertEquals(SessionState.RETIRED, cache.state(token));
  }

  @Test
  void failedFinalWriteIsRetriedThenGivenUp() {
    SessionToken token = activeSession(1, "alice");
    cache.adjustCredits(token, 5, "a");
    cache.onLeave(token);

    store.failSave("alice", ErrorCode.CONNECTION_LOST);
    assertEquals(SessionState.FLUSHING, cache.state(token));
    assertEquals(2005, cache.balance(token));

    clock.incrementAndGet();
    cache.maintain();
    store.failSave("alice", ErrorCode.DEADLOCK_RETRY_EXHAUSTED);
    clock.incrementAndGet();
    cache.maintain();
    assertEquals(SessionState.FLUSHING, cache.state(token));
    store.failSave("alice", ErrorCode.CONNECTION_LOST);

    assertEquals(SessionState.FAILED, cache.state(token));
  }

  @Test
  void failedFinalWriteSucceedsOnRetry() {
    SessionToken token = activeSession(1, "alice");
    cache.adjustCredits(token, 5, "a");
    cache.onLeave(token);
    store.failSave("alice", ErrorCode.CONNECTION_LOST);

    clock.incrementAndGet();
    cache.maintain();
    store.completeSave("alice");

    assertEquals(SessionState.RETIRED, cache.state(token));
    assertEquals(2005, store.durable.get("alice").balance());
  }

  @Test
  void sellRefundsAndRemovesTheItem() {
    SessionToken token = activeSession(1, "alice");
    cache.purchase(token, helmet);
    assertEquals(1900, cache.balance(token));

    Receipt receipt = cache.sell(token, helmet);

    assertEquals(40, receipt.amount());
    assertEquals(1940, cache.balance(token));
    assertFalse(cache.owns(token, helmet));
    assertCode(ErrorCode.NOT_OWNED, () -> cache.sell(token, helmet));
    cache.purchase(token, ak47);
    assertCode(ErrorCode.ITEM_NOT_SELLABLE, () -> cache.sell(token, ak47));
  }

  @Test
  void purchaseChecksCatalogState() {
    SessionToken token = activeSession(1, "alice");
    cache.purchase(token, helmet);

    assertCode(ErrorCode.ALREADY_OWNED, () -> cache.purchase(token, helmet));
    assertCode(ErrorCode.NOT_FOUND, () -> cache.purchase(token, new ItemHandle(999)));
    registry.deactivateItem(ak47);
    assertCode(ErrorCode.ITEM_NOT_PURCHASABLE, () -> cache.purchase(token, ak47));
    assertEquals(1900, cache.balance(token));
  }

  @Test
  void priceChangeAppliesToLaterPurchasesOnly() {
    SessionToken alice = activeSession(1, "alice");
    SessionToken bob = activeSession(2, "bob");
    cache.purchase(alice, helmet);

    registry.setPrice(helmet, 250);
    cache.purchase(bob, helmet);

    assertEquals(1900, cache.balance(alice));
    assertEquals(1750, cache.balance(bob));
    assertEquals(100, cache.ownedItems(alice).get(0).pricePaid());
  }

  @Test
  void transferMovesBothBalancesOrNeither() {
    SessionToken alice = activeSession(1, "alice");
    SessionToken bob = activeSession(2, "bob");

    assertEquals(1500, cache.transfer(alice, bob, 500, "gift"));
    assertEquals(2500, cache.balance(bob));

    assertCode(ErrorCode.INSUFFICIENT_FUNDS, () -> cache.transfer(alice, bob, 5000, "gift"));
    cache.setCredits(bob, 999_900, "admin");
    assertCode(ErrorCode.BALANCE_LIMIT, () -> cache.transfer(alice, bob, 500, "gift"));
    assertCode(ErrorCode.INVALID_ARGUMENT, () -> cache.transfer(alice, alice, 1, "self"));
    assertCode(ErrorCode.INVALID_ARGUMENT, () -> cache.transfer(alice, bob, 0, "none"));
    assertEquals(1500, cache.balance(alice));
    assertEquals(999_900, cache.balance(bob));

    cache.onLeave(bob);
    assertCode(ErrorCode.SESSION_NOT_ACTIVE, () -> cache.transfer(alice, bob, 1, "late"));
  }

  @Test
  void balanceStaysWithinFloorAndCeiling() {
    SessionToken token = activeSession(1, "alice");

    assertCode(ErrorCode.INSUFFICIENT_FUNDS, () -> cache.adjustCredits(token, -2001, "x"));
    assertCode(ErrorCode.BALANCE_LIMIT, () -> cache.adjustCredits(token, 1_000_000, "x"));
    assertCode(ErrorCode.INVALID_ARGUMENT, () -> cache.setCredits(token, -1, "x"));
    assertCode(ErrorCode.INVALID_ARGUMENT, () -> cache.setCredits(token, 1_000_001, "x"));
    assertEquals(0, cache.adjustCredits(token, -2000, "x"));

    cache =
        new SessionCache(
            store,
            registry,
            events,
            null,
            new SessionCache.Settings(0, -1000, 1_000_000, 30, 10, 20, 3),
            clock::get);
    CategoryHandle gear = registry.lookupCategory("gear").orElseThrow();
    ItemHandle yacht = registry.registerItem(gear, "yacht", "Yacht", Long.MAX_VALUE);
    SessionToken debtor = activeSession(2, "bob");
    assertEquals(-10, cache.adjustCredits(debtor, -10, "x"));

    assertCode(ErrorCode.INSUFFICIENT_FUNDS, () -> cache.purchase(debtor, yacht));
    assertEquals(-10, cache.balance(debtor));
    assertFalse(cache.owns(debtor, yacht));
  }

  @Test
  void timedItemsExpire() {
    SessionToken token = activeSession(1, "alice");
    cache.purchase(token, pass);
    assertEquals(1060, cache.ownedItems(token).get(0).expiresAtS());

    clock.addAndGet(60);

    assertFalse(cache.owns(token, pass));
    assertTrue(cache.ownedItems(token).isEmpty());
    cache.purchase(token, pass);
    assertEquals(1800, cache.balance(token));
  }

  @Test
  void expiredRowsAreDroppedOnLoad() {
    store.durable.put(
        "alice",
        new StoredAccount("alice", 50, 1, List.of(new InventoryRow("gear", "pass", 1, 100, 500))));

    SessionToken token = activeSession(1, "alice");

    assertTrue(cache.ownedItems(token).isEmpty());
    assertEquals(1, cache.flushDirty());
    assertTrue(store.pendingSave("alice").inventory().isEmpty());
  }

  @Test
  void rowsForUnregisteredItemsArePreserved() {
    InventoryRow orphan = new InventoryRow("old", "thing", 1, 10, 0);
    InventoryRow known = new InventoryRow("weapons", "ak47", 2, 1500, 0);
    store.durable.put("alice", new StoredAccount("alice", 50, 1, List.of(orphan, known)));

    SessionToken token = activeSession(1, "alice");
    cache.onLeave(token);

    assertEquals(1, cache.ownedItems(token).size());
    List<InventoryRow> written = store.pendingSave("alice").inventory();
    assertTrue(written.contains(orphan));
    assertTrue(written.contains(known));
  }

  @Test
  void grantAndRevokeDoNotTouchTheBalance() {
    SessionToken token = activeSession(1, "alice");

    assertEquals(0, cache.grantItem(token, ak47).pricePaid());
    assertCode(ErrorCode.ALREADY_OWNED, () -> cache.grantItem(token, ak47));
    cache.revokeItem(token, ak47);
    assertCode(ErrorCode.NOT_OWNED, () -> cache.revokeItem(token, ak47));
    assertEquals(2000, cache.balance(token));
  }

  @Test
  void lifecycleAndCreditEventsAreFired() {
    List<SessionStateChangedEvent> states = new ArrayList<>();
    List<CreditsChangedEvent> credits = new ArrayList<>();
    events.onSessionStateChanged(states::add);
    events.onCreditsChanged(credits::add);

    SessionToken token = activeSession(1, "alice");
    cache.purchase(token, helmet);
    cache.onLeave(token);
    store.completeSave("alice");

    assertEquals(
        List.of(
            SessionState.LOADING,
            SessionState.ACTIVE,
            SessionState.FLUSHING,
            SessionState.RETIRED),
        states.stream().map(SessionStateChangedEvent::to).toList());
    assertNull(states.get(0).from());
    assertEquals(1, credits.size());
    assertEquals(2000, credits.get(0).oldBalance());
    assertEquals(1900, credits.get(0).newBalance());
  }

  @Test
  void shutdownLeavesEverySession() {
    SessionToken alice = activeSession(1, "alice");
    SessionToken bob = cache.onJoin(2, "bob");

    cache.shutdown();

    assertEquals(SessionState.FLUSHING, cache.state(alice));
    assertEquals(SessionState.LOADING, cache.state(bob));
    store.completeSave("alice");
    store.completeLoad("bob");
    store.completeSave("bob");
    assertEquals(0, cache.size());
  }
}
