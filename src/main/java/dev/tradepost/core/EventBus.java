/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.core;

import dev.tradepost.api.events.EconomyEvents;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process event bus for economy events.
 *
 * <p>Events are dispatched synchronously on the thread that fires them, which is always the server
 * loop thread, so handlers observe changes in the order they were applied. Each handler is
 * isolated: a throwing handler is logged and the remaining handlers still run.
 */
public final class EventBus implements EconomyEvents, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("tradepost");

  private final List<Consumer<CreditsChangedEvent>> credits = new CopyOnWriteArrayList<>();
  private final List<Consumer<ItemPurchasedEvent>> purchased = new CopyOnWriteArrayList<>();
  private final List<Consumer<ItemSoldEvent>> sold = new CopyOnWriteArrayList<>();
  private final List<Consumer<SessionStateChangedEvent>> states = new CopyOnWriteArrayList<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  @Override
  public AutoCloseable onCreditsChanged(Consumer<CreditsChangedEvent> h) {
    credits.add(h);
    return () -> credits.remove(h);
  }

  @Override
  public AutoCloseable onItemPurchased(Consumer<ItemPurchasedEvent> h) {
    purchased.add(h);
    return () -> purchased.remove(h);
  }

  @Override
  public AutoCloseable onItemSold(Consumer<ItemSoldEvent> h) {
    sold.add(h);
    return () -> sold.remove(h);
  }

  @Override
  public AutoCloseable onSessionStateChanged(Consumer<SessionStateChangedEvent> h) {
    states.add(h);
    return () -> states.remove(h);
  }

  /**
   * Dispatches a credits changed event.
   *
   * @param e event to dispatch
   */
  public void fireCreditsChanged(CreditsChangedEvent e) {
    dispatch(credits, e, "creditsChanged");
  }

  public void fireItemPurchased(ItemPurchasedEvent e) {
    dispatch(purchased, e, "itemPurchased");
  }

  public void fireItemSold(ItemSoldEvent e) {
    dispatch(sold, e, "itemSold");
  }

  public void fireSessionStateChanged(SessionStateChangedEvent e) {
    dispatch(states, e, "sessionStateChanged");
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      credits.clear();
      purchased.clear();
      sold.clear();
      states.clear();
    }
  }

  private <T> void dispatch(List<Consumer<T>> handlers, T event, String name) {
    if (event == null || closed.get()) {
      return;
    }
    for (Consumer<T> handler : handlers) {
      try {
        handler.accept(event);
      } catch (RuntimeException e) {
        LOG.warn(
            "(tradepost) code={} op={} message={}",
            "EVENT_HANDLER_FAILED",
            name,
            e.getMessage(),
            e);
      }
    }
  }
}
