/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.api;

/**
 * Outcome of a purchase or sale.
 *
 * @param session session the trade was applied to
 * @param item traded item
 * @param amount credits debited (purchase) or credited (sale)
 * @param balanceAfter balance once the trade applied
 * @param atS trade time (epoch seconds)
 */
public record Receipt(
    SessionToken session, ItemHandle item, long amount, long balanceAfter, long atS) {}
