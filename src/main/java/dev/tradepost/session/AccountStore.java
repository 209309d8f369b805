/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.session;

import dev.tradepost.jdbc.GatewayError;
import java.util.List;
import java.util.function.Consumer;

/**
 * Durable per-identity account state as seen by the session cache.
 *
 * <p>Callbacks run on the server loop thread. Exactly one of the two callbacks runs per call.
 */
public interface AccountStore {

  /**
   * Loads an account, creating a default row with {@code startingBalance} when none exists.
   *
   * @param identity durable identity
   * @param startingBalance balance of a newly created account
   * @param nowS creation timestamp for a new account (epoch seconds)
   * @param onLoaded receives the stored account
   * @param onFailed receives the classified failure
   */
  void load(
      String identity,
      long startingBalance,
      long nowS,
      Consumer<StoredAccount> onLoaded,
      Consumer<GatewayError> onFailed);

  /**
   * Replaces the stored state of an account with {@code snapshot} as one unit. Saving the same
   * snapshot twice leaves the store unchanged.
   *
   * @param snapshot full account state
   * @param onSaved runs after the write is durable
   * @param onFailed receives the classified failure; nothing was written
   */
  void save(AccountSnapshot snapshot, Runnable onSaved, Consumer<GatewayError> onFailed);

  /**
   * Stored account as loaded.
   *
   * @param identity durable identity
   * @param balance stored balance
   * @param createdAtS creation time (epoch seconds)
   * @param inventory stored inventory rows
   */
  record StoredAccount(
      String identity, long balance, long createdAtS, List<InventoryRow> inventory) {
    public StoredAccount {
      inventory = List.copyOf(inventory);
    }
  }

  /**
   * Full account state to persist.
   *
   * @param identity durable identity
   * @param balance current balance
   * @param createdAtS creation time (epoch seconds)
   * @param updatedAtS time of the snapshot (epoch seconds)
   * @param inventory every owned row, including rows for items no longer registered
   * @param version session mutation counter the snapshot was taken at
   */
  record AccountSnapshot(
      String identity,
      long balance,
      long createdAtS,
      long updatedAtS,
      List<InventoryRow> inventory,
      long version) {
    public AccountSnapshot {
      inventory = List.copyOf(inventory);
    }
  }

  /**
   * One owned item, keyed by stable category and item keys rather than process-local handles.
   *
   * @param categoryKey category key
   * @param itemKey item key
   * @param acquiredAtS acquisition time (epoch seconds)
   * @param pricePaid credits paid
   * @param expiresAtS expiry time, {@code 0} for permanent
   */
  record InventoryRow(
      String categoryKey, String itemKey, long acquiredAtS, long pricePaid, long expiresAtS) {}
}
