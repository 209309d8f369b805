/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.session;

import dev.tradepost.jdbc.GatewayError;
import dev.tradepost.jdbc.PersistenceGateway;
import dev.tradepost.jdbc.QueryOutcome;
import dev.tradepost.jdbc.Row;
import dev.tradepost.jdbc.Schema;
import dev.tradepost.jdbc.SqlStatement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * {@link AccountStore} backed by the users and inventory tables through the persistence gateway.
 * Every request uses the identity as its ordering lane, so a save issued after a load for the same
 * identity is applied after it.
 */
public final class SqlAccountStore implements AccountStore {
  private final PersistenceGateway gateway;
  private final Schema schema;

  public SqlAccountStore(PersistenceGateway gateway, Schema schema) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  @Override
  public void load(
      String identity,
      long startingBalance,
      long nowS,
      Consumer<StoredAccount> onLoaded,
      Consumer<GatewayError> onFailed) {
    SqlStatement selectUser =
        SqlStatement.read(
            "SELECT balance, created_at_s FROM " + schema.users() + " WHERE identity=?", identity);
    gateway.query(
        identity,
        selectUser,
        outcome -> {
          if (!outcome.ok()) {
            onFailed.accept(outcome.error());
            return;
          }
          Row user = outcome.result().first().orElse(null);
          if (user != null) {
            long balance = user.getLong("balance");
            long created = user.getLong("created_at_s");
            loadInventory(identity, balance, created, onLoaded, onFailed);
            return;
          }
          createDefault(identity, startingBalance, nowS, onLoaded, onFailed);
        });
  }

  private void createDefault(
      String identity,
      long startingBalance,
      long nowS,
      Consumer<StoredAccount> onLoaded,
      Consumer<GatewayError> onFailed) {
    SqlStatement insert =
        SqlStatement.write(schema.insertUserIfAbsent(), identity, startingBalance, nowS, nowS);
    gateway.query(
        identity,
        insert,
        inserted -> {
          if (!inserted.ok()) {
            onFailed.accept(inserted.error());
            return;
          }
          // Re-read: another server may have created the row between the select and the insert.
          SqlStatement reselect =
              SqlStatement.read(
                  "SELECT balance, created_at_s FROM " + schema.users() + " WHERE identity=?",
                  identity);
          gateway.query(
              identity,
              reselect,
              again -> {
                if (!again.ok()) {
                  onFailed.accept(again.error());
                  return;
                }
                Row user = again.result().first().orElse(null);
                long balance = user != null ? user.getLong("balance") : startingBalance;
                long created = user != null ? user.getLong("created_at_s") : nowS;
                loadInventory(identity, balance, created, onLoaded, onFailed);
              });
        });
  }

  private void loadInventory(
      String identity,
      long balance,
      long createdAtS,
      Consumer<StoredAccount> onLoaded,
      Consumer<GatewayError> onFailed) {
    SqlStatement select =
        SqlStatement.read(
            "SELECT category_key, item_key, acquired_at_s, price_paid, expires_at_s FROM "
                + schema.inventory()
                + " WHERE identity=? ORDER BY acquired_at_s, category_key, item_key",
            identity);
    gateway.query(
        identity,
        select,
        (QueryOutcome outcome) -> {
          if (!outcome.ok()) {
            onFailed.accept(outcome.error());
            return;
          }
          List<InventoryRow> rows = new ArrayList<>(outcome.result().rows().size());
          for (Row row : outcome.result().rows()) {
            rows.add(
                new InventoryRow(
                    row.getString("category_key"),
                    row.getString("item_key"),
                    row.getLong("acquired_at_s"),
                    row.getLong("price_paid"),
                    row.getLong("expires_at_s")));
          }
          onLoaded.accept(new StoredAccount(identity, balance, createdAtS, rows));
        });
  }

  @Override
  public void save(AccountSnapshot snapshot, Runnable onSaved, Consumer<GatewayError> onFailed) {
    List<SqlStatement> batch = new ArrayList<>(snapshot.inventory().size() + 2);
    batch.add(
        SqlStatement.write(
            schema.upsertUser(),
            snapshot.identity(),
            snapshot.balance(),
            snapshot.createdAtS(),
            snapshot.updatedAtS()));
    batch.add(
        SqlStatement.write(
            "DELETE FROM " + schema.inventory() + " WHERE identity=?", snapshot.identity()));
    String insert =
        "INSERT INTO "
            + schema.inventory()
            + " (identity, category_key, item_key, acquired_at_s, price_paid, expires_at_s)"
            + " VALUES (?, ?, ?, ?, ?, ?)";
    for (InventoryRow row : snapshot.inventory()) {
      batch.add(
          SqlStatement.write(
              insert,
              snapshot.identity(),
              row.categoryKey(),
              row.itemKey(),
              row.acquiredAtS(),
              row.pricePaid(),
              row.expiresAtS()));
    }
    gateway.runTransaction(snapshot.identity(), batch, results -> onSaved.run(), onFailed);
  }
}
