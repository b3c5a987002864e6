package com.gruelbox.migrationledger.spi;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A key-value table abstraction over the shared data store which holds the ledger and the lock.
 *
 * <p>Every table is keyed by a single string attribute named {@link #KEY}. Attribute values are
 * either {@link String} or {@link Boolean}.
 *
 * <p>The only synchronisation primitive relied upon is that each conditional write is atomic with
 * respect to its {@link KeyCondition}. Implementations must not cache reads: every call should go
 * to the underlying store.
 *
 * <p>Conditional operations return {@code false} when the precondition does not hold. Every other
 * failure is thrown as a {@link BackendStoreException}.
 */
public interface BackendStore {

  /** The name of the primary key attribute of every table. */
  String KEY = "id";

  /**
   * Reads every item in a table.
   *
   * @param tableName The table.
   * @return All items, in no particular order.
   */
  List<Map<String, Object>> scan(String tableName);

  /**
   * Writes a whole item, replacing any existing item with the same key, provided the condition
   * holds.
   *
   * @param tableName The table.
   * @param item The item. Must contain {@link #KEY}.
   * @param condition The precondition on the existing item.
   * @return false if the precondition failed and nothing was written.
   */
  boolean put(String tableName, Map<String, Object> item, KeyCondition condition);

  /**
   * Sets the given attributes on an item, provided the condition holds.
   *
   * @param tableName The table.
   * @param key The primary key.
   * @param changes Attribute values to set. May not contain {@link #KEY}.
   * @param condition The precondition on the existing item.
   * @return false if the precondition failed and nothing was written.
   */
  boolean update(
      String tableName, String key, Map<String, Object> changes, KeyCondition condition);

  /**
   * Deletes an item, provided the condition holds.
   *
   * @param tableName The table.
   * @param key The primary key.
   * @param condition The precondition on the existing item.
   * @return false if the precondition failed and nothing was deleted.
   */
  boolean delete(String tableName, String key, KeyCondition condition);

  /**
   * Deletes an item if present. Deleting a missing item is not an error.
   *
   * @param tableName The table.
   * @param key The primary key.
   */
  void delete(String tableName, String key);

  /**
   * @return The names of all tables visible to this store.
   */
  Set<String> listTables();

  /**
   * Creates a table keyed by {@link #KEY}.
   *
   * @param tableName The table.
   * @return false if the table already existed.
   */
  boolean createTable(String tableName);

  /**
   * Deletes a table and everything in it.
   *
   * @param tableName The table.
   */
  void deleteTable(String tableName);
}
