package com.gruelbox.migrationledger;

import com.gruelbox.migrationledger.spi.BackendStore;
import com.gruelbox.migrationledger.spi.BackendStoreException;
import com.gruelbox.migrationledger.spi.KeyCondition;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * A {@link BackendStore} held in memory. Conditional writes are atomic across threads, so this
 * behaves like a shared store for runners within one JVM. Useful for tests and local tooling;
 * nothing survives the JVM.
 */
public class InMemoryBackendStore implements BackendStore {

  private final ConcurrentMap<String, ConcurrentMap<String, Map<String, Object>>> tables =
      new ConcurrentHashMap<>();

  @Override
  public List<Map<String, Object>> scan(String tableName) {
    return new ArrayList<>(table(tableName).values());
  }

  @Override
  public boolean put(String tableName, Map<String, Object> item, KeyCondition condition) {
    checkValues(item);
    Object key = item.get(KEY);
    if (!(key instanceof String)) {
      throw new IllegalArgumentException("Item has no string attribute '" + KEY + "'");
    }
    return write(tableName, (String) key, condition, existing -> new HashMap<>(item));
  }

  @Override
  public boolean update(
      String tableName, String key, Map<String, Object> changes, KeyCondition condition) {
    checkValues(changes);
    if (changes.containsKey(KEY)) {
      throw new IllegalArgumentException("The key attribute may not be updated");
    }
    return write(
        tableName,
        key,
        condition,
        existing -> {
          Map<String, Object> updated = existing == null ? new HashMap<>() : new HashMap<>(existing);
          updated.put(KEY, key);
          updated.putAll(changes);
          return updated;
        });
  }

  @Override
  public boolean delete(String tableName, String key, KeyCondition condition) {
    return write(tableName, key, condition, existing -> null);
  }

  @Override
  public void delete(String tableName, String key) {
    table(tableName).remove(key);
  }

  @Override
  public Set<String> listTables() {
    return Set.copyOf(tables.keySet());
  }

  @Override
  public boolean createTable(String tableName) {
    return tables.putIfAbsent(tableName, new ConcurrentHashMap<>()) == null;
  }

  @Override
  public void deleteTable(String tableName) {
    if (tables.remove(tableName) == null) {
      throw new BackendStoreException("Table " + tableName + " does not exist");
    }
  }

  /**
   * Atomically replaces the item at {@code key} with the result of {@code mutation} (null deletes)
   * if the condition holds for the current item.
   */
  private boolean write(
      String tableName,
      String key,
      KeyCondition condition,
      UnaryOperator<Map<String, Object>> mutation) {
    AtomicBoolean applied = new AtomicBoolean();
    table(tableName)
        .compute(
            key,
            (k, existing) -> {
              boolean holds =
                  condition == KeyCondition.KEY_EXISTS ? existing != null : existing == null;
              if (!holds) {
                return existing;
              }
              applied.set(true);
              Map<String, Object> result = mutation.apply(existing);
              return result == null ? null : Collections.unmodifiableMap(result);
            });
    return applied.get();
  }

  private ConcurrentMap<String, Map<String, Object>> table(String tableName) {
    var table = tables.get(tableName);
    if (table == null) {
      throw new BackendStoreException("Table " + tableName + " does not exist");
    }
    return table;
  }

  private static void checkValues(Map<String, Object> attributes) {
    attributes.forEach(
        (name, value) -> {
          if (!(value instanceof String) && !(value instanceof Boolean)) {
            throw new IllegalArgumentException(
                "Attribute " + name + " must be a String or Boolean, was " + value);
          }
        });
  }
}
