package com.gruelbox.migrationledger;

import com.gruelbox.migrationledger.spi.BackendStore;
import com.gruelbox.migrationledger.spi.KeyCondition;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Wraps an instance of {@link BackendStore} allowing its behaviour to be composed, for example to
 * add instrumentation or to inject faults in tests. Override the methods of interest.
 */
public class BackendStoreWrapper implements BackendStore {

  private final BackendStore delegate;

  public BackendStoreWrapper(BackendStore delegate) {
    this.delegate = delegate;
  }

  @Override
  public List<Map<String, Object>> scan(String tableName) {
    return delegate.scan(tableName);
  }

  @Override
  public boolean put(String tableName, Map<String, Object> item, KeyCondition condition) {
    return delegate.put(tableName, item, condition);
  }

  @Override
  public boolean update(
      String tableName, String key, Map<String, Object> changes, KeyCondition condition) {
    return delegate.update(tableName, key, changes, condition);
  }

  @Override
  public boolean delete(String tableName, String key, KeyCondition condition) {
    return delegate.delete(tableName, key, condition);
  }

  @Override
  public void delete(String tableName, String key) {
    delegate.delete(tableName, key);
  }

  @Override
  public Set<String> listTables() {
    return delegate.listTables();
  }

  @Override
  public boolean createTable(String tableName) {
    return delegate.createTable(tableName);
  }

  @Override
  public void deleteTable(String tableName) {
    delegate.deleteTable(tableName);
  }
}
