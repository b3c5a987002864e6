package com.gruelbox.migrationledger;

import com.gruelbox.migrationledger.spi.BackendStore;
import com.gruelbox.migrationledger.spi.BackendStoreException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@ToString(onlyExplicitlyIncluded = true)
@RequiredArgsConstructor
final class StoreUnlocker implements Unlocker {

  private final BackendStore store;
  @ToString.Include private final String lockTableName;
  @ToString.Include private final String lockId;
  private final AtomicBoolean released = new AtomicBoolean();

  @Override
  public void unlock() {
    if (!released.compareAndSet(false, true)) {
      log.warn("Migration lock {} was already released using this handle. Ignoring.", lockId);
      return;
    }
    try {
      store.delete(lockTableName, lockId);
    } catch (BackendStoreException e) {
      released.set(false);
      throw new LedgerBackendException("Failed to release migration lock " + lockId, e);
    }
    log.info("Released migration lock {}", lockId);
  }
}
