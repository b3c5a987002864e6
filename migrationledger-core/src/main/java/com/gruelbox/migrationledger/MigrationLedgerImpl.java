package com.gruelbox.migrationledger;

import static com.gruelbox.migrationledger.spi.KeyCondition.KEY_EXISTS;
import static com.gruelbox.migrationledger.spi.KeyCondition.KEY_NOT_EXISTS;

import com.gruelbox.migrationledger.spi.BackendStore;
import com.gruelbox.migrationledger.spi.BackendStoreException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
final class MigrationLedgerImpl implements MigrationLedger, Validatable {

  private final BackendStore store;
  private final String tableName;
  private final String lockTableName;
  private final String lockId;
  private final Duration lockPollInterval;
  private final Supplier<Clock> clockProvider;

  @Override
  public void validate(Validator validator) {
    validator.notNull("backendStore", store);
    validator.notBlank("tableName", tableName);
    validator.notBlank("lockTableName", lockTableName);
    validator.notBlank("lockId", lockId);
    validator.isTrue(
        "lockTableName",
        !lockTableName.equals(tableName),
        "must differ from tableName (%s)",
        tableName);
    validator.positive("lockPollInterval", lockPollInterval);
    validator.notNull("clockProvider", clockProvider);
  }

  static MigrationLedgerBuilder builder() {
    return new MigrationLedgerBuilderImpl();
  }

  @Override
  public void provision() {
    Set<String> existing = inBackend("list tables", store::listTables);
    createIfMissing(existing, tableName, "migrations table");
    createIfMissing(existing, lockTableName, "migrations lock table");
  }

  private void createIfMissing(Set<String> existing, String name, String description) {
    if (existing.contains(name)) {
      log.debug("{} {} already exists", description, name);
      return;
    }
    if (inBackend("create " + description + " " + name, () -> store.createTable(name))) {
      log.info("Created {} {}", description, name);
    } else {
      log.info("{} {} was created concurrently by another runner", description, name);
    }
  }

  @Override
  public void deprovision() {
    inBackend(
        "delete migrations table " + tableName,
        () -> {
          store.deleteTable(tableName);
          return null;
        });
    log.info("Deleted migrations table {}", tableName);
    inBackend(
        "delete migrations lock table " + lockTableName,
        () -> {
          store.deleteTable(lockTableName);
          return null;
        });
    log.info("Deleted migrations lock table {}", lockTableName);
  }

  @Override
  public List<String> listDone() {
    List<Map<String, Object>> items =
        inBackend("scan migrations table " + tableName, () -> store.scan(tableName));
    List<String> done = new ArrayList<>(items.size());
    for (Map<String, Object> item : items) {
      MigrationRecord record = MigrationRecord.fromItem(item);
      if (record.isDirty()) {
        throw new DirtyMigrationException(record.getId());
      }
      done.add(record.getId());
    }
    done.sort(MigrationLedgerImpl::compareCodePoints);
    return Collections.unmodifiableList(done);
  }

  @Override
  public String current() {
    List<String> done = listDone();
    if (done.isEmpty()) {
      throw new NoCurrentMigrationException();
    }
    return done.get(done.size() - 1);
  }

  @Override
  public void add(String migrationId) {
    checkId(migrationId);
    var item = MigrationRecord.builder().id(migrationId).dirty(true).build().toItem();
    if (!inBackend(
        "add migration " + migrationId, () -> store.put(tableName, item, KEY_NOT_EXISTS))) {
      throw new MigrationAlreadyExistsException(migrationId);
    }
    log.debug("Added migration {}", migrationId);
  }

  @Override
  public void remove(String migrationId) {
    checkId(migrationId);
    if (!inBackend(
        "remove migration " + migrationId,
        () -> store.delete(tableName, migrationId, KEY_EXISTS))) {
      throw new MigrationNotFoundException(migrationId);
    }
    log.debug("Removed migration {}", migrationId);
  }

  @Override
  public void startMigration(String migrationId) {
    setDirty(migrationId, true, "start");
  }

  @Override
  public void finishMigration(String migrationId) {
    setDirty(migrationId, false, "finish");
  }

  private void setDirty(String migrationId, boolean dirty, String verb) {
    checkId(migrationId);
    if (!inBackend(
        verb + " migration " + migrationId,
        () ->
            store.update(
                tableName, migrationId, Map.of(MigrationRecord.DIRTY, dirty), KEY_EXISTS))) {
      throw new MigrationNotFoundException(migrationId);
    }
    log.debug("Marked migration {} dirty={}", migrationId, dirty);
  }

  @Override
  public Unlocker lock() {
    return acquire(null).orElseThrow();
  }

  @Override
  public Optional<Unlocker> tryLock(Duration maxWait) {
    if (maxWait == null || maxWait.isNegative()) {
      throw new IllegalArgumentException("maxWait must be zero or positive");
    }
    return acquire(clockProvider.get().instant().plus(maxWait));
  }

  /**
   * Polls for the lock item until we create it. The interrupt flag is checked between attempts
   * rather than during one, so a write which has been sent is always allowed to complete.
   */
  private Optional<Unlocker> acquire(Instant deadline) {
    Map<String, Object> lockItem = Map.of(BackendStore.KEY, lockId);
    int attempts = 0;
    while (true) {
      if (Thread.currentThread().isInterrupted()) {
        throw new LockInterruptedException();
      }
      attempts++;
      boolean acquired;
      try {
        acquired = store.put(lockTableName, lockItem, KEY_NOT_EXISTS);
      } catch (BackendStoreException e) {
        if (Thread.currentThread().isInterrupted()) {
          throw new LockInterruptedException(e);
        }
        throw new LedgerBackendException("Failed to lock before migrating", e);
      }
      if (acquired) {
        log.info("Acquired migration lock {} after {} attempt(s)", lockId, attempts);
        return Optional.of(new StoreUnlocker(store, lockTableName, lockId));
      }
      Duration wait = lockPollInterval;
      if (deadline != null) {
        Duration remaining = Duration.between(clockProvider.get().instant(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
          log.info("Gave up waiting for migration lock {} after {} attempt(s)", lockId, attempts);
          return Optional.empty();
        }
        if (remaining.compareTo(wait) < 0) {
          wait = remaining;
        }
      }
      log.debug("Migration lock {} is held elsewhere. Retrying in {}", lockId, wait);
      sleep(wait);
    }
  }

  private void sleep(Duration duration) {
    try {
      Thread.sleep(duration.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LockInterruptedException(e);
    }
  }

  /** Orders by Unicode code point, which is also the order of the UTF-8 bytes. */
  static int compareCodePoints(String a, String b) {
    int i = 0;
    int j = 0;
    while (i < a.length() && j < b.length()) {
      int ca = a.codePointAt(i);
      int cb = b.codePointAt(j);
      if (ca != cb) {
        return Integer.compare(ca, cb);
      }
      i += Character.charCount(ca);
      j += Character.charCount(cb);
    }
    return Integer.compare(a.length() - i, b.length() - j);
  }

  private void checkId(String migrationId) {
    if (migrationId == null || migrationId.isEmpty()) {
      throw new IllegalArgumentException("migrationId may not be null or empty");
    }
  }

  private <T> T inBackend(String operation, Supplier<T> call) {
    try {
      return call.get();
    } catch (BackendStoreException e) {
      throw new LedgerBackendException("Failed to " + operation, e);
    }
  }

  @ToString
  static class MigrationLedgerBuilderImpl extends MigrationLedgerBuilder {

    MigrationLedgerBuilderImpl() {
      super();
    }

    @Override
    public MigrationLedgerImpl build() {
      MigrationLedgerImpl impl =
          new MigrationLedgerImpl(
              backendStore,
              Utils.firstNonNull(tableName, () -> DEFAULT_TABLE_NAME),
              Utils.firstNonNull(lockTableName, () -> DEFAULT_LOCK_TABLE_NAME),
              Utils.firstNonNull(lockId, () -> DEFAULT_LOCK_ID),
              Utils.firstNonNull(lockPollInterval, () -> DEFAULT_LOCK_POLL_INTERVAL),
              clockProvider == null ? Clock::systemUTC : clockProvider);
      new Validator().validate(impl);
      return impl;
    }
  }
}
