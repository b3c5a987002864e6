package com.gruelbox.migrationledger;

import com.gruelbox.migrationledger.spi.BackendStore;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import lombok.ToString;

/**
 * Records which schema migrations have been applied to a target, and serialises migration runs
 * across processes using an advisory lock. Both are held in a shared {@link BackendStore}.
 *
 * <p>Typical usage by a migration runner:
 *
 * <pre>
 * MigrationLedger ledger = MigrationLedger.builder().backendStore(store).build();
 * ledger.provision();
 * ledger.inLock(() -&gt; {
 *   List&lt;String&gt; done = ledger.listDone();
 *   for (String id : pending(done)) {
 *     ledger.add(id);
 *     apply(id);
 *     ledger.finishMigration(id);
 *   }
 * });
 * </pre>
 *
 * <p>A migration which is added (or started) but never finished leaves a dirty record behind.
 * While any dirty record exists, {@link #listDone()} and {@link #current()} refuse to report
 * state, so a crash part way through a migration stops further runs until someone looks at it.
 *
 * <p>Implementations are thread-safe and hold no state other than their configuration; every
 * call goes to the backend.
 */
public interface MigrationLedger {

  /**
   * @return A builder for creating a new instance of {@link MigrationLedger}.
   */
  static MigrationLedgerBuilder builder() {
    return MigrationLedgerImpl.builder();
  }

  /**
   * Creates the ledger table and the lock table, skipping any which already exist. Safe to call
   * repeatedly and from several runners at once.
   *
   * @throws LedgerBackendException If the tables could not be listed or created.
   */
  void provision();

  /**
   * Deletes the ledger table and then the lock table. There is no rollback: if deleting the lock
   * table fails, the ledger table is already gone.
   *
   * @throws LedgerBackendException If either table could not be deleted.
   */
  void deprovision();

  /**
   * Lists the migrations confirmed applied.
   *
   * @return The migration ids, sorted in ascending order of Unicode code points (the same as
   *     comparing their UTF-8 bytes). This matches {@link String#compareTo(String)} except where
   *     characters outside the Basic Multilingual Plane are involved.
   * @throws DirtyMigrationException If any migration is dirty. No partial list is returned.
   * @throws RecordDecodingException If an item in the ledger table is malformed.
   * @throws LedgerBackendException If the ledger table could not be read.
   */
  List<String> listDone();

  /**
   * @return The greatest id returned by {@link #listDone()}.
   * @throws NoCurrentMigrationException If no migration has been applied.
   * @throws DirtyMigrationException If any migration is dirty.
   * @throws LedgerBackendException If the ledger table could not be read.
   */
  String current();

  /**
   * Records a new migration as started (dirty).
   *
   * @param migrationId The migration id.
   * @throws MigrationAlreadyExistsException If the id is already in the ledger.
   * @throws LedgerBackendException On any other backend fault.
   */
  void add(String migrationId);

  /**
   * Removes a migration from the ledger, whatever its state.
   *
   * @param migrationId The migration id.
   * @throws MigrationNotFoundException If the id is not in the ledger.
   * @throws LedgerBackendException On any other backend fault.
   */
  void remove(String migrationId);

  /**
   * Marks an existing migration as started (dirty).
   *
   * @param migrationId The migration id.
   * @throws MigrationNotFoundException If the id is not in the ledger.
   * @throws LedgerBackendException On any other backend fault.
   */
  void startMigration(String migrationId);

  /**
   * Marks an existing migration as finished (clean).
   *
   * @param migrationId The migration id.
   * @throws MigrationNotFoundException If the id is not in the ledger.
   * @throws LedgerBackendException On any other backend fault.
   */
  void finishMigration(String migrationId);

  /**
   * Acquires the migration lock, polling every {@link
   * MigrationLedgerBuilder#lockPollInterval(Duration)} for as long as another runner holds it.
   * Contention never causes this to fail, but it will wait forever if the holder never releases
   * the lock. The lock is not re-entrant: calling this while already holding the lock never
   * returns.
   *
   * @return The handle to release the lock with.
   * @throws LockInterruptedException If the calling thread is interrupted while waiting.
   * @throws LedgerBackendException On any backend fault other than the lock being held.
   */
  Unlocker lock();

  /**
   * As {@link #lock()}, but gives up once {@code maxWait} has passed.
   *
   * @param maxWait How long to keep trying. {@link Duration#ZERO} makes a single attempt.
   * @return The handle to release the lock with, or empty if the lock was not acquired.
   * @throws LockInterruptedException If the calling thread is interrupted while waiting.
   * @throws LedgerBackendException On any backend fault other than the lock being held.
   */
  Optional<Unlocker> tryLock(Duration maxWait);

  /**
   * Runs work while holding the migration lock, releasing it afterwards whether or not the work
   * succeeded.
   *
   * @param work The work. Checked exceptions are rethrown wrapped in {@link UncheckedException}.
   */
  default void inLock(ThrowingRunnable work) {
    try (Unlocker ignored = lock()) {
      Utils.uncheck(work);
    }
  }

  /**
   * Runs work while holding the migration lock, releasing it afterwards whether or not the work
   * succeeded.
   *
   * @param work The work. Checked exceptions are rethrown wrapped in {@link UncheckedException}.
   * @param <T> The type returned.
   * @return The value returned by {@code work}.
   */
  default <T> T inLockReturns(Callable<T> work) {
    try (Unlocker ignored = lock()) {
      return Utils.uncheckedly(work);
    }
  }

  /** Builder for {@link MigrationLedger}. */
  @ToString
  abstract class MigrationLedgerBuilder {

    public static final String DEFAULT_TABLE_NAME = "_migrations";
    public static final String DEFAULT_LOCK_TABLE_NAME = "_migrations-lock";
    public static final String DEFAULT_LOCK_ID = "migrations";
    public static final Duration DEFAULT_LOCK_POLL_INTERVAL = Duration.ofSeconds(1);

    protected BackendStore backendStore;
    protected String tableName;
    protected String lockTableName;
    protected String lockId;
    protected Duration lockPollInterval;
    protected Supplier<Clock> clockProvider;

    protected MigrationLedgerBuilder() {}

    /**
     * @param backendStore The store holding the ledger and lock tables. Required.
     * @return Builder.
     */
    public MigrationLedgerBuilder backendStore(BackendStore backendStore) {
      this.backendStore = backendStore;
      return this;
    }

    /**
     * @param tableName The table recording migrations. Defaults to {@value #DEFAULT_TABLE_NAME}.
     * @return Builder.
     */
    public MigrationLedgerBuilder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    /**
     * @param lockTableName The table holding the lock item. Defaults to {@value
     *     #DEFAULT_LOCK_TABLE_NAME}.
     * @return Builder.
     */
    public MigrationLedgerBuilder lockTableName(String lockTableName) {
      this.lockTableName = lockTableName;
      return this;
    }

    /**
     * @param lockId The key of the lock item. All runners migrating the same target must share
     *     it. Defaults to {@value #DEFAULT_LOCK_ID}.
     * @return Builder.
     */
    public MigrationLedgerBuilder lockId(String lockId) {
      this.lockId = lockId;
      return this;
    }

    /**
     * @param lockPollInterval How long to wait between attempts to take a held lock. Defaults to
     *     one second.
     * @return Builder.
     */
    public MigrationLedgerBuilder lockPollInterval(Duration lockPollInterval) {
      this.lockPollInterval = lockPollInterval;
      return this;
    }

    /**
     * @param clockProvider The {@link Clock} source for {@link MigrationLedger#tryLock(Duration)}
     *     deadlines. Generally best left alone except when testing. Defaults to the system clock.
     * @return Builder.
     */
    public MigrationLedgerBuilder clockProvider(Supplier<Clock> clockProvider) {
      this.clockProvider = clockProvider;
      return this;
    }

    /**
     * Creates and validates the instance. No backend calls are made.
     *
     * @return The ledger.
     * @throws IllegalArgumentException If the configuration is invalid.
     */
    public abstract MigrationLedger build();
  }
}
