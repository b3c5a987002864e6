package com.gruelbox.migrationledger;

/**
 * Returned by a successful acquisition of the migration lock. Call {@link #unlock()} exactly once
 * when the migrations are complete, or use in a try-with-resources block.
 */
public interface Unlocker extends AutoCloseable {

  /**
   * Releases the migration lock by deleting the lock item.
   *
   * <p>This does not check ownership: if the lock has been deleted and re-acquired by another
   * runner since this handle was issued, the other runner's lock is released. Only the first call
   * on a given handle reaches the backend; later calls are ignored.
   *
   * @throws LedgerBackendException If the backend could not delete the lock item. The handle may
   *     be used to try again.
   */
  void unlock();

  @Override
  default void close() {
    unlock();
  }
}
