package com.gruelbox.migrationledger;

/**
 * Thrown when the thread waiting for the migration lock is interrupted. The interrupt flag is
 * restored before this is thrown, and the lock is not held.
 */
public class LockInterruptedException extends MigrationLedgerException {

  public LockInterruptedException(Throwable cause) {
    super("Interrupted waiting for migration lock", cause);
  }

  public LockInterruptedException() {
    super("Interrupted waiting for migration lock");
  }
}
