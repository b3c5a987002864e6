package com.gruelbox.migrationledger;

/**
 * Base class of everything thrown by {@link MigrationLedger}. Callers branch on the subclasses:
 *
 * <ul>
 *   <li>{@link MigrationAlreadyExistsException}
 *   <li>{@link MigrationNotFoundException}
 *   <li>{@link DirtyMigrationException}
 *   <li>{@link NoCurrentMigrationException}
 *   <li>{@link LockInterruptedException}
 *   <li>{@link LedgerBackendException}
 * </ul>
 */
public abstract class MigrationLedgerException extends RuntimeException {

  MigrationLedgerException(String message) {
    super(message);
  }

  MigrationLedgerException(String message, Throwable cause) {
    super(message, cause);
  }
}
