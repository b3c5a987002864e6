package com.gruelbox.migrationledger;

/**
 * Wraps a fault in the backend store with the name of the ledger or lock operation which failed.
 * The original fault is available as the cause.
 */
public class LedgerBackendException extends MigrationLedgerException {

  public LedgerBackendException(String message, Throwable cause) {
    super(message, cause);
  }

  public LedgerBackendException(String message) {
    super(message);
  }
}
