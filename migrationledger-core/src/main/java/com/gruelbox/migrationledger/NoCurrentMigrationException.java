package com.gruelbox.migrationledger;

/** Thrown by {@link MigrationLedger#current()} when no migration has been applied yet. */
public class NoCurrentMigrationException extends MigrationLedgerException {

  public NoCurrentMigrationException() {
    super("No current migration");
  }
}
