package com.gruelbox.migrationledger;

import lombok.Getter;

/**
 * Thrown when the ledger contains a migration which was started but never confirmed finished. The
 * ledger refuses to report any state until an operator has resolved it, either by finishing or
 * removing the record.
 */
@Getter
public class DirtyMigrationException extends MigrationLedgerException {

  /** The first dirty migration encountered. There may be others. */
  private final String migrationId;

  public DirtyMigrationException(String migrationId) {
    super("Migration " + migrationId + " is dirty");
    this.migrationId = migrationId;
  }
}
