package com.gruelbox.migrationledger;

import lombok.Getter;

/** Thrown when adding a migration whose id is already recorded in the ledger. */
@Getter
public class MigrationAlreadyExistsException extends MigrationLedgerException {

  private final String migrationId;

  public MigrationAlreadyExistsException(String migrationId) {
    super("Migration " + migrationId + " already exists");
    this.migrationId = migrationId;
  }
}
