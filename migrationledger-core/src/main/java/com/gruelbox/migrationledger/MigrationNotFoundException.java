package com.gruelbox.migrationledger;

import lombok.Getter;

/** Thrown when removing, starting or finishing a migration which is not in the ledger. */
@Getter
public class MigrationNotFoundException extends MigrationLedgerException {

  private final String migrationId;

  public MigrationNotFoundException(String migrationId) {
    super("Migration " + migrationId + " not found");
    this.migrationId = migrationId;
  }
}
