package com.gruelbox.migrationledger;

/** Thrown when an item in the ledger table does not have the shape of a migration record. */
public class RecordDecodingException extends LedgerBackendException {

  public RecordDecodingException(String message) {
    super(message);
  }
}
