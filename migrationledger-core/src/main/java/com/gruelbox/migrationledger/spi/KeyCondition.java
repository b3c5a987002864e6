package com.gruelbox.migrationledger.spi;

/**
 * The preconditions a {@link BackendStore} must be able to evaluate atomically against the primary
 * key of the item being written.
 */
public enum KeyCondition {

  /** The write only succeeds if no item with the same key is present. */
  KEY_NOT_EXISTS,

  /** The write only succeeds if an item with the same key is present. */
  KEY_EXISTS
}
