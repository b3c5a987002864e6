package com.gruelbox.migrationledger.spi;

/**
 * Thrown by a {@link BackendStore} for any fault other than a failed {@link KeyCondition}, such as
 * network errors, timeouts, missing permissions or unavailable tables.
 */
public class BackendStoreException extends RuntimeException {

  public BackendStoreException(String message) {
    super(message);
  }

  public BackendStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
