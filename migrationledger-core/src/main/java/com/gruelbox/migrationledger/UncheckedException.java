package com.gruelbox.migrationledger;

/** A checked {@link Exception} from caller-supplied work, rethrown as unchecked. */
public class UncheckedException extends RuntimeException {

  public UncheckedException(Throwable cause) {
    super(cause);
  }
}
