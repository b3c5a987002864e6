package com.gruelbox.migrationledger;

/** Work run under the migration lock, which may throw checked exceptions. */
@FunctionalInterface
public interface ThrowingRunnable {

  void run() throws Exception;
}
