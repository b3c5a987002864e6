package com.gruelbox.migrationledger.testing;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;

import com.gruelbox.migrationledger.InMemoryBackendStore;
import com.gruelbox.migrationledger.spi.BackendStore;
import org.junit.jupiter.api.Test;

class TestInMemoryMigrationLedger extends AbstractMigrationLedgerTest {

  private final InMemoryBackendStore store = new InMemoryBackendStore();

  @Override
  protected BackendStore backendStore() {
    return store;
  }

  @Test
  void testProvisionCreatesExactlyTwoTables() {
    ledger.provision();
    ledger.provision();
    assertThat(store.listTables(), containsInAnyOrder(TABLE, LOCK_TABLE));
  }

  @Test
  void testDeprovisionLeavesNoTables() {
    ledger.provision();
    ledger.deprovision();
    assertThat(store.listTables(), empty());
  }
}
