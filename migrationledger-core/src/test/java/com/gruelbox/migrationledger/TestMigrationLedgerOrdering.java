package com.gruelbox.migrationledger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class TestMigrationLedgerOrdering {

  private static final String EMOJI = "😀";
  private static final String HALFWIDTH_STOP = "｡";

  @Test
  void testSupplementaryCharactersSortAfterBasicPlane() {
    assertThat(MigrationLedgerImpl.compareCodePoints(HALFWIDTH_STOP, EMOJI), lessThan(0));
    assertThat(MigrationLedgerImpl.compareCodePoints(EMOJI, HALFWIDTH_STOP), greaterThan(0));
  }

  @Test
  void testPrefixSortsFirst() {
    assertThat(MigrationLedgerImpl.compareCodePoints("001", "001a"), lessThan(0));
    assertEquals(0, MigrationLedgerImpl.compareCodePoints(EMOJI, EMOJI));
  }

  @Test
  void testListDoneUsesCodePointOrder() {
    MigrationLedger ledger =
        MigrationLedger.builder().backendStore(new InMemoryBackendStore()).build();
    ledger.provision();
    for (String id : List.of(EMOJI, "b", HALFWIDTH_STOP, "a")) {
      ledger.add(id);
      ledger.finishMigration(id);
    }
    assertThat(ledger.listDone(), contains("a", "b", HALFWIDTH_STOP, EMOJI));
    assertEquals(EMOJI, ledger.current());
  }
}
