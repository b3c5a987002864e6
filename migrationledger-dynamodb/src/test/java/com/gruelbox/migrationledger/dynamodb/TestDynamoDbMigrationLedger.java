package com.gruelbox.migrationledger.dynamodb;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gruelbox.migrationledger.LedgerBackendException;
import com.gruelbox.migrationledger.spi.BackendStore;
import com.gruelbox.migrationledger.spi.BackendStoreException;
import com.gruelbox.migrationledger.spi.KeyCondition;
import com.gruelbox.migrationledger.testing.AbstractMigrationLedgerTest;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

@Testcontainers(disabledWithoutDocker = true)
class TestDynamoDbMigrationLedger extends AbstractMigrationLedgerTest {

  private static final int PORT = 8000;

  @Container
  @SuppressWarnings("resource")
  private static final GenericContainer<?> container =
      new GenericContainer<>("amazon/dynamodb-local:2.1.0")
          .withCommand("-jar DynamoDBLocal.jar -inMemory -sharedDb")
          .withExposedPorts(PORT)
          .withStartupTimeout(Duration.ofMinutes(5));

  private final DynamoDbClient client =
      DynamoDbClient.builder()
          .endpointOverride(
              URI.create("http://" + container.getHost() + ":" + container.getMappedPort(PORT)))
          .region(Region.US_EAST_1)
          .credentialsProvider(
              StaticCredentialsProvider.create(AwsBasicCredentials.create("local", "local")))
          .build();

  private final DynamoDbBackendStore store = DynamoDbBackendStore.builder().client(client).build();

  @Override
  protected BackendStore backendStore() {
    return store;
  }

  @AfterEach
  void closeClient() {
    client.close();
  }

  @Test
  void testScanReadsEveryPage() {
    ledger.provision();
    String padding = "x".repeat(10_000);
    for (int i = 0; i < 150; i++) {
      store.put(
          TABLE,
          Map.of(BackendStore.KEY, String.format("%03d", i), "dirty", false, "padding", padding),
          KeyCondition.KEY_NOT_EXISTS);
    }
    var done = ledger.listDone();
    assertEquals(150, done.size());
    assertEquals("149", ledger.current());
  }

  @Test
  void testUpdateKeepsOtherAttributes() {
    ledger.provision();
    store.put(
        TABLE,
        Map.of(BackendStore.KEY, "1", "dirty", true, "appliedBy", "someone"),
        KeyCondition.KEY_NOT_EXISTS);
    ledger.finishMigration("1");
    Map<String, Object> expected =
        Map.of(BackendStore.KEY, "1", "dirty", false, "appliedBy", "someone");
    assertThat(store.scan(TABLE), contains(expected));
  }

  @Test
  void testCreateExistingTableReportsFalse() {
    assertTrue(store.createTable(TABLE));
    assertFalse(store.createTable(TABLE));
  }

  @Test
  void testDeleteMissingTableFails() {
    var e = assertThrows(BackendStoreException.class, () -> store.deleteTable(TABLE));
    assertThat(e.getCause(), instanceOf(ResourceNotFoundException.class));
  }

  @Test
  void testDeprovisionWithoutTablesKeepsCause() {
    var e = assertThrows(LedgerBackendException.class, ledger::deprovision);
    assertThat(e.getCause(), instanceOf(BackendStoreException.class));
    assertThat(e.getCause().getCause(), instanceOf(ResourceNotFoundException.class));
  }
}
