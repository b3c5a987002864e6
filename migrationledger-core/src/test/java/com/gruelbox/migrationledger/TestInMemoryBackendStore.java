package com.gruelbox.migrationledger;

import static com.gruelbox.migrationledger.spi.KeyCondition.KEY_EXISTS;
import static com.gruelbox.migrationledger.spi.KeyCondition.KEY_NOT_EXISTS;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gruelbox.migrationledger.spi.BackendStoreException;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TestInMemoryBackendStore {

  private final InMemoryBackendStore store = new InMemoryBackendStore();

  @BeforeEach
  void setup() {
    assertTrue(store.createTable("t"));
  }

  @Test
  void testCreateTableTwice() {
    assertFalse(store.createTable("t"));
  }

  @Test
  void testDeleteMissingTable() {
    assertThrows(BackendStoreException.class, () -> store.deleteTable("missing"));
  }

  @Test
  void testMissingTable() {
    assertThrows(BackendStoreException.class, () -> store.scan("missing"));
    assertThrows(
        BackendStoreException.class,
        () -> store.put("missing", Map.of("id", "1"), KEY_NOT_EXISTS));
    assertThrows(BackendStoreException.class, () -> store.delete("missing", "1"));
  }

  @Test
  void testPutIfNotExists() {
    assertTrue(store.put("t", Map.of("id", "1", "v", "a"), KEY_NOT_EXISTS));
    assertFalse(store.put("t", Map.of("id", "1", "v", "b"), KEY_NOT_EXISTS));
    assertThat(store.scan("t"), contains(item("1", "a")));
  }

  @Test
  void testPutIfExists() {
    assertFalse(store.put("t", Map.of("id", "1", "v", "a"), KEY_EXISTS));
    assertThat(store.scan("t"), empty());
  }

  @Test
  void testUpdateMergesAttributes() {
    store.put("t", Map.of("id", "1", "v", "a", "w", true), KEY_NOT_EXISTS);
    assertTrue(store.update("t", "1", Map.of("v", "b"), KEY_EXISTS));
    Map<String, Object> expected = Map.of("id", "1", "v", "b", "w", true);
    assertThat(store.scan("t"), contains(expected));
  }

  @Test
  void testUpdateMissing() {
    assertFalse(store.update("t", "1", Map.of("v", "b"), KEY_EXISTS));
    assertThat(store.scan("t"), empty());
  }

  @Test
  void testUpdateKeyRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> store.update("t", "1", Map.of("id", "2"), KEY_EXISTS));
  }

  @Test
  void testUnsupportedValueRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> store.put("t", Map.of("id", "1", "n", 1), KEY_NOT_EXISTS));
  }

  @Test
  void testConditionalDelete() {
    assertFalse(store.delete("t", "1", KEY_EXISTS));
    store.put("t", Map.of("id", "1", "v", "a"), KEY_NOT_EXISTS);
    assertFalse(store.delete("t", "1", KEY_NOT_EXISTS));
    assertTrue(store.delete("t", "1", KEY_EXISTS));
    assertThat(store.scan("t"), empty());
  }

  @Test
  void testUnconditionalDeleteOfMissingItem() {
    store.delete("t", "1");
    assertThat(store.scan("t"), empty());
  }

  @Test
  void testStoredItemsAreImmutable() {
    store.put("t", Map.of("id", "1", "v", "a"), KEY_NOT_EXISTS);
    assertThrows(
        UnsupportedOperationException.class, () -> store.scan("t").get(0).put("v", "b"));
  }

  private static Map<String, Object> item(String id, String value) {
    return Map.of("id", id, "v", value);
  }
}
