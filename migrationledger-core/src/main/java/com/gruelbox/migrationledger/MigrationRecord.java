package com.gruelbox.migrationledger;

import com.gruelbox.migrationledger.spi.BackendStore;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * An entry in the ledger table. A migration is {@code dirty} between being started and being
 * confirmed finished.
 */
@Value
@Builder
@AllArgsConstructor
public class MigrationRecord {

  static final String ID = BackendStore.KEY;
  static final String DIRTY = "dirty";

  @NonNull String id;
  boolean dirty;

  Map<String, Object> toItem() {
    return Map.of(ID, id, DIRTY, dirty);
  }

  /**
   * Maps a raw item from the ledger table. Unknown attributes are ignored.
   *
   * @param item The item.
   * @return The record.
   * @throws RecordDecodingException If {@code id} or {@code dirty} is missing or of the wrong type.
   */
  static MigrationRecord fromItem(Map<String, Object> item) {
    Object id = item.get(ID);
    if (!(id instanceof String)) {
      throw new RecordDecodingException(
          "Ledger item " + item + " has no string attribute '" + ID + "'");
    }
    Object dirty = item.get(DIRTY);
    if (!(dirty instanceof Boolean)) {
      throw new RecordDecodingException(
          "Ledger item " + id + " has no boolean attribute '" + DIRTY + "'");
    }
    return new MigrationRecord((String) id, (Boolean) dirty);
  }
}
