package com.gruelbox.migrationledger.dynamodb;

import com.gruelbox.migrationledger.spi.BackendStore;
import com.gruelbox.migrationledger.spi.BackendStoreException;
import com.gruelbox.migrationledger.spi.KeyCondition;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.AbortedException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.retry.backoff.FixedDelayBackoffStrategy;
import software.amazon.awssdk.core.waiters.WaiterOverrideConfiguration;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ListTablesRequest;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.waiters.DynamoDbWaiter;

/**
 * A {@link BackendStore} over Amazon DynamoDB.
 *
 * <p>Key conditions are expressed as {@code attribute_not_exists(id)} and {@code
 * attribute_exists(id)} condition expressions, so each conditional write is atomic on the server.
 * Tables are created with a string hash key named {@value BackendStore#KEY} and provisioned
 * throughput.
 *
 * <p>The client is supplied by the caller, who remains responsible for closing it.
 */
@Slf4j
@Builder
public class DynamoDbBackendStore implements BackendStore {

  private static final String KEY_NAME = "#k";
  private static final Map<String, String> KEY_NAMES = Map.of(KEY_NAME, KEY);

  /**
   * @param client The DynamoDB client. Required.
   */
  @SuppressWarnings("JavaDoc")
  @NonNull
  private final DynamoDbClient client;

  /**
   * @param readCapacityUnits Provisioned read capacity for tables created by {@link
   *     #createTable(String)}. Defaults to 1.
   */
  @SuppressWarnings("JavaDoc")
  @Builder.Default
  private final long readCapacityUnits = 1;

  /**
   * @param writeCapacityUnits Provisioned write capacity for tables created by {@link
   *     #createTable(String)}. Defaults to 1.
   */
  @SuppressWarnings("JavaDoc")
  @Builder.Default
  private final long writeCapacityUnits = 1;

  /**
   * @param waitForTables If true, {@link #createTable(String)} does not return until the new table
   *     is active, and {@link #deleteTable(String)} does not return until the table is gone.
   *     Without this, writes made straight after provisioning may fail, and a table which is still
   *     being deleted is listed as present. Defaults to true.
   */
  @SuppressWarnings("JavaDoc")
  @Builder.Default
  private final boolean waitForTables = true;

  /**
   * @param tableWaitPollInterval How often to check the table status while waiting for a table to
   *     be created or deleted. If null, the AWS SDK's waiter defaults apply.
   */
  @SuppressWarnings("JavaDoc")
  private final Duration tableWaitPollInterval;

  @Override
  public List<Map<String, Object>> scan(String tableName) {
    return call(
        "scan " + tableName,
        () -> {
          List<Map<String, Object>> result = new ArrayList<>();
          client
              .scanPaginator(ScanRequest.builder().tableName(tableName).consistentRead(true).build())
              .items()
              .forEach(item -> result.add(fromAttributes(tableName, item)));
          return result;
        });
  }

  @Override
  public boolean put(String tableName, Map<String, Object> item, KeyCondition condition) {
    if (!(item.get(KEY) instanceof String)) {
      throw new IllegalArgumentException("Item has no string attribute '" + KEY + "'");
    }
    var request =
        PutItemRequest.builder()
            .tableName(tableName)
            .item(toAttributes(item))
            .conditionExpression(conditionExpression(condition))
            .expressionAttributeNames(KEY_NAMES)
            .build();
    return conditionally("put into " + tableName, () -> client.putItem(request));
  }

  @Override
  public boolean update(
      String tableName, String key, Map<String, Object> changes, KeyCondition condition) {
    if (changes.containsKey(KEY)) {
      throw new IllegalArgumentException("The key attribute may not be updated");
    }
    if (changes.isEmpty()) {
      throw new IllegalArgumentException("No attributes to update");
    }
    Map<String, String> names = new HashMap<>(KEY_NAMES);
    Map<String, AttributeValue> values = new HashMap<>();
    List<String> assignments = new ArrayList<>();
    int i = 0;
    for (Map.Entry<String, Object> change : changes.entrySet()) {
      names.put("#a" + i, change.getKey());
      values.put(":v" + i, toAttribute(change.getKey(), change.getValue()));
      assignments.add("#a" + i + " = :v" + i);
      i++;
    }
    var request =
        UpdateItemRequest.builder()
            .tableName(tableName)
            .key(keyOf(key))
            .updateExpression("SET " + String.join(", ", assignments))
            .conditionExpression(conditionExpression(condition))
            .expressionAttributeNames(names)
            .expressionAttributeValues(values)
            .build();
    return conditionally("update " + key + " in " + tableName, () -> client.updateItem(request));
  }

  @Override
  public boolean delete(String tableName, String key, KeyCondition condition) {
    var request =
        DeleteItemRequest.builder()
            .tableName(tableName)
            .key(keyOf(key))
            .conditionExpression(conditionExpression(condition))
            .expressionAttributeNames(KEY_NAMES)
            .build();
    return conditionally("delete " + key + " from " + tableName, () -> client.deleteItem(request));
  }

  @Override
  public void delete(String tableName, String key) {
    var request = DeleteItemRequest.builder().tableName(tableName).key(keyOf(key)).build();
    call("delete " + key + " from " + tableName, () -> client.deleteItem(request));
  }

  @Override
  public Set<String> listTables() {
    return call(
        "list tables",
        () -> {
          Set<String> result = new HashSet<>();
          client
              .listTablesPaginator(ListTablesRequest.builder().build())
              .tableNames()
              .forEach(result::add);
          return result;
        });
  }

  @Override
  public boolean createTable(String tableName) {
    var request =
        CreateTableRequest.builder()
            .tableName(tableName)
            .keySchema(KeySchemaElement.builder().attributeName(KEY).keyType(KeyType.HASH).build())
            .attributeDefinitions(
                AttributeDefinition.builder()
                    .attributeName(KEY)
                    .attributeType(ScalarAttributeType.S)
                    .build())
            .provisionedThroughput(
                ProvisionedThroughput.builder()
                    .readCapacityUnits(readCapacityUnits)
                    .writeCapacityUnits(writeCapacityUnits)
                    .build())
            .build();
    boolean created =
        call(
            "create table " + tableName,
            () -> {
              try {
                client.createTable(request);
                return true;
              } catch (ResourceInUseException e) {
                log.debug("Table {} already exists: {}", tableName, e.getMessage());
                return false;
              }
            });
    if (waitForTables) {
      awaitActive(tableName);
    }
    return created;
  }

  private void awaitActive(String tableName) {
    call(
        "wait for table " + tableName,
        () -> {
          try (DynamoDbWaiter waiter = waiter()) {
            var response =
                waiter.waitUntilTableExists(
                    DescribeTableRequest.builder().tableName(tableName).build());
            response
                .matched()
                .exception()
                .ifPresent(
                    e -> {
                      throw new BackendStoreException(
                          "Table " + tableName + " did not become active", e);
                    });
          }
          log.debug("Table {} is active", tableName);
          return null;
        });
  }

  @Override
  public void deleteTable(String tableName) {
    call(
        "delete table " + tableName,
        () -> client.deleteTable(DeleteTableRequest.builder().tableName(tableName).build()));
    if (waitForTables) {
      awaitDeleted(tableName);
    }
  }

  private void awaitDeleted(String tableName) {
    call(
        "wait for deletion of table " + tableName,
        () -> {
          // Succeeds on ResourceNotFoundException, so the matched exception is not a failure
          try (DynamoDbWaiter waiter = waiter()) {
            waiter.waitUntilTableNotExists(
                DescribeTableRequest.builder().tableName(tableName).build());
          }
          log.debug("Table {} is deleted", tableName);
          return null;
        });
  }

  private DynamoDbWaiter waiter() {
    var builder = DynamoDbWaiter.builder().client(client);
    if (tableWaitPollInterval != null) {
      builder.overrideConfiguration(
          WaiterOverrideConfiguration.builder()
              .backoffStrategy(FixedDelayBackoffStrategy.create(tableWaitPollInterval))
              .build());
    }
    return builder.build();
  }

  private boolean conditionally(String operation, Runnable request) {
    return call(
        operation,
        () -> {
          try {
            request.run();
            return true;
          } catch (ConditionalCheckFailedException e) {
            log.debug("Condition failed on {}", operation);
            return false;
          }
        });
  }

  private <T> T call(String operation, Supplier<T> request) {
    try {
      return request.get();
    } catch (AbortedException e) {
      // The SDK clears the interrupt flag when it aborts an interrupted call
      Thread.currentThread().interrupt();
      throw new BackendStoreException("Interrupted during " + operation, e);
    } catch (SdkException e) {
      throw new BackendStoreException("DynamoDB failed to " + operation, e);
    }
  }

  private static String conditionExpression(KeyCondition condition) {
    switch (condition) {
      case KEY_EXISTS:
        return "attribute_exists(" + KEY_NAME + ")";
      case KEY_NOT_EXISTS:
        return "attribute_not_exists(" + KEY_NAME + ")";
      default:
        throw new IllegalArgumentException("Unknown condition " + condition);
    }
  }

  private static Map<String, AttributeValue> keyOf(String key) {
    return Map.of(KEY, AttributeValue.builder().s(key).build());
  }

  private static Map<String, AttributeValue> toAttributes(Map<String, Object> item) {
    Map<String, AttributeValue> result = new HashMap<>();
    item.forEach((name, value) -> result.put(name, toAttribute(name, value)));
    return result;
  }

  private static AttributeValue toAttribute(String name, Object value) {
    if (value instanceof String) {
      return AttributeValue.builder().s((String) value).build();
    }
    if (value instanceof Boolean) {
      return AttributeValue.builder().bool((Boolean) value).build();
    }
    throw new IllegalArgumentException(
        "Attribute " + name + " must be a String or Boolean, was " + value);
  }

  private static Map<String, Object> fromAttributes(
      String tableName, Map<String, AttributeValue> item) {
    Map<String, Object> result = new HashMap<>();
    item.forEach(
        (name, value) -> {
          if (value.s() != null) {
            result.put(name, value.s());
          } else if (value.bool() != null) {
            result.put(name, value.bool());
          } else {
            log.debug("Ignoring attribute {} of unsupported type in {}", name, tableName);
          }
        });
    return result;
  }
}
