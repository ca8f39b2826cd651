package com.starscape.mentana.features.users.infra;

import com.starscape.mentana.common.domain.Result;
import com.starscape.mentana.common.exception.DomainError;
import com.starscape.mentana.common.exception.ErrorKind;
import com.starscape.mentana.common.health.ProbeResult;
import com.starscape.mentana.features.users.domain.User;
import com.starscape.mentana.features.users.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.Delete;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.dynamodb.model.Put;
import software.amazon.awssdk.services.dynamodb.model.RequestLimitExceededException;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link UserRepository} on a single DynamoDB table with partition key {@code id}.
 *
 * <p>Each user is stored twice over: the user item itself ({@code item_type = USER}) and an
 * email lock item keyed {@code EMAIL#<email>} ({@code item_type = EMAIL}). Both are written in
 * one {@code TransactWriteItems} call under {@code attribute_not_exists(id)}, which is how email
 * uniqueness is enforced without a secondary index.</p>
 *
 * <p>Backend errors are translated to {@link ErrorKind} here and nowhere else.</p>
 */
public class DynamoDbUserRepository implements UserRepository, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DynamoDbUserRepository.class);

    static final String ATTR_ID = "id";
    static final String ATTR_ITEM_TYPE = "item_type";
    static final String ATTR_EMAIL = "email";
    static final String ATTR_NAME = "name";
    static final String ATTR_ACTIVE = "is_active";
    static final String ATTR_CREATED_AT = "created_at";
    static final String ATTR_UPDATED_AT = "updated_at";
    static final String ATTR_USER_ID = "user_id";

    static final String TYPE_USER = "USER";
    static final String TYPE_EMAIL = "EMAIL";
    static final String EMAIL_KEY_PREFIX = "EMAIL#";

    private static final String CONDITIONAL_CHECK_FAILED = "ConditionalCheckFailed";

    private final DynamoDbClient dynamoDb;
    private final String tableName;

    public DynamoDbUserRepository(DynamoDbClient dynamoDb, String tableName) {
        this.dynamoDb = dynamoDb;
        this.tableName = tableName;
    }

    @Override
    public Result<User> create(User user) {
        if (user == null) {
            return Result.failure(DomainError.validation("User is required"));
        }
        TransactWriteItemsRequest request = TransactWriteItemsRequest.builder()
                .transactItems(
                    TransactWriteItem.builder().put(Put.builder()
                            .tableName(tableName)
                            .item(toItem(user))
                            .conditionExpression("attribute_not_exists(id)")
                            .build()).build(),
                    TransactWriteItem.builder().put(Put.builder()
                            .tableName(tableName)
                            .item(emailLockItem(user))
                            .conditionExpression("attribute_not_exists(id)")
                            .build()).build())
                .build();
        try {
            dynamoDb.transactWriteItems(request);
            log.info("Saved user to DynamoDB: table={}, userId={}", tableName, user.getId());
            return Result.success(user);
        } catch (TransactionCanceledException e) {
            if (failedOnCondition(e, 1)) {
                return Result.failure(DomainError.conflict("Email is already registered: " + user.getEmail()));
            }
            if (failedOnCondition(e, 0)) {
                return Result.failure(DomainError.conflict("User already exists: " + user.getId()));
            }
            return translate(e, "save user " + user.getId());
        } catch (SdkException e) {
            return translate(e, "save user " + user.getId());
        }
    }

    @Override
    public Result<User> findById(UUID id) {
        try {
            GetItemResponse response = dynamoDb.getItem(GetItemRequest.builder()
                    .tableName(tableName)
                    .key(key(id.toString()))
                    .consistentRead(true)
                    .build());
            if (!response.hasItem() || !isUserItem(response.item())) {
                return Result.failure(DomainError.notFound("User not found: " + id));
            }
            return Result.success(fromItem(response.item()));
        } catch (SdkException e) {
            return translate(e, "find user " + id);
        }
    }

    @Override
    public Result<User> findByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Result.failure(DomainError.notFound("User not found for email: " + email));
        }
        String normalized = User.normalizeEmail(email);
        try {
            GetItemResponse lock = dynamoDb.getItem(GetItemRequest.builder()
                    .tableName(tableName)
                    .key(key(EMAIL_KEY_PREFIX + normalized))
                    .consistentRead(true)
                    .build());
            if (!lock.hasItem() || !lock.item().containsKey(ATTR_USER_ID)) {
                return Result.failure(DomainError.notFound("User not found for email: " + email));
            }
            return findById(UUID.fromString(lock.item().get(ATTR_USER_ID).s()));
        } catch (SdkException e) {
            return translate(e, "find user by email");
        }
    }

    @Override
    public Result<List<User>> findAll() {
        return scan(ScanRequest.builder()
                .tableName(tableName)
                .filterExpression("item_type = :user")
                .expressionAttributeValues(Map.of(":user", AttributeValue.fromS(TYPE_USER)))
                .build());
    }

    @Override
    public Result<List<User>> findActive() {
        return scan(ScanRequest.builder()
                .tableName(tableName)
                .filterExpression("item_type = :user AND is_active = :active")
                .expressionAttributeValues(Map.of(
                    ":user", AttributeValue.fromS(TYPE_USER),
                    ":active", AttributeValue.fromBool(true)))
                .build());
    }

    @Override
    public Result<User> update(User user) {
        try {
            UpdateItemResponse response = dynamoDb.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(key(user.getId().toString()))
                    .conditionExpression("attribute_exists(id) AND item_type = :user")
                    .updateExpression("SET #name = :name, is_active = :active, updated_at = :updated")
                    .expressionAttributeNames(Map.of("#name", ATTR_NAME))
                    .expressionAttributeValues(Map.of(
                        ":user", AttributeValue.fromS(TYPE_USER),
                        ":name", AttributeValue.fromS(user.getName()),
                        ":active", AttributeValue.fromBool(user.isActive()),
                        ":updated", AttributeValue.fromS(user.getUpdatedAt().toString())))
                    .returnValues(ReturnValue.ALL_NEW)
                    .build());
            log.info("Updated user in DynamoDB: table={}, userId={}", tableName, user.getId());
            return Result.success(fromItem(response.attributes()));
        } catch (ConditionalCheckFailedException e) {
            return Result.failure(DomainError.notFound("User not found: " + user.getId()));
        } catch (SdkException e) {
            return translate(e, "update user " + user.getId());
        }
    }

    @Override
    public Result<User> delete(UUID id) {
        Result<User> existing = findById(id);
        if (existing.isFailure()) {
            return existing;
        }
        User user = existing.value();
        TransactWriteItemsRequest request = TransactWriteItemsRequest.builder()
                .transactItems(
                    TransactWriteItem.builder().delete(Delete.builder()
                            .tableName(tableName)
                            .key(key(id.toString()))
                            .conditionExpression("attribute_exists(id)")
                            .build()).build(),
                    TransactWriteItem.builder().delete(Delete.builder()
                            .tableName(tableName)
                            .key(key(EMAIL_KEY_PREFIX + user.getEmail()))
                            .build()).build())
                .build();
        try {
            dynamoDb.transactWriteItems(request);
            log.info("Deleted user from DynamoDB: table={}, userId={}", tableName, id);
            return Result.success(user);
        } catch (TransactionCanceledException e) {
            if (failedOnCondition(e, 0)) {
                return Result.failure(DomainError.notFound("User not found: " + id));
            }
            return translate(e, "delete user " + id);
        } catch (SdkException e) {
            return translate(e, "delete user " + id);
        }
    }

    @Override
    public ProbeResult probe() {
        try {
            DescribeTableResponse response = dynamoDb.describeTable(
                    DescribeTableRequest.builder().tableName(tableName).build());
            return ProbeResult.reachable("table " + tableName + " is " + response.table().tableStatusAsString());
        } catch (SdkException e) {
            log.warn("DynamoDB probe failed: table={}, error={}", tableName, e.getMessage());
            return ProbeResult.unreachable(e.getMessage());
        }
    }

    /**
     * Creates the table when it does not exist yet and waits until it is usable.
     * Meant for DynamoDB Local and first-run development setups.
     */
    public void ensureTable() {
        try {
            dynamoDb.createTable(CreateTableRequest.builder()
                    .tableName(tableName)
                    .keySchema(KeySchemaElement.builder().attributeName(ATTR_ID).keyType(KeyType.HASH).build())
                    .attributeDefinitions(AttributeDefinition.builder()
                            .attributeName(ATTR_ID)
                            .attributeType(ScalarAttributeType.S)
                            .build())
                    .billingMode(BillingMode.PAY_PER_REQUEST)
                    .build());
            log.info("Created DynamoDB table {}", tableName);
        } catch (ResourceInUseException e) {
            log.debug("DynamoDB table {} already exists", tableName);
            return;
        }
        dynamoDb.waiter().waitUntilTableExists(DescribeTableRequest.builder().tableName(tableName).build());
    }

    @Override
    public void close() {
        dynamoDb.close();
    }

    private Result<List<User>> scan(ScanRequest request) {
        try {
            List<User> users = new ArrayList<>();
            dynamoDb.scanPaginator(request).items().forEach(item -> users.add(fromItem(item)));
            log.debug("Scanned {} users from DynamoDB table {}", users.size(), tableName);
            return Result.success(users);
        } catch (SdkException e) {
            return translate(e, "scan users");
        }
    }

    private <T> Result<T> translate(SdkException e, String action) {
        ErrorKind kind = classify(e);
        log.warn("DynamoDB call failed: action={}, table={}, kind={}, error={}",
                action, tableName, kind, e.getMessage());
        return Result.failure(kind, "Could not " + action + ": " + e.getMessage());
    }

    static ErrorKind classify(SdkException e) {
        if (e instanceof ConditionalCheckFailedException) {
            return ErrorKind.CONFLICT;
        }
        if (e instanceof ResourceNotFoundException
                || e instanceof ProvisionedThroughputExceededException
                || e instanceof RequestLimitExceededException
                || e instanceof SdkClientException) {
            return ErrorKind.UNAVAILABLE;
        }
        if (e instanceof AwsServiceException serviceException) {
            if (serviceException.isThrottlingException() || serviceException.statusCode() >= 500) {
                return ErrorKind.UNAVAILABLE;
            }
            if (serviceException.awsErrorDetails() != null
                    && "ValidationException".equals(serviceException.awsErrorDetails().errorCode())) {
                return ErrorKind.VALIDATION;
            }
        }
        return ErrorKind.UNAVAILABLE;
    }

    private static boolean failedOnCondition(TransactionCanceledException e, int index) {
        if (!e.hasCancellationReasons() || e.cancellationReasons().size() <= index) {
            return false;
        }
        CancellationReason reason = e.cancellationReasons().get(index);
        return CONDITIONAL_CHECK_FAILED.equals(reason.code());
    }

    private static Map<String, AttributeValue> key(String id) {
        return Map.of(ATTR_ID, AttributeValue.fromS(id));
    }

    private static boolean isUserItem(Map<String, AttributeValue> item) {
        AttributeValue type = item.get(ATTR_ITEM_TYPE);
        return type != null && TYPE_USER.equals(type.s());
    }

    static Map<String, AttributeValue> toItem(User user) {
        Map<String, AttributeValue> item = new HashMap<>();
        item.put(ATTR_ID, AttributeValue.fromS(user.getId().toString()));
        item.put(ATTR_ITEM_TYPE, AttributeValue.fromS(TYPE_USER));
        item.put(ATTR_EMAIL, AttributeValue.fromS(user.getEmail()));
        item.put(ATTR_NAME, AttributeValue.fromS(user.getName()));
        item.put(ATTR_ACTIVE, AttributeValue.fromBool(user.isActive()));
        item.put(ATTR_CREATED_AT, AttributeValue.fromS(user.getCreatedAt().toString()));
        item.put(ATTR_UPDATED_AT, AttributeValue.fromS(user.getUpdatedAt().toString()));
        return item;
    }

    private static Map<String, AttributeValue> emailLockItem(User user) {
        return Map.of(
            ATTR_ID, AttributeValue.fromS(EMAIL_KEY_PREFIX + user.getEmail()),
            ATTR_ITEM_TYPE, AttributeValue.fromS(TYPE_EMAIL),
            ATTR_USER_ID, AttributeValue.fromS(user.getId().toString()));
    }

    static User fromItem(Map<String, AttributeValue> item) {
        AttributeValue active = item.get(ATTR_ACTIVE);
        return User.restore(
            UUID.fromString(item.get(ATTR_ID).s()),
            item.get(ATTR_EMAIL).s(),
            item.get(ATTR_NAME).s(),
            active == null || Boolean.TRUE.equals(active.bool()),
            Instant.parse(item.get(ATTR_CREATED_AT).s()),
            Instant.parse(item.get(ATTR_UPDATED_AT).s()));
    }
}
