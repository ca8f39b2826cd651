package com.starscape.mentana.wiring;

import com.starscape.mentana.common.adapter.AdapterKey;
import com.starscape.mentana.common.adapter.AdapterRegistry;
import com.starscape.mentana.common.adapter.BackendType;
import com.starscape.mentana.common.config.AppProperties;
import com.starscape.mentana.common.config.AwsClientFactory;
import com.starscape.mentana.common.exception.ConfigurationException;
import com.starscape.mentana.common.health.LivenessProbe;
import com.starscape.mentana.features.users.domain.UserRepository;
import com.starscape.mentana.features.users.infra.DynamoDbUserRepository;
import com.starscape.mentana.features.users.infra.InMemoryUserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Decides which adapter backs each repository port.
 *
 * <p>The default adapter comes from {@code app.backends.*} and is memoized in the
 * {@link AdapterRegistry}. {@link #createByType(String)} builds a fresh instance outside
 * the cache for tests and multi-backend setups.</p>
 */
public class RepositoryFactory {

    private static final Logger log = LoggerFactory.getLogger(RepositoryFactory.class);

    private final AdapterRegistry registry;
    private final AppProperties properties;
    private final AwsClientFactory awsClients;

    public RepositoryFactory(AdapterRegistry registry, AppProperties properties, AwsClientFactory awsClients) {
        this.registry = registry;
        this.properties = properties;
        this.awsClients = awsClients;
    }

    /**
     * Resolves the cached default repository for the entity type, seen only as a
     * {@link LivenessProbe}. This enum-keyed entry point exists so health checks can walk every
     * entity type; callers that need the repository itself use the typed accessor
     * ({@link #resolveUserRepository()}), which returns the same cached instance.
     *
     * @throws ConfigurationException when the configured backend is unknown, cannot serve the
     *                                port, or misses a required setting
     */
    public LivenessProbe resolveRepository(EntityType entityType) {
        return switch (entityType) {
            case USER -> resolveUserRepository();
        };
    }

    public UserRepository resolveUserRepository() {
        BackendType backend = BackendType.fromName(properties.getBackends().getUserRepository());
        return registry.resolve(AdapterKey.of(UserRepository.class, backend), () -> construct(backend));
    }

    /**
     * Builds a new user repository for the named backend, bypassing the cache.
     * The caller owns the returned instance.
     */
    public UserRepository createByType(String type) {
        return construct(BackendType.fromName(type));
    }

    public List<AdapterDescription> describe() {
        String configured = properties.getBackends().getUserRepository();
        boolean created;
        try {
            created = registry.isCreated(AdapterKey.of(UserRepository.class, BackendType.fromName(configured)));
        } catch (ConfigurationException e) {
            created = false;
        }
        return List.of(new AdapterDescription(EntityType.USER.componentName(), configured, created));
    }

    private UserRepository construct(BackendType backend) {
        log.info("Creating user repository for backend {}", backend.configName());
        return switch (backend) {
            case DYNAMODB -> dynamoDbUserRepository();
            case MEMORY -> new InMemoryUserRepository();
            case S3 -> throw new ConfigurationException(
                    "Backend '" + backend.configName() + "' cannot serve the user repository");
        };
    }

    private DynamoDbUserRepository dynamoDbUserRepository() {
        AppProperties.DynamoDb dynamoDb = properties.getAws().getDynamodb();
        if (dynamoDb.getTable() == null || dynamoDb.getTable().isBlank()) {
            throw ConfigurationException.missingSetting("app.aws.dynamodb.table", BackendType.DYNAMODB.configName());
        }
        DynamoDbUserRepository repository = new DynamoDbUserRepository(awsClients.dynamoDbClient(), dynamoDb.getTable());
        if (dynamoDb.isCreateTable()) {
            repository.ensureTable();
        }
        log.info("User repository instance created: table={}", dynamoDb.getTable());
        return repository;
    }
}
