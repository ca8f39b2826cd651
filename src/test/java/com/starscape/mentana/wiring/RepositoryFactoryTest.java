package com.starscape.mentana.wiring;

import com.starscape.mentana.common.adapter.AdapterRegistry;
import com.starscape.mentana.common.config.AppProperties;
import com.starscape.mentana.common.config.AwsClientFactory;
import com.starscape.mentana.common.exception.ConfigurationException;
import com.starscape.mentana.features.users.domain.UserRepository;
import com.starscape.mentana.features.users.infra.InMemoryUserRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class RepositoryFactoryTest {

    private AppProperties properties;
    private AdapterRegistry registry;
    private AwsClientFactory awsClients;
    private RepositoryFactory factory;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        properties.getBackends().setUserRepository("memory");
        registry = new AdapterRegistry();
        awsClients = mock(AwsClientFactory.class);
        factory = new RepositoryFactory(registry, properties, awsClients);
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void memoryBackendIsResolvedOnceUnderConcurrency() throws Exception {
        int threads = 12;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<UserRepository>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return factory.resolveUserRepository();
                }));
            }
            start.countDown();

            Set<UserRepository> distinct = ConcurrentHashMap.newKeySet();
            for (Future<UserRepository> future : futures) {
                distinct.add(future.get(5, TimeUnit.SECONDS));
            }

            assertEquals(1, distinct.size());
            assertInstanceOf(InMemoryUserRepository.class, distinct.iterator().next());
            assertEquals(1, registry.size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void entityTypeLookupReturnsTheTypedDefault() {
        UserRepository typed = factory.resolveUserRepository();

        assertSame(typed, factory.resolveRepository(EntityType.USER));
    }

    @Test
    void createByTypeBypassesTheCache() {
        UserRepository cached = factory.resolveUserRepository();

        UserRepository fresh = factory.createByType("memory");

        assertNotSame(cached, fresh);
        assertSame(cached, factory.resolveUserRepository());
    }

    @Test
    void unknownBackendFailsWithItsName() {
        properties.getBackends().setUserRepository("unknown-backend");

        ConfigurationException ex = assertThrows(ConfigurationException.class, factory::resolveUserRepository);

        assertTrue(ex.getMessage().contains("unknown-backend"));
        assertEquals(0, registry.size());
    }

    @Test
    void fileOnlyBackendCannotServeUsers() {
        assertThrows(ConfigurationException.class, () -> factory.createByType("s3"));
    }

    @Test
    void dynamoDbWithoutTableIsAConfigurationError() {
        properties.getBackends().setUserRepository("dynamodb");
        properties.getAws().getDynamodb().setTable(" ");

        ConfigurationException ex = assertThrows(ConfigurationException.class, factory::resolveUserRepository);

        assertTrue(ex.getMessage().contains("app.aws.dynamodb.table"));
        verifyNoInteractions(awsClients);
    }

    @Test
    void describeReportsWhetherTheDefaultWasBuilt() {
        assertEquals(List.of(new AdapterDescription("user-repository", "memory", false)), factory.describe());

        factory.resolveRepository(EntityType.USER);

        assertEquals(List.of(new AdapterDescription("user-repository", "memory", true)), factory.describe());
    }
}
