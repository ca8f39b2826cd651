package com.starscape.mentana.wiring;

import com.starscape.mentana.common.adapter.AdapterKey;
import com.starscape.mentana.common.adapter.AdapterRegistry;
import com.starscape.mentana.common.adapter.BackendType;
import com.starscape.mentana.common.config.AppProperties;
import com.starscape.mentana.common.config.AwsClientFactory;
import com.starscape.mentana.common.exception.ConfigurationException;
import com.starscape.mentana.common.health.LivenessProbe;
import com.starscape.mentana.features.files.domain.FileStorage;
import com.starscape.mentana.features.files.infra.InMemoryFileStorage;
import com.starscape.mentana.features.files.infra.S3FileStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Decides which adapter backs each external service port. Same caching rules as
 * {@link RepositoryFactory}.
 */
public class ServiceFactory {

    private static final Logger log = LoggerFactory.getLogger(ServiceFactory.class);

    private static final String DEFAULT_MEMORY_BUCKET = "local";

    private final AdapterRegistry registry;
    private final AppProperties properties;
    private final AwsClientFactory awsClients;

    public ServiceFactory(AdapterRegistry registry, AppProperties properties, AwsClientFactory awsClients) {
        this.registry = registry;
        this.properties = properties;
        this.awsClients = awsClients;
    }

    /**
     * Probe-only view of the cached default adapter for the service type, used by health checks.
     * The typed accessor {@link #resolveFileStorage()} returns the same instance.
     */
    public LivenessProbe resolveService(ServiceType serviceType) {
        return switch (serviceType) {
            case FILE_STORAGE -> resolveFileStorage();
        };
    }

    public FileStorage resolveFileStorage() {
        BackendType backend = BackendType.fromName(properties.getBackends().getFileStorage());
        return registry.resolve(AdapterKey.of(FileStorage.class, backend), () -> construct(backend));
    }

    /**
     * Builds a new file storage adapter for the named backend, bypassing the cache.
     */
    public FileStorage createByType(String type) {
        return construct(BackendType.fromName(type));
    }

    public List<AdapterDescription> describe() {
        String configured = properties.getBackends().getFileStorage();
        boolean created;
        try {
            created = registry.isCreated(AdapterKey.of(FileStorage.class, BackendType.fromName(configured)));
        } catch (ConfigurationException e) {
            created = false;
        }
        return List.of(new AdapterDescription(ServiceType.FILE_STORAGE.componentName(), configured, created));
    }

    private FileStorage construct(BackendType backend) {
        log.info("Creating file storage for backend {}", backend.configName());
        return switch (backend) {
            case S3 -> s3FileStorage();
            case MEMORY -> new InMemoryFileStorage(bucketOr(DEFAULT_MEMORY_BUCKET));
            case DYNAMODB -> throw new ConfigurationException(
                    "Backend '" + backend.configName() + "' cannot serve file storage");
        };
    }

    private S3FileStorage s3FileStorage() {
        String bucket = properties.getAws().getS3().getBucket();
        if (bucket == null || bucket.isBlank()) {
            throw ConfigurationException.missingSetting("app.aws.s3.bucket", BackendType.S3.configName());
        }
        log.info("S3 file storage instance created: bucket={}", bucket);
        return new S3FileStorage(awsClients.s3Client(), bucket, properties.getAws().getEndpointUrl());
    }

    private String bucketOr(String fallback) {
        String bucket = properties.getAws().getS3().getBucket();
        return bucket == null || bucket.isBlank() ? fallback : bucket;
    }
}
