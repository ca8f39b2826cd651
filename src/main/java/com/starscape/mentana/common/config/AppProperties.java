package com.starscape.mentana.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Configuration properties for backends, AWS connectivity and health checks.
 * Binds to app.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Backends backends = new Backends();
    private final Aws aws = new Aws();
    private final Health health = new Health();

    public Backends getBackends() {
        return backends;
    }

    public Aws getAws() {
        return aws;
    }

    public Health getHealth() {
        return health;
    }

    /**
     * Backend-type selectors, e.g. "dynamodb", "memory", "s3".
     * Validated only when the factory resolves them.
     */
    public static class Backends {

        private String userRepository = "dynamodb";
        private String fileStorage = "s3";

        public String getUserRepository() {
            return userRepository;
        }

        public void setUserRepository(String userRepository) {
            this.userRepository = userRepository;
        }

        public String getFileStorage() {
            return fileStorage;
        }

        public void setFileStorage(String fileStorage) {
            this.fileStorage = fileStorage;
        }
    }

    public static class Aws {

        private String region = "us-east-1";
        private String profile;
        private String accessKeyId;
        private String secretAccessKey;
        private String endpointUrl;
        private int maxAttempts = 3;
        private Duration callTimeout = Duration.ofSeconds(5);
        private final DynamoDb dynamodb = new DynamoDb();
        private final S3 s3 = new S3();

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getProfile() {
            return profile;
        }

        public void setProfile(String profile) {
            this.profile = profile;
        }

        public String getAccessKeyId() {
            return accessKeyId;
        }

        public void setAccessKeyId(String accessKeyId) {
            this.accessKeyId = accessKeyId;
        }

        public String getSecretAccessKey() {
            return secretAccessKey;
        }

        public void setSecretAccessKey(String secretAccessKey) {
            this.secretAccessKey = secretAccessKey;
        }

        /**
         * Endpoint override for local testing (DynamoDB Local, LocalStack). Blank means AWS.
         */
        public String getEndpointUrl() {
            return endpointUrl;
        }

        public void setEndpointUrl(String endpointUrl) {
            this.endpointUrl = endpointUrl;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getCallTimeout() {
            return callTimeout;
        }

        public void setCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
        }

        public DynamoDb getDynamodb() {
            return dynamodb;
        }

        public S3 getS3() {
            return s3;
        }
    }

    public static class DynamoDb {

        private String table;
        private boolean createTable;

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public boolean isCreateTable() {
            return createTable;
        }

        public void setCreateTable(boolean createTable) {
            this.createTable = createTable;
        }
    }

    public static class S3 {

        private String bucket;

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }
    }

    public static class Health {

        private Duration timeout = Duration.ofSeconds(2);
        private List<String> optionalComponents = new ArrayList<>();

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public List<String> getOptionalComponents() {
            return optionalComponents;
        }

        public void setOptionalComponents(List<String> optionalComponents) {
            this.optionalComponents = optionalComponents;
        }

        /**
         * Check if a component is required for the composite status.
         * Performs case-insensitive comparison.
         */
        public boolean isRequired(String component) {
            if (component == null || optionalComponents == null || optionalComponents.isEmpty()) {
                return true;
            }
            String normalized = component.toLowerCase(Locale.ROOT).trim();
            return optionalComponents.stream()
                    .map(name -> name.toLowerCase(Locale.ROOT).trim())
                    .noneMatch(name -> name.equals(normalized));
        }
    }
}
