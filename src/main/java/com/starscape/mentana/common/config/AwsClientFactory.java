package com.starscape.mentana.common.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

/**
 * Builds AWS SDK clients from {@link AppProperties}.
 *
 * <p>Clients are created on demand by the adapter factories, so a process configured with
 * in-memory backends never touches AWS credentials. Each client carries a bounded retry
 * count and an API call timeout; that is the only retry in the request path.</p>
 */
@Component
public class AwsClientFactory {

    private static final Logger log = LoggerFactory.getLogger(AwsClientFactory.class);

    private final AppProperties.Aws aws;

    public AwsClientFactory(AppProperties properties) {
        this.aws = properties.getAws();
    }

    public DynamoDbClient dynamoDbClient() {
        DynamoDbClientBuilder builder = DynamoDbClient.builder()
                .region(Region.of(aws.getRegion()))
                .credentialsProvider(credentialsProvider())
                .overrideConfiguration(overrideConfiguration());
        if (hasEndpointOverride()) {
            builder.endpointOverride(URI.create(aws.getEndpointUrl()));
        }
        log.info("Building DynamoDB client: region={}, endpoint={}", aws.getRegion(), endpointForLog());
        return builder.build();
    }

    public S3Client s3Client() {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(aws.getRegion()))
                .credentialsProvider(credentialsProvider())
                .overrideConfiguration(overrideConfiguration());
        if (hasEndpointOverride()) {
            // LocalStack and MinIO do not serve virtual-hosted bucket names
            builder.endpointOverride(URI.create(aws.getEndpointUrl())).forcePathStyle(true);
        }
        log.info("Building S3 client: region={}, endpoint={}", aws.getRegion(), endpointForLog());
        return builder.build();
    }

    AwsCredentialsProvider credentialsProvider() {
        if (notBlank(aws.getAccessKeyId()) && notBlank(aws.getSecretAccessKey())) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(aws.getAccessKeyId(), aws.getSecretAccessKey()));
        }
        // Use profile if specified, otherwise use default credentials chain
        if (notBlank(aws.getProfile())) {
            return ProfileCredentialsProvider.create(aws.getProfile());
        }
        return DefaultCredentialsProvider.create();
    }

    private ClientOverrideConfiguration overrideConfiguration() {
        int retries = Math.max(0, aws.getMaxAttempts() - 1);
        return ClientOverrideConfiguration.builder()
                .apiCallTimeout(aws.getCallTimeout())
                .retryPolicy(RetryPolicy.builder().numRetries(retries).build())
                .build();
    }

    private boolean hasEndpointOverride() {
        return notBlank(aws.getEndpointUrl());
    }

    private String endpointForLog() {
        return hasEndpointOverride() ? aws.getEndpointUrl() : "default";
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
