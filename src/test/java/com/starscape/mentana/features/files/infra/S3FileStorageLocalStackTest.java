package com.starscape.mentana.features.files.infra;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.testcontainers.containers.localstack.LocalStackContainer.Service.S3;

@Testcontainers(disabledWithoutDocker = true)
class S3FileStorageLocalStackTest {

    private static final String TEST_BUCKET = "test-bucket";

    @Container
    static LocalStackContainer localstack = new LocalStackContainer(
            DockerImageName.parse("localstack/localstack:3.4"))
            .withServices(S3);

    private static S3Client s3Client;

    @BeforeAll
    static void createBucket() {
        s3Client = S3Client.builder()
                .endpointOverride(localstack.getEndpointOverride(S3))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(localstack.getAccessKey(), localstack.getSecretKey())))
                .region(Region.of(localstack.getRegion()))
                .forcePathStyle(true)
                .build();
        s3Client.createBucket(CreateBucketRequest.builder().bucket(TEST_BUCKET).build());
    }

    @AfterAll
    static void closeClient() {
        if (s3Client != null) {
            s3Client.close();
        }
    }

    @Test
    void putExistsDeleteRoundTrip() {
        S3FileStorage storage = storage(TEST_BUCKET);
        String key = "probe-files/roundtrip.txt";

        String location = storage.put(key, "hello".getBytes(StandardCharsets.UTF_8), "text/plain").value();

        assertTrue(location.endsWith("/" + TEST_BUCKET + "/" + key), location);
        assertTrue(storage.exists(key).value());
        assertTrue(storage.delete(key).value());
        assertFalse(storage.exists(key).value());
    }

    @Test
    void probeReflectsBucketAccess() {
        assertTrue(storage(TEST_BUCKET).probe().reachable());
        assertFalse(storage("missing-bucket").probe().reachable());
    }

    private static S3FileStorage storage(String bucket) {
        return new S3FileStorage(s3Client, bucket, localstack.getEndpointOverride(S3).toString());
    }
}
