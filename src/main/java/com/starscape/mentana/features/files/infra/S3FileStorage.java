package com.starscape.mentana.features.files.infra;

import com.starscape.mentana.common.domain.Result;
import com.starscape.mentana.common.exception.DomainError;
import com.starscape.mentana.common.exception.ErrorKind;
import com.starscape.mentana.common.health.ProbeResult;
import com.starscape.mentana.features.files.domain.FileStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * {@link FileStorage} backed by one S3 bucket.
 * Errors are mapped to {@link ErrorKind} at this boundary.
 */
public class S3FileStorage implements FileStorage, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(S3FileStorage.class);

    private final S3Client s3Client;
    private final String bucket;
    private final String endpointUrl;

    /**
     * @param endpointUrl endpoint override (LocalStack, MinIO); null or blank for AWS
     */
    public S3FileStorage(S3Client s3Client, String bucket, String endpointUrl) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.endpointUrl = endpointUrl;
    }

    @Override
    public Result<String> put(String key, byte[] content, String contentType) {
        if (key == null || key.isBlank()) {
            return Result.failure(DomainError.validation("Object key is required"));
        }
        if (content == null) {
            return Result.failure(DomainError.validation("Object content is required"));
        }
        try {
            PutObjectRequest.Builder request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key);
            if (contentType != null && !contentType.isBlank()) {
                request.contentType(contentType);
            }
            s3Client.putObject(request.build(), RequestBody.fromBytes(content));
            String location = locationOf(key);
            log.info("Uploaded S3 object: bucket={}, key={}, bytes={}", bucket, key, content.length);
            return Result.success(location);
        } catch (SdkException e) {
            return translate(e, "upload " + key);
        }
    }

    @Override
    public Result<Boolean> exists(String key) {
        if (key == null || key.isBlank()) {
            return Result.success(false);
        }
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
            return Result.success(true);
        } catch (SdkException e) {
            if (isMissing(e)) {
                return Result.success(false);
            }
            return translate(e, "check " + key);
        }
    }

    @Override
    public Result<Boolean> delete(String key) {
        if (key == null || key.isBlank()) {
            return Result.failure(DomainError.validation("Object key is required"));
        }
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
            log.info("Deleted S3 object: bucket={}, key={}", bucket, key);
            return Result.success(true);
        } catch (SdkException e) {
            if (isMissing(e)) {
                log.debug("S3 object does not exist (already deleted?): bucket={}, key={}", bucket, key);
                return Result.success(true);
            }
            return translate(e, "delete " + key);
        }
    }

    @Override
    public String locationOf(String key) {
        if (endpointUrl != null && !endpointUrl.isBlank()) {
            String base = endpointUrl.endsWith("/") ? endpointUrl.substring(0, endpointUrl.length() - 1) : endpointUrl;
            return base + "/" + bucket + "/" + key;
        }
        return "https://" + bucket + ".s3.amazonaws.com/" + key;
    }

    @Override
    public ProbeResult probe() {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
            return ProbeResult.reachable("bucket " + bucket + " is accessible");
        } catch (SdkException e) {
            log.warn("S3 probe failed: bucket={}, error={}", bucket, e.getMessage());
            return ProbeResult.unreachable(e.getMessage());
        }
    }

    public String getBucket() {
        return bucket;
    }

    @Override
    public void close() {
        s3Client.close();
    }

    private <T> Result<T> translate(SdkException e, String action) {
        ErrorKind kind = classify(e);
        log.warn("S3 call failed: action={}, bucket={}, kind={}, error={}", action, bucket, kind, e.getMessage());
        return Result.failure(kind, "Could not " + action + " in bucket " + bucket + ": " + e.getMessage());
    }

    static ErrorKind classify(SdkException e) {
        if (e instanceof SdkClientException) {
            return ErrorKind.UNAVAILABLE;
        }
        if (e instanceof AwsServiceException serviceException) {
            int status = serviceException.statusCode();
            if (status == 401 || status == 403) {
                return ErrorKind.PERMISSION_DENIED;
            }
            if (status == 400 && !serviceException.isThrottlingException()) {
                return ErrorKind.VALIDATION;
            }
        }
        return ErrorKind.UNAVAILABLE;
    }

    private static boolean isMissing(SdkException e) {
        return e instanceof NoSuchKeyException
                || (e instanceof AwsServiceException serviceException && serviceException.statusCode() == 404);
    }
}
