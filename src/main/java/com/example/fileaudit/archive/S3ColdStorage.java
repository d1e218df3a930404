package com.example.fileaudit.archive;

import com.example.fileaudit.AuditConfig;
import com.example.fileaudit.ErrorKind;
import com.example.fileaudit.FileAuditException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.GlacierJobParameters;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.RestoreObjectRequest;
import software.amazon.awssdk.services.s3.model.RestoreRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.ServerSideEncryption;
import software.amazon.awssdk.services.s3.model.StorageClass;
import software.amazon.awssdk.services.s3.model.Tier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Set;

public final class S3ColdStorage implements ColdStorage {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3ColdStorage.class);
    private static final Set<String> ARCHIVAL_CLASSES = Set.of("GLACIER", "DEEP_ARCHIVE");
    private static final String ONGOING_TRUE = "ongoing-request=\"true\"";

    private final S3Client s3Client;
    private final String bucket;
    private final StorageClass storageClass;

    public S3ColdStorage(AuditConfig.Archive settings) {
        this(buildClient(settings), requireBucket(settings), settings.storageClass());
    }

    S3ColdStorage(S3Client s3Client, String bucket, String storageClass) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.storageClass = StorageClass.fromValue(storageClass);
        if (this.storageClass == StorageClass.UNKNOWN_TO_SDK_VERSION) {
            throw new IllegalArgumentException("Unsupported storage class: " + storageClass);
        }
    }

    public String bucket() {
        return bucket;
    }

    // TODO: switch to multipart upload through the S3 transfer manager; single PUT stops at 5 GiB.
    @Override
    public ColdObjectRef upload(String key, Path file, ArchiveMetadata metadata) {
        ColdObjectRef ref = new ColdObjectRef(bucket, key);
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .storageClass(storageClass)
                .serverSideEncryption(ServerSideEncryption.AES256)
                .metadata(metadata.toUserMetadata())
                .build();
        try {
            LOGGER.info("Uploading {} to {}", file, ref);
            s3Client.putObject(request, RequestBody.fromFile(file));
            return ref;
        } catch (SdkException ex) {
            throw translate("upload", ref, ex);
        }
    }

    @Override
    public ArchiveMetadata readMetadata(ColdObjectRef ref) {
        return ArchiveMetadata.fromUserMetadata(head(ref).metadata());
    }

    @Override
    public RestoreRequestResult requestRestore(ColdObjectRef ref, int days, String tier) {
        RestoreObjectRequest request = RestoreObjectRequest.builder()
                .bucket(ref.bucket())
                .key(ref.key())
                .restoreRequest(RestoreRequest.builder()
                        .days(days)
                        .glacierJobParameters(GlacierJobParameters.builder().tier(Tier.fromValue(tier)).build())
                        .build())
                .build();
        try {
            s3Client.restoreObject(request);
            LOGGER.info("Restore initiated for {} ({} days, tier {}). Available in 12-48 hours.", ref, days, tier);
            return RestoreRequestResult.INITIATED;
        } catch (S3Exception ex) {
            if ("RestoreAlreadyInProgress".equals(errorCode(ex))) {
                LOGGER.info("Restore already in progress for {}", ref);
                return RestoreRequestResult.ALREADY_IN_PROGRESS;
            }
            throw translate("restore", ref, ex);
        } catch (SdkException ex) {
            throw translate("restore", ref, ex);
        }
    }

    @Override
    public RehydrationState rehydrationState(ColdObjectRef ref) {
        HeadObjectResponse response = head(ref);
        String objectClass = response.storageClassAsString();
        if (objectClass == null || !ARCHIVAL_CLASSES.contains(objectClass)) {
            return RehydrationState.AVAILABLE;
        }
        String restore = response.restore();
        if (restore == null || restore.isBlank()) {
            return RehydrationState.NOT_REQUESTED;
        }
        return restore.contains(ONGOING_TRUE) ? RehydrationState.IN_PROGRESS : RehydrationState.AVAILABLE;
    }

    @Override
    public void download(ColdObjectRef ref, Path target) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(ref.bucket())
                .key(ref.key())
                .build();
        try (ResponseInputStream<GetObjectResponse> in = s3Client.getObject(request)) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            LOGGER.info("Downloaded {} to {}", ref, target);
        } catch (SdkException ex) {
            throw translate("download", ref, ex);
        } catch (IOException ex) {
            throw new FileAuditException(ErrorKind.COLLABORATOR_FAILURE,
                    "Download of " + ref + " was interrupted: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void close() {
        s3Client.close();
    }

    private HeadObjectResponse head(ColdObjectRef ref) {
        try {
            return s3Client.headObject(HeadObjectRequest.builder().bucket(ref.bucket()).key(ref.key()).build());
        } catch (SdkException ex) {
            throw translate("head", ref, ex);
        }
    }

    static FileAuditException translate(String action, ColdObjectRef ref, SdkException ex) {
        if (ex instanceof ApiCallTimeoutException || ex instanceof ApiCallAttemptTimeoutException) {
            return new FileAuditException(ErrorKind.COLLABORATOR_TIMEOUT,
                    "Cold storage " + action + " of " + ref + " timed out. Try again later.", ex);
        }
        if (!(ex instanceof S3Exception)) {
            return new FileAuditException(ErrorKind.COLLABORATOR_FAILURE,
                    "Cold storage " + action + " of " + ref + " failed: " + ex.getMessage(), ex);
        }
        S3Exception s3 = (S3Exception) ex;
        String code = errorCode(s3);
        if ("InvalidObjectState".equals(code)) {
            return new FileAuditException(ErrorKind.INVALID_STATE,
                    "File is not yet restored from cold storage. Try again in 12-48 hours.", ex);
        }
        if ("NoSuchBucket".equals(code)) {
            return new FileAuditException(ErrorKind.COLLABORATOR_NOT_FOUND,
                    "Archive bucket " + ref.bucket() + " does not exist.", ex);
        }
        if ("SlowDown".equals(code)) {
            return new FileAuditException(ErrorKind.COLLABORATOR_RATE_LIMITED,
                    "Cold storage is throttling requests. Try again shortly.", ex);
        }
        return switch (s3.statusCode()) {
            case 401 -> new FileAuditException(ErrorKind.COLLABORATOR_UNAUTHORIZED,
                    "Cold storage rejected the credentials. Check the AWS credentials configuration.", ex);
            case 403 -> new FileAuditException(ErrorKind.COLLABORATOR_FORBIDDEN,
                    "Access denied to " + ref + ". Check IAM permissions.", ex);
            case 404 -> new FileAuditException(ErrorKind.COLLABORATOR_NOT_FOUND,
                    "Archived object " + ref + " was not found in cold storage.", ex);
            case 429, 503 -> new FileAuditException(ErrorKind.COLLABORATOR_RATE_LIMITED,
                    "Cold storage is throttling requests. Try again shortly.", ex);
            default -> new FileAuditException(ErrorKind.COLLABORATOR_FAILURE,
                    "Cold storage " + action + " of " + ref + " failed (" + code + ").", ex);
        };
    }

    private static String errorCode(S3Exception ex) {
        return ex.awsErrorDetails() == null ? null : ex.awsErrorDetails().errorCode();
    }

    private static S3Client buildClient(AuditConfig.Archive settings) {
        S3ClientBuilder builder = S3Client.builder()
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(settings.apiCallTimeout())
                        .build());
        settings.region().map(Region::of).ifPresent(builder::region);
        return builder.build();
    }

    private static String requireBucket(AuditConfig.Archive settings) {
        return settings.bucket().orElseThrow(
                () -> new IllegalArgumentException("archive.bucket (ARCHIVE_BUCKET) is required for cold storage."));
    }
}
