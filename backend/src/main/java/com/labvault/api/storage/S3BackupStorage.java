package com.labvault.api.storage;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

/**
 * Stores backup artifacts in an S3-compatible bucket under a key prefix.
 * Created by {@link com.labvault.api.config.StorageConfig} when {@code backup.storage.type=s3}.
 */
@Slf4j
public class S3BackupStorage implements BackupStorage {

    private final S3Client s3Client;
    private final String bucket;
    private final String prefix;

    public S3BackupStorage(S3Client s3Client, String bucket, String prefix) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.prefix = normalizePrefix(prefix);
    }

    @Override
    public void ensureDirectory() {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
        } catch (NoSuchBucketException e) {
            log.info("Bucket {} does not exist, creating it", bucket);
            try {
                s3Client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
            } catch (Exception createError) {
                throw new StorageException("Failed to create bucket " + bucket, createError);
            }
        } catch (Exception e) {
            throw new StorageException("Backup bucket " + bucket + " is not reachable", e);
        }
    }

    @Override
    public void write(String filename, byte[] content) {
        String key = key(filename);
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType("application/octet-stream")
                    .build();

            s3Client.putObject(request, RequestBody.fromBytes(content));
            log.debug("Uploaded {} bytes to S3: {}", content.length, key);
        } catch (Exception e) {
            throw new StorageException("Failed to upload backup to S3: " + key, e);
        }
    }

    @Override
    public byte[] read(String filename) {
        String key = key(filename);
        try {
            GetObjectRequest request = GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build();

            return s3Client.getObjectAsBytes(request).asByteArray();
        } catch (NoSuchKeyException e) {
            throw new StorageException("Backup file not found in S3: " + key, e);
        } catch (Exception e) {
            throw new StorageException("Failed to download backup from S3: " + key, e);
        }
    }

    @Override
    public long size(String filename) {
        String key = key(filename);
        try {
            HeadObjectResponse response = s3Client.headObject(head(key));
            return response.contentLength();
        } catch (Exception e) {
            throw new StorageException("Failed to stat backup in S3: " + key, e);
        }
    }

    @Override
    public boolean exists(String filename) {
        String key = key(filename);
        try {
            s3Client.headObject(head(key));
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw new StorageException("Failed to check backup in S3: " + key, e);
        }
    }

    @Override
    public boolean delete(String filename) {
        String key = key(filename);
        if (!exists(filename)) {
            return false;
        }
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            log.debug("Deleted backup from S3: {}", key);
            return true;
        } catch (Exception e) {
            throw new StorageException("Failed to delete backup from S3: " + key, e);
        }
    }

    @Override
    public String describe() {
        return "s3://" + bucket + "/" + prefix;
    }

    String key(String filename) {
        if (filename == null || filename.isBlank() || filename.contains("/") || filename.contains("..")) {
            throw new IllegalArgumentException("Invalid backup filename: " + filename);
        }
        return prefix + filename;
    }

    private HeadObjectRequest head(String key) {
        return HeadObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return "";
        }
        String trimmed = prefix.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.isEmpty() || trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }
}
