package com.labvault.api.config;

import com.labvault.api.storage.BackupStorage;
import com.labvault.api.storage.S3BackupStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

/**
 * Object storage wiring, active only with {@code backup.storage.type=s3}.
 * The local filesystem storage registers itself otherwise.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "backup.storage.type", havingValue = "s3")
public class StorageConfig {

    @Value("${backup.storage.s3.endpoint:}")
    private String endpoint;

    @Value("${backup.storage.s3.access-key:}")
    private String accessKey;

    @Value("${backup.storage.s3.secret-key:}")
    private String secretKey;

    @Value("${backup.storage.s3.bucket:labvault-backups}")
    private String bucket;

    @Value("${backup.storage.s3.region:eu-central-1}")
    private String region;

    @Value("${backup.storage.s3.prefix:backups/}")
    private String prefix;

    @Bean(destroyMethod = "close")
    public S3Client backupS3Client() {
        if (accessKey == null || accessKey.isBlank() || secretKey == null || secretKey.isBlank()) {
            throw new IllegalStateException(
                    "backup.storage.type=s3 requires backup.storage.s3.access-key and backup.storage.s3.secret-key");
        }

        AwsBasicCredentials credentials = AwsBasicCredentials.create(accessKey, secretKey);
        S3ClientBuilder builder = S3Client.builder()
                .credentialsProvider(StaticCredentialsProvider.create(credentials))
                .region(Region.of(region))
                .forcePathStyle(true);

        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint));
        }

        log.info("S3 backup storage client initialized (endpoint: {}, bucket: {})",
                endpoint == null || endpoint.isBlank() ? "aws default" : endpoint, bucket);
        return builder.build();
    }

    @Bean
    public BackupStorage s3BackupStorage(S3Client backupS3Client) {
        return new S3BackupStorage(backupS3Client, bucket, prefix);
    }
}
