package com.ragguard.backend;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.util.Map;

/**
 * Object store on Amazon S3, scoped to one bucket
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class S3ObjectStore implements ObjectStore {

    private final S3Client s3Client;

    @Value("${s3.bucket:}")
    private String bucket;

    @Override
    public byte[] get(String key) throws IOException {
        try {
            return s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build()).asByteArray();
        } catch (SdkException e) {
            throw new IOException("Failed to read s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void put(String key, byte[] content, String contentType, Map<String, String> metadata) throws IOException {
        try {
            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType(contentType)
                            .metadata(metadata)
                            .build(),
                    RequestBody.fromBytes(content));
            log.debug("Stored s3://{}/{} ({} bytes)", bucket, key, content.length);
        } catch (SdkException e) {
            throw new IOException("Failed to write s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String key) throws IOException {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
        } catch (SdkException e) {
            throw new IOException("Failed to delete s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        }
    }
}
