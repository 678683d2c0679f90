package com.stationsync.synchronizer.client.s3;

import com.stationsync.synchronizer.client.ObjectStore;
import com.stationsync.synchronizer.exception.ObjectStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.List;

/**
 * {@link ObjectStore} over one S3 (or S3-compatible) bucket.
 */
@Component
@Slf4j
public class S3ObjectStore implements ObjectStore {

    private final S3Client s3Client;
    private final String bucket;

    public S3ObjectStore(S3Client s3Client, @Value("${s3.bucket}") String bucket) {
        this.s3Client = s3Client;
        this.bucket = bucket;
    }

    @Override
    public List<String> listKeys(String prefix) {
        try {
            ListObjectsV2Request request = ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .prefix(prefix)
                    .build();
            List<String> keys = s3Client.listObjectsV2Paginator(request).contents().stream()
                    .map(S3Object::key)
                    .toList();
            log.debug("Listed {} objects under s3://{}/{}", keys.size(), bucket, prefix);
            return keys;
        } catch (SdkException e) {
            throw new ObjectStoreException("Failed to list s3://" + bucket + "/" + prefix + ": " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] getObject(String key) {
        try {
            return s3Client.getObjectAsBytes(GetObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .build())
                    .asByteArray();
        } catch (SdkException e) {
            throw new ObjectStoreException("Failed to read s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        }
    }
}
