package com.strata.storage.cold;

import com.strata.error.NotFoundException;
import com.strata.error.TransientStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link ObjectStorage} on an S3 bucket.
 */
@Component
public class S3ObjectStorage implements ObjectStorage {
    private static final Logger logger = LoggerFactory.getLogger(S3ObjectStorage.class);

    private final S3Client s3Client;
    private final String bucketName;

    public S3ObjectStorage(S3Client s3Client,
                           @Value("${strata.storage.s3.bucket:strata-cold-tier}") String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
    }

    @Override
    public void put(String key, byte[] content) {
        PutObjectRequest request = PutObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .contentLength((long) content.length)
            .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(content));
            logger.info("Uploaded s3://{}/{} ({} bytes)", bucketName, key, content.length);
        } catch (SdkException e) {
            logger.error("Failed to upload s3://{}/{}", bucketName, key, e);
            throw new TransientStoreException("object storage upload failed", e);
        }
    }

    @Override
    public byte[] get(String key) {
        GetObjectRequest request = GetObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .build();
        try {
            return s3Client.getObjectAsBytes(request).asByteArray();
        } catch (NoSuchKeyException e) {
            throw new NotFoundException("archive", key);
        } catch (SdkException e) {
            logger.error("Failed to download s3://{}/{}", bucketName, key, e);
            throw new TransientStoreException("object storage download failed", e);
        }
    }

    @Override
    public List<String> list(String prefix) {
        ListObjectsV2Request request = ListObjectsV2Request.builder()
            .bucket(bucketName)
            .prefix(prefix)
            .build();
        try {
            List<String> keys = new ArrayList<>();
            for (S3Object object : s3Client.listObjectsV2Paginator(request).contents()) {
                keys.add(object.key());
            }
            return keys;
        } catch (SdkException e) {
            logger.error("Failed to list s3://{}/{}", bucketName, prefix, e);
            throw new TransientStoreException("object storage listing failed", e);
        }
    }

    @Override
    public void delete(String key) {
        DeleteObjectRequest request = DeleteObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .build();
        try {
            s3Client.deleteObject(request);
        } catch (SdkException e) {
            logger.error("Failed to delete s3://{}/{}", bucketName, key, e);
            throw new TransientStoreException("object storage delete failed", e);
        }
    }
}
