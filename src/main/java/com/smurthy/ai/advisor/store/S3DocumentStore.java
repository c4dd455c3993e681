package com.smurthy.ai.advisor.store;

import com.smurthy.ai.advisor.config.CorpusConfig;
import com.smurthy.ai.advisor.exceptions.CorpusUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;

/**
 * S3-backed document store. Each object under the prefix is one JSON document.
 */
@Service
public class S3DocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(S3DocumentStore.class);

    private final S3Client s3Client;
    private final String bucket;

    public S3DocumentStore(S3Client s3Client, CorpusConfig config) {
        this.s3Client = s3Client;
        this.bucket = config.bucket();
        log.info("S3DocumentStore initialized for bucket '{}'", bucket);
    }

    @Override
    public List<StoredObject> listDocuments(String prefix) {
        List<StoredObject> objects = new ArrayList<>();
        String continuationToken = null;

        try {
            do {
                ListObjectsV2Response page = s3Client.listObjectsV2(ListObjectsV2Request.builder()
                        .bucket(bucket)
                        .prefix(prefix)
                        .continuationToken(continuationToken)
                        .build());

                for (S3Object object : page.contents()) {
                    if (object.key().endsWith("/")) {
                        continue; // folder placeholder
                    }
                    byte[] bytes = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                            .bucket(bucket)
                            .key(object.key())
                            .build()).asByteArray();
                    objects.add(new StoredObject(object.key(), bytes));
                }

                continuationToken = Boolean.TRUE.equals(page.isTruncated()) ? page.nextContinuationToken() : null;
            } while (continuationToken != null);

        } catch (SdkException e) {
            throw new CorpusUnavailableException(
                    "Failed to read s3://" + bucket + "/" + prefix + ": " + e.getMessage(), e);
        }

        log.debug("Listed {} object(s) under s3://{}/{}", objects.size(), bucket, prefix);
        return objects;
    }
}
