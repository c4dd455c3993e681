package com.smurthy.ai.advisor.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

import java.net.URI;

/**
 * S3 client for the responder corpus.
 *
 * With {@code app.corpus.endpoint} set (MinIO, LocalStack) the client uses path-style access and
 * dummy credentials; otherwise it uses the default AWS credential chain.
 */
@Configuration
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public S3Client s3Client(CorpusConfig corpusConfig) {
        var clientBuilder = S3Client.builder()
                .region(Region.of(corpusConfig.region()));

        String endpoint = corpusConfig.endpoint();
        if (endpoint != null && !endpoint.isEmpty()) {
            clientBuilder
                    .endpointOverride(URI.create(endpoint))
                    .forcePathStyle(true)
                    .credentialsProvider(StaticCredentialsProvider.create(
                            AwsBasicCredentials.create("fakeAccessKey", "fakeSecretKey")));
            log.info("Corpus store configured for local S3 at {}", endpoint);
        } else {
            log.info("Corpus store configured for AWS S3 in region {}", corpusConfig.region());
        }
        return clientBuilder.build();
    }
}
