package com.example.ttsgateway.config;

import com.example.ttsgateway.service.backend.polly.PollyBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.polly.PollyClient;

@Configuration
@ConditionalOnProperty(prefix = "app.polly", name = "enabled", havingValue = "true")
public class PollyConfig {

    private static final Logger log = LoggerFactory.getLogger(PollyConfig.class);

    @Bean(destroyMethod = "close")
    PollyClient pollyClient(PollyProperties properties) {
        PollyClient client = PollyClient.builder()
                .region(Region.of(properties.getRegion()))
                .credentialsProvider(credentialsProvider(properties))
                .build();
        log.info("Polly client initialized region={}", properties.getRegion());
        return client;
    }

    @Bean
    PollyBackend pollyBackend(PollyClient pollyClient, PollyProperties properties) {
        return new PollyBackend(pollyClient, properties);
    }

    private AwsCredentialsProvider credentialsProvider(PollyProperties properties) {
        boolean hasKeyId = properties.getAccessKeyId() != null && !properties.getAccessKeyId().isBlank();
        boolean hasSecret = properties.getSecretAccessKey() != null && !properties.getSecretAccessKey().isBlank();
        if (hasKeyId != hasSecret) {
            throw new IllegalStateException("app.polly.access-key-id and app.polly.secret-access-key must be set together");
        }
        if (hasKeyId) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(properties.getAccessKeyId(), properties.getSecretAccessKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}
