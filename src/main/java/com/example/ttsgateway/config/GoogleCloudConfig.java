package com.example.ttsgateway.config;

import com.example.ttsgateway.service.TtsMode;
import com.example.ttsgateway.service.backend.gcloud.GoogleCloudTtsBackend;
import com.example.ttsgateway.service.credential.AccessTokenProvider;
import com.example.ttsgateway.service.credential.SelfSignedTokenProvider;
import com.example.ttsgateway.service.credential.ServiceAccountJwtSigner;
import com.example.ttsgateway.service.credential.ServiceAccountKey;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
@ConditionalOnProperty(prefix = "app.gcloud", name = "enabled", havingValue = "true")
public class GoogleCloudConfig {

    private static final Logger log = LoggerFactory.getLogger(GoogleCloudConfig.class);

    @Bean
    ServiceAccountKey gcloudServiceAccountKey(GoogleCloudProperties properties, ObjectMapper objectMapper) {
        ServiceAccountKey key;
        if (properties.getCredentialsJson() != null && !properties.getCredentialsJson().isBlank()) {
            key = ServiceAccountKey.fromJson(properties.getCredentialsJson(), objectMapper);
        } else if (properties.getCredentialsFile() != null && !properties.getCredentialsFile().isBlank()) {
            key = ServiceAccountKey.fromFile(Path.of(properties.getCredentialsFile()), objectMapper);
        } else {
            throw new IllegalStateException(
                    "app.gcloud.credentials-file or app.gcloud.credentials-json must be set when app.gcloud.enabled=true");
        }
        log.info("gCloud service account loaded client_email={} key_id={}", key.clientEmail(), key.keyId());
        return key;
    }

    @Bean
    AccessTokenProvider gcloudTokenProvider(ServiceAccountKey key,
                                            GoogleCloudProperties properties,
                                            ObjectMapper objectMapper) {
        ServiceAccountJwtSigner signer = new ServiceAccountJwtSigner(
                key, properties.getTokenAudience(), properties.getTokenLease(), objectMapper);
        return new SelfSignedTokenProvider(TtsMode.GCLOUD, signer, Clock.systemUTC(), properties.getTokenSkew());
    }

    @Bean
    GoogleCloudTtsBackend googleCloudTtsBackend(@Qualifier("gcloudRestClient") RestClient restClient,
                                                AccessTokenProvider gcloudTokenProvider) {
        return new GoogleCloudTtsBackend(restClient, gcloudTokenProvider);
    }
}
