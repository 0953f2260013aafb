package com.example.ttsgateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class HttpClientConfig {

    @Bean
    RestClient gttsRestClient(GatewayProperties gatewayProperties, GoogleTranslateProperties properties) {
        return RestClient.builder()
                .requestFactory(requestFactory(gatewayProperties))
                .baseUrl(properties.getBaseUrl())
                .build();
    }

    @Bean
    RestClient gcloudRestClient(GatewayProperties gatewayProperties, GoogleCloudProperties properties) {
        return RestClient.builder()
                .requestFactory(requestFactory(gatewayProperties))
                .baseUrl(properties.getBaseUrl())
                .build();
    }

    private ClientHttpRequestFactory requestFactory(GatewayProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) properties.getReadTimeout().toMillis());
        return factory;
    }
}
