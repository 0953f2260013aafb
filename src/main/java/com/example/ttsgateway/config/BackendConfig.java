package com.example.ttsgateway.config;

import com.example.ttsgateway.service.BackendRegistry;
import com.example.ttsgateway.service.TtsBackend;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BackendConfig {

    @Bean
    BackendRegistry backendRegistry(ObjectProvider<TtsBackend> backends) {
        return new BackendRegistry(backends.orderedStream().toList());
    }
}
