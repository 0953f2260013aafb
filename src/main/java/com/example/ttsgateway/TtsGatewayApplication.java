package com.example.ttsgateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TtsGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(TtsGatewayApplication.class, args);
    }
}
