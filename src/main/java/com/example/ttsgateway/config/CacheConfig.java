package com.example.ttsgateway.config;

import com.example.ttsgateway.service.cache.AesGcmAudioCipher;
import com.example.ttsgateway.service.cache.AudioCache;
import com.example.ttsgateway.service.cache.DisabledAudioCache;
import com.example.ttsgateway.service.cache.EncryptedAudioCache;
import com.example.ttsgateway.service.cache.RedisKeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    @Bean
    AudioCache audioCache(AudioCacheProperties properties,
                          ObjectProvider<RedisConnectionFactory> connectionFactory) {
        if (!properties.isEnabled()) {
            log.info("Audio cache disabled");
            return new DisabledAudioCache();
        }
        if (properties.getKey() == null || properties.getKey().isBlank()) {
            throw new IllegalStateException("app.cache.key must be set when app.cache.enabled=true");
        }

        RedisTemplate<byte[], byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory.getObject());
        template.setKeySerializer(RedisSerializer.byteArray());
        template.setValueSerializer(RedisSerializer.byteArray());
        template.afterPropertiesSet();

        log.info("Audio cache enabled ttl={}", properties.getTtl() == null ? "none" : properties.getTtl());
        return new EncryptedAudioCache(
                new RedisKeyValueStore(template, properties.getTtl()),
                AesGcmAudioCipher.fromBase64Key(properties.getKey()));
    }

    @Bean(name = "cacheWriteExecutor")
    ThreadPoolTaskExecutor cacheWriteExecutor(AudioCacheProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWriteThreads());
        executor.setMaxPoolSize(properties.getWriteThreads());
        executor.setQueueCapacity(properties.getWriteQueueCapacity());
        executor.setThreadNamePrefix("cache-write-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
