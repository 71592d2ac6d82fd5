package com.propertyguess.fmvengine.infra.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyguess.fmvengine.domain.model.PropertyReference;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

@Configuration
@ConditionalOnProperty(prefix = "fmv.cache", name = "backend", havingValue = "redis")
public class RedisCacheConfig {

    @Bean
    public RedisTemplate<String, PropertyReference> propertyReferenceRedisTemplate(
            RedisConnectionFactory connectionFactory, ObjectMapper objectMapper) {
        RedisTemplate<String, PropertyReference> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new Jackson2JsonRedisSerializer<>(objectMapper, PropertyReference.class));
        template.afterPropertiesSet();
        return template;
    }
}
