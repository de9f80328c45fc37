package com.vimbiso.backend.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@EnableConfigurationProperties(AuditProperties.class)
public class AuditConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AuditEventRepository auditEventRepository(
      AuditProperties properties,
      ObjectProvider<StringRedisTemplate> redisTemplate,
      ObjectMapper objectMapper) {
    StringRedisTemplate template = redisTemplate.getIfAvailable();
    if (properties.getStore() == AuditProperties.Store.MEMORY || template == null) {
      return new InMemoryAuditEventRepository(properties.getMaxEventsPerFlow());
    }
    return new RedisAuditEventRepository(
        template, objectMapper, properties.getHistoryTtl(), properties.getMaxEventsPerFlow());
  }
}
