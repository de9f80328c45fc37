package com.vimbiso.backend.state;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@EnableConfigurationProperties(StateProperties.class)
public class StateConfiguration {

  private static final Logger log = LoggerFactory.getLogger(StateConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public StateStore stateStore(
      StateProperties properties, ObjectProvider<StringRedisTemplate> redisTemplate, Clock clock) {
    if (properties.getStore() == StateProperties.StoreType.MEMORY) {
      log.info("state_store_selected type=memory ttl={}", properties.getTtl());
      return new InMemoryStateStore(clock);
    }
    StringRedisTemplate template = redisTemplate.getIfAvailable();
    if (template == null) {
      log.warn("state_store_fallback type=memory reason=redis_template_unavailable");
      return new InMemoryStateStore(clock);
    }
    log.info("state_store_selected type=redis ttl={}", properties.getTtl());
    return new RedisStateStore(template);
  }
}
