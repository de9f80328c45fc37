package com.vimbiso.backend.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

/** Keeps each flow's audit trail in a capped Redis list that expires after the history TTL. */
public class RedisAuditEventRepository implements AuditEventRepository {

  private static final Logger log = LoggerFactory.getLogger(RedisAuditEventRepository.class);
  private static final String KEY_PREFIX = "audit:flow:";

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final Duration ttl;
  private final int maxEventsPerFlow;

  public RedisAuditEventRepository(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      Duration ttl,
      int maxEventsPerFlow) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.ttl = ttl;
    this.maxEventsPerFlow = maxEventsPerFlow;
  }

  @Override
  public void append(AuditEvent event) {
    String key = KEY_PREFIX + event.flowId();
    String json;
    try {
      json = objectMapper.writeValueAsString(event);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize audit event", ex);
    }
    ListOperations<String, String> list = redisTemplate.opsForList();
    list.rightPush(key, json);
    list.trim(key, -maxEventsPerFlow, -1);
    redisTemplate.expire(key, ttl);
  }

  @Override
  public List<AuditEvent> findByFlowId(String flowId) {
    List<String> raw = redisTemplate.opsForList().range(KEY_PREFIX + flowId, 0, -1);
    if (raw == null || raw.isEmpty()) {
      return List.of();
    }
    List<AuditEvent> events = new ArrayList<>(raw.size());
    for (String json : raw) {
      try {
        events.add(objectMapper.readValue(json, AuditEvent.class));
      } catch (JsonProcessingException ex) {
        log.warn("audit_event_unreadable flowId={} error={}", flowId, ex.getMessage());
      }
    }
    return events;
  }
}
