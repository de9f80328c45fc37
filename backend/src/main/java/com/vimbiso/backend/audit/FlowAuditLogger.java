package com.vimbiso.backend.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vimbiso.backend.state.Session;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Append-only recorder for flow events, validation outcomes and session transitions. Each event
 * is written as a JSON line to the {@code flow_audit} logger and kept in the history repository.
 * Recording is best effort: a failing write is reported and never reaches the caller.
 */
@Service
public class FlowAuditLogger {

  private static final Logger log = LoggerFactory.getLogger(FlowAuditLogger.class);
  private static final Logger auditLog = LoggerFactory.getLogger("flow_audit");
  private static final int MAX_INPUT_LENGTH = 64;

  private final AuditEventRepository repository;
  private final ObjectMapper objectMapper;
  private final AuditProperties properties;
  private final Clock clock;

  public FlowAuditLogger(
      AuditEventRepository repository,
      ObjectMapper objectMapper,
      AuditProperties properties,
      Clock clock) {
    this.repository = repository;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.clock = clock;
  }

  public void logFlowEvent(
      String flowId,
      String eventType,
      @Nullable String stepId,
      Map<String, Object> context,
      AuditStatus status) {
    logFlowEvent(flowId, eventType, stepId, context, status, null);
  }

  public void logFlowEvent(
      String flowId,
      String eventType,
      @Nullable String stepId,
      Map<String, Object> context,
      AuditStatus status,
      @Nullable String error) {
    record(
        new AuditEvent(
            clock.instant(), flowId, eventType, stepId, status, sanitize(context), error));
  }

  public void logStateTransition(
      String flowId, Session before, Session after, AuditStatus status) {
    logStateTransition(flowId, before, after, status, null);
  }

  public void logStateTransition(
      String flowId,
      @Nullable Session before,
      @Nullable Session after,
      AuditStatus status,
      @Nullable String error) {
    Map<String, Object> context = new LinkedHashMap<>();
    context.put("before", before == null ? null : before.auditSummary());
    context.put("after", after == null ? null : after.auditSummary());
    record(
        new AuditEvent(clock.instant(), flowId, "state_transition", null, status, context, error));
  }

  public void logValidationEvent(
      String flowId, String stepId, @Nullable String input, boolean valid, @Nullable String error) {
    Map<String, Object> context = new LinkedHashMap<>();
    context.put("input", truncate(input));
    context.put("valid", valid);
    record(
        new AuditEvent(
            clock.instant(),
            flowId,
            "validation",
            stepId,
            valid ? AuditStatus.SUCCESS : AuditStatus.FAILURE,
            context,
            error));
  }

  /** Recorded events of a flow in the order they were written. */
  public List<AuditEvent> history(String flowId) {
    try {
      return repository.findByFlowId(flowId);
    } catch (RuntimeException ex) {
      log.warn("flow_audit_read_failed flowId={} error={}", flowId, ex.getMessage());
      return List.of();
    }
  }

  private void record(AuditEvent event) {
    if (!properties.isEnabled()) {
      return;
    }
    try {
      auditLog.info(objectMapper.writeValueAsString(event));
      repository.append(event);
    } catch (Exception ex) {
      log.warn(
          "flow_audit_write_failed flowId={} eventType={} error={}",
          event.flowId(),
          event.eventType(),
          ex.getMessage());
    }
  }

  private static Map<String, Object> sanitize(Map<String, Object> context) {
    if (context == null || context.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    context.forEach(
        (key, value) -> {
          if (key.toLowerCase(Locale.ROOT).contains("token")) {
            copy.put(key, value == null ? null : "****");
          } else {
            copy.put(key, value);
          }
        });
    return copy;
  }

  private static String truncate(String input) {
    if (input == null || input.length() <= MAX_INPUT_LENGTH) {
      return input;
    }
    return input.substring(0, MAX_INPUT_LENGTH) + "...";
  }
}
