package com.vimbiso.backend.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;

/** One append-only audit record, keyed by the flow it belongs to. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
    Instant timestamp,
    @JsonProperty("flow_id") String flowId,
    @JsonProperty("event_type") String eventType,
    @JsonProperty("step_id") String stepId,
    AuditStatus status,
    Map<String, Object> context,
    String error) {

  public AuditEvent {
    context = context == null ? Map.of() : context;
  }
}
