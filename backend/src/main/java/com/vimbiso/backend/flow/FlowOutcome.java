package com.vimbiso.backend.flow;

import com.vimbiso.backend.common.error.ErrorKind;
import com.vimbiso.backend.messaging.api.OutboundMessage;
import com.vimbiso.backend.state.FlowState;
import org.springframework.lang.Nullable;

/**
 * Result of driving a flow by one input. {@code flow} is the state to persist; it is {@code null}
 * whenever the flow has finished and must be cleared from the session. Errored outcomes carry no
 * message of their own: the caller renders them from {@code errorKind} and {@code errorDetail}.
 */
public record FlowOutcome(
    Status status,
    @Nullable String flowId,
    @Nullable FlowState flow,
    @Nullable String stepId,
    @Nullable OutboundMessage message,
    @Nullable ErrorKind errorKind,
    @Nullable String errorDetail) {

  public enum Status {
    NOT_STARTED,
    RUNNING,
    INVALID_INPUT,
    COMPLETED,
    CANCELLED,
    ERRORED
  }

  static FlowOutcome notStarted(OutboundMessage message) {
    return new FlowOutcome(Status.NOT_STARTED, null, null, null, message, null, null);
  }

  static FlowOutcome running(FlowState flow, String stepId, OutboundMessage message) {
    return new FlowOutcome(Status.RUNNING, flow.flowId(), flow, stepId, message, null, null);
  }

  static FlowOutcome invalidInput(FlowState flow, String stepId, OutboundMessage message) {
    return new FlowOutcome(
        Status.INVALID_INPUT, flow.flowId(), flow, stepId, message, ErrorKind.VALIDATION, null);
  }

  static FlowOutcome completed(String flowId, OutboundMessage message) {
    return new FlowOutcome(Status.COMPLETED, flowId, null, null, message, null, null);
  }

  static FlowOutcome cancelled(String flowId, String stepId, OutboundMessage message) {
    return new FlowOutcome(Status.CANCELLED, flowId, null, stepId, message, null, null);
  }

  static FlowOutcome errored(
      String flowId, @Nullable String stepId, ErrorKind kind, @Nullable String detail) {
    return new FlowOutcome(Status.ERRORED, flowId, null, stepId, null, kind, detail);
  }

  public boolean flowCleared() {
    return flow == null;
  }
}
