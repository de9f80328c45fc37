package com.vimbiso.backend.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Progress of the single active flow of a session. {@code stepIndex} points at the current step of
 * the flow definition; {@code stepData} holds the result of every step answered so far.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlowState(
    String flowId,
    String flowType,
    int stepIndex,
    Map<String, StepResult> stepData,
    Map<String, String> context,
    Instant startedAt) {

  public FlowState {
    stepData =
        stepData == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stepData));
    context =
        context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public static FlowState start(
      String flowId, String flowType, Map<String, String> context, Instant startedAt) {
    return new FlowState(flowId, flowType, 0, Map.of(), context, startedAt);
  }

  public FlowState withStepIndex(int index) {
    return new FlowState(flowId, flowType, index, stepData, context, startedAt);
  }

  public FlowState withResult(String stepId, StepResult result) {
    Map<String, StepResult> updated = new LinkedHashMap<>(stepData);
    updated.put(stepId, result);
    return new FlowState(flowId, flowType, stepIndex, updated, context, startedAt);
  }

  public boolean answered(String stepId) {
    return stepData.containsKey(stepId);
  }

  public Optional<StepResult> result(String stepId) {
    return Optional.ofNullable(stepData.get(stepId));
  }

  public Optional<String> contextValue(String key) {
    return Optional.ofNullable(context.get(key));
  }
}
