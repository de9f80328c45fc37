package com.vimbiso.backend.flow;

import com.vimbiso.backend.audit.AuditStatus;
import com.vimbiso.backend.audit.FlowAuditLogger;
import com.vimbiso.backend.common.error.BotException;
import com.vimbiso.backend.common.error.ErrorKind;
import com.vimbiso.backend.messaging.api.OutboundMessage;
import com.vimbiso.backend.state.FlowState;
import com.vimbiso.backend.state.Session;
import com.vimbiso.backend.state.SessionField;
import com.vimbiso.backend.state.StateManager;
import com.vimbiso.backend.state.StepResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives flows step by step. The engine never persists anything: it returns the next {@link
 * FlowState} inside a {@link FlowOutcome} and leaves the write to its caller.
 *
 * <p>The current step is always the first step, in declaration order, whose condition holds and
 * whose result has not been recorded yet.
 */
@Service
public class FlowEngine {

  private static final Logger log = LoggerFactory.getLogger(FlowEngine.class);
  private static final String OUTCOME_METRIC = "bot.flow.outcome";

  /** Reserved button values that abandon the flow. */
  public static final Set<String> CANCEL_INPUTS = Set.of("cancel", "cancel_action");

  private final FlowCatalog catalog;
  private final StateManager stateManager;
  private final FlowAuditLogger audit;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  public FlowEngine(
      FlowCatalog catalog,
      StateManager stateManager,
      FlowAuditLogger audit,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.catalog = catalog;
    this.stateManager = stateManager;
    this.audit = audit;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  public FlowOutcome start(Session session, FlowType type, Map<String, String> initialContext) {
    FlowDefinition definition = catalog.definition(type);
    Optional<String> unavailable = definition.unavailableReason(session);
    if (unavailable.isPresent()) {
      log.info("flow_not_started flowType={} reason={}", type.id(), unavailable.get());
      return FlowOutcome.notStarted(OutboundMessage.text(unavailable.get()));
    }
    String flowId = type.id() + "_" + UUID.randomUUID().toString().substring(0, 8);
    FlowState state = FlowState.start(flowId, type.id(), initialContext, clock.instant());
    Map<String, Object> context = new LinkedHashMap<>();
    context.put("flow_type", type.id());
    context.put("initial_context", state.context().keySet());
    audit.logFlowEvent(flowId, "flow_started", null, context, AuditStatus.IN_PROGRESS);
    log.info("flow_started flowId={} flowType={}", flowId, type.id());
    return moveToNextStep(definition, session, state);
  }

  /** Feeds one input into the session's active flow. */
  public FlowOutcome processInput(Session session, String rawInput) {
    FlowState state = stateManager.getField(session, SessionField.FLOW);
    if (state == null) {
      throw new IllegalStateException("Session " + session.channel().key() + " has no active flow");
    }
    FlowDefinition definition = catalog.definition(state.flowType());
    int index = currentStepIndex(definition, new StepContext(session, state));
    if (index < 0) {
      return complete(definition, new StepContext(session, state));
    }

    StepDefinition step = definition.steps().get(index);
    FlowState positioned = state.withStepIndex(index);
    StepContext context = new StepContext(session, positioned);
    String input = rawInput == null ? "" : rawInput.trim();

    if (isCancellation(step, input)) {
      audit.logFlowEvent(
          state.flowId(), "flow_cancelled", step.id(), Map.of("input", input), AuditStatus.SUCCESS);
      log.info("flow_cancelled flowId={} stepId={}", state.flowId(), step.id());
      count(definition, FlowOutcome.Status.CANCELLED);
      return FlowOutcome.cancelled(
          state.flowId(),
          step.id(),
          OutboundMessage.text("Okay, I've cancelled that. Send *hi* for the menu."));
    }

    if (!step.validator().test(context, input)) {
      audit.logValidationEvent(state.flowId(), step.id(), input, false, step.invalidMessage());
      count(definition, FlowOutcome.Status.INVALID_INPUT);
      return FlowOutcome.invalidInput(
          positioned, step.id(), step.message(context).withNotice(step.invalidMessage()));
    }

    StepResult result;
    try {
      result = step.transformer().apply(context, input);
    } catch (StepInputException ex) {
      String notice = ex.userMessage().orElse(step.invalidMessage());
      audit.logValidationEvent(state.flowId(), step.id(), input, false, notice);
      count(definition, FlowOutcome.Status.INVALID_INPUT);
      return FlowOutcome.invalidInput(
          positioned, step.id(), step.message(context).withNotice(notice));
    } catch (BotException ex) {
      return fail(definition, positioned, step.id(), ex.kind(), ex.userMessage().orElse(null), ex);
    } catch (RuntimeException ex) {
      return fail(definition, positioned, step.id(), ErrorKind.SYSTEM, null, ex);
    }

    audit.logValidationEvent(state.flowId(), step.id(), input, true, null);
    return moveToNextStep(definition, session, positioned.withResult(step.id(), result));
  }

  /** Whether {@code input} would cancel the active flow at its current step. */
  public boolean acceptsCancellation(Session session, String input) {
    FlowState state = stateManager.getField(session, SessionField.FLOW);
    if (state == null || input == null) {
      return false;
    }
    FlowDefinition definition = catalog.definition(state.flowType());
    int index = currentStepIndex(definition, new StepContext(session, state));
    return index >= 0 && isCancellation(definition.steps().get(index), input.trim());
  }

  private FlowOutcome moveToNextStep(FlowDefinition definition, Session session, FlowState state) {
    int next = currentStepIndex(definition, new StepContext(session, state));
    if (next < 0) {
      return complete(definition, new StepContext(session, state));
    }
    FlowState moved = state.withStepIndex(next);
    StepDefinition step = definition.steps().get(next);
    StepContext context = new StepContext(session, moved);
    try {
      OutboundMessage message = step.message(context);
      audit.logFlowEvent(
          moved.flowId(),
          "step_presented",
          step.id(),
          Map.of("step_index", next),
          AuditStatus.IN_PROGRESS);
      count(definition, FlowOutcome.Status.RUNNING);
      return FlowOutcome.running(moved, step.id(), message);
    } catch (BotException ex) {
      return fail(definition, moved, step.id(), ex.kind(), ex.userMessage().orElse(null), ex);
    } catch (RuntimeException ex) {
      return fail(definition, moved, step.id(), ErrorKind.SYSTEM, null, ex);
    }
  }

  private FlowOutcome complete(FlowDefinition definition, StepContext context) {
    FlowState state = context.flow();
    try {
      OutboundMessage message = definition.complete(context);
      audit.logFlowEvent(
          state.flowId(),
          "flow_completed",
          null,
          Map.of("steps", state.stepData().keySet()),
          AuditStatus.SUCCESS);
      log.info("flow_completed flowId={} flowType={}", state.flowId(), state.flowType());
      count(definition, FlowOutcome.Status.COMPLETED);
      return FlowOutcome.completed(state.flowId(), message);
    } catch (BotException ex) {
      return fail(definition, state, null, ex.kind(), ex.userMessage().orElse(null), ex);
    } catch (RuntimeException ex) {
      return fail(definition, state, null, ErrorKind.SYSTEM, null, ex);
    }
  }

  private FlowOutcome fail(
      FlowDefinition definition,
      FlowState state,
      String stepId,
      ErrorKind kind,
      String detail,
      RuntimeException cause) {
    if (kind == ErrorKind.SYSTEM) {
      log.error("flow_errored flowId={} stepId={} kind={}", state.flowId(), stepId, kind, cause);
    } else {
      log.warn(
          "flow_errored flowId={} stepId={} kind={} error={}",
          state.flowId(),
          stepId,
          kind,
          cause.getMessage());
    }
    audit.logFlowEvent(
        state.flowId(),
        "flow_errored",
        stepId,
        Map.of("error_kind", kind.name()),
        AuditStatus.FAILURE,
        cause.getMessage());
    count(definition, FlowOutcome.Status.ERRORED);
    return FlowOutcome.errored(state.flowId(), stepId, kind, detail);
  }

  private static int currentStepIndex(FlowDefinition definition, StepContext context) {
    List<StepDefinition> steps = definition.steps();
    for (int i = 0; i < steps.size(); i++) {
      StepDefinition step = steps.get(i);
      if (!context.flow().answered(step.id()) && step.visible(context)) {
        return i;
      }
    }
    return -1;
  }

  private static boolean isCancellation(StepDefinition step, String input) {
    return step.inputKind() == InputKind.BUTTON
        && CANCEL_INPUTS.contains(input.toLowerCase(Locale.ROOT));
  }

  private void count(FlowDefinition definition, FlowOutcome.Status status) {
    meterRegistry
        .counter(OUTCOME_METRIC, "flow", definition.type().id(), "status", status.name())
        .increment();
  }
}
