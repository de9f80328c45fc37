package com.vimbiso.backend.flow;

import com.vimbiso.backend.messaging.api.OutboundMessage;
import com.vimbiso.backend.state.Session;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** A fixed, ordered sequence of steps plus the action executed once every step is answered. */
public interface FlowDefinition {

  FlowType type();

  List<StepDefinition> steps();

  /**
   * Runs the flow's final action. Failures are reported by throwing; the engine turns them into
   * an errored outcome.
   */
  OutboundMessage complete(StepContext context);

  /** Whether the flow needs a logged-in session before it can start. */
  default boolean requiresAuthentication() {
    return true;
  }

  /**
   * Matches a trimmed top-level input against this flow's start commands, returning the start
   * context when the input is one of them. Keywords match case-insensitively.
   */
  default Optional<Map<String, String>> matchTrigger(String input) {
    return Optional.empty();
  }

  /** Reason the flow cannot run for this session right now, shown instead of the first step. */
  default Optional<String> unavailableReason(Session session) {
    return Optional.empty();
  }
}
