package com.vimbiso.backend.messaging;

import com.vimbiso.backend.audit.AuditStatus;
import com.vimbiso.backend.audit.FlowAuditLogger;
import com.vimbiso.backend.common.error.BotException;
import com.vimbiso.backend.common.error.ErrorKind;
import com.vimbiso.backend.flow.FlowCatalog;
import com.vimbiso.backend.flow.FlowDefinition;
import com.vimbiso.backend.flow.FlowEngine;
import com.vimbiso.backend.flow.FlowOutcome;
import com.vimbiso.backend.flow.FlowStart;
import com.vimbiso.backend.flow.FlowType;
import com.vimbiso.backend.flow.definitions.RegistrationFlowDefinition;
import com.vimbiso.backend.ledger.LedgerApiClient;
import com.vimbiso.backend.ledger.LoginResult;
import com.vimbiso.backend.messaging.api.InboundEvent;
import com.vimbiso.backend.messaging.api.OutboundMessage;
import com.vimbiso.backend.state.ChannelIdentity;
import com.vimbiso.backend.state.FlowState;
import com.vimbiso.backend.state.Session;
import com.vimbiso.backend.state.SessionField;
import com.vimbiso.backend.state.SessionUpdate;
import com.vimbiso.backend.state.StateManager;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Entry point for every inbound event. Continues the active flow, starts a flow for a recognized
 * command, or falls back to the menu; state changes are persisted before the reply is returned.
 * Failures never escape: they are audited and turned into a reply here.
 */
@Service
public class FlowDispatcher {

  private static final Logger log = LoggerFactory.getLogger(FlowDispatcher.class);

  static final Set<String> RESET_KEYWORDS =
      Set.of(
          "hi", "hie", "hey", "hello", "hy", "menu", "memu", "home", "reset", "cancel", "x", "c",
          "retry");

  /** Audit key prefix for failures raised while no flow is active, one history per channel. */
  static final String DISPATCH_FLOW_PREFIX = "dispatch:";

  private final StateManager stateManager;
  private final FlowEngine flowEngine;
  private final FlowCatalog flowCatalog;
  private final LedgerApiClient ledgerApiClient;
  private final MenuHandler menuHandler;
  private final FlowAuditLogger audit;

  public FlowDispatcher(
      StateManager stateManager,
      FlowEngine flowEngine,
      FlowCatalog flowCatalog,
      LedgerApiClient ledgerApiClient,
      MenuHandler menuHandler,
      FlowAuditLogger audit) {
    this.stateManager = stateManager;
    this.flowEngine = flowEngine;
    this.flowCatalog = flowCatalog;
    this.ledgerApiClient = ledgerApiClient;
    this.menuHandler = menuHandler;
    this.audit = audit;
  }

  public OutboundMessage handle(ChannelIdentity channel, InboundEvent event) {
    Session session = null;
    try {
      session = stateManager.load(channel);
      String input = event.rawValue().trim();
      String keyword = input.toLowerCase(Locale.ROOT);
      boolean reset = RESET_KEYWORDS.contains(keyword);

      if (activeFlow(session) != null) {
        if (reset && !flowEngine.acceptsCancellation(session, keyword)) {
          session = abandonFlow(session, keyword);
          return defaultHandling(session, event, true);
        }
        return persist(session, flowEngine.processInput(session, input));
      }
      if (!reset) {
        Optional<FlowStart> start = flowCatalog.matchTrigger(input);
        if (start.isPresent()) {
          return startFlow(session, event, start.get());
        }
      }
      return defaultHandling(session, event, reset);
    } catch (BotException ex) {
      return recover(channel, session, ex.kind(), ex.userMessage().orElse(null), ex);
    } catch (RuntimeException ex) {
      return recover(channel, session, ErrorKind.SYSTEM, null, ex);
    }
  }

  private OutboundMessage startFlow(Session session, InboundEvent event, FlowStart start) {
    FlowDefinition definition = flowCatalog.definition(start.type());
    Session current = session;
    if (definition.requiresAuthentication() && !authenticated(session)) {
      LoginResult login = ledgerApiClient.login(session.channel());
      if (login.registrationRequired()) {
        return startRegistration(session, event);
      }
      current = login.session();
    }
    log.debug("flow_trigger flowType={} context={}", start.type().id(), start.context().keySet());
    return persist(current, flowEngine.start(current, start.type(), start.context()));
  }

  private OutboundMessage startRegistration(Session session, InboundEvent event) {
    Map<String, String> context =
        RegistrationFlowDefinition.contextFromProfileName(event.profileName());
    return persist(session, flowEngine.start(session, FlowType.REGISTRATION, context));
  }

  private OutboundMessage defaultHandling(Session session, InboundEvent event, boolean recognized) {
    if (!authenticated(session)) {
      LoginResult login = ledgerApiClient.login(session.channel());
      if (login.registrationRequired()) {
        return startRegistration(session, event);
      }
      session = login.session();
    }
    return menuHandler.handle(session, event.rawValue(), recognized);
  }

  private OutboundMessage persist(Session before, FlowOutcome outcome) {
    switch (outcome.status()) {
      case NOT_STARTED:
        return outcome.message();
      case ERRORED:
        if (outcome.errorKind() == ErrorKind.STATE_INVALID) {
          resetAuthenticationQuietly(before.channel());
        } else if (before.hasActiveFlow()) {
          clearFlowQuietly(before.channel());
        }
        return ErrorReplies.render(outcome.errorKind(), outcome.errorDetail());
      default:
        Session after = stateManager.update(before.channel(), SessionUpdate.flow(outcome.flow()));
        audit.logStateTransition(
            outcome.flowId(),
            before,
            after,
            outcome.status() == FlowOutcome.Status.INVALID_INPUT
                ? AuditStatus.FAILURE
                : AuditStatus.SUCCESS);
        return outcome.message();
    }
  }

  private Session abandonFlow(Session session, String keyword) {
    String flowId = activeFlow(session).flowId();
    Session after = stateManager.clearFlow(session.channel());
    audit.logFlowEvent(
        flowId,
        "flow_cancelled",
        null,
        Map.of("reason", "reset_keyword", "input", keyword),
        AuditStatus.SUCCESS);
    audit.logStateTransition(flowId, session, after, AuditStatus.SUCCESS);
    log.info("flow_abandoned flowId={} keyword={}", flowId, keyword);
    return after;
  }

  private OutboundMessage recover(
      ChannelIdentity channel,
      @Nullable Session session,
      ErrorKind kind,
      @Nullable String detail,
      RuntimeException cause) {
    // The session may be the invalid one that raised, so its flow is read without the gate.
    String flowId =
        session != null && session.hasActiveFlow()
            ? session.flow().flowId()
            : DISPATCH_FLOW_PREFIX + channel.key();
    if (kind == ErrorKind.SYSTEM) {
      log.error("dispatch_failed channel={} flowId={} kind={}", channel.key(), flowId, kind, cause);
    } else {
      log.warn(
          "dispatch_failed channel={} flowId={} kind={} error={}",
          channel.key(),
          flowId,
          kind,
          cause.getMessage());
    }
    audit.logFlowEvent(
        flowId,
        "dispatch_error",
        null,
        Map.of("error_kind", kind.name()),
        AuditStatus.FAILURE,
        cause.getMessage());
    if (kind == ErrorKind.STATE_INVALID) {
      resetAuthenticationQuietly(channel);
    } else if (kind.abortsFlow() && session != null && session.hasActiveFlow()) {
      clearFlowQuietly(channel);
    }
    return ErrorReplies.render(kind, detail);
  }

  @Nullable
  private FlowState activeFlow(Session session) {
    return stateManager.getField(session, SessionField.FLOW);
  }

  private boolean authenticated(Session session) {
    return Boolean.TRUE.equals(stateManager.getField(session, SessionField.AUTHENTICATED));
  }

  private void clearFlowQuietly(ChannelIdentity channel) {
    try {
      stateManager.clearFlow(channel);
    } catch (RuntimeException ex) {
      log.warn("flow_clear_failed channel={} error={}", channel.key(), ex.getMessage());
    }
  }

  private void resetAuthenticationQuietly(ChannelIdentity channel) {
    try {
      stateManager.resetAuthentication(channel);
    } catch (RuntimeException ex) {
      log.warn("session_reset_failed channel={} error={}", channel.key(), ex.getMessage());
    }
  }
}
