package com.vimbiso.backend.flow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.node.MissingNode;
import com.vimbiso.backend.audit.AuditEvent;
import com.vimbiso.backend.audit.AuditProperties;
import com.vimbiso.backend.audit.FlowAuditLogger;
import com.vimbiso.backend.audit.InMemoryAuditEventRepository;
import com.vimbiso.backend.common.error.ErrorKind;
import com.vimbiso.backend.config.BotProperties;
import com.vimbiso.backend.flow.definitions.OfferFlowDefinition;
import com.vimbiso.backend.flow.definitions.RegistrationFlowDefinition;
import com.vimbiso.backend.ledger.CredexActionResult;
import com.vimbiso.backend.ledger.LedgerApiClient;
import com.vimbiso.backend.ledger.LedgerApiException;
import com.vimbiso.backend.ledger.LedgerEndpoint;
import com.vimbiso.backend.ledger.OfferRequest;
import com.vimbiso.backend.messaging.api.OutboundMessage;
import com.vimbiso.backend.state.AccountRef;
import com.vimbiso.backend.state.ChannelIdentity;
import com.vimbiso.backend.state.FlowState;
import com.vimbiso.backend.state.Session;
import com.vimbiso.backend.state.StateInvalidException;
import com.vimbiso.backend.state.StateManager;
import com.vimbiso.backend.state.StepResult;
import com.vimbiso.backend.support.MutableClock;
import com.vimbiso.backend.support.TestObjectMappers;
import com.vimbiso.backend.support.TestStateManagers;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FlowEngineTest {

  private static final ChannelIdentity CHANNEL = ChannelIdentity.whatsapp("263771234567");
  private static final AccountRef OWN_ACCOUNT = new AccountRef("acc-1", "Ada Personal", "ada");

  private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
  private LedgerApiClient ledgerApiClient;
  private StateManager stateManager;
  private FlowAuditLogger audit;
  private SimpleMeterRegistry meterRegistry;
  private FlowEngine engine;

  @BeforeEach
  void setUp() {
    ledgerApiClient = mock(LedgerApiClient.class);
    stateManager = mock(StateManager.class);
    AuditProperties auditProperties = new AuditProperties();
    audit =
        new FlowAuditLogger(
            new InMemoryAuditEventRepository(50),
            TestObjectMappers.create(),
            auditProperties,
            clock);
    meterRegistry = new SimpleMeterRegistry();
    FlowCatalog catalog =
        new FlowCatalog(
            List.of(
                new OfferFlowDefinition(ledgerApiClient, stateManager),
                new RegistrationFlowDefinition(ledgerApiClient, new BotProperties())));
    engine =
        new FlowEngine(catalog, TestStateManagers.inMemory(clock), audit, clock, meterRegistry);
  }

  @Test
  void offerFlowWalksAmountHandleConfirmThenCancel() {
    Session session = authenticatedSession();

    FlowOutcome started = engine.start(session, FlowType.OFFER, Map.of());
    assertThat(started.status()).isEqualTo(FlowOutcome.Status.RUNNING);
    assertThat(started.stepId()).isEqualTo("amount");
    assertThat(started.flow().stepIndex()).isZero();

    FlowOutcome amount = engine.processInput(withFlow(session, started.flow()), "100");
    assertThat(amount.stepId()).isEqualTo("handle");
    assertThat(amount.flow().stepIndex()).isEqualTo(1);
    assertThat(amount.flow().result("amount"))
        .contains(StepResult.builder().put("amount", "100").put("denom", "USD").build());

    FlowOutcome badHandle = engine.processInput(withFlow(session, amount.flow()), "not_a_handle!");
    assertThat(badHandle.status()).isEqualTo(FlowOutcome.Status.INVALID_INPUT);
    assertThat(badHandle.stepId()).isEqualTo("handle");
    assertThat(badHandle.flow().stepData()).isEqualTo(amount.flow().stepData());
    assertThat(badHandle.message().body()).startsWith("Invalid handle");
    verify(ledgerApiClient, never()).validateHandle(any(), anyString());

    when(ledgerApiClient.validateHandle(any(), eq("alice_ops")))
        .thenReturn(new AccountRef("acc-77", "Alice Ops", "alice_ops"));
    FlowOutcome handle = engine.processInput(withFlow(session, badHandle.flow()), "alice_ops");
    assertThat(handle.status()).isEqualTo(FlowOutcome.Status.RUNNING);
    assertThat(handle.stepId()).isEqualTo("confirm");
    assertThat(handle.message().type()).isEqualTo(OutboundMessage.Type.BUTTONS);
    assertThat(handle.flow().result("handle").orElseThrow().get("accountId")).isEqualTo("acc-77");

    FlowOutcome cancelled = engine.processInput(withFlow(session, handle.flow()), "cancel");
    assertThat(cancelled.status()).isEqualTo(FlowOutcome.Status.CANCELLED);
    assertThat(cancelled.flowCleared()).isTrue();
    assertThat(cancelled.flowId()).isEqualTo(started.flowId());
    verify(ledgerApiClient, never()).createOffer(any(), any());
  }

  @Test
  void confirmedOfferCreatesSecuredCredex() {
    Session session = authenticatedSession();
    FlowState atConfirm = offerAtConfirm(session);
    when(ledgerApiClient.createOffer(any(), any()))
        .thenReturn(
            new CredexActionResult(
                "CREDEX_CREATED", "c-1", MissingNode.getInstance(), MissingNode.getInstance()));

    FlowOutcome outcome = engine.processInput(withFlow(session, atConfirm), "confirm_action");

    assertThat(outcome.status()).isEqualTo(FlowOutcome.Status.COMPLETED);
    assertThat(outcome.flowCleared()).isTrue();
    assertThat(outcome.message().body()).contains("100 USD").contains("Alice Ops");
    verify(ledgerApiClient)
        .createOffer(any(), eq(new OfferRequest("acc-1", "acc-77", new BigDecimal("100"), "USD")));
    verifyNoInteractions(stateManager);
  }

  @Test
  void failedCompletionEndsTheFlowWithTheServiceError() {
    Session session = authenticatedSession();
    FlowState atConfirm = offerAtConfirm(session);
    when(ledgerApiClient.createOffer(any(), any()))
        .thenThrow(
            new LedgerApiException(LedgerEndpoint.CREATE_CREDEX, 400, "Insufficient balance"));

    FlowOutcome outcome = engine.processInput(withFlow(session, atConfirm), "confirm");

    assertThat(outcome.status()).isEqualTo(FlowOutcome.Status.ERRORED);
    assertThat(outcome.errorKind()).isEqualTo(ErrorKind.API);
    assertThat(outcome.errorDetail()).isEqualTo("Insufficient balance");
    assertThat(outcome.flowCleared()).isTrue();
    assertThat(audit.history(atConfirm.flowId()))
        .extracting(AuditEvent::eventType)
        .contains("flow_errored");
  }

  @Test
  void unexpectedFailureIsReportedAsSystemError() {
    Session session = authenticatedSession();
    FlowState atConfirm = offerAtConfirm(session);
    when(ledgerApiClient.createOffer(any(), any())).thenThrow(new IllegalStateException("boom"));

    FlowOutcome outcome = engine.processInput(withFlow(session, atConfirm), "confirm");

    assertThat(outcome.status()).isEqualTo(FlowOutcome.Status.ERRORED);
    assertThat(outcome.errorKind()).isEqualTo(ErrorKind.SYSTEM);
    assertThat(outcome.errorDetail()).isNull();
  }

  @Test
  void unknownHandleIsAskedAgain() {
    Session session = authenticatedSession();
    FlowState atHandle =
        engine.processInput(
                withFlow(session, engine.start(session, FlowType.OFFER, Map.of()).flow()), "5")
            .flow();
    when(ledgerApiClient.validateHandle(any(), eq("ghost")))
        .thenThrow(new LedgerApiException(LedgerEndpoint.GET_ACCOUNT_BY_HANDLE, 404, "missing"));

    FlowOutcome outcome = engine.processInput(withFlow(session, atHandle), "ghost");

    assertThat(outcome.status()).isEqualTo(FlowOutcome.Status.INVALID_INPUT);
    assertThat(outcome.stepId()).isEqualTo("handle");
    assertThat(outcome.message().body()).startsWith("No account found with handle *ghost*");
    assertThat(outcome.flow().answered("handle")).isFalse();
  }

  @Test
  void repeatedInvalidInputLeavesStateUnchanged() {
    Session session = authenticatedSession();
    FlowState start = engine.start(session, FlowType.OFFER, Map.of()).flow();

    FlowOutcome first = engine.processInput(withFlow(session, start), "lots");
    FlowOutcome second = engine.processInput(withFlow(session, first.flow()), "lots");

    assertThat(first.status()).isEqualTo(FlowOutcome.Status.INVALID_INPUT);
    assertThat(second.flow()).isEqualTo(first.flow());
    assertThat(second.flow()).isEqualTo(start);
  }

  @Test
  void cancelOnTextStepIsOrdinaryInput() {
    Session session = authenticatedSession();
    FlowState start = engine.start(session, FlowType.OFFER, Map.of()).flow();

    assertThat(engine.acceptsCancellation(withFlow(session, start), "cancel")).isFalse();
    assertThat(engine.processInput(withFlow(session, start), "cancel").status())
        .isEqualTo(FlowOutcome.Status.INVALID_INPUT);
  }

  @Test
  void registrationSkipsNamesKnownFromProfile() {
    Session anonymous = Session.empty(CHANNEL);
    FlowOutcome started =
        engine.start(
            anonymous,
            FlowType.REGISTRATION,
            RegistrationFlowDefinition.contextFromProfileName("ada"));

    assertThat(started.stepId()).isEqualTo("lastname");

    FlowOutcome done = engine.processInput(withFlow(anonymous, started.flow()), "moyo");

    assertThat(done.status()).isEqualTo(FlowOutcome.Status.COMPLETED);
    verify(ledgerApiClient).registerMember(CHANNEL, "Ada", "Moyo", "USD");
  }

  @Test
  void refusesToDriveFlowOfInvalidSession() {
    Session session = authenticatedSession();
    FlowState start = engine.start(session, FlowType.OFFER, Map.of()).flow();
    Session tokenless =
        new Session(
            CHANNEL, "m-1", "acc-1", true, null, null, OWN_ACCOUNT, start, 3, Instant.EPOCH);

    assertThatThrownBy(() -> engine.processInput(tokenless, "100"))
        .isInstanceOf(StateInvalidException.class)
        .hasMessageContaining("flow");
    verify(ledgerApiClient, never()).validateHandle(any(), anyString());
  }

  @Test
  void outcomesAreCounted() {
    Session session = authenticatedSession();
    FlowState start = engine.start(session, FlowType.OFFER, Map.of()).flow();
    engine.processInput(withFlow(session, start), "nope");

    assertThat(
            meterRegistry
                .counter("bot.flow.outcome", "flow", "offer", "status", "INVALID_INPUT")
                .count())
        .isEqualTo(1.0);
  }

  private FlowState offerAtConfirm(Session session) {
    when(ledgerApiClient.validateHandle(any(), eq("alice_ops")))
        .thenReturn(new AccountRef("acc-77", "Alice Ops", "alice_ops"));
    FlowState flow = engine.start(session, FlowType.OFFER, Map.of()).flow();
    flow = engine.processInput(withFlow(session, flow), "100").flow();
    return engine.processInput(withFlow(session, flow), "alice_ops").flow();
  }

  private static Session authenticatedSession() {
    return new Session(
        CHANNEL, "m-1", "acc-1", true, "token", null, OWN_ACCOUNT, null, 3, Instant.EPOCH);
  }

  private static Session withFlow(Session session, FlowState flow) {
    return new Session(
        session.channel(),
        session.memberId(),
        session.accountId(),
        session.authenticated(),
        session.authToken(),
        session.profileSnapshot(),
        session.activeAccount(),
        flow,
        session.version(),
        session.lastUpdated());
  }
}
