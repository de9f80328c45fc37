package com.vimbiso.backend.flow.definitions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vimbiso.backend.audit.AuditProperties;
import com.vimbiso.backend.audit.FlowAuditLogger;
import com.vimbiso.backend.audit.InMemoryAuditEventRepository;
import com.vimbiso.backend.flow.FlowCatalog;
import com.vimbiso.backend.flow.FlowEngine;
import com.vimbiso.backend.flow.FlowOutcome;
import com.vimbiso.backend.flow.FlowStart;
import com.vimbiso.backend.flow.FlowType;
import com.vimbiso.backend.ledger.CredexActionResult;
import com.vimbiso.backend.ledger.LedgerApiClient;
import com.vimbiso.backend.messaging.api.MessageOption;
import com.vimbiso.backend.state.AccountRef;
import com.vimbiso.backend.state.ChannelIdentity;
import com.vimbiso.backend.state.FlowState;
import com.vimbiso.backend.state.Session;
import com.vimbiso.backend.state.StateManager;
import com.vimbiso.backend.support.MutableClock;
import com.vimbiso.backend.support.TestObjectMappers;
import com.vimbiso.backend.support.TestStateManagers;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UpgradeFlowDefinitionTest {

  private static final ChannelIdentity CHANNEL = ChannelIdentity.whatsapp("263771234567");

  private static final String DASHBOARD =
      """
      {"member": {"memberID": "m-1", "firstname": "Ada", "memberTier": 1},
       "accounts": [{
         "accountID": "acc-1", "accountName": "Ada Personal", "accountHandle": "ada",
         "isOwnedAccount": true
       }]}
      """;

  private final ObjectMapper objectMapper = TestObjectMappers.create();
  private LedgerApiClient ledgerApiClient;
  private UpgradeFlowDefinition upgrade;
  private FlowCatalog catalog;
  private FlowEngine engine;

  @BeforeEach
  void setUp() {
    ledgerApiClient = mock(LedgerApiClient.class);
    MutableClock clock = new MutableClock(Instant.parse("2024-05-01T22:30:00Z"));
    upgrade = new UpgradeFlowDefinition(ledgerApiClient, mock(StateManager.class), clock);
    catalog = new FlowCatalog(List.of(upgrade));
    FlowAuditLogger audit =
        new FlowAuditLogger(
            new InMemoryAuditEventRepository(50), objectMapper, new AuditProperties(), clock);
    engine =
        new FlowEngine(
            catalog, TestStateManagers.inMemory(clock), audit, clock, new SimpleMeterRegistry());
  }

  @Test
  void startsFromMenuIdOrKeyword() {
    assertThat(catalog.matchTrigger("upgrade_membertier"))
        .contains(new FlowStart(FlowType.UPGRADE, Map.of()));
    assertThat(upgrade.matchTrigger("Upgrade")).contains(Map.of());
    assertThat(upgrade.matchTrigger("upgrade_now")).isEmpty();
  }

  @Test
  void topTierMembersCannotUpgradeAgain() throws Exception {
    ObjectNode dashboard = (ObjectNode) objectMapper.readTree(DASHBOARD);
    ((ObjectNode) dashboard.path("member")).put("memberTier", 3);

    FlowOutcome outcome = engine.start(session(dashboard), FlowType.UPGRADE, Map.of());

    assertThat(outcome.status()).isEqualTo(FlowOutcome.Status.NOT_STARTED);
    assertThat(outcome.message().body()).contains("already on tier 3");
  }

  @Test
  void confirmationSubscribesFromTheActiveAccount() throws Exception {
    Session session = session(objectMapper.readTree(DASHBOARD));
    when(ledgerApiClient.upgradeMemberTier(any(), eq("acc-1"), any()))
        .thenReturn(
            new CredexActionResult(
                "RECURRING_CREATED",
                "r-1",
                objectMapper.readTree("{\"scheduleInfo\": {\"memberTier\": 3}}"),
                MissingNode.getInstance()));

    FlowOutcome started = engine.start(session, FlowType.UPGRADE, Map.of());
    assertThat(started.stepId()).isEqualTo("confirm");
    assertThat(started.message().body())
        .contains("1.00 USD every 28 days")
        .contains("Ada Personal");
    assertThat(started.message().options())
        .extracting(MessageOption::id)
        .containsExactly("confirm_action", "cancel_action");

    FlowOutcome done = engine.processInput(withFlow(session, started.flow()), "confirm_action");

    assertThat(done.status()).isEqualTo(FlowOutcome.Status.COMPLETED);
    assertThat(done.message().body()).contains("Upgraded to member tier 3");
    verify(ledgerApiClient).upgradeMemberTier(any(), eq("acc-1"), eq(LocalDate.of(2024, 5, 1)));
  }

  @Test
  void cancelButtonLeavesTheTierUntouched() throws Exception {
    Session session = session(objectMapper.readTree(DASHBOARD));
    FlowOutcome started = engine.start(session, FlowType.UPGRADE, Map.of());

    FlowOutcome cancelled = engine.processInput(withFlow(session, started.flow()), "cancel_action");

    assertThat(cancelled.status()).isEqualTo(FlowOutcome.Status.CANCELLED);
    verify(ledgerApiClient, never()).upgradeMemberTier(any(), anyString(), any());
  }

  private static Session session(JsonNode dashboard) {
    return new Session(
        CHANNEL,
        "m-1",
        "acc-1",
        true,
        "token",
        dashboard,
        new AccountRef("acc-1", "Ada Personal", "ada"),
        null,
        1,
        Instant.EPOCH);
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
