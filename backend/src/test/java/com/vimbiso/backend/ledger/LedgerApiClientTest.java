package com.vimbiso.backend.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vimbiso.backend.common.error.ErrorKind;
import com.vimbiso.backend.state.AccountRef;
import com.vimbiso.backend.state.ChannelIdentity;
import com.vimbiso.backend.state.InMemoryStateStore;
import com.vimbiso.backend.state.Session;
import com.vimbiso.backend.state.SessionUpdate;
import com.vimbiso.backend.state.StateManager;
import com.vimbiso.backend.state.StateProperties;
import com.vimbiso.backend.support.MutableClock;
import com.vimbiso.backend.support.TestObjectMappers;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;

class LedgerApiClientTest {

  private static final ChannelIdentity CHANNEL = ChannelIdentity.whatsapp("263771234567");

  private static final String LOGIN_OK =
      """
      {"data": {
        "action": {"type": "MEMBER_LOGIN", "details": {"token": "fresh-token", "memberID": "m-1"}},
        "dashboard": {
          "member": {"memberID": "m-1", "firstname": "Ada", "lastname": "Moyo"},
          "accounts": [
            {"accountID": "acc-shared", "accountName": "Team", "accountHandle": "team",
             "isOwnedAccount": false},
            {"accountID": "acc-1", "accountName": "Ada Personal", "accountHandle": "ada",
             "isOwnedAccount": true}
          ]
        }
      }}
      """;

  private static final String DASHBOARD_OK =
      """
      {"data": {"dashboard": {"member": {"memberID": "m-1"}, "accounts": []}}}
      """;

  private ScriptedExchange exchange;
  private StateManager stateManager;
  private SimpleMeterRegistry meterRegistry;
  private LedgerApiClient client;

  @BeforeEach
  void setUp() {
    ObjectMapper objectMapper = TestObjectMappers.create();
    MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    meterRegistry = new SimpleMeterRegistry();
    stateManager =
        new StateManager(
            new InMemoryStateStore(clock),
            objectMapper,
            new StateProperties(),
            clock,
            meterRegistry);

    LedgerProperties properties = new LedgerProperties();
    properties.getRetry().setDelay(Duration.ofMillis(1));
    properties.setTimeout(Duration.ofSeconds(5));
    exchange = new ScriptedExchange();
    WebClient webClient =
        WebClient.builder().baseUrl("http://ledger.test").exchangeFunction(exchange).build();
    client = new LedgerApiClient(webClient, properties, stateManager, objectMapper, meterRegistry);
  }

  @Test
  void transportFailuresAreRetriedThenSurfaceAsNetworkError() {
    Session session = authenticatedSession("stale-token");
    exchange.failTransport(LedgerEndpoint.GET_MEMBER_DASHBOARD, 3);

    assertThatThrownBy(() -> client.getDashboard(session))
        .isInstanceOfSatisfying(
            LedgerNetworkException.class, ex -> assertThat(ex.kind()).isEqualTo(ErrorKind.NETWORK));
    assertThat(exchange.calls(LedgerEndpoint.GET_MEMBER_DASHBOARD)).isEqualTo(3);
    assertThat(
            meterRegistry
                .counter(
                    "bot.ledger.request",
                    "endpoint",
                    "getMemberDashboardByPhone",
                    "outcome",
                    "unreachable")
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void transientTransportFailureRecoversOnRetry() {
    Session session = authenticatedSession("good-token");
    exchange
        .failTransport(LedgerEndpoint.GET_MEMBER_DASHBOARD, 2)
        .respond(LedgerEndpoint.GET_MEMBER_DASHBOARD, HttpStatus.OK, DASHBOARD_OK);

    assertThat(client.getDashboard(session).path("member").path("memberID").asText())
        .isEqualTo("m-1");
    assertThat(exchange.calls(LedgerEndpoint.GET_MEMBER_DASHBOARD)).isEqualTo(3);
  }

  @Test
  void httpErrorsAreNotRetried() {
    Session session = authenticatedSession("good-token");
    exchange.respond(
        LedgerEndpoint.GET_MEMBER_DASHBOARD, HttpStatus.INTERNAL_SERVER_ERROR, "{}");

    assertThatThrownBy(() -> client.getDashboard(session))
        .isInstanceOfSatisfying(
            LedgerApiException.class, ex -> assertThat(ex.status()).isEqualTo(500));
    assertThat(exchange.calls(LedgerEndpoint.GET_MEMBER_DASHBOARD)).isEqualTo(1);
  }

  @Test
  void unauthorizedCallRefreshesTokenOnceAndReplays() {
    Session session = authenticatedSession("stale-token");
    exchange
        .respond(LedgerEndpoint.GET_MEMBER_DASHBOARD, HttpStatus.UNAUTHORIZED, "{}")
        .respond(LedgerEndpoint.LOGIN, HttpStatus.OK, LOGIN_OK)
        .respond(LedgerEndpoint.GET_MEMBER_DASHBOARD, HttpStatus.OK, DASHBOARD_OK);

    client.getDashboard(session);

    assertThat(exchange.authorizations(LedgerEndpoint.GET_MEMBER_DASHBOARD))
        .containsExactly("Bearer stale-token", "Bearer fresh-token");
    assertThat(exchange.calls(LedgerEndpoint.LOGIN)).isEqualTo(1);
    assertThat(stateManager.load(CHANNEL).authToken()).isEqualTo("fresh-token");
  }

  @Test
  void secondUnauthorizedAnswerEndsAsAuthenticationError() {
    Session session = authenticatedSession("stale-token");
    exchange
        .respond(LedgerEndpoint.GET_MEMBER_DASHBOARD, HttpStatus.UNAUTHORIZED, "{}")
        .respond(LedgerEndpoint.LOGIN, HttpStatus.OK, LOGIN_OK)
        .respond(LedgerEndpoint.GET_MEMBER_DASHBOARD, HttpStatus.UNAUTHORIZED, "{}");

    assertThatThrownBy(() -> client.getDashboard(session))
        .isInstanceOf(LedgerAuthenticationException.class);

    assertThat(exchange.calls(LedgerEndpoint.GET_MEMBER_DASHBOARD)).isEqualTo(2);
    assertThat(exchange.calls(LedgerEndpoint.LOGIN)).isEqualTo(1);
    Session stored = stateManager.load(CHANNEL);
    assertThat(stored.authenticated()).isFalse();
    assertThat(stored.authToken()).isNull();
  }

  @Test
  void failedRefreshMarksSessionUnauthenticated() {
    Session session = authenticatedSession("stale-token");
    exchange
        .respond(LedgerEndpoint.GET_MEMBER_DASHBOARD, HttpStatus.UNAUTHORIZED, "{}")
        .failTransport(LedgerEndpoint.LOGIN, 3);

    assertThatThrownBy(() -> client.getDashboard(session))
        .isInstanceOfSatisfying(
            LedgerAuthenticationException.class,
            ex -> assertThat(ex.kind()).isEqualTo(ErrorKind.AUTHENTICATION));

    assertThat(exchange.calls(LedgerEndpoint.GET_MEMBER_DASHBOARD)).isEqualTo(1);
    assertThat(stateManager.load(CHANNEL).authenticated()).isFalse();
  }

  @Test
  void missingTokenLogsInBeforeTheCall() {
    Session anonymous = stateManager.load(CHANNEL);
    exchange
        .respond(LedgerEndpoint.LOGIN, HttpStatus.OK, LOGIN_OK)
        .respond(LedgerEndpoint.GET_MEMBER_DASHBOARD, HttpStatus.OK, DASHBOARD_OK);

    client.getDashboard(anonymous);

    assertThat(exchange.authorizations(LedgerEndpoint.GET_MEMBER_DASHBOARD))
        .containsExactly("Bearer fresh-token");
    assertThat(exchange.authorizations(LedgerEndpoint.LOGIN)).containsExactly("null");
  }

  @Test
  void loginStoresTokenMemberAndOwnedAccountInOneUpdate() {
    exchange.respond(LedgerEndpoint.LOGIN, HttpStatus.OK, LOGIN_OK);

    LoginResult result = client.login(CHANNEL);

    assertThat(result.registrationRequired()).isFalse();
    Session stored = stateManager.load(CHANNEL);
    assertThat(stored.version()).isEqualTo(1);
    assertThat(stored.authenticated()).isTrue();
    assertThat(stored.authToken()).isEqualTo("fresh-token");
    assertThat(stored.memberId()).isEqualTo("m-1");
    assertThat(stored.accountId()).isEqualTo("acc-1");
    assertThat(stored.activeAccount().accountHandle()).isEqualTo("ada");
    assertThat(stored.profileSnapshot().path("member").path("firstname").asText())
        .isEqualTo("Ada");
  }

  @Test
  void loginAnsweredWithBadRequestMeansRegistrationRequired() {
    exchange.respond(
        LedgerEndpoint.LOGIN, HttpStatus.BAD_REQUEST, "{\"message\": \"Member not found\"}");

    LoginResult result = client.login(CHANNEL);

    assertThat(result.registrationRequired()).isTrue();
    assertThat(stateManager.load(CHANNEL).version()).isZero();
  }

  @Test
  void unknownHandleSurfacesAsNotFoundWithServiceMessage() {
    Session session = authenticatedSession("good-token");
    exchange.respond(
        LedgerEndpoint.GET_ACCOUNT_BY_HANDLE,
        HttpStatus.NOT_FOUND,
        "{\"data\": {\"action\": {\"details\": {\"reason\": \"Account not found\"}}}}");

    assertThatThrownBy(() -> client.validateHandle(session, "Nobody"))
        .isInstanceOfSatisfying(
            LedgerApiException.class,
            ex -> {
              assertThat(ex.notFound()).isTrue();
              assertThat(ex.userMessage()).contains("Account not found");
            });
  }

  @Test
  void validateHandleReturnsAccountReference() {
    Session session = authenticatedSession("good-token");
    exchange.respond(
        LedgerEndpoint.GET_ACCOUNT_BY_HANDLE,
        HttpStatus.OK,
        """
        {"data": {"action": {"details":
          {"accountID": "acc-77", "accountName": "Alice Ops", "accountHandle": "alice_ops"}}}}
        """);

    AccountRef ref = client.validateHandle(session, "Alice_Ops");

    assertThat(ref.accountId()).isEqualTo("acc-77");
    assertThat(ref.accountName()).isEqualTo("Alice Ops");
  }

  @Test
  void handleIsLowercasedIndependentlyOfDefaultLocale() {
    Session session = authenticatedSession("good-token");
    exchange.respond(
        LedgerEndpoint.GET_ACCOUNT_BY_HANDLE,
        HttpStatus.OK,
        "{\"data\": {\"action\": {\"details\": {\"accountID\": \"acc-9\"}}}}");
    Locale previous = Locale.getDefault();
    Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    try {
      AccountRef ref = client.validateHandle(session, "ALICE_IVY");

      assertThat(ref.accountHandle()).isEqualTo("alice_ivy");
    } finally {
      Locale.setDefault(previous);
    }
  }

  @Test
  void ledgerPageDetectsFurtherRowsFromTheExtraEntry() {
    Session session = authenticatedSession("good-token");
    exchange.respond(
        LedgerEndpoint.GET_LEDGER,
        HttpStatus.OK,
        """
        {"data": [
          {"credexID": "c1", "formattedInitialAmount": "-5.00 USD", "counterpartyAccountName": "A"},
          {"credexID": "c2", "formattedInitialAmount": "7.00 USD", "counterpartyAccountName": "B"},
          {"credexID": "c3", "formattedInitialAmount": "1.00 USD", "counterpartyAccountName": "C"}
        ]}
        """);

    LedgerPage page = client.getLedger(session, "acc-1", 0, 2);

    assertThat(page.hasMore()).isTrue();
    assertThat(page.entries()).extracting(LedgerEntry::credexId).containsExactly("c1", "c2");
    assertThat(page.entries().get(0).debit()).isTrue();
  }

  @Test
  void credexActionReadsActionAndRefreshedDashboard() {
    Session session = authenticatedSession("good-token");
    exchange.respond(
        LedgerEndpoint.ACCEPT_CREDEX,
        HttpStatus.OK,
        """
        {"data": {
          "action": {"type": "CREDEX_ACCEPTED", "id": "C-9", "details": {"credexID": "C-9"}},
          "dashboard": {"member": {"memberID": "m-1"}, "accounts": []}
        }}
        """);

    CredexActionResult result = client.acceptOffer(session, "C-9");

    assertThat(result.actionType()).isEqualTo("CREDEX_ACCEPTED");
    assertThat(result.credexId()).isEqualTo("C-9");
    assertThat(result.hasDashboard()).isTrue();
  }

  @Test
  void memberTierUpgradePostsRecurringSubscription() {
    Session session = authenticatedSession("good-token");
    exchange.respond(
        LedgerEndpoint.CREATE_RECURRING,
        HttpStatus.OK,
        """
        {"data": {
          "action": {"type": "RECURRING_CREATED", "id": "r-1",
                     "details": {"scheduleInfo": {"previousTier": 1, "memberTier": 3}}}
        }}
        """);

    CredexActionResult result =
        client.upgradeMemberTier(session, "acc-1", LocalDate.of(2024, 5, 1));

    assertThat(result.actionType()).isEqualTo(MemberTiers.SUBSCRIBED_ACTION);
    assertThat(result.details().path("scheduleInfo").path("memberTier").asInt()).isEqualTo(3);
    assertThat(result.hasDashboard()).isFalse();
    assertThat(exchange.authorizations(LedgerEndpoint.CREATE_RECURRING))
        .containsExactly("Bearer good-token");
  }

  @Test
  void getCredexReturnsDataBlock() {
    Session session = authenticatedSession("good-token");
    exchange.respond(
        LedgerEndpoint.GET_CREDEX,
        HttpStatus.OK,
        """
        {"data": {"credexData": {"credexID": "C-9", "formattedInitialAmount": "5 USD"}}}
        """);

    assertThat(client.getCredex(session, "C-9").path("credexData").path("credexID").asText())
        .isEqualTo("C-9");
  }

  private Session authenticatedSession(String token) {
    return stateManager.update(
        CHANNEL,
        SessionUpdate.builder()
            .memberId("m-1")
            .accountId("acc-1")
            .authToken(token)
            .authenticated(true)
            .build());
  }
}
