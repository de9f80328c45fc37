package com.vimbiso.backend.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vimbiso.backend.common.error.BotException;
import com.vimbiso.backend.state.AccountRef;
import com.vimbiso.backend.state.ChannelIdentity;
import com.vimbiso.backend.state.Session;
import com.vimbiso.backend.state.SessionField;
import com.vimbiso.backend.state.SessionUpdate;
import com.vimbiso.backend.state.StateManager;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;

/**
 * Client for the ledger service. Transport failures are retried with a fixed delay; a 401 on an
 * authenticated call triggers exactly one fresh login followed by exactly one replay of the
 * original request.
 */
@Service
public class LedgerApiClient {

  private static final Logger log = LoggerFactory.getLogger(LedgerApiClient.class);
  private static final String REQUEST_METRIC = "bot.ledger.request";

  private final WebClient webClient;
  private final LedgerProperties properties;
  private final StateManager stateManager;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final RetryTemplate retryTemplate;

  public LedgerApiClient(
      @Qualifier("ledgerWebClient") WebClient webClient,
      LedgerProperties properties,
      StateManager stateManager,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    this.webClient = webClient;
    this.properties = properties;
    this.stateManager = stateManager;
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
    this.retryTemplate = buildRetryTemplate(properties.getRetry());
  }

  /**
   * Sends {@code payload} to {@code endpoint}, attaching the session's bearer token when the
   * endpoint requires authentication.
   *
   * @throws LedgerApiException for non-2xx answers
   * @throws LedgerNetworkException when the service stays unreachable
   * @throws LedgerAuthenticationException when the token cannot be refreshed or is rejected again
   */
  public LedgerResponse request(Session session, LedgerEndpoint endpoint, JsonNode payload) {
    return request(session, endpoint, payload, true);
  }

  LedgerResponse request(
      Session session, LedgerEndpoint endpoint, JsonNode payload, boolean refreshPermitted) {
    if (!endpoint.requiresAuth()) {
      return validate(endpoint, send(endpoint, payload, null));
    }
    String token = stateManager.getField(session, SessionField.AUTH_TOKEN);
    if (!StringUtils.hasText(token)) {
      if (!refreshPermitted) {
        throw new LedgerAuthenticationException("No auth token available for " + endpoint.path());
      }
      log.info("ledger_token_missing endpoint={} action=login", endpoint.path());
      return replay(endpoint, payload, refreshToken(session.channel()));
    }

    LedgerResponse response = send(endpoint, payload, token);
    if (!response.unauthorized()) {
      return validate(endpoint, response);
    }
    if (!refreshPermitted) {
      throw new LedgerAuthenticationException("Ledger rejected the token for " + endpoint.path());
    }
    log.info("ledger_token_rejected endpoint={} action=refresh", endpoint.path());
    return replay(endpoint, payload, refreshToken(session.channel()));
  }

  /** Logs the channel in. A 400 answer means the ledger does not know this member yet. */
  public LoginResult login(ChannelIdentity channel) {
    ObjectNode payload = objectMapper.createObjectNode().put("phone", channel.identifier());
    LedgerResponse response = send(LedgerEndpoint.LOGIN, payload, null);
    if (response.status() == 400) {
      log.info("ledger_login_unregistered channelType={}", channel.channelType());
      return LoginResult.newMember();
    }
    if (!response.successful()) {
      throw new LedgerAuthenticationException(
          "Login rejected with status "
              + response.status()
              + ": "
              + LedgerErrorMessages.extract(response.status(), response.body()));
    }
    return LoginResult.authenticated(applyAuthentication(channel, response));
  }

  public LoginResult registerMember(
      ChannelIdentity channel, String firstname, String lastname, String defaultDenom) {
    ObjectNode payload =
        objectMapper
            .createObjectNode()
            .put("firstname", firstname)
            .put("lastname", lastname)
            .put("phone", channel.identifier())
            .put("defaultDenom", defaultDenom);
    LedgerResponse response =
        validate(
            LedgerEndpoint.ONBOARD_MEMBER, send(LedgerEndpoint.ONBOARD_MEMBER, payload, null));
    log.info("ledger_member_registered channelType={}", channel.channelType());
    return LoginResult.authenticated(applyAuthentication(channel, response));
  }

  /** Fetches the member dashboard; the caller decides whether to cache it. */
  public JsonNode getDashboard(Session session) {
    ObjectNode payload =
        objectMapper.createObjectNode().put("phone", session.channel().identifier());
    return request(session, LedgerEndpoint.GET_MEMBER_DASHBOARD, payload).dashboard();
  }

  /** Resolves an account handle; a 404 surfaces as {@link LedgerApiException#notFound()}. */
  public AccountRef validateHandle(Session session, String handle) {
    String normalized = handle.trim().toLowerCase(Locale.ROOT);
    ObjectNode payload = objectMapper.createObjectNode().put("accountHandle", normalized);
    JsonNode details =
        request(session, LedgerEndpoint.GET_ACCOUNT_BY_HANDLE, payload).actionDetails();
    String accountId = details.path("accountID").asText(null);
    if (!StringUtils.hasText(accountId)) {
      throw new LedgerApiException(
          LedgerEndpoint.GET_ACCOUNT_BY_HANDLE, 404, "No account found for handle " + handle);
    }
    return new AccountRef(
        accountId,
        details.path("accountName").asText(handle),
        details.path("accountHandle").asText(handle.toLowerCase(Locale.ROOT)));
  }

  public CredexActionResult createOffer(Session session, OfferRequest offer) {
    ObjectNode payload =
        objectMapper
            .createObjectNode()
            .put("issuerAccountID", offer.issuerAccountId())
            .put("receiverAccountID", offer.receiverAccountId())
            .put("Denomination", offer.denomination())
            .put("InitialAmount", offer.amount())
            .put("credexType", "PURCHASE")
            .put("OFFERSorREQUESTS", "OFFERS")
            .put("securedCredex", true);
    return CredexActionResult.from(request(session, LedgerEndpoint.CREATE_CREDEX, payload));
  }

  public CredexActionResult acceptOffer(Session session, String credexId) {
    return credexAction(session, LedgerEndpoint.ACCEPT_CREDEX, credexId);
  }

  public CredexActionResult declineOffer(Session session, String credexId) {
    return credexAction(session, LedgerEndpoint.DECLINE_CREDEX, credexId);
  }

  public CredexActionResult cancelOffer(Session session, String credexId) {
    return credexAction(session, LedgerEndpoint.CANCEL_CREDEX, credexId);
  }

  public CredexActionResult acceptOffersBulk(Session session, List<String> credexIds) {
    ObjectNode payload = objectMapper.createObjectNode();
    ArrayNode ids = payload.putArray("credexIDs");
    credexIds.forEach(ids::add);
    payload.put("signerID", stateManager.getField(session, SessionField.MEMBER_ID));
    return CredexActionResult.from(request(session, LedgerEndpoint.ACCEPT_CREDEX_BULK, payload));
  }

  public JsonNode getCredex(Session session, String credexId) {
    ObjectNode payload = objectMapper.createObjectNode().put("credexID", credexId);
    return request(session, LedgerEndpoint.GET_CREDEX, payload).data();
  }

  /** Reads {@code pageSize} entries starting at {@code startRow}, asking for one extra row. */
  public LedgerPage getLedger(Session session, String accountId, int startRow, int pageSize) {
    ObjectNode payload =
        objectMapper
            .createObjectNode()
            .put("accountID", accountId)
            .put("startRow", startRow)
            .put("numRows", pageSize + 1);
    JsonNode data = request(session, LedgerEndpoint.GET_LEDGER, payload).data();
    JsonNode rows = data.isArray() ? data : data.path("entries");
    List<LedgerEntry> entries = new ArrayList<>();
    for (JsonNode row : rows) {
      entries.add(LedgerEntry.from(row));
    }
    boolean hasMore = entries.size() > pageSize;
    return new LedgerPage(
        List.copyOf(hasMore ? entries.subList(0, pageSize) : entries), hasMore);
  }

  /**
   * Subscribes the member to {@link MemberTiers#SUBSCRIPTION_TIER}, paying the recurring fee from
   * {@code sourceAccountId} starting on {@code startDate}.
   */
  public CredexActionResult upgradeMemberTier(
      Session session, String sourceAccountId, LocalDate startDate) {
    ObjectNode payload =
        objectMapper
            .createObjectNode()
            .put("sourceAccountID", sourceAccountId)
            .put("templateType", "MEMBERTIER_SUBSCRIPTION")
            .put("memberTier", MemberTiers.SUBSCRIPTION_TIER)
            .put("payFrequency", MemberTiers.PAY_FREQUENCY_DAYS)
            .put("startDate", startDate.toString())
            .put("amount", MemberTiers.SUBSCRIPTION_AMOUNT)
            .put("denomination", MemberTiers.SUBSCRIPTION_DENOMINATION)
            .put("securedCredex", true);
    CredexActionResult result =
        CredexActionResult.from(request(session, LedgerEndpoint.CREATE_RECURRING, payload));
    log.info(
        "ledger_member_tier_upgrade accountId={} actionType={}",
        sourceAccountId,
        result.actionType());
    return result;
  }

  private CredexActionResult credexAction(
      Session session, LedgerEndpoint endpoint, String credexId) {
    ObjectNode payload =
        objectMapper
            .createObjectNode()
            .put("credexID", credexId)
            .put("signerID", stateManager.getField(session, SessionField.MEMBER_ID));
    CredexActionResult result = CredexActionResult.from(request(session, endpoint, payload));
    log.info(
        "ledger_credex_action endpoint={} credexId={} actionType={}",
        endpoint.path(),
        credexId,
        result.actionType());
    return result;
  }

  private LedgerResponse replay(LedgerEndpoint endpoint, JsonNode payload, Session refreshed) {
    LedgerResponse retried = send(endpoint, payload, refreshed.authToken());
    if (retried.unauthorized()) {
      log.warn("ledger_token_rejected_after_refresh endpoint={}", endpoint.path());
      markUnauthenticated(refreshed.channel());
      throw new LedgerAuthenticationException(
          "Ledger rejected the refreshed token for " + endpoint.path());
    }
    return validate(endpoint, retried);
  }

  private Session refreshToken(ChannelIdentity channel) {
    LoginResult result;
    try {
      result = login(channel);
    } catch (LedgerAuthenticationException ex) {
      markUnauthenticated(channel);
      throw ex;
    } catch (LedgerNetworkException | LedgerApiException ex) {
      markUnauthenticated(channel);
      throw new LedgerAuthenticationException("Token refresh failed: " + ex.getMessage(), ex);
    }
    if (result.registrationRequired() || result.session() == null) {
      markUnauthenticated(channel);
      throw new LedgerAuthenticationException("Token refresh failed: member is not registered");
    }
    return result.session();
  }

  private Session applyAuthentication(ChannelIdentity channel, LedgerResponse response) {
    JsonNode details = response.actionDetails();
    JsonNode dashboard = response.dashboard();
    String token = details.path("token").asText(null);
    String memberId = details.path("memberID").asText(null);
    if (!StringUtils.hasText(memberId)) {
      memberId = dashboard.path("member").path("memberID").asText(null);
    }
    if (!StringUtils.hasText(token) || !StringUtils.hasText(memberId)) {
      throw new LedgerAuthenticationException(
          "Ledger authentication response lacks token or member");
    }
    SessionUpdate.Builder update =
        SessionUpdate.builder().authToken(token).memberId(memberId).authenticated(true);
    if (dashboard.isObject()) {
      update.profileSnapshot(dashboard);
      Dashboard.of(dashboard)
          .defaultAccount()
          .ifPresent(
              account ->
                  update.accountId(account.ref().accountId()).activeAccount(account.ref()));
    }
    Session session = stateManager.update(channel, update.build());
    log.info(
        "ledger_session_authenticated channelType={} memberId={}",
        channel.channelType(),
        memberId);
    return session;
  }

  private void markUnauthenticated(ChannelIdentity channel) {
    try {
      stateManager.update(
          channel, SessionUpdate.builder().authenticated(false).authToken(null).build());
    } catch (BotException ex) {
      log.warn(
          "ledger_session_reset_failed channelType={} error={}",
          channel.channelType(),
          ex.getMessage());
    }
  }

  private LedgerResponse validate(LedgerEndpoint endpoint, LedgerResponse response) {
    if (response.successful()) {
      return response;
    }
    String message = LedgerErrorMessages.extract(response.status(), response.body());
    log.warn(
        "ledger_request_failed endpoint={} status={} message={}",
        endpoint.path(),
        response.status(),
        message);
    throw new LedgerApiException(endpoint, response.status(), message);
  }

  private LedgerResponse send(LedgerEndpoint endpoint, JsonNode payload, @Nullable String token) {
    return retryTemplate.execute(
        context -> exchange(endpoint, payload, token, context.getRetryCount() + 1),
        context -> {
          if (!(context.getLastThrowable() instanceof LedgerNetworkException)
              && context.getLastThrowable() instanceof RuntimeException unexpected) {
            throw unexpected;
          }
          record(endpoint, "unreachable");
          throw new LedgerNetworkException(
              "Ledger service unreachable for "
                  + endpoint.path()
                  + " after "
                  + context.getRetryCount()
                  + " attempts",
              context.getLastThrowable());
        });
  }

  private LedgerResponse exchange(
      LedgerEndpoint endpoint, JsonNode payload, @Nullable String token, int attempt) {
    try {
      LedgerResponse response =
          webClient
              .post()
              .uri("/" + endpoint.path())
              .headers(
                  headers -> {
                    if (token != null) {
                      headers.setBearerAuth(token);
                    }
                  })
              .bodyValue(payload)
              .exchangeToMono(
                  clientResponse ->
                      clientResponse
                          .bodyToMono(String.class)
                          .defaultIfEmpty("")
                          .map(
                              body ->
                                  new LedgerResponse(
                                      clientResponse.statusCode().value(), parse(endpoint, body))))
              .timeout(properties.getTimeout())
              .block();
      if (response == null) {
        throw new LedgerNetworkException("Empty exchange for " + endpoint.path(), null);
      }
      record(endpoint, String.valueOf(response.status()));
      return response;
    } catch (WebClientRequestException ex) {
      log.warn(
          "ledger_transport_failure endpoint={} attempt={} error={}",
          endpoint.path(),
          attempt,
          ex.getMessage());
      throw new LedgerNetworkException("Transport failure calling " + endpoint.path(), ex);
    } catch (LedgerNetworkException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      Throwable cause = Exceptions.unwrap(ex);
      if (cause instanceof TimeoutException || cause instanceof IOException) {
        log.warn(
            "ledger_transport_failure endpoint={} attempt={} error={}",
            endpoint.path(),
            attempt,
            cause.toString());
        throw new LedgerNetworkException("Transport failure calling " + endpoint.path(), cause);
      }
      throw ex;
    }
  }

  private JsonNode parse(LedgerEndpoint endpoint, String body) {
    if (!StringUtils.hasText(body)) {
      return MissingNode.getInstance();
    }
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException ex) {
      log.debug("ledger_body_unparseable endpoint={} error={}", endpoint.path(), ex.getMessage());
      return MissingNode.getInstance();
    }
  }

  private void record(LedgerEndpoint endpoint, String outcome) {
    meterRegistry
        .counter(REQUEST_METRIC, "endpoint", endpoint.path(), "outcome", outcome)
        .increment();
  }

  private static RetryTemplate buildRetryTemplate(LedgerProperties.Retry retry) {
    return RetryTemplate.builder()
        .maxAttempts(Math.max(1, retry.getMaxAttempts()))
        .fixedBackoff(Math.max(1L, retry.getDelay().toMillis()))
        .retryOn(LedgerNetworkException.class)
        .build();
  }
}
