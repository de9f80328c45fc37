package com.vimbiso.backend.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * Authoritative per-channel record. Instances are immutable; all changes go through {@link
 * StateManager#update(ChannelIdentity, SessionUpdate)}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Session(
    ChannelIdentity channel,
    @Nullable String memberId,
    @Nullable String accountId,
    boolean authenticated,
    @Nullable String authToken,
    @Nullable JsonNode profileSnapshot,
    @Nullable AccountRef activeAccount,
    @Nullable FlowState flow,
    long version,
    @Nullable Instant lastUpdated) {

  public static Session empty(ChannelIdentity channel) {
    return new Session(channel, null, null, false, null, null, null, null, 0L, null);
  }

  Session withMetadata(long version, Instant lastUpdated) {
    return new Session(
        channel,
        memberId,
        accountId,
        authenticated,
        authToken,
        profileSnapshot,
        activeAccount,
        flow,
        version,
        lastUpdated);
  }

  /** Returns the first invariant this session breaks, if any. */
  public Optional<String> invariantViolation() {
    if (channel == null) {
      return Optional.of("channel identity is missing");
    }
    if (authenticated && !StringUtils.hasText(authToken)) {
      return Optional.of("authenticated session has no auth token");
    }
    if (authenticated && !StringUtils.hasText(memberId)) {
      return Optional.of("authenticated session has no member id");
    }
    if (flow != null) {
      if (!StringUtils.hasText(flow.flowId()) || !StringUtils.hasText(flow.flowType())) {
        return Optional.of("active flow has no id or type");
      }
      if (flow.stepIndex() < 0) {
        return Optional.of("active flow has a negative step index");
      }
    }
    return Optional.empty();
  }

  public boolean hasActiveFlow() {
    return flow != null;
  }

  /** Token-free view of the session used in audit records. */
  public Map<String, Object> auditSummary() {
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("channel_type", channel == null ? null : channel.channelType());
    summary.put("member_id", memberId);
    summary.put("authenticated", authenticated);
    summary.put("has_token", StringUtils.hasText(authToken));
    summary.put("flow_id", flow == null ? null : flow.flowId());
    summary.put("flow_type", flow == null ? null : flow.flowType());
    summary.put("step_index", flow == null ? null : flow.stepIndex());
    summary.put("version", version);
    return summary;
  }

  @Override
  public String toString() {
    return "Session[channel="
        + (channel == null ? null : channel.key())
        + ", memberId="
        + memberId
        + ", accountId="
        + accountId
        + ", authenticated="
        + authenticated
        + ", authToken="
        + (authToken == null ? null : "****")
        + ", activeAccount="
        + activeAccount
        + ", flow="
        + (flow == null ? null : flow.flowId() + "@" + flow.stepIndex())
        + ", version="
        + version
        + ", lastUpdated="
        + lastUpdated
        + "]";
  }
}
