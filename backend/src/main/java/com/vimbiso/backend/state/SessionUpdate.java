package com.vimbiso.backend.state;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Partial change to a {@link Session}. Fields that were never touched keep their current value;
 * fields set to {@code null} are cleared. The channel identity cannot be changed.
 */
public final class SessionUpdate {

  private final Change<String> memberId;
  private final Change<String> accountId;
  private final Change<Boolean> authenticated;
  private final Change<String> authToken;
  private final Change<JsonNode> profileSnapshot;
  private final Change<AccountRef> activeAccount;
  private final Change<FlowState> flow;

  private SessionUpdate(Builder builder) {
    this.memberId = builder.memberId;
    this.accountId = builder.accountId;
    this.authenticated = builder.authenticated;
    this.authToken = builder.authToken;
    this.profileSnapshot = builder.profileSnapshot;
    this.activeAccount = builder.activeAccount;
    this.flow = builder.flow;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static SessionUpdate flow(FlowState flow) {
    return builder().flow(flow).build();
  }

  public static SessionUpdate clearFlow() {
    return builder().flow(null).build();
  }

  /** Drops credentials and any active flow, forcing a fresh login on the next call. */
  public static SessionUpdate resetAuthentication() {
    return builder().authenticated(false).authToken(null).flow(null).build();
  }

  Session applyTo(Session current) {
    return new Session(
        current.channel(),
        pick(memberId, current.memberId()),
        pick(accountId, current.accountId()),
        Boolean.TRUE.equals(pick(authenticated, current.authenticated())),
        pick(authToken, current.authToken()),
        pick(profileSnapshot, current.profileSnapshot()),
        pick(activeAccount, current.activeAccount()),
        pick(flow, current.flow()),
        current.version(),
        current.lastUpdated());
  }

  public List<String> fieldNames() {
    List<String> names = new ArrayList<>();
    addIfSet(names, memberId, SessionField.MEMBER_ID);
    addIfSet(names, accountId, SessionField.ACCOUNT_ID);
    addIfSet(names, authenticated, SessionField.AUTHENTICATED);
    addIfSet(names, authToken, SessionField.AUTH_TOKEN);
    addIfSet(names, profileSnapshot, SessionField.PROFILE_SNAPSHOT);
    addIfSet(names, activeAccount, SessionField.ACTIVE_ACCOUNT);
    addIfSet(names, flow, SessionField.FLOW);
    return names;
  }

  private static void addIfSet(List<String> names, Change<?> change, SessionField<?> field) {
    if (change != null) {
      names.add(field.name());
    }
  }

  private static <T> T pick(Change<T> change, T current) {
    return change == null ? current : change.value();
  }

  @Override
  public String toString() {
    return "SessionUpdate" + fieldNames();
  }

  private record Change<T>(T value) {}

  public static final class Builder {

    private Change<String> memberId;
    private Change<String> accountId;
    private Change<Boolean> authenticated;
    private Change<String> authToken;
    private Change<JsonNode> profileSnapshot;
    private Change<AccountRef> activeAccount;
    private Change<FlowState> flow;

    private Builder() {}

    public Builder memberId(String memberId) {
      this.memberId = new Change<>(memberId);
      return this;
    }

    public Builder accountId(String accountId) {
      this.accountId = new Change<>(accountId);
      return this;
    }

    public Builder authenticated(boolean authenticated) {
      this.authenticated = new Change<>(authenticated);
      return this;
    }

    public Builder authToken(String authToken) {
      this.authToken = new Change<>(authToken);
      return this;
    }

    public Builder profileSnapshot(JsonNode profileSnapshot) {
      this.profileSnapshot = new Change<>(profileSnapshot);
      return this;
    }

    public Builder activeAccount(AccountRef activeAccount) {
      this.activeAccount = new Change<>(activeAccount);
      return this;
    }

    public Builder flow(FlowState flow) {
      this.flow = new Change<>(flow);
      return this;
    }

    public SessionUpdate build() {
      return new SessionUpdate(this);
    }
  }
}
