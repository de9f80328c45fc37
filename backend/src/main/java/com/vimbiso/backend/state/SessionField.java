package com.vimbiso.backend.state;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.function.Function;

/**
 * Typed handle on a session field. Critical fields may only be read from a session that satisfies
 * its invariant.
 */
public final class SessionField<T> {

  public static final SessionField<ChannelIdentity> CHANNEL =
      new SessionField<>("channel", true, Session::channel);
  public static final SessionField<String> MEMBER_ID =
      new SessionField<>("member_id", true, Session::memberId);
  public static final SessionField<String> AUTH_TOKEN =
      new SessionField<>("auth_token", true, Session::authToken);
  public static final SessionField<Boolean> AUTHENTICATED =
      new SessionField<>("authenticated", true, Session::authenticated);
  public static final SessionField<FlowState> FLOW =
      new SessionField<>("flow", true, Session::flow);
  public static final SessionField<String> ACCOUNT_ID =
      new SessionField<>("account_id", false, Session::accountId);
  public static final SessionField<JsonNode> PROFILE_SNAPSHOT =
      new SessionField<>("profile_snapshot", false, Session::profileSnapshot);
  public static final SessionField<AccountRef> ACTIVE_ACCOUNT =
      new SessionField<>("active_account", false, Session::activeAccount);

  private final String name;
  private final boolean critical;
  private final Function<Session, T> accessor;

  private SessionField(String name, boolean critical, Function<Session, T> accessor) {
    this.name = name;
    this.critical = critical;
    this.accessor = accessor;
  }

  public String name() {
    return name;
  }

  public boolean critical() {
    return critical;
  }

  T read(Session session) {
    return accessor.apply(Objects.requireNonNull(session, "session"));
  }

  @Override
  public String toString() {
    return name;
  }
}
