package com.vimbiso.backend.ledger;

import com.vimbiso.backend.state.Session;
import org.springframework.lang.Nullable;

/**
 * Outcome of a login or registration. When the ledger does not know the member yet, {@code
 * session} is absent and the caller is expected to start onboarding.
 */
public record LoginResult(boolean registrationRequired, @Nullable Session session) {

  public static LoginResult newMember() {
    return new LoginResult(true, null);
  }

  public static LoginResult authenticated(Session session) {
    return new LoginResult(false, session);
  }
}
