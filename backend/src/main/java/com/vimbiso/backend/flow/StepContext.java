package com.vimbiso.backend.flow;

import com.vimbiso.backend.ledger.Dashboard;
import com.vimbiso.backend.state.AccountRef;
import com.vimbiso.backend.state.FlowState;
import com.vimbiso.backend.state.Session;
import com.vimbiso.backend.state.StepResult;
import java.util.Optional;

/** What a step sees when it is evaluated: the loaded session and the flow's progress. */
public record StepContext(Session session, FlowState flow) {

  public Optional<StepResult> result(String stepId) {
    return flow.result(stepId);
  }

  /** Value recorded by {@code stepId}, falling back to the flow's start context. */
  public Optional<String> value(String stepId, String key) {
    return flow.result(stepId)
        .flatMap(result -> result.find(key))
        .or(() -> flow.contextValue(key));
  }

  public Dashboard dashboard() {
    return Dashboard.of(session.profileSnapshot());
  }

  /** Dashboard entry of the session's active account, or the default one. */
  public Optional<Dashboard.Account> activeAccount() {
    Dashboard dashboard = dashboard();
    AccountRef active = session.activeAccount();
    if (active != null && active.accountId() != null) {
      Optional<Dashboard.Account> account = dashboard.account(active.accountId());
      if (account.isPresent()) {
        return account;
      }
    }
    return dashboard.defaultAccount();
  }
}
