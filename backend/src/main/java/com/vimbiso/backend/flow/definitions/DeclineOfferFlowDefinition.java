package com.vimbiso.backend.flow.definitions;

import com.vimbiso.backend.flow.FlowType;
import com.vimbiso.backend.ledger.CredexActionResult;
import com.vimbiso.backend.ledger.Dashboard;
import com.vimbiso.backend.ledger.LedgerApiClient;
import com.vimbiso.backend.ledger.PendingOffer;
import com.vimbiso.backend.state.Session;
import com.vimbiso.backend.state.StateManager;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class DeclineOfferFlowDefinition extends CredexActionFlowDefinition {

  private final LedgerApiClient ledgerApiClient;

  public DeclineOfferFlowDefinition(LedgerApiClient ledgerApiClient, StateManager stateManager) {
    super(stateManager);
    this.ledgerApiClient = ledgerApiClient;
  }

  @Override
  public FlowType type() {
    return FlowType.DECLINE;
  }

  @Override
  protected String action() {
    return "decline";
  }

  @Override
  protected String pastTense() {
    return "declined";
  }

  @Override
  protected Set<String> aliases() {
    return Set.of("decline_offers");
  }

  @Override
  protected List<PendingOffer> candidates(Dashboard.Account account) {
    return account.pendingIn();
  }

  @Override
  protected CredexActionResult execute(Session session, String credexId) {
    return ledgerApiClient.declineOffer(session, credexId);
  }
}
