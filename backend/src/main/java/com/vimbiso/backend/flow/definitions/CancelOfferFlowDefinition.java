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
public class CancelOfferFlowDefinition extends CredexActionFlowDefinition {

  private final LedgerApiClient ledgerApiClient;

  public CancelOfferFlowDefinition(LedgerApiClient ledgerApiClient, StateManager stateManager) {
    super(stateManager);
    this.ledgerApiClient = ledgerApiClient;
  }

  @Override
  public FlowType type() {
    return FlowType.CANCEL;
  }

  @Override
  protected String action() {
    return "cancel";
  }

  @Override
  protected String pastTense() {
    return "cancelled";
  }

  @Override
  protected Set<String> aliases() {
    return Set.of("cancel_offer");
  }

  @Override
  protected List<PendingOffer> candidates(Dashboard.Account account) {
    return account.pendingOut();
  }

  @Override
  protected CredexActionResult execute(Session session, String credexId) {
    return ledgerApiClient.cancelOffer(session, credexId);
  }
}
