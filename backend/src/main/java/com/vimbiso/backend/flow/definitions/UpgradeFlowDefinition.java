package com.vimbiso.backend.flow.definitions;

import com.vimbiso.backend.flow.FlowDefinition;
import com.vimbiso.backend.flow.FlowType;
import com.vimbiso.backend.flow.StepContext;
import com.vimbiso.backend.flow.StepDefinition;
import com.vimbiso.backend.ledger.CredexActionResult;
import com.vimbiso.backend.ledger.Dashboard;
import com.vimbiso.backend.ledger.LedgerApiClient;
import com.vimbiso.backend.ledger.MemberTiers;
import com.vimbiso.backend.messaging.api.OutboundMessage;
import com.vimbiso.backend.state.AccountRef;
import com.vimbiso.backend.state.Session;
import com.vimbiso.backend.state.SessionUpdate;
import com.vimbiso.backend.state.StateInvalidException;
import com.vimbiso.backend.state.StateManager;
import com.vimbiso.backend.state.StepResult;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Subscribes the member to the paid tier after a single confirmation. */
@Component
public class UpgradeFlowDefinition implements FlowDefinition {

  static final String CONFIRM_STEP = "confirm";
  public static final String MENU_ID = "upgrade_membertier";

  private static final Set<String> TRIGGERS = Set.of("upgrade", MENU_ID);

  private final LedgerApiClient ledgerApiClient;
  private final StateManager stateManager;
  private final Clock clock;
  private final List<StepDefinition> steps;

  public UpgradeFlowDefinition(
      LedgerApiClient ledgerApiClient, StateManager stateManager, Clock clock) {
    this.ledgerApiClient = ledgerApiClient;
    this.stateManager = stateManager;
    this.clock = clock;
    this.steps =
        List.of(
            StepDefinition.button(CONFIRM_STEP)
                .message(this::confirmation)
                .validator((context, input) -> ConfirmButtons.confirms(input))
                .transformer((context, input) -> StepResult.of("confirmed", "true"))
                .invalidMessage("Please choose Confirm or Cancel.")
                .build());
  }

  @Override
  public FlowType type() {
    return FlowType.UPGRADE;
  }

  @Override
  public List<StepDefinition> steps() {
    return steps;
  }

  @Override
  public Optional<Map<String, String>> matchTrigger(String input) {
    return TRIGGERS.contains(input.toLowerCase(Locale.ROOT))
        ? Optional.of(Map.of())
        : Optional.empty();
  }

  @Override
  public Optional<String> unavailableReason(Session session) {
    Dashboard dashboard = Dashboard.of(session.profileSnapshot());
    if (dashboard.present() && !dashboard.tierUpgradeAvailable()) {
      return Optional.of(
          "Your membership is already on tier "
              + dashboard.memberTier()
              + ". Send *hi* for the menu.");
    }
    if (payingAccount(session).isEmpty()) {
      return Optional.of("No account is available to pay for the upgrade. Send *hi* for the menu.");
    }
    return Optional.empty();
  }

  @Override
  public OutboundMessage complete(StepContext context) {
    Session session = context.session();
    AccountRef source =
        payingAccount(session)
            .orElseThrow(
                () -> new StateInvalidException("Session has no account to pay the upgrade"));
    CredexActionResult result =
        ledgerApiClient.upgradeMemberTier(session, source.accountId(), LocalDate.now(clock));
    if (result.hasDashboard()) {
      stateManager.update(
          session.channel(), SessionUpdate.builder().profileSnapshot(result.dashboard()).build());
    }
    if (!MemberTiers.SUBSCRIBED_ACTION.equals(result.actionType())) {
      return OutboundMessage.text(
          "Your upgrade could not be confirmed yet. Please check your dashboard shortly."
              + " Send *hi* for the menu.");
    }
    int tier =
        result
            .details()
            .path("scheduleInfo")
            .path("memberTier")
            .asInt(MemberTiers.SUBSCRIPTION_TIER);
    return OutboundMessage.text(
        "Upgraded to member tier " + tier + ". Hustle hard! Send *hi* for the menu.");
  }

  private OutboundMessage confirmation(StepContext context) {
    return ConfirmButtons.prompt(
        "*Upgrade your member tier*\n\nYour account will be subscribed to tier "
            + MemberTiers.SUBSCRIPTION_TIER
            + " for "
            + MemberTiers.SUBSCRIPTION_AMOUNT.toPlainString()
            + " "
            + MemberTiers.SUBSCRIPTION_DENOMINATION
            + " every "
            + MemberTiers.PAY_FREQUENCY_DAYS
            + " days, paid with secured credex from "
            + payingAccount(context.session()).map(AccountRef::accountName).orElse("your account")
            + ".");
  }

  private static Optional<AccountRef> payingAccount(Session session) {
    AccountRef active = session.activeAccount();
    if (active != null && active.accountId() != null) {
      return Optional.of(active);
    }
    return Dashboard.of(session.profileSnapshot()).defaultAccount().map(Dashboard.Account::ref);
  }
}
