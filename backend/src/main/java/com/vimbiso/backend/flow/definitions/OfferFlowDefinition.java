package com.vimbiso.backend.flow.definitions;

import com.vimbiso.backend.flow.AmountParser;
import com.vimbiso.backend.flow.FlowDefinition;
import com.vimbiso.backend.flow.FlowType;
import com.vimbiso.backend.flow.ParsedAmount;
import com.vimbiso.backend.flow.StepContext;
import com.vimbiso.backend.flow.StepDefinition;
import com.vimbiso.backend.flow.StepInputException;
import com.vimbiso.backend.ledger.CredexActionResult;
import com.vimbiso.backend.ledger.Dashboard;
import com.vimbiso.backend.ledger.LedgerApiClient;
import com.vimbiso.backend.ledger.LedgerApiException;
import com.vimbiso.backend.ledger.OfferRequest;
import com.vimbiso.backend.messaging.api.OutboundMessage;
import com.vimbiso.backend.state.AccountRef;
import com.vimbiso.backend.state.Session;
import com.vimbiso.backend.state.SessionUpdate;
import com.vimbiso.backend.state.StateInvalidException;
import com.vimbiso.backend.state.StateManager;
import com.vimbiso.backend.state.StepResult;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Offers a secured credex: amount, then recipient handle, then confirmation. */
@Component
public class OfferFlowDefinition implements FlowDefinition {

  static final String AMOUNT_STEP = "amount";
  static final String HANDLE_STEP = "handle";
  static final String CONFIRM_STEP = "confirm";

  static final Pattern HANDLE_PATTERN = Pattern.compile("^[a-zA-Z0-9_]+$");

  private static final Set<String> TRIGGERS = Set.of("offer", "offer_credex");
  private static final String AMOUNT_PROMPT =
      "How much would you like to offer? Your response defaults to USD unless otherwise"
          + " indicated.\n\nValid examples: `1`, `5`, `3.23`, `53.22 ZWG`, `ZWG 5384.54`,"
          + " `0.04 XAU`, `CAD 5.18`";

  private final LedgerApiClient ledgerApiClient;
  private final StateManager stateManager;
  private final List<StepDefinition> steps;

  public OfferFlowDefinition(LedgerApiClient ledgerApiClient, StateManager stateManager) {
    this.ledgerApiClient = ledgerApiClient;
    this.stateManager = stateManager;
    this.steps =
        List.of(
            StepDefinition.text(AMOUNT_STEP)
                .message(context -> OutboundMessage.text(AMOUNT_PROMPT))
                .validator((context, input) -> AmountParser.parse(input).isPresent())
                .transformer((context, input) -> amountResult(input))
                .invalidMessage(
                    "Invalid amount. Use a positive number, optionally with USD, ZWG, XAU or CAD.")
                .build(),
            StepDefinition.text(HANDLE_STEP)
                .message(
                    context ->
                        OutboundMessage.text(
                            "Enter the account handle of the recipient (letters, numbers and"
                                + " underscores only)."))
                .validator((context, input) -> HANDLE_PATTERN.matcher(input).matches())
                .transformer(this::resolveHandle)
                .invalidMessage("Invalid handle. Use only letters, numbers and underscores.")
                .build(),
            StepDefinition.button(CONFIRM_STEP)
                .message(this::confirmation)
                .validator((context, input) -> ConfirmButtons.confirms(input))
                .transformer((context, input) -> StepResult.of("confirmed", "true"))
                .invalidMessage("Please choose Confirm or Cancel.")
                .build());
  }

  @Override
  public FlowType type() {
    return FlowType.OFFER;
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
  public OutboundMessage complete(StepContext context) {
    Session session = context.session();
    AccountRef issuer = issuingAccount(context);
    StepResult amount = context.result(AMOUNT_STEP).orElseThrow();
    StepResult recipient = context.result(HANDLE_STEP).orElseThrow();
    OfferRequest request =
        new OfferRequest(
            issuer.accountId(),
            recipient.get("accountId"),
            amount.decimal("amount"),
            amount.get("denom"));
    CredexActionResult result = ledgerApiClient.createOffer(session, request);
    if (result.hasDashboard()) {
      stateManager.update(
          session.channel(), SessionUpdate.builder().profileSnapshot(result.dashboard()).build());
    }
    return OutboundMessage.text(
        "Secured credex of "
            + amount.get("amount")
            + " "
            + amount.get("denom")
            + " offered to "
            + recipient.get("accountName")
            + ". Send *hi* for the menu.");
  }

  private static StepResult amountResult(String input) {
    ParsedAmount parsed =
        AmountParser.parse(input).orElseThrow(() -> new StepInputException("Invalid amount."));
    BigDecimal amount = parsed.amount().stripTrailingZeros();
    return StepResult.builder().put("amount", amount).put("denom", parsed.denomination()).build();
  }

  private StepResult resolveHandle(StepContext context, String input) {
    AccountRef account;
    try {
      account = ledgerApiClient.validateHandle(context.session(), input);
    } catch (LedgerApiException ex) {
      if (ex.notFound()) {
        throw new StepInputException("No account found with handle *" + input + "*.", ex);
      }
      throw ex;
    }
    AccountRef active = context.session().activeAccount();
    if (active != null && account.accountId().equals(active.accountId())) {
      throw new StepInputException("You can't offer a credex to your own account.");
    }
    return StepResult.builder()
        .put("handle", input.toLowerCase(Locale.ROOT))
        .put("accountId", account.accountId())
        .put("accountName", account.accountName())
        .build();
  }

  private OutboundMessage confirmation(StepContext context) {
    StepResult amount = context.result(AMOUNT_STEP).orElseThrow();
    StepResult recipient = context.result(HANDLE_STEP).orElseThrow();
    return ConfirmButtons.prompt(
        "Offer a secured credex of *"
            + amount.get("amount")
            + " "
            + amount.get("denom")
            + "* to *"
            + recipient.get("accountName")
            + "* (@"
            + recipient.get("handle")
            + ")?");
  }

  private static AccountRef issuingAccount(StepContext context) {
    AccountRef active = context.session().activeAccount();
    if (active != null && active.accountId() != null) {
      return active;
    }
    return context
        .activeAccount()
        .map(Dashboard.Account::ref)
        .orElseThrow(() -> new StateInvalidException("Session has no account to offer from"));
  }
}
