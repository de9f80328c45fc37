package com.vimbiso.backend.flow.definitions;

import com.vimbiso.backend.flow.FlowDefinition;
import com.vimbiso.backend.flow.FlowEngine;
import com.vimbiso.backend.flow.StepContext;
import com.vimbiso.backend.flow.StepDefinition;
import com.vimbiso.backend.ledger.CredexActionResult;
import com.vimbiso.backend.ledger.Dashboard;
import com.vimbiso.backend.ledger.PendingOffer;
import com.vimbiso.backend.messaging.api.MessageOption;
import com.vimbiso.backend.messaging.api.OutboundMessage;
import com.vimbiso.backend.state.FlowState;
import com.vimbiso.backend.state.Session;
import com.vimbiso.backend.state.SessionUpdate;
import com.vimbiso.backend.state.StateManager;
import com.vimbiso.backend.state.StepResult;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shared shape of the accept, decline and cancel flows: pick a pending offer, then confirm. The
 * pick is skipped when the flow was started for a specific credex.
 */
abstract class CredexActionFlowDefinition implements FlowDefinition {

  static final String SELECT_STEP = "select";
  static final String CONFIRM_STEP = "confirm";
  static final String CREDEX_ID = "credexId";

  private static final int MAX_LIST_ROWS = 10;
  private static final Set<String> RESERVED_SUFFIXES = Set.of("all", "action", "offer", "offers");

  private final StateManager stateManager;
  private final List<StepDefinition> steps;

  protected CredexActionFlowDefinition(StateManager stateManager) {
    this.stateManager = stateManager;
    this.steps =
        List.of(
            StepDefinition.list(SELECT_STEP)
                .when(context -> context.flow().contextValue(CREDEX_ID).isEmpty())
                .message(this::selection)
                .validator((context, input) -> find(context, parseSelection(input)).isPresent())
                .transformer(
                    (context, input) -> StepResult.of(CREDEX_ID, parseSelection(input)))
                .invalidMessage("Please pick one of the listed offers.")
                .build(),
            StepDefinition.button(CONFIRM_STEP)
                .message(this::confirmation)
                .validator((context, input) -> ConfirmButtons.confirms(input))
                .transformer((context, input) -> StepResult.of("confirmed", "true"))
                .invalidMessage("Please choose Confirm or Cancel.")
                .build());
  }

  /** Prefix of list row ids and of the start command that pre-selects an offer. */
  protected abstract String action();

  /** Past tense used in the completion message, e.g. "accepted". */
  protected abstract String pastTense();

  protected abstract List<PendingOffer> candidates(Dashboard.Account account);

  protected abstract CredexActionResult execute(Session session, String credexId);

  /** Plain start commands besides the bare action name. */
  protected Set<String> aliases() {
    return Set.of();
  }

  @Override
  public List<StepDefinition> steps() {
    return steps;
  }

  @Override
  public Optional<Map<String, String>> matchTrigger(String input) {
    String keyword = input.toLowerCase(Locale.ROOT);
    boolean bareAction = keyword.equals(action()) && !FlowEngine.CANCEL_INPUTS.contains(keyword);
    if (bareAction || aliases().contains(keyword)) {
      return Optional.of(Map.of());
    }
    String prefix = action() + "_";
    if (keyword.startsWith(prefix) && input.length() > prefix.length()) {
      String credexId = input.substring(prefix.length());
      if (!RESERVED_SUFFIXES.contains(credexId.toLowerCase(Locale.ROOT))) {
        return Optional.of(Map.of(CREDEX_ID, credexId));
      }
    }
    return Optional.empty();
  }

  @Override
  public Optional<String> unavailableReason(Session session) {
    StepContext preview = new StepContext(session, emptyFlow());
    if (preview.activeAccount().map(this::candidates).map(List::isEmpty).orElse(true)) {
      return Optional.of("You have no pending offers to " + action() + ". Send *hi* for the menu.");
    }
    return Optional.empty();
  }

  @Override
  public OutboundMessage complete(StepContext context) {
    String credexId = selectedCredex(context);
    Optional<PendingOffer> offer = find(context, credexId);
    CredexActionResult result = execute(context.session(), credexId);
    if (result.hasDashboard()) {
      stateManager.update(
          context.session().channel(),
          SessionUpdate.builder().profileSnapshot(result.dashboard()).build());
    }
    String description = offer.map(CredexActionFlowDefinition::describe).orElse("the offer");
    return OutboundMessage.text(
        "Done: " + description + " " + pastTense() + ". Send *hi* for the menu.");
  }

  private OutboundMessage selection(StepContext context) {
    List<MessageOption> rows =
        context.activeAccount().map(this::candidates).orElse(List.of()).stream()
            .limit(MAX_LIST_ROWS)
            .map(
                offer ->
                    new MessageOption(
                        action() + "_" + offer.credexId(),
                        offer.formattedAmount(),
                        offer.counterpartyAccountName()))
            .toList();
    return OutboundMessage.list(
        "Select the offer you want to " + action() + ":", "Pending offers", rows);
  }

  private OutboundMessage confirmation(StepContext context) {
    String credexId = selectedCredex(context);
    String description =
        find(context, credexId).map(CredexActionFlowDefinition::describe).orElse(credexId);
    String verb = Character.toUpperCase(action().charAt(0)) + action().substring(1);
    return ConfirmButtons.prompt(verb + " " + description + "?");
  }

  private String selectedCredex(StepContext context) {
    return context
        .value(SELECT_STEP, CREDEX_ID)
        .orElseThrow(() -> new IllegalStateException("No credex selected"));
  }

  private Optional<PendingOffer> find(StepContext context, String credexId) {
    if (credexId == null || credexId.isBlank()) {
      return Optional.empty();
    }
    return context.activeAccount().map(this::candidates).orElse(List.of()).stream()
        .filter(offer -> credexId.equals(offer.credexId()))
        .findFirst();
  }

  private String parseSelection(String input) {
    String prefix = action() + "_";
    return input.startsWith(prefix) ? input.substring(prefix.length()) : input;
  }

  private static String describe(PendingOffer offer) {
    return offer.formattedAmount() + " with " + offer.counterpartyAccountName();
  }

  private FlowState emptyFlow() {
    return FlowState.start("preview", type().id(), Map.of(), null);
  }
}
