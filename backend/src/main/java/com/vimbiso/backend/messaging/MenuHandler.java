package com.vimbiso.backend.messaging;

import com.fasterxml.jackson.databind.JsonNode;
import com.vimbiso.backend.config.BotProperties;
import com.vimbiso.backend.flow.definitions.UpgradeFlowDefinition;
import com.vimbiso.backend.ledger.CredexActionResult;
import com.vimbiso.backend.ledger.Dashboard;
import com.vimbiso.backend.ledger.LedgerApiClient;
import com.vimbiso.backend.ledger.LedgerEntry;
import com.vimbiso.backend.ledger.LedgerPage;
import com.vimbiso.backend.ledger.PendingOffer;
import com.vimbiso.backend.messaging.api.MessageOption;
import com.vimbiso.backend.messaging.api.OutboundMessage;
import com.vimbiso.backend.state.Session;
import com.vimbiso.backend.state.SessionUpdate;
import com.vimbiso.backend.state.StateManager;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Top-level actions that run outside of any flow: the dashboard menu, ledger and bulk accept. */
@Component
public class MenuHandler {

  private static final Logger log = LoggerFactory.getLogger(MenuHandler.class);

  static final String DASHBOARD = "dashboard";
  static final String LEDGER = "ledger";
  static final String ACCEPT_ALL = "accept_all";
  private static final Pattern LEDGER_PAGE = Pattern.compile("^ledger_page_(\\d+)$");
  static final int MAX_LEDGER_PAGE = 1000;

  private final LedgerApiClient ledgerApiClient;
  private final StateManager stateManager;
  private final BotProperties properties;

  public MenuHandler(
      LedgerApiClient ledgerApiClient, StateManager stateManager, BotProperties properties) {
    this.ledgerApiClient = ledgerApiClient;
    this.stateManager = stateManager;
    this.properties = properties;
  }

  /**
   * Handles input that neither continues nor starts a flow. {@code session} must be
   * authenticated; {@code recognized} is false for input that matched nothing.
   */
  public OutboundMessage handle(Session session, String input, boolean recognized) {
    String command = input.trim().toLowerCase(Locale.ROOT);
    if (LEDGER.equals(command)) {
      return ledger(session, 1);
    }
    Matcher page = LEDGER_PAGE.matcher(command);
    if (page.matches()) {
      return ledger(session, ledgerPage(page.group(1)));
    }
    if (ACCEPT_ALL.equals(command)) {
      return acceptAll(session);
    }
    OutboundMessage menu = menu(refreshDashboard(session));
    if (recognized || DASHBOARD.equals(command)) {
      return menu;
    }
    return menu.withNotice("Sorry, I didn't understand that.");
  }

  /** Renders the menu from the dashboard cached on the session, without calling the ledger. */
  public OutboundMessage menu(Session session) {
    Dashboard dashboard = Dashboard.of(session.profileSnapshot());
    Optional<Dashboard.Account> account = activeAccount(session);
    StringBuilder body = new StringBuilder();
    String name = dashboard.memberName();
    body.append(name.isEmpty() ? "Welcome!" : "Welcome, " + name + "!");
    List<MessageOption> options = new ArrayList<>();
    options.add(new MessageOption("offer", "Offer secured credex", "Send a credex offer"));
    if (account.isPresent()) {
      Dashboard.Account current = account.get();
      body.append("\n\n*Account:* ")
          .append(current.ref().accountName())
          .append(" (@")
          .append(current.ref().accountHandle())
          .append(")");
      body.append("\n*Secured balances:*");
      if (current.securedBalances().isEmpty()) {
        body.append("\n- $0.00");
      }
      current.securedBalances().forEach(balance -> body.append("\n- ").append(balance));
      if (current.netAssets() != null) {
        body.append("\n*Net assets:* ").append(current.netAssets());
      }
      int incoming = current.pendingIn().size();
      int outgoing = current.pendingOut().size();
      body.append("\n\nPending offers: ")
          .append(incoming)
          .append(" incoming, ")
          .append(outgoing)
          .append(" outgoing");
      if (incoming > 0) {
        options.add(new MessageOption("accept", "Accept offers (" + incoming + ")", null));
        options.add(new MessageOption("decline", "Decline offers (" + incoming + ")", null));
      }
      if (incoming > 1) {
        options.add(new MessageOption(ACCEPT_ALL, "Accept all (" + incoming + ")", null));
      }
      if (outgoing > 0) {
        options.add(new MessageOption("cancel_offer", "Cancel offers (" + outgoing + ")", null));
      }
    }
    options.add(new MessageOption(LEDGER, "View ledger", "Recent transactions"));
    if (account.isPresent() && dashboard.tierUpgradeAvailable()) {
      options.add(
          new MessageOption(
              UpgradeFlowDefinition.MENU_ID, "Upgrade member tier", "Subscribe to the next tier"));
    }
    return OutboundMessage.list(body.toString(), "Options", options);
  }

  private Session refreshDashboard(Session session) {
    JsonNode dashboard = ledgerApiClient.getDashboard(session);
    if (!dashboard.isObject()) {
      return session;
    }
    return stateManager.update(
        session.channel(), SessionUpdate.builder().profileSnapshot(dashboard).build());
  }

  private OutboundMessage ledger(Session session, int page) {
    Optional<Dashboard.Account> account = activeAccount(session);
    if (account.isEmpty()) {
      return OutboundMessage.text("No account is available to show a ledger for.");
    }
    int pageSize = properties.getLedgerPageSize();
    LedgerPage ledger =
        ledgerApiClient.getLedger(
            session, account.get().ref().accountId(), (page - 1) * pageSize, pageSize);
    if (ledger.entries().isEmpty()) {
      return OutboundMessage.buttons(
          "*Empty*\n\nNo transactions found.", List.of(MessageOption.of("menu", "Menu")));
    }
    StringBuilder body = new StringBuilder("*Transactions* (page ").append(page).append(")\n");
    int index = (page - 1) * pageSize + 1;
    for (LedgerEntry entry : ledger.entries()) {
      body.append('\n')
          .append(index++)
          .append(". ")
          .append(entry.formattedAmount())
          .append(entry.debit() ? " to " : " from ")
          .append(entry.counterpartyAccountName());
    }
    List<MessageOption> buttons = new ArrayList<>();
    if (page > 1) {
      buttons.add(MessageOption.of("ledger_page_" + (page - 1), "< Prev"));
    }
    if (ledger.hasMore() && page < MAX_LEDGER_PAGE) {
      buttons.add(MessageOption.of("ledger_page_" + (page + 1), "Next >"));
    }
    buttons.add(MessageOption.of("menu", "Menu"));
    return OutboundMessage.buttons(body.toString(), buttons);
  }

  /** Page requested by a {@code ledger_page_} id, clamped to the pages the menu can reach. */
  static int ledgerPage(String digits) {
    int page;
    try {
      page = Integer.parseInt(digits);
    } catch (NumberFormatException ex) {
      log.debug("menu_ledger_page_unparseable value={}", digits);
      return 1;
    }
    return Math.min(Math.max(1, page), MAX_LEDGER_PAGE);
  }

  private OutboundMessage acceptAll(Session session) {
    List<PendingOffer> pending =
        activeAccount(session).map(Dashboard.Account::pendingIn).orElse(List.of());
    if (pending.isEmpty()) {
      return menu(session).withNotice("There are no pending offers to accept.");
    }
    List<String> ids = pending.stream().map(PendingOffer::credexId).toList();
    CredexActionResult result = ledgerApiClient.acceptOffersBulk(session, ids);
    log.info("menu_accept_all count={} actionType={}", ids.size(), result.actionType());
    Session updated =
        result.hasDashboard()
            ? stateManager.update(
                session.channel(),
                SessionUpdate.builder().profileSnapshot(result.dashboard()).build())
            : refreshDashboard(session);
    return menu(updated).withNotice("Accepted " + ids.size() + " offers.");
  }

  private static Optional<Dashboard.Account> activeAccount(Session session) {
    Dashboard dashboard = Dashboard.of(session.profileSnapshot());
    if (session.activeAccount() != null && session.activeAccount().accountId() != null) {
      Optional<Dashboard.Account> account = dashboard.account(session.activeAccount().accountId());
      if (account.isPresent()) {
        return account;
      }
    }
    return dashboard.defaultAccount();
  }
}
