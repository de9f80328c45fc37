package com.vimbiso.backend.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.vimbiso.backend.state.AccountRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Read-only view over the dashboard blob cached as the session's profile snapshot. */
public final class Dashboard {

  private final JsonNode root;

  private Dashboard(JsonNode root) {
    this.root = root;
  }

  public static Dashboard of(JsonNode snapshot) {
    return new Dashboard(snapshot == null ? MissingNode.getInstance() : snapshot);
  }

  public boolean present() {
    return root.isObject();
  }

  public Optional<String> memberId() {
    return Optional.ofNullable(root.path("member").path("memberID").asText(null));
  }

  public String memberName() {
    JsonNode member = root.path("member");
    String first = member.path("firstname").asText("");
    String last = member.path("lastname").asText("");
    return (first + " " + last).trim();
  }

  public int memberTier() {
    return root.path("member").path("memberTier").asInt(1);
  }

  /** Whether the member can still subscribe to the paid tier. */
  public boolean tierUpgradeAvailable() {
    return present() && memberTier() < MemberTiers.SUBSCRIPTION_TIER;
  }

  public List<Account> accounts() {
    List<Account> accounts = new ArrayList<>();
    for (JsonNode node : root.path("accounts")) {
      accounts.add(Account.from(node));
    }
    return accounts;
  }

  public Optional<Account> account(String accountId) {
    return accounts().stream().filter(a -> accountId.equals(a.ref().accountId())).findFirst();
  }

  /** First owned account, falling back to the first listed one. */
  public Optional<Account> defaultAccount() {
    List<Account> accounts = accounts();
    return accounts.stream()
        .filter(Account::owned)
        .findFirst()
        .or(() -> accounts.stream().findFirst());
  }

  /** One account entry of the dashboard. */
  public record Account(
      AccountRef ref,
      String accountType,
      String defaultDenom,
      boolean owned,
      List<String> securedBalances,
      String netAssets,
      List<PendingOffer> pendingIn,
      List<PendingOffer> pendingOut) {

    static Account from(JsonNode node) {
      AccountRef ref =
          new AccountRef(
              node.path("accountID").asText(null),
              node.path("accountName").asText(null),
              node.path("accountHandle").asText(null));
      JsonNode balances = node.path("balanceData");
      List<String> secured = new ArrayList<>();
      for (JsonNode balance : balances.path("securedNetBalancesByDenom")) {
        secured.add(balance.asText());
      }
      return new Account(
          ref,
          node.path("accountType").asText(null),
          node.path("defaultDenom").asText("USD"),
          node.path("isOwnedAccount").asBoolean(false),
          List.copyOf(secured),
          balances.path("netCredexAssetsInDefaultDenom").asText(null),
          offers(node.path("pendingInData")),
          offers(node.path("pendingOutData")));
    }

    private static List<PendingOffer> offers(JsonNode array) {
      List<PendingOffer> offers = new ArrayList<>();
      for (JsonNode item : array) {
        PendingOffer offer = PendingOffer.from(item);
        if (offer.credexId() != null) {
          offers.add(offer);
        }
      }
      return List.copyOf(offers);
    }
  }
}
