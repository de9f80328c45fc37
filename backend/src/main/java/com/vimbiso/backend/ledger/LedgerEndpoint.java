package com.vimbiso.backend.ledger;

/** Operations of the ledger service. All of them are JSON POSTs relative to the base URL. */
public enum LedgerEndpoint {
  LOGIN("login", false),
  ONBOARD_MEMBER("onboardMember", false),
  GET_MEMBER_DASHBOARD("getMemberDashboardByPhone", true),
  GET_ACCOUNT_BY_HANDLE("getAccountByHandle", true),
  CREATE_CREDEX("createCredex", true),
  ACCEPT_CREDEX("acceptCredex", true),
  ACCEPT_CREDEX_BULK("acceptCredexBulk", true),
  DECLINE_CREDEX("declineCredex", true),
  CANCEL_CREDEX("cancelCredex", true),
  GET_CREDEX("getCredex", true),
  GET_LEDGER("getLedger", true),
  CREATE_RECURRING("createRecurring", true);

  private final String path;
  private final boolean requiresAuth;

  LedgerEndpoint(String path, boolean requiresAuth) {
    this.path = path;
    this.requiresAuth = requiresAuth;
  }

  public String path() {
    return path;
  }

  public boolean requiresAuth() {
    return requiresAuth;
  }
}
