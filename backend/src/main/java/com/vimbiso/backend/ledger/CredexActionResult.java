package com.vimbiso.backend.ledger;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of a credex or subscription mutation: the action the ledger recorded plus the refreshed
 * dashboard when the service returned one.
 */
public record CredexActionResult(
    String actionType, String credexId, JsonNode details, JsonNode dashboard) {

  static CredexActionResult from(LedgerResponse response) {
    JsonNode action = response.action();
    String credexId = action.path("id").asText(null);
    if (credexId == null) {
      credexId = response.actionDetails().path("credexID").asText(null);
    }
    return new CredexActionResult(
        response.actionType(), credexId, response.actionDetails(), response.dashboard());
  }

  public boolean hasDashboard() {
    return dashboard != null && dashboard.isObject();
  }
}
