package com.vimbiso.backend.ledger;

import com.fasterxml.jackson.databind.JsonNode;

public record LedgerEntry(String credexId, String formattedAmount, String counterpartyAccountName) {

  static LedgerEntry from(JsonNode node) {
    String amount = node.path("formattedInitialAmount").asText(null);
    if (amount == null) {
      amount = node.path("formattedAmount").asText("");
    }
    return new LedgerEntry(
        node.path("credexID").asText(null),
        amount,
        node.path("counterpartyAccountName").asText(""));
  }

  public boolean debit() {
    return formattedAmount.startsWith("-");
  }
}
