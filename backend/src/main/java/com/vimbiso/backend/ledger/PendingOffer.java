package com.vimbiso.backend.ledger;

import com.fasterxml.jackson.databind.JsonNode;

/** Unresolved credex listed on a dashboard account. */
public record PendingOffer(
    String credexId,
    String formattedAmount,
    String counterpartyAccountName,
    String dueDate,
    boolean secured) {

  static PendingOffer from(JsonNode node) {
    return new PendingOffer(
        node.path("credexID").asText(null),
        node.path("formattedInitialAmount").asText(""),
        node.path("counterpartyAccountName").asText(""),
        node.path("dueDate").asText(null),
        node.path("secured").asBoolean(false));
  }
}
