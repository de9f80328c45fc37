package com.vimbiso.backend.ledger;

import com.fasterxml.jackson.databind.JsonNode;

/** Extracts the best human-readable explanation from a failed ledger response. */
final class LedgerErrorMessages {

  private LedgerErrorMessages() {}

  static String extract(int status, JsonNode body) {
    String direct = text(body.path("message"));
    if (direct != null) {
      return direct;
    }
    JsonNode action = body.path("data").path("action");
    String reason = text(action.path("details").path("reason"));
    if (reason == null) {
      reason = text(action.path("message"));
    }
    if (reason == null) {
      reason = text(body.path("error"));
    }
    if (reason != null) {
      return reason;
    }
    return fallback(status);
  }

  static String fallback(int status) {
    if (status == 401) {
      return "Your session has expired. Please log in again.";
    }
    if (status == 403) {
      return "You don't have permission to perform this action.";
    }
    if (status == 404) {
      return "The requested record was not found.";
    }
    if (status >= 500) {
      return "The ledger service is having trouble right now. Please try again later.";
    }
    return "The request could not be completed (status " + status + ").";
  }

  private static String text(JsonNode node) {
    if (node == null || !node.isTextual()) {
      return null;
    }
    String value = node.asText().trim();
    return value.isEmpty() ? null : value;
  }
}
