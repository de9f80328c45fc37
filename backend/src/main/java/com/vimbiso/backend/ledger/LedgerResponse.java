package com.vimbiso.backend.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/** Raw status and JSON body of a ledger exchange. */
public record LedgerResponse(int status, JsonNode body) {

  public LedgerResponse {
    body = body == null ? MissingNode.getInstance() : body;
  }

  public boolean successful() {
    return status >= 200 && status < 300;
  }

  public boolean unauthorized() {
    return status == 401;
  }

  public JsonNode data() {
    return body.path("data");
  }

  public JsonNode action() {
    return data().path("action");
  }

  public String actionType() {
    return action().path("type").asText(null);
  }

  public JsonNode actionDetails() {
    return action().path("details");
  }

  public JsonNode dashboard() {
    return data().path("dashboard");
  }
}
