package com.vimbiso.backend.ledger;

import com.vimbiso.backend.common.error.BotException;
import com.vimbiso.backend.common.error.ErrorKind;
import java.util.Optional;

/** The ledger service answered with a non-success status. */
public class LedgerApiException extends BotException {

  private final LedgerEndpoint endpoint;
  private final int status;
  private final String serviceMessage;

  public LedgerApiException(LedgerEndpoint endpoint, int status, String serviceMessage) {
    super(
        ErrorKind.API,
        "Ledger call " + endpoint.path() + " failed with status " + status + ": " + serviceMessage);
    this.endpoint = endpoint;
    this.status = status;
    this.serviceMessage = serviceMessage;
  }

  public LedgerEndpoint endpoint() {
    return endpoint;
  }

  public int status() {
    return status;
  }

  public boolean notFound() {
    return status == 404;
  }

  @Override
  public Optional<String> userMessage() {
    return Optional.ofNullable(serviceMessage);
  }
}
