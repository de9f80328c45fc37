package com.vimbiso.backend.ledger;

import com.vimbiso.backend.common.error.BotException;
import com.vimbiso.backend.common.error.ErrorKind;

/** The ledger service could not be reached, or did not answer in time. */
public class LedgerNetworkException extends BotException {

  public LedgerNetworkException(String message, Throwable cause) {
    super(ErrorKind.NETWORK, message, cause);
  }
}
