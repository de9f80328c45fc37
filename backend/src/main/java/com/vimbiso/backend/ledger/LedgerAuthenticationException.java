package com.vimbiso.backend.ledger;

import com.vimbiso.backend.common.error.BotException;
import com.vimbiso.backend.common.error.ErrorKind;

/** Login or token refresh against the ledger service failed. */
public class LedgerAuthenticationException extends BotException {

  public LedgerAuthenticationException(String message) {
    super(ErrorKind.AUTHENTICATION, message);
  }

  public LedgerAuthenticationException(String message, Throwable cause) {
    super(ErrorKind.AUTHENTICATION, message, cause);
  }
}
