package com.vimbiso.backend.state;

import com.vimbiso.backend.common.error.BotException;
import com.vimbiso.backend.common.error.ErrorKind;

/** Raised when a session breaks its invariant, either on write or when a critical field is read. */
public class StateInvalidException extends BotException {

  public StateInvalidException(String message) {
    super(ErrorKind.STATE_INVALID, message);
  }
}
