package com.vimbiso.backend.state;

import com.vimbiso.backend.common.error.BotException;
import com.vimbiso.backend.common.error.ErrorKind;

/** Raised when concurrent writers kept the session update from committing within its bound. */
public class StateConflictException extends BotException {

  private final int attempts;

  public StateConflictException(String key, int attempts) {
    super(
        ErrorKind.STATE_CONFLICT,
        "Session " + key + " changed concurrently on every one of " + attempts + " attempts");
    this.attempts = attempts;
  }

  public int attempts() {
    return attempts;
  }
}
