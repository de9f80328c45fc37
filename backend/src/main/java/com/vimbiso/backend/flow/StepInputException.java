package com.vimbiso.backend.flow;

import com.vimbiso.backend.common.error.BotException;
import com.vimbiso.backend.common.error.ErrorKind;
import java.util.Optional;

/** Input passed the syntactic check but cannot be used; the user is asked again. */
public class StepInputException extends BotException {

  public StepInputException(String message) {
    super(ErrorKind.VALIDATION, message);
  }

  public StepInputException(String message, Throwable cause) {
    super(ErrorKind.VALIDATION, message, cause);
  }

  @Override
  public Optional<String> userMessage() {
    return Optional.ofNullable(getMessage());
  }
}
