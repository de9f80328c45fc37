package com.vimbiso.backend.common.error;

import java.util.Optional;

/**
 * Base type for failures classified by {@link ErrorKind}. The exception message is meant for logs;
 * {@link #userMessage()} is the only text that may be shown to the user.
 */
public abstract class BotException extends RuntimeException {

  private final ErrorKind kind;

  protected BotException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected BotException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }

  public Optional<String> userMessage() {
    return Optional.empty();
  }
}
