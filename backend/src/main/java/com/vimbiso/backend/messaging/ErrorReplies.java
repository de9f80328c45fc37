package com.vimbiso.backend.messaging;

import com.vimbiso.backend.common.error.ErrorKind;
import com.vimbiso.backend.messaging.api.OutboundMessage;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/** The one place where an error kind becomes text shown to the user. */
final class ErrorReplies {

  private static final String MENU_HINT = "\n\nSend *hi* to return to the menu.";

  private ErrorReplies() {}

  static OutboundMessage render(ErrorKind kind, @Nullable String detail) {
    return OutboundMessage.text(body(kind, detail) + MENU_HINT);
  }

  private static String body(ErrorKind kind, @Nullable String detail) {
    return switch (kind) {
      case VALIDATION -> StringUtils.hasText(detail) ? detail : "That input isn't valid.";
      case STATE_CONFLICT ->
          "We couldn't save your progress because of another update. Please try again.";
      case STATE_INVALID -> "Your session needs to be refreshed, so you'll be signed in again.";
      case AUTHENTICATION -> "We couldn't verify your account. Please start over.";
      case NETWORK -> "The service is temporarily unreachable. Please try again shortly.";
      case API -> StringUtils.hasText(detail) ? detail : "The request could not be completed.";
      case SYSTEM -> "Something went wrong on our side. Please try again later.";
    };
  }
}
