package com.vimbiso.backend.flow.definitions;

import com.vimbiso.backend.messaging.api.MessageOption;
import com.vimbiso.backend.messaging.api.OutboundMessage;
import java.util.List;
import java.util.Locale;
import java.util.Set;

final class ConfirmButtons {

  static final String CONFIRM_ID = "confirm_action";
  static final String CANCEL_ID = "cancel_action";

  private static final Set<String> CONFIRM_INPUTS = Set.of(CONFIRM_ID, "confirm");

  private ConfirmButtons() {}

  static OutboundMessage prompt(String body) {
    return OutboundMessage.buttons(
        body,
        List.of(MessageOption.of(CONFIRM_ID, "Confirm"), MessageOption.of(CANCEL_ID, "Cancel")));
  }

  static boolean confirms(String input) {
    return input != null && CONFIRM_INPUTS.contains(input.trim().toLowerCase(Locale.ROOT));
  }
}
