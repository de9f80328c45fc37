package com.vimbiso.backend.messaging.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Channel-neutral reply. The channel adapter renders it as plain text, reply buttons or an
 * interactive list.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record OutboundMessage(
    Type type, String body, List<MessageOption> options, String listLabel) {

  public OutboundMessage {
    options = options == null ? List.of() : List.copyOf(options);
  }

  public static OutboundMessage text(String body) {
    return new OutboundMessage(Type.TEXT, body, List.of(), null);
  }

  public static OutboundMessage buttons(String body, List<MessageOption> buttons) {
    return new OutboundMessage(Type.BUTTONS, body, buttons, null);
  }

  public static OutboundMessage list(String body, String label, List<MessageOption> rows) {
    return new OutboundMessage(Type.LIST, body, rows, label);
  }

  /** Same message with {@code notice} placed above the body. */
  public OutboundMessage withNotice(String notice) {
    if (notice == null || notice.isBlank()) {
      return this;
    }
    return new OutboundMessage(type, notice + "\n\n" + body, options, listLabel);
  }

  public enum Type {
    TEXT,
    BUTTONS,
    LIST
  }
}
