package com.vimbiso.backend.messaging.api;

import com.vimbiso.backend.state.ChannelIdentity;
import org.springframework.lang.Nullable;

/**
 * Normalized inbound event. {@code rawValue} is the typed text, or the id of the pressed button or
 * selected list row. {@code profileName} is the display name the channel reported, if any.
 */
public record InboundEvent(
    ChannelIdentity channel,
    MessageKind kind,
    String rawValue,
    @Nullable String profileName) {

  public InboundEvent {
    rawValue = rawValue == null ? "" : rawValue;
    kind = kind == null ? MessageKind.TEXT : kind;
  }

  public static InboundEvent text(ChannelIdentity channel, String value) {
    return new InboundEvent(channel, MessageKind.TEXT, value, null);
  }

  public static InboundEvent button(ChannelIdentity channel, String id) {
    return new InboundEvent(channel, MessageKind.BUTTON, id, null);
  }
}
