package com.vimbiso.backend.web;

import com.vimbiso.backend.messaging.api.InboundEvent;
import com.vimbiso.backend.messaging.api.MessageKind;
import com.vimbiso.backend.state.ChannelIdentity;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record InboundEventRequest(
    @NotBlank @Size(max = 32) String channelType,
    @NotBlank @Size(max = 64) String identifier,
    MessageKind messageKind,
    @NotNull @Size(max = 4096) String rawValue,
    @Size(max = 128) String profileName) {

  ChannelIdentity channel() {
    return new ChannelIdentity(channelType.trim(), identifier.trim());
  }

  InboundEvent toEvent() {
    return new InboundEvent(channel(), messageKind, rawValue, profileName);
  }
}
