package com.vimbiso.backend.state;

import org.springframework.util.Assert;

/**
 * Stable external address of a user on a messaging channel, for example a WhatsApp phone number.
 */
public record ChannelIdentity(String channelType, String identifier) {

  public ChannelIdentity {
    Assert.hasText(channelType, "channelType must not be blank");
    Assert.hasText(identifier, "identifier must not be blank");
  }

  public static ChannelIdentity whatsapp(String phone) {
    return new ChannelIdentity("whatsapp", phone);
  }

  public String key() {
    return channelType + ":" + identifier;
  }
}
