package com.vimbiso.backend.messaging.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Button or list row offered to the user; {@code id} comes back as the inbound raw value. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageOption(String id, String title, String description) {

  public static MessageOption of(String id, String title) {
    return new MessageOption(id, title, null);
  }
}
