package com.vimbiso.backend.flow;

import java.util.Arrays;
import java.util.Optional;

public enum FlowType {
  OFFER("offer"),
  ACCEPT("accept"),
  DECLINE("decline"),
  CANCEL("cancel"),
  UPGRADE("upgrade"),
  REGISTRATION("registration");

  private final String id;

  FlowType(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  public static Optional<FlowType> fromId(String id) {
    return Arrays.stream(values()).filter(type -> type.id.equals(id)).findFirst();
  }
}
