package com.vimbiso.backend.flow;

import java.util.Map;

/** A recognized start command: which flow to run and the context to seed it with. */
public record FlowStart(FlowType type, Map<String, String> context) {

  public FlowStart {
    context = context == null ? Map.of() : Map.copyOf(context);
  }
}
