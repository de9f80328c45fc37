package com.vimbiso.backend.flow;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Registry of the compiled-in flow definitions. */
@Component
public class FlowCatalog {

  private final Map<FlowType, FlowDefinition> definitions = new EnumMap<>(FlowType.class);

  public FlowCatalog(List<FlowDefinition> definitions) {
    for (FlowDefinition definition : definitions) {
      FlowDefinition previous = this.definitions.put(definition.type(), definition);
      if (previous != null) {
        throw new IllegalStateException("Duplicate flow definition for " + definition.type());
      }
    }
  }

  public FlowDefinition definition(FlowType type) {
    FlowDefinition definition = definitions.get(type);
    if (definition == null) {
      throw new IllegalArgumentException("No flow definition registered for " + type);
    }
    return definition;
  }

  public FlowDefinition definition(String flowTypeId) {
    return definition(
        FlowType.fromId(flowTypeId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown flow type " + flowTypeId)));
  }

  public Optional<FlowStart> matchTrigger(String input) {
    if (input == null || input.isBlank()) {
      return Optional.empty();
    }
    String trimmed = input.trim();
    for (FlowDefinition definition : definitions.values()) {
      Optional<Map<String, String>> context = definition.matchTrigger(trimmed);
      if (context.isPresent()) {
        return Optional.of(new FlowStart(definition.type(), context.get()));
      }
    }
    return Optional.empty();
  }
}
