package com.vimbiso.backend.audit;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class InMemoryAuditEventRepository implements AuditEventRepository {

  private static final int MAX_FLOWS = 10_000;

  private final int maxEventsPerFlow;
  private final Map<String, Deque<AuditEvent>> events =
      new LinkedHashMap<>(16, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Deque<AuditEvent>> eldest) {
          return size() > MAX_FLOWS;
        }
      };

  public InMemoryAuditEventRepository(int maxEventsPerFlow) {
    this.maxEventsPerFlow = maxEventsPerFlow;
  }

  @Override
  public synchronized void append(AuditEvent event) {
    Deque<AuditEvent> history = events.computeIfAbsent(event.flowId(), id -> new ArrayDeque<>());
    history.addLast(event);
    while (history.size() > maxEventsPerFlow) {
      history.removeFirst();
    }
  }

  @Override
  public synchronized List<AuditEvent> findByFlowId(String flowId) {
    Deque<AuditEvent> history = events.get(flowId);
    return history == null ? List.of() : List.copyOf(history);
  }
}
