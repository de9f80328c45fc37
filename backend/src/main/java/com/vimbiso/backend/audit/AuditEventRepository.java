package com.vimbiso.backend.audit;

import java.util.List;

/** Storage for audit history. Implementations bound the history they keep per flow. */
public interface AuditEventRepository {

  void append(AuditEvent event);

  List<AuditEvent> findByFlowId(String flowId);
}
