package com.vimbiso.backend.web;

import com.vimbiso.backend.audit.AuditEvent;
import com.vimbiso.backend.audit.FlowAuditLogger;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/bot/audit")
public class FlowAuditController {

  private final FlowAuditLogger auditLogger;

  public FlowAuditController(FlowAuditLogger auditLogger) {
    this.auditLogger = auditLogger;
  }

  @GetMapping("/{flowId}")
  public List<AuditEvent> history(@PathVariable String flowId) {
    if (!StringUtils.hasText(flowId)) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "flowId must not be blank");
    }
    List<AuditEvent> events = auditLogger.history(flowId);
    if (events.isEmpty()) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No audit history for " + flowId);
    }
    return events;
  }
}
