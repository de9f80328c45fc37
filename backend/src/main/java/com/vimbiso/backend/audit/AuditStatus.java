package com.vimbiso.backend.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AuditStatus {
  SUCCESS,
  FAILURE,
  IN_PROGRESS;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static AuditStatus fromValue(String value) {
    return AuditStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
