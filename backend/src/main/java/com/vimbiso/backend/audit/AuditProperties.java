package com.vimbiso.backend.audit;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.audit")
public class AuditProperties {

  /** When disabled, audit events are neither logged nor stored. */
  private boolean enabled = true;

  /** How long a flow's audit history stays retrievable. */
  @NotNull private Duration historyTtl = Duration.ofHours(24);

  @Min(1)
  private int maxEventsPerFlow = 200;

  /** Keep history in Redis ({@code redis}) or in process memory ({@code memory}). */
  @NotNull private Store store = Store.REDIS;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Duration getHistoryTtl() {
    return historyTtl;
  }

  public void setHistoryTtl(Duration historyTtl) {
    this.historyTtl = historyTtl;
  }

  public int getMaxEventsPerFlow() {
    return maxEventsPerFlow;
  }

  public void setMaxEventsPerFlow(int maxEventsPerFlow) {
    this.maxEventsPerFlow = maxEventsPerFlow;
  }

  public Store getStore() {
    return store;
  }

  public void setStore(Store store) {
    this.store = store;
  }

  public enum Store {
    REDIS,
    MEMORY
  }
}
