package com.vimbiso.backend.state;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.state")
public class StateProperties {

  /** Inactivity window after which a session expires. */
  @NotNull private Duration ttl = Duration.ofMinutes(5);

  /** Prefix for session keys in the store. */
  @NotBlank private String keyPrefix = "channel:";

  /** Bound on the load-merge-write cycle when the stored version keeps changing. */
  @Min(1)
  private int maxUpdateAttempts = 3;

  /** Backing store for sessions. */
  @NotNull private StoreType store = StoreType.REDIS;

  public Duration getTtl() {
    return ttl;
  }

  public void setTtl(Duration ttl) {
    this.ttl = ttl;
  }

  public String getKeyPrefix() {
    return keyPrefix;
  }

  public void setKeyPrefix(String keyPrefix) {
    this.keyPrefix = keyPrefix;
  }

  public int getMaxUpdateAttempts() {
    return maxUpdateAttempts;
  }

  public void setMaxUpdateAttempts(int maxUpdateAttempts) {
    this.maxUpdateAttempts = maxUpdateAttempts;
  }

  public StoreType getStore() {
    return store;
  }

  public void setStore(StoreType store) {
    this.store = store;
  }

  public enum StoreType {
    REDIS,
    MEMORY
  }
}
