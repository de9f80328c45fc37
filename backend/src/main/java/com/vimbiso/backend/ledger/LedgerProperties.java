package com.vimbiso.backend.ledger;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.ledger")
public class LedgerProperties {

  /** Base URL of the ledger service API. */
  @NotBlank private String baseUrl = "http://localhost:5000/v1";

  /** Client key sent as {@code x-client-api-key} on every request. */
  private String clientApiKey;

  /** Upper bound for a single HTTP exchange. */
  @NotNull private Duration timeout = Duration.ofSeconds(30);

  @NotNull private Duration connectTimeout = Duration.ofSeconds(10);

  @Valid private final Retry retry = new Retry();

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getClientApiKey() {
    return clientApiKey;
  }

  public void setClientApiKey(String clientApiKey) {
    this.clientApiKey = clientApiKey;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public Retry getRetry() {
    return retry;
  }

  /** Retry policy for transport failures. HTTP error statuses are never retried. */
  public static class Retry {

    /** Total number of attempts, including the first one. */
    @Min(1)
    private int maxAttempts = 3;

    @NotNull private Duration delay = Duration.ofSeconds(1);

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getDelay() {
      return delay;
    }

    public void setDelay(Duration delay) {
      this.delay = delay;
    }
  }
}
