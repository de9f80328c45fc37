package com.vimbiso.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.bot")
public class BotProperties {

  /** Denomination new members are onboarded with. */
  @NotBlank private String defaultDenomination = "USD";

  /** Number of ledger entries shown per page. */
  @Min(1)
  @Max(50)
  private int ledgerPageSize = 7;

  @Valid private final Webhook webhook = new Webhook();

  public String getDefaultDenomination() {
    return defaultDenomination;
  }

  public void setDefaultDenomination(String defaultDenomination) {
    this.defaultDenomination = defaultDenomination;
  }

  public int getLedgerPageSize() {
    return ledgerPageSize;
  }

  public void setLedgerPageSize(int ledgerPageSize) {
    this.ledgerPageSize = ledgerPageSize;
  }

  public Webhook getWebhook() {
    return webhook;
  }

  public static class Webhook {

    /** Exposes the normalized event endpoint. */
    private boolean enabled = true;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }
  }
}
