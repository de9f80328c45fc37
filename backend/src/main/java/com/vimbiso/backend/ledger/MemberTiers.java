package com.vimbiso.backend.ledger;

import java.math.BigDecimal;

/** Terms of the member tier subscription offered by the ledger. */
public final class MemberTiers {

  public static final int SUBSCRIPTION_TIER = 3;
  public static final int PAY_FREQUENCY_DAYS = 28;
  public static final BigDecimal SUBSCRIPTION_AMOUNT = new BigDecimal("1.00");
  public static final String SUBSCRIPTION_DENOMINATION = "USD";
  public static final String SUBSCRIBED_ACTION = "RECURRING_CREATED";

  private MemberTiers() {}
}
