package com.vimbiso.backend.flow;

import java.math.BigDecimal;

public record ParsedAmount(BigDecimal amount, String denomination) {

  public String display() {
    return amount.toPlainString() + " " + denomination;
  }
}
