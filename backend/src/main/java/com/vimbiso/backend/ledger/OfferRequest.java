package com.vimbiso.backend.ledger;

import java.math.BigDecimal;

public record OfferRequest(
    String issuerAccountId, String receiverAccountId, BigDecimal amount, String denomination) {}
