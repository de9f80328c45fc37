package com.vimbiso.backend.ledger;

import java.util.List;

/** One page of account history. {@code hasMore} is set when the service returned an extra row. */
public record LedgerPage(List<LedgerEntry> entries, boolean hasMore) {}
