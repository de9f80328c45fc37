package com.vimbiso.backend.state;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Ledger account a member acts on behalf of. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccountRef(String accountId, String accountName, String accountHandle) {}
