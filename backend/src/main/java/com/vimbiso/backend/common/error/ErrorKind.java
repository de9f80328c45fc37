package com.vimbiso.backend.common.error;

/**
 * Classification of failures that can surface while handling an inbound event. Every kind except
 * {@link #VALIDATION} aborts the active flow.
 */
public enum ErrorKind {
  /** Bad step input; the user is re-prompted on the same step. */
  VALIDATION,
  /** Concurrent writers kept invalidating the session version. */
  STATE_CONFLICT,
  /** The session violates its invariant; re-authentication is required. */
  STATE_INVALID,
  /** Login or token refresh failed. */
  AUTHENTICATION,
  /** The ledger service could not be reached. */
  NETWORK,
  /** The ledger service answered with a non-success status. */
  API,
  /** Unexpected internal fault. */
  SYSTEM;

  public boolean abortsFlow() {
    return this != VALIDATION;
  }
}
