package com.vimbiso.backend.state;

/** Serialized value of a store key together with the version the store assigned to it. */
public record StoredState(String payload, long version) {}
