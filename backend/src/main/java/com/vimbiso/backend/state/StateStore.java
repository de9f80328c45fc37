package com.vimbiso.backend.state;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value persistence with per-key TTL and versioned compare-and-set. The store owns the version
 * counter: an absent key has version {@code 0} and every accepted write increments it by one.
 * Writes are linearizable per key and never partially applied; an expired key is gone for good.
 */
public interface StateStore {

  Optional<StoredState> get(String key);

  /** Unconditionally writes {@code payload}, returning the stored value with its new version. */
  StoredState set(String key, String payload, Duration ttl);

  /**
   * Writes {@code payload} only if the key's current version equals {@code expectedVersion}.
   */
  CompareAndSetResult compareAndSet(
      String key, long expectedVersion, String payload, Duration ttl);
}
