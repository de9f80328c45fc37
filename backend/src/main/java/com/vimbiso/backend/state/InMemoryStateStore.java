package com.vimbiso.backend.state;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/** Process-local store used when Redis is disabled and in tests. */
public class InMemoryStateStore implements StateStore {

  private final Map<String, Entry> entries = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryStateStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Optional<StoredState> get(String key) {
    Entry entry = entries.computeIfPresent(key, (k, existing) -> live(existing));
    return Optional.ofNullable(entry).map(Entry::state);
  }

  @Override
  public StoredState set(String key, String payload, Duration ttl) {
    Entry written =
        entries.compute(
            key,
            (k, existing) -> {
              Entry current = live(existing);
              long version = current == null ? 1L : current.state().version() + 1;
              return new Entry(new StoredState(payload, version), expiry(ttl));
            });
    return written.state();
  }

  @Override
  public CompareAndSetResult compareAndSet(
      String key, long expectedVersion, String payload, Duration ttl) {
    AtomicReference<CompareAndSetResult> result = new AtomicReference<>();
    entries.compute(
        key,
        (k, existing) -> {
          Entry current = live(existing);
          long currentVersion = current == null ? 0L : current.state().version();
          if (currentVersion != expectedVersion) {
            result.set(CompareAndSetResult.rejected(current == null ? null : current.state()));
            return current;
          }
          Entry next = new Entry(new StoredState(payload, currentVersion + 1), expiry(ttl));
          result.set(CompareAndSetResult.applied(next.state()));
          return next;
        });
    return result.get();
  }

  private Entry live(Entry entry) {
    if (entry == null || !clock.instant().isBefore(entry.expiresAt())) {
      return null;
    }
    return entry;
  }

  private Instant expiry(Duration ttl) {
    return clock.instant().plus(ttl);
  }

  private record Entry(StoredState state, Instant expiresAt) {}
}
