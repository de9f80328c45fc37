package com.vimbiso.backend.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single entry point for reading and writing sessions. Updates always merge into the copy read
 * immediately before the write and are committed with a versioned compare-and-set.
 */
@Service
public class StateManager {

  private static final Logger log = LoggerFactory.getLogger(StateManager.class);
  private static final String UPDATE_METRIC = "bot.state.update";

  private final StateStore store;
  private final ObjectMapper objectMapper;
  private final StateProperties properties;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  public StateManager(
      StateStore store,
      ObjectMapper objectMapper,
      StateProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.store = store;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  /** Returns the stored session, or a fresh empty one when the key is absent or expired. */
  public Session load(ChannelIdentity channel) {
    Objects.requireNonNull(channel, "channel");
    return store
        .get(key(channel))
        .map(stored -> decode(channel, stored))
        .orElseGet(() -> Session.empty(channel));
  }

  /**
   * Applies {@code update} to the latest stored session and persists the result, bumping its
   * version and refreshing the TTL.
   *
   * @throws StateInvalidException if the merged session breaks the session invariant
   * @throws StateConflictException if every attempt lost the race against another writer
   */
  public Session update(ChannelIdentity channel, SessionUpdate update) {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(update, "update");
    String key = key(channel);
    int maxAttempts = properties.getMaxUpdateAttempts();
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      Optional<StoredState> current = store.get(key);
      long expectedVersion = current.map(StoredState::version).orElse(0L);
      Session base =
          current.map(stored -> decode(channel, stored)).orElseGet(() -> Session.empty(channel));
      Session merged = update.applyTo(base).withMetadata(expectedVersion + 1, clock.instant());

      Optional<String> violation = merged.invariantViolation();
      if (violation.isPresent()) {
        record("invalid");
        log.warn(
            "session_update_rejected channel={} fields={} reason={}",
            channel.key(),
            update.fieldNames(),
            violation.get());
        throw new StateInvalidException("Session update rejected: " + violation.get());
      }

      CompareAndSetResult result =
          store.compareAndSet(key, expectedVersion, encode(merged), properties.getTtl());
      if (result.applied()) {
        record("success");
        log.debug(
            "session_updated channel={} version={} fields={}",
            channel.key(),
            merged.version(),
            update.fieldNames());
        return merged;
      }
      record("conflict");
      log.debug(
          "session_update_conflict channel={} attempt={} expectedVersion={} currentVersion={}",
          channel.key(),
          attempt,
          expectedVersion,
          result.currentVersion());
    }
    record("exhausted");
    log.warn("session_update_exhausted channel={} attempts={}", channel.key(), maxAttempts);
    throw new StateConflictException(channel.key(), maxAttempts);
  }

  /**
   * Reads a field from {@code session}. Critical fields are refused when the session does not
   * satisfy its invariant.
   */
  public <T> T getField(Session session, SessionField<T> field) {
    if (field.critical()) {
      Optional<String> violation = session.invariantViolation();
      if (violation.isPresent()) {
        throw new StateInvalidException(
            "Refusing to read " + field.name() + " from invalid session: " + violation.get());
      }
    }
    return field.read(session);
  }

  public Session clearFlow(ChannelIdentity channel) {
    return update(channel, SessionUpdate.clearFlow());
  }

  public Session resetAuthentication(ChannelIdentity channel) {
    return update(channel, SessionUpdate.resetAuthentication());
  }

  private String key(ChannelIdentity channel) {
    return properties.getKeyPrefix() + channel.key();
  }

  private Session decode(ChannelIdentity channel, StoredState stored) {
    try {
      Session session = objectMapper.readValue(stored.payload(), Session.class);
      if (!channel.equals(session.channel())) {
        log.warn(
            "session_channel_mismatch expected={} stored={}",
            channel.key(),
            session.channel() == null ? null : session.channel().key());
        return Session.empty(channel).withMetadata(stored.version(), null);
      }
      return session.withMetadata(stored.version(), session.lastUpdated());
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      log.warn("session_decode_failed channel={} error={}", channel.key(), ex.getMessage());
      return Session.empty(channel).withMetadata(stored.version(), null);
    }
  }

  private String encode(Session session) {
    try {
      return objectMapper.writeValueAsString(session);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize session " + session, ex);
    }
  }

  private void record(String outcome) {
    meterRegistry.counter(UPDATE_METRIC, "outcome", outcome).increment();
  }
}
