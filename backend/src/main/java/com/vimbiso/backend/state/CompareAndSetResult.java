package com.vimbiso.backend.state;

import java.util.Optional;
import org.springframework.lang.Nullable;

/**
 * Outcome of {@link StateStore#compareAndSet}. When the write was rejected {@code current} holds
 * what the store had at that moment; an absent current value means the key did not exist.
 */
public record CompareAndSetResult(boolean applied, @Nullable StoredState current) {

  public static CompareAndSetResult applied(StoredState written) {
    return new CompareAndSetResult(true, written);
  }

  public static CompareAndSetResult rejected(@Nullable StoredState current) {
    return new CompareAndSetResult(false, current);
  }

  public Optional<StoredState> currentValue() {
    return Optional.ofNullable(current);
  }

  public long currentVersion() {
    return current == null ? 0L : current.version();
  }
}
