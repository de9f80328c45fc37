package com.vimbiso.backend.support;

import com.vimbiso.backend.state.InMemoryStateStore;
import com.vimbiso.backend.state.StateManager;
import com.vimbiso.backend.state.StateProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;

public final class TestStateManagers {

  private TestStateManagers() {}

  /** State manager over a fresh process-local store. */
  public static StateManager inMemory(Clock clock) {
    return new StateManager(
        new InMemoryStateStore(clock),
        TestObjectMappers.create(),
        new StateProperties(),
        clock,
        new SimpleMeterRegistry());
  }
}
