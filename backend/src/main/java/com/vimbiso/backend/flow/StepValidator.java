package com.vimbiso.backend.flow;

/** Pure check of a raw input; must not change any state. */
@FunctionalInterface
public interface StepValidator {

  boolean test(StepContext context, String input);
}
