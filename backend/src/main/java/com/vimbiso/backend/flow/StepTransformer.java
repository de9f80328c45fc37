package com.vimbiso.backend.flow;

import com.vimbiso.backend.state.StepResult;

/**
 * Turns validated input into the step's result. May call the ledger; throws {@link
 * StepInputException} when the input turns out to be unusable after all.
 */
@FunctionalInterface
public interface StepTransformer {

  StepResult apply(StepContext context, String input);
}
