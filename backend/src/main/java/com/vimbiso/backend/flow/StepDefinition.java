package com.vimbiso.backend.flow;

import com.vimbiso.backend.messaging.api.OutboundMessage;
import com.vimbiso.backend.state.StepResult;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import org.springframework.util.Assert;

/**
 * One compiled-in step of a flow. Steps whose {@code condition} is false are skipped; the
 * condition is evaluated again on every input.
 */
public record StepDefinition(
    String id,
    InputKind inputKind,
    Function<StepContext, OutboundMessage> messageBuilder,
    StepValidator validator,
    StepTransformer transformer,
    Predicate<StepContext> condition,
    String invalidMessage) {

  public StepDefinition {
    Assert.hasText(id, "step id must not be blank");
    Objects.requireNonNull(inputKind, "inputKind");
    Objects.requireNonNull(messageBuilder, "messageBuilder");
    Objects.requireNonNull(validator, "validator");
    Objects.requireNonNull(transformer, "transformer");
    Objects.requireNonNull(condition, "condition");
  }

  public static Builder text(String id) {
    return new Builder(id, InputKind.TEXT);
  }

  public static Builder button(String id) {
    return new Builder(id, InputKind.BUTTON);
  }

  public static Builder list(String id) {
    return new Builder(id, InputKind.LIST);
  }

  public OutboundMessage message(StepContext context) {
    return messageBuilder.apply(context);
  }

  public boolean visible(StepContext context) {
    return condition.test(context);
  }

  public static final class Builder {

    private final String id;
    private final InputKind inputKind;
    private Function<StepContext, OutboundMessage> messageBuilder;
    private StepValidator validator = (context, input) -> !input.isBlank();
    private StepTransformer transformer;
    private Predicate<StepContext> condition = context -> true;
    private String invalidMessage = "That doesn't look right. Please try again.";

    private Builder(String id, InputKind inputKind) {
      this.id = id;
      this.inputKind = inputKind;
      this.transformer = (context, input) -> StepResult.of(id, input);
    }

    public Builder message(Function<StepContext, OutboundMessage> messageBuilder) {
      this.messageBuilder = messageBuilder;
      return this;
    }

    public Builder validator(StepValidator validator) {
      this.validator = validator;
      return this;
    }

    public Builder transformer(StepTransformer transformer) {
      this.transformer = transformer;
      return this;
    }

    public Builder when(Predicate<StepContext> condition) {
      this.condition = condition;
      return this;
    }

    public Builder invalidMessage(String invalidMessage) {
      this.invalidMessage = invalidMessage;
      return this;
    }

    public StepDefinition build() {
      return new StepDefinition(
          id, inputKind, messageBuilder, validator, transformer, condition, invalidMessage);
    }
  }
}
