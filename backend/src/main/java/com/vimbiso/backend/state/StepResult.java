package com.vimbiso.backend.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Normalized output of one flow step. Values are kept as strings so a result survives a JSON round
 * trip unchanged; numeric values use their plain decimal form.
 */
public final class StepResult {

  private final Map<String, String> values;

  private StepResult(Map<String, String> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  @JsonCreator
  public static StepResult of(Map<String, String> values) {
    return new StepResult(values == null ? Map.of() : values);
  }

  public static StepResult of(String key, String value) {
    return new StepResult(Map.of(key, value));
  }

  public static Builder builder() {
    return new Builder();
  }

  @JsonValue
  public Map<String, String> values() {
    return values;
  }

  public Optional<String> find(String key) {
    return Optional.ofNullable(values.get(key));
  }

  public String get(String key) {
    String value = values.get(key);
    if (value == null) {
      throw new IllegalStateException("Step result has no value for '" + key + "'");
    }
    return value;
  }

  public BigDecimal decimal(String key) {
    return new BigDecimal(get(key));
  }

  @Override
  public boolean equals(Object other) {
    return this == other || (other instanceof StepResult that && values.equals(that.values));
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "StepResult" + values;
  }

  public static final class Builder {

    private final Map<String, String> values = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(String key, String value) {
      if (value != null) {
        values.put(key, value);
      }
      return this;
    }

    public Builder put(String key, BigDecimal value) {
      return put(key, value == null ? null : value.toPlainString());
    }

    public StepResult build() {
      return new StepResult(values);
    }
  }
}
