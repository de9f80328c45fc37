package com.vimbiso.backend.flow;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses amounts such as {@code 5}, {@code 53.22 ZWG} or {@code CAD 5.18}. A bare number is in
 * {@link #DEFAULT_DENOMINATION}.
 */
public final class AmountParser {

  public static final String DEFAULT_DENOMINATION = "USD";
  public static final Set<String> DENOMINATIONS = Set.of("USD", "ZWG", "XAU", "CAD");

  private static final Pattern AMOUNT =
      Pattern.compile(
          "^(?:([A-Z]{3})\\s+(\\d+(?:\\.\\d+)?)|(\\d+(?:\\.\\d+)?)\\s+([A-Z]{3})|(\\d+(?:\\.\\d+)?))$");

  private AmountParser() {}

  public static Optional<ParsedAmount> parse(String input) {
    if (input == null) {
      return Optional.empty();
    }
    Matcher matcher = AMOUNT.matcher(input.trim().toUpperCase(Locale.ROOT));
    if (!matcher.matches()) {
      return Optional.empty();
    }
    String denomination;
    String amount;
    if (matcher.group(1) != null) {
      denomination = matcher.group(1);
      amount = matcher.group(2);
    } else if (matcher.group(3) != null) {
      amount = matcher.group(3);
      denomination = matcher.group(4);
    } else {
      amount = matcher.group(5);
      denomination = DEFAULT_DENOMINATION;
    }
    if (!DENOMINATIONS.contains(denomination)) {
      return Optional.empty();
    }
    BigDecimal value = new BigDecimal(amount);
    if (value.signum() <= 0) {
      return Optional.empty();
    }
    return Optional.of(new ParsedAmount(value, denomination));
  }
}
