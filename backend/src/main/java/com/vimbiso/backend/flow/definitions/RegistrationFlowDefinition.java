package com.vimbiso.backend.flow.definitions;

import com.vimbiso.backend.config.BotProperties;
import com.vimbiso.backend.flow.FlowDefinition;
import com.vimbiso.backend.flow.FlowType;
import com.vimbiso.backend.flow.StepContext;
import com.vimbiso.backend.flow.StepDefinition;
import com.vimbiso.backend.ledger.LedgerApiClient;
import com.vimbiso.backend.messaging.api.OutboundMessage;
import com.vimbiso.backend.state.StepResult;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Onboards a member the ledger does not know yet. Names already known from the channel profile
 * are not asked for again.
 */
@Component
public class RegistrationFlowDefinition implements FlowDefinition {

  static final String FIRSTNAME = "firstname";
  static final String LASTNAME = "lastname";

  static final Pattern NAME_PATTERN = Pattern.compile("^\\p{L}[\\p{L} '\\-]{0,49}$");

  private final LedgerApiClient ledgerApiClient;
  private final BotProperties properties;
  private final List<StepDefinition> steps;

  public RegistrationFlowDefinition(LedgerApiClient ledgerApiClient, BotProperties properties) {
    this.ledgerApiClient = ledgerApiClient;
    this.properties = properties;
    this.steps =
        List.of(
            nameStep(
                FIRSTNAME,
                "Welcome to VimbisoPay! Let's set up your account.\n\nWhat is your first name?"),
            nameStep(LASTNAME, "Thanks! What is your last name?"));
  }

  /**
   * Start context for a new member, pre-filled from the channel's display name when it holds a
   * usable first and last name.
   */
  public static Map<String, String> contextFromProfileName(@Nullable String profileName) {
    Map<String, String> context = new LinkedHashMap<>();
    if (!StringUtils.hasText(profileName)) {
      return context;
    }
    String[] parts = profileName.trim().split("\\s+", 2);
    if (NAME_PATTERN.matcher(parts[0]).matches()) {
      context.put(FIRSTNAME, capitalize(parts[0]));
    }
    if (parts.length > 1 && NAME_PATTERN.matcher(parts[1]).matches()) {
      context.put(LASTNAME, capitalize(parts[1]));
    }
    return context;
  }

  @Override
  public FlowType type() {
    return FlowType.REGISTRATION;
  }

  @Override
  public List<StepDefinition> steps() {
    return steps;
  }

  @Override
  public boolean requiresAuthentication() {
    return false;
  }

  @Override
  public OutboundMessage complete(StepContext context) {
    String firstname = context.value(FIRSTNAME, FIRSTNAME).orElseThrow();
    String lastname = context.value(LASTNAME, LASTNAME).orElseThrow();
    ledgerApiClient.registerMember(
        context.session().channel(), firstname, lastname, properties.getDefaultDenomination());
    return OutboundMessage.text(
        "Welcome, " + firstname + "! Your account is ready. Send *hi* to open the menu.");
  }

  private static StepDefinition nameStep(String id, String prompt) {
    return StepDefinition.text(id)
        .when(context -> context.flow().contextValue(id).isEmpty())
        .message(context -> OutboundMessage.text(prompt))
        .validator((context, input) -> NAME_PATTERN.matcher(input).matches())
        .transformer((context, input) -> StepResult.of(id, capitalize(input)))
        .invalidMessage("Please enter a name of up to 50 letters.")
        .build();
  }

  private static String capitalize(String value) {
    String trimmed = value.trim();
    return trimmed.substring(0, 1).toUpperCase(Locale.ROOT) + trimmed.substring(1);
  }
}
