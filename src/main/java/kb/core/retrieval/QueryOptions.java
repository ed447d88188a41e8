package kb.core.retrieval;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import kb.core.errors.ValidationException;
import kb.core.store.CompletionMessage;

/**
 * Optional inputs of a query: earlier conversation turns, free text placed next to the retrieved
 * context, and the sampling temperature. Prior turns are user or assistant messages only.
 */
public record QueryOptions(
    List<CompletionMessage> history, String additionalContext, Double temperature) {
  public static final double MIN_TEMPERATURE = 0.0;
  public static final double MAX_TEMPERATURE = 2.0;

  private static final QueryOptions NONE = new QueryOptions(List.of(), null, null);

  public QueryOptions {
    history = history == null ? List.of() : List.copyOf(validTurns(history));
    additionalContext =
        additionalContext == null || additionalContext.isBlank() ? null : additionalContext.trim();
    if (temperature != null
        && (temperature.isNaN()
            || temperature < MIN_TEMPERATURE
            || temperature > MAX_TEMPERATURE)) {
      throw new ValidationException(
          "temperature must be between " + MIN_TEMPERATURE + " and " + MAX_TEMPERATURE + ".");
    }
  }

  public static QueryOptions none() {
    return NONE;
  }

  /** Parses a conversation turn given by role name ({@code user} or {@code assistant}). */
  public static CompletionMessage turn(String role, String content) {
    if (role == null || role.isBlank()) {
      throw new ValidationException("History message role is required.");
    }
    return switch (role.trim().toLowerCase(Locale.ROOT)) {
      case "user" -> CompletionMessage.user(content);
      case "assistant" -> CompletionMessage.assistant(content);
      default -> throw new ValidationException(
          "Unsupported history role: " + role + ". Use user or assistant.");
    };
  }

  private static List<CompletionMessage> validTurns(List<CompletionMessage> history) {
    List<CompletionMessage> turns = new ArrayList<>(history.size());
    for (CompletionMessage message : history) {
      if (message == null || message.role() == null) {
        throw new ValidationException("History messages need a role.");
      }
      if (message.role() == CompletionMessage.Role.SYSTEM) {
        throw new ValidationException("History may only contain user and assistant messages.");
      }
      if (message.content() == null || message.content().isBlank()) {
        throw new ValidationException("History messages need content.");
      }
      turns.add(message);
    }
    return turns;
  }
}
