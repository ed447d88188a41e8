package kb.platform.adapters.local;

import java.util.List;
import kb.core.errors.RemoteStoreException;
import kb.core.retrieval.RetrievalComposer;
import kb.core.store.CompletionMessage;
import kb.core.store.CompletionPort;

/**
 * Deterministic completion stub. Answers the last user message with the first context line when
 * context was supplied, and with the no-information answer otherwise. Temperature is ignored.
 */
public class LocalCompletionAdapter implements CompletionPort {
  private static final int MAX_EXCERPT_CHARS = 360;

  private final boolean failAlways;

  public LocalCompletionAdapter(boolean failAlways) {
    this.failAlways = failAlways;
  }

  @Override
  public String complete(String model, List<CompletionMessage> messages, Double temperature) {
    if (failAlways) {
      throw new RemoteStoreException("Injected completion failure (kb.local.failCompletions=true).");
    }

    String context = null;
    String question = "";
    for (CompletionMessage message : messages) {
      if (message.role() == CompletionMessage.Role.USER) {
        question = message.content().trim();
      } else if (message.role() == CompletionMessage.Role.SYSTEM
          && (message.content().contains("[Chunk #")
              || message.content().contains(RetrievalComposer.NO_CONTEXT_MARKER))) {
        context = message.content();
      }
    }

    if (context == null || context.contains(RetrievalComposer.NO_CONTEXT_MARKER)) {
      return RetrievalComposer.NO_INFORMATION_ANSWER;
    }

    StringBuilder out = new StringBuilder();
    out.append("Local answer (deterministic stub) to: ").append(question).append("\n\n");
    out.append(firstExcerpt(context));
    return out.toString();
  }

  private static String firstExcerpt(String context) {
    for (String line : context.split("\n")) {
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("[Chunk #") || trimmed.equals("---")) {
        continue;
      }
      if (trimmed.startsWith("KNOWLEDGE BASE CONTEXT")) {
        continue;
      }
      return trimmed.length() > MAX_EXCERPT_CHARS ? trimmed.substring(0, MAX_EXCERPT_CHARS) : trimmed;
    }
    return "";
  }
}
