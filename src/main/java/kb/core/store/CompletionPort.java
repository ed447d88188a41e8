package kb.core.store;

import java.util.List;

public interface CompletionPort {
  /** {@code temperature} may be null, in which case the provider default applies. */
  String complete(String model, List<CompletionMessage> messages, Double temperature);
}
