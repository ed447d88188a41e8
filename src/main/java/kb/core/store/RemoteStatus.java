package kb.core.store;

import java.util.Locale;

public final class RemoteStatus {
  private RemoteStatus() {}

  /** Lower-cased, trimmed status, or null when absent. */
  public static String normalize(String status) {
    if (status == null) {
      return null;
    }
    String trimmed = status.trim().toLowerCase(Locale.ROOT);
    return trimmed.isBlank() ? null : trimmed;
  }
}
