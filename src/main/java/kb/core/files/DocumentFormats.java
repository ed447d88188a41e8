package kb.core.files;

import java.util.Locale;
import java.util.Set;

public final class DocumentFormats {
  private static final Set<String> SUPPORTED_EXTENSIONS = Set.of("pdf", "md", "txt");
  private static final Set<String> PLAIN_TEXT_EXTENSIONS = Set.of("md", "txt");

  private DocumentFormats() {}

  public static boolean isSupported(String filename) {
    String extension = extension(filename);
    return extension != null && SUPPORTED_EXTENSIONS.contains(extension);
  }

  /** Whether the remote store can hand the file back as plain text. */
  public static boolean isPlainText(String filename) {
    String extension = extension(filename);
    return extension != null && PLAIN_TEXT_EXTENSIONS.contains(extension);
  }

  public static String describeSupported() {
    return ".pdf, .md or .txt";
  }

  static String extension(String filename) {
    if (filename == null) {
      return null;
    }
    String normalized = filename.trim().replace('\\', '/');
    int lastSlash = normalized.lastIndexOf('/');
    if (lastSlash >= 0) {
      normalized = normalized.substring(lastSlash + 1);
    }
    int lastDot = normalized.lastIndexOf('.');
    if (lastDot < 0 || lastDot == normalized.length() - 1) {
      return null;
    }
    return normalized.substring(lastDot + 1).toLowerCase(Locale.ROOT);
  }
}
