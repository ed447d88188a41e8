package kb.core.retrieval;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import kb.core.store.RemoteChunk;

/** Retrieved chunks packed into a bounded prompt context, with the files they came from. */
record ContextWindow(String text, List<String> sources) {
  static final String CHUNK_SEPARATOR = "\n\n---\n\n";

  boolean isEmpty() {
    return text.isEmpty();
  }

  /**
   * Concatenates chunks in the given order. A chunk that would cross {@code maxChars} is dropped
   * whole and assembly stops there; only a first chunk that alone exceeds the limit is cut.
   */
  static ContextWindow assemble(List<RemoteChunk> chunks, int maxChars) {
    StringBuilder out = new StringBuilder();
    Set<String> sources = new LinkedHashSet<>();
    int number = 0;

    for (RemoteChunk chunk : chunks == null ? List.<RemoteChunk>of() : chunks) {
      if (chunk == null || chunk.text() == null || chunk.text().isBlank()) {
        continue;
      }
      number++;
      String rendered = "[Chunk #" + number + "]\n" + chunk.text().trim();
      String piece = out.length() == 0 ? rendered : CHUNK_SEPARATOR + rendered;

      if (out.length() + piece.length() > maxChars) {
        if (out.length() == 0) {
          out.append(rendered, 0, maxChars);
          sources.add(sourceName(chunk));
        }
        break;
      }
      out.append(piece);
      sources.add(sourceName(chunk));
    }

    return new ContextWindow(out.toString(), List.copyOf(new ArrayList<>(sources)));
  }

  private static String sourceName(RemoteChunk chunk) {
    if (chunk.filename() != null && !chunk.filename().isBlank()) {
      return chunk.filename().trim();
    }
    return chunk.fileId();
  }
}
