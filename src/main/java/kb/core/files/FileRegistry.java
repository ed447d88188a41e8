package kb.core.files;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import kb.core.errors.UnsupportedFormatException;
import kb.core.errors.ValidationException;
import kb.core.store.KnowledgeStorePort;
import kb.core.store.RemoteFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Files uploaded during the current session, in upload order.
 *
 * <p>Entries are removed only when a file is explicitly deleted from an index; the registry has
 * no deletion operation of its own.
 */
public class FileRegistry {
  private static final Logger LOGGER = LoggerFactory.getLogger(FileRegistry.class);

  private final KnowledgeStorePort store;
  private final Clock clock;
  private final List<UploadedFile> files = new CopyOnWriteArrayList<>();

  public FileRegistry(KnowledgeStorePort store, Clock clock) {
    this.store = Objects.requireNonNull(store, "store must not be null.");
    this.clock = Objects.requireNonNull(clock, "clock must not be null.");
  }

  public UploadedFile register(byte[] content, String displayName) {
    if (content == null) {
      throw new ValidationException("File content is required.");
    }
    String name = displayName == null ? null : displayName.trim();
    if (name == null || name.isBlank()) {
      throw new ValidationException("File name is required.");
    }
    if (!DocumentFormats.isSupported(name)) {
      throw new UnsupportedFormatException(
          name, "Only " + DocumentFormats.describeSupported() + " files are allowed.");
    }

    RemoteFile remote = store.uploadFile(name, content);
    long size = remote.bytes() > 0 ? remote.bytes() : content.length;
    UploadedFile uploaded = new UploadedFile(remote.id(), name, size, Instant.now(clock));

    files.removeIf(f -> f.remoteId().equals(uploaded.remoteId()));
    files.add(uploaded);
    LOGGER.info("Registered file {} as {} ({} bytes)", name, uploaded.remoteId(), size);
    return uploaded;
  }

  public List<UploadedFile> list() {
    return List.copyOf(files);
  }

  public List<String> fileIds() {
    List<String> ids = new ArrayList<>(files.size());
    for (UploadedFile file : files) {
      ids.add(file.remoteId());
    }
    return List.copyOf(ids);
  }

  public Optional<UploadedFile> find(String remoteId) {
    if (remoteId == null) {
      return Optional.empty();
    }
    return files.stream().filter(f -> f.remoteId().equals(remoteId)).findFirst();
  }

  /** Drops the session entry for a file that was deleted from an index. */
  public boolean forget(String remoteId) {
    return remoteId != null && files.removeIf(f -> f.remoteId().equals(remoteId));
  }
}
