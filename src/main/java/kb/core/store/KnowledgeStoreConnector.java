package kb.core.store;

public interface KnowledgeStoreConnector {
  /**
   * Builds remote bindings for the given key and verifies connectivity before returning.
   *
   * @throws kb.core.errors.AuthenticationException when the remote service rejects the key
   * @throws kb.core.errors.RemoteStoreException when the service cannot be reached
   */
  RemoteServices connect(String apiKey);
}
