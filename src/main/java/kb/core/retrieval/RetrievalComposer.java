package kb.core.retrieval;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import kb.core.errors.KnowledgeBaseException;
import kb.core.errors.PreconditionException;
import kb.core.errors.RemoteStoreException;
import kb.core.errors.ValidationException;
import kb.core.store.CompletionMessage;
import kb.core.store.CompletionPort;
import kb.core.store.KnowledgeStorePort;
import kb.core.store.RemoteChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers a question from an index: similarity search, bounded context assembly with source
 * attribution, then one grounded completion call. Reads the index, never mutates it.
 */
public class RetrievalComposer {
  private static final Logger LOGGER = LoggerFactory.getLogger(RetrievalComposer.class);

  public static final String NO_CONTEXT_MARKER = "NO RELEVANT CONTEXT FOUND";
  public static final String NO_INFORMATION_ANSWER =
      "I don't have that information in my knowledge base.";

  static final String GROUNDING_INSTRUCTION =
      String.join(
          "\n",
          "You are a helpful assistant that answers questions using ONLY the knowledge base context provided.",
          "Rules:",
          "- Use only information from the supplied context.",
          "- If the context is insufficient, say \"" + NO_INFORMATION_ANSWER + "\" instead of guessing.",
          "- Be precise, concise and friendly.",
          "- Answer in the same language as the question.");

  private final KnowledgeStorePort store;
  private final CompletionPort completions;
  private final RetrievalSettings settings;

  public RetrievalComposer(
      KnowledgeStorePort store, CompletionPort completions, RetrievalSettings settings) {
    this.store = Objects.requireNonNull(store, "store must not be null.");
    this.completions = Objects.requireNonNull(completions, "completions must not be null.");
    this.settings = settings == null ? RetrievalSettings.defaults() : settings;
  }

  public QueryResult query(String queryText, String indexId, String model) {
    return query(queryText, indexId, model, QueryOptions.none());
  }

  public QueryResult query(String queryText, String indexId, String model, QueryOptions options) {
    return query(queryText, indexId, model, settings.topK(), settings.maxContextChars(), options);
  }

  public QueryResult query(
      String queryText, String indexId, String model, int topK, int maxContextChars) {
    return query(queryText, indexId, model, topK, maxContextChars, QueryOptions.none());
  }

  public QueryResult query(
      String queryText,
      String indexId,
      String model,
      int topK,
      int maxContextChars,
      QueryOptions options) {
    if (indexId == null || indexId.isBlank()) {
      throw new PreconditionException("No index selected. Create or select an index first.");
    }
    if (queryText == null || queryText.isBlank()) {
      throw new ValidationException("Query text is required.");
    }
    if (topK <= 0) {
      throw new ValidationException("topK must be positive.");
    }
    if (maxContextChars <= 0) {
      throw new ValidationException("maxContextChars must be positive.");
    }

    QueryOptions safeOptions = options == null ? QueryOptions.none() : options;
    String question = queryText.trim();
    String effectiveModel = model == null || model.isBlank() ? settings.defaultModel() : model.trim();

    List<RemoteChunk> chunks = store.search(indexId.trim(), question, topK);
    List<RemoteChunk> ranked = chunks.size() > topK ? chunks.subList(0, topK) : chunks;
    ContextWindow window = ContextWindow.assemble(ranked, maxContextChars);
    QueryOutcome outcome = window.isEmpty() ? QueryOutcome.NO_CONTEXT : QueryOutcome.ANSWERED;
    LOGGER.debug(
        "Search on index {} returned {} chunk(s); context {} chars from {} source(s)",
        indexId,
        chunks.size(),
        window.text().length(),
        window.sources().size());

    String answer =
        complete(
            effectiveModel,
            buildMessages(question, window, safeOptions),
            safeOptions.temperature());
    if (answer.isBlank()) {
      answer = NO_INFORMATION_ANSWER;
    }
    return new QueryResult(answer, window.sources(), window.text(), outcome, effectiveModel);
  }

  private String complete(String model, List<CompletionMessage> messages, Double temperature) {
    try {
      String text = completions.complete(model, messages, temperature);
      return text == null ? "" : text.trim();
    } catch (KnowledgeBaseException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new RemoteStoreException("Completion request failed: " + e.getMessage(), e);
    }
  }

  static List<CompletionMessage> buildMessages(String question, ContextWindow window) {
    return buildMessages(question, window, QueryOptions.none());
  }

  /**
   * Instruction, retrieved context, optional additional context, earlier turns, then the
   * question.
   */
  static List<CompletionMessage> buildMessages(
      String question, ContextWindow window, QueryOptions options) {
    List<CompletionMessage> messages = new ArrayList<>();
    messages.add(CompletionMessage.system(GROUNDING_INSTRUCTION));
    if (window.isEmpty()) {
      messages.add(
          CompletionMessage.system(
              "KNOWLEDGE BASE CONTEXT:\n\n" + NO_CONTEXT_MARKER + ". No information is available."));
    } else {
      messages.add(CompletionMessage.system("KNOWLEDGE BASE CONTEXT:\n\n" + window.text()));
    }
    if (options.additionalContext() != null) {
      messages.add(CompletionMessage.system("ADDITIONAL CONTEXT:\n" + options.additionalContext()));
    }
    messages.addAll(options.history());
    messages.add(CompletionMessage.user(question));
    return List.copyOf(messages);
  }
}
