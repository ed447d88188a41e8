package kb.core.retrieval;

import java.util.List;

/**
 * Answer to one question. {@code sources} lists the contributing file names in retrieval rank
 * order without duplicates; {@code rawContext} is the context sent to the model.
 */
public record QueryResult(
    String answer, List<String> sources, String rawContext, QueryOutcome outcome, String model) {}
