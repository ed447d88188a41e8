package kb.core.index;

import kb.core.batch.Batch;

/** A newly created index and, when initial files were given, the batch indexing them. */
public record IndexCreation(Index index, Batch batch) {}
