package dev.beacon.search;

import java.time.LocalDate;
import java.util.List;

/**
 * Reranked retrieval outcome for one request.
 *
 * @param query the query text sent to the retrieval store (question plus school name, if any)
 * @param dateSensitive whether the question was classified as date-sensitive
 * @param referenceNow the day passages were classified against
 * @param passages classified passages in final order
 */
public record RetrievedContext(
    String query, boolean dateSensitive, LocalDate referenceNow, List<ClassifiedPassage> passages) {

  /** Compact constructor making the passage list unmodifiable. */
  public RetrievedContext {
    passages = List.copyOf(passages);
  }

  public boolean isEmpty() {
    return passages.isEmpty();
  }
}
