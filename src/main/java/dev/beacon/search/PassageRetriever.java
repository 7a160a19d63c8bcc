package dev.beacon.search;

import java.util.List;

/**
 * Port to the knowledge-base retrieval store. Implementations return passages in the store's own
 * relevance order; the store owns scoring.
 */
public interface PassageRetriever {

  /**
   * Retrieves passages indexed under one site domain.
   *
   * @param query the retrieval query text
   * @param domain the site domain to restrict results to
   * @param maxResults the maximum number of passages to return
   * @return passages in descending relevance order
   */
  List<Passage> retrieve(String query, String domain, int maxResults);
}
