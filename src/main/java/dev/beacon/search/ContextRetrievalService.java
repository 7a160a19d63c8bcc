package dev.beacon.search;

import dev.beacon.school.School;
import dev.beacon.school.SchoolDirectory;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-request retrieval orchestration: query the knowledge base once per site domain, merge the
 * results, then rerank the merged list once.
 *
 * <p>Pipeline: resolve the selected school (if any) -> append the school name to the question ->
 * retrieve from the school domain ({@code school-results}) and the district domain ({@code
 * district-results}) -> merge with school passages ahead of district passages -> rerank with
 * {@link SourceAwareReranker}.
 *
 * <p>Reranking the merged list puts website content from both domains ahead of every archival
 * document. Within a label, the selected school's passages lead, so a downstream token budget cuts
 * district content first.
 *
 * <p>Date sensitivity is decided once per request from the user's question, before the school
 * name is appended.
 */
@Service
public class ContextRetrievalService {

  private static final Logger log = LoggerFactory.getLogger(ContextRetrievalService.class);

  private final PassageRetriever passageRetriever;
  private final SourceAwareReranker reranker;
  private final SchoolDirectory schoolDirectory;
  private final RetrievalProperties properties;

  public ContextRetrievalService(
      PassageRetriever passageRetriever,
      SourceAwareReranker reranker,
      SchoolDirectory schoolDirectory,
      RetrievalProperties properties) {
    this.passageRetriever = passageRetriever;
    this.reranker = reranker;
    this.schoolDirectory = schoolDirectory;
    this.properties = properties;
  }

  /**
   * Retrieves and reranks passages for a question.
   *
   * @param request the question and optional school selection
   * @return the reranked passages with their classification labels
   * @throws IllegalArgumentException if the selected school is not configured
   */
  public RetrievedContext retrieve(RetrievalRequest request) {
    LocalDate referenceNow = reranker.today();
    boolean dateSensitive = reranker.isDateSensitive(request.question());

    String query = request.question();
    School school = null;
    if (request.school() != null) {
      school =
          schoolDirectory
              .find(request.school())
              .orElseThrow(
                  () -> new IllegalArgumentException("Unknown school: " + request.school()));
      query = query + " " + school.name();
    }

    List<Passage> merged = new ArrayList<>();
    if (school != null && !school.domain().equalsIgnoreCase(properties.getDistrictDomain())) {
      merged.addAll(retrieveDomain(query, school.domain(), properties.getSchoolResults()));
    }
    merged.addAll(
        retrieveDomain(query, properties.getDistrictDomain(), properties.getDistrictResults()));

    List<ClassifiedPassage> passages =
        reranker.rerankClassified(merged, dateSensitive, referenceNow);

    log.info(
        "Retrieved {} passages for school={} (dateSensitive={})",
        passages.size(),
        school == null ? "none" : school.name(),
        dateSensitive);
    return new RetrievedContext(query, dateSensitive, referenceNow, passages);
  }

  /**
   * Retrieves one domain's passages in upstream order. A failing retrieval store yields no
   * passages for that domain instead of failing the whole request.
   */
  List<Passage> retrieveDomain(String query, String domain, int maxResults) {
    try {
      return passageRetriever.retrieve(query, domain, maxResults);
    } catch (RuntimeException e) {
      log.warn("Retrieval failed for domain {}: {}", domain, e.getMessage(), e);
      return List.of();
    }
  }
}
