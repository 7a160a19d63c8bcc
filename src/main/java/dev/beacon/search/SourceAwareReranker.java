package dev.beacon.search;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Post-retrieval reranker that puts live website content ahead of archival documents and, for
 * date-sensitive questions, upcoming dates ahead of past ones.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Classify every passage by {@link SourceType} and {@link DateRelevance}
 *   <li>Partition into website and archive groups, keeping the upstream order in each
 *   <li>If the question is date-sensitive, stable-sort each group by {@link DateRelevance}
 *       declaration order; the upstream order stays the tie-break
 *   <li>Return the website group followed by the archive group
 * </ol>
 *
 * <p>The result is always a permutation of the input. Past-dated passages are moved down, never
 * removed. Relevance scores are not consulted.
 *
 * @see DateExtractor
 * @see SourceTypeClassifier
 * @see QueryIntentClassifier
 */
@Service
public class SourceAwareReranker {

  private static final Logger log = LoggerFactory.getLogger(SourceAwareReranker.class);

  private static final Comparator<ClassifiedPassage> BY_DATE_RELEVANCE =
      Comparator.comparing(ClassifiedPassage::dateRelevance);

  private final QueryIntentClassifier queryIntentClassifier;
  private final SourceTypeClassifier sourceTypeClassifier;
  private final Clock clock;

  public SourceAwareReranker(RerankProperties properties, Clock clock) {
    this.queryIntentClassifier = new QueryIntentClassifier(properties.getDateKeywords());
    this.sourceTypeClassifier = new SourceTypeClassifier(properties.getArchiveExtensions());
    this.clock = clock;
  }

  /**
   * Reranks passages against today's date in the configured clock zone.
   *
   * @param passages retrieved passages in upstream relevance order
   * @param query the raw user question
   * @return the reordered passages
   */
  public List<Passage> rerank(@Nullable List<Passage> passages, @Nullable String query) {
    return rerank(passages, query, today());
  }

  /**
   * Reranks passages against an explicit reference day.
   *
   * @param passages retrieved passages in upstream relevance order
   * @param query the raw user question
   * @param referenceNow the current calendar day
   * @return the reordered passages, same length as the input
   */
  public List<Passage> rerank(
      @Nullable List<Passage> passages, @Nullable String query, LocalDate referenceNow) {
    return rerankClassified(passages, isDateSensitive(query), referenceNow).stream()
        .map(ClassifiedPassage::passage)
        .toList();
  }

  /**
   * Reranks passages and returns them with the labels that determined their position.
   *
   * @param passages retrieved passages in upstream relevance order (null is treated as empty)
   * @param dateSensitive whether the question was classified as date-sensitive
   * @param referenceNow the current calendar day
   * @return classified passages in final order
   */
  public List<ClassifiedPassage> rerankClassified(
      @Nullable List<Passage> passages, boolean dateSensitive, LocalDate referenceNow) {
    if (passages == null || passages.isEmpty()) {
      return List.of();
    }

    List<ClassifiedPassage> website = new ArrayList<>();
    List<ClassifiedPassage> archive = new ArrayList<>();

    for (Passage passage : passages) {
      ClassifiedPassage classified = classify(passage, referenceNow);
      if (classified.sourceType() == SourceType.WEBSITE) {
        website.add(classified);
      } else {
        archive.add(classified);
      }
    }

    if (dateSensitive) {
      // List.sort is stable: equal labels keep the upstream order
      website.sort(BY_DATE_RELEVANCE);
      archive.sort(BY_DATE_RELEVANCE);
    }

    log.info(
        "Reranked passages: {} website, {} archive (dateSensitive={}, referenceNow={})",
        website.size(),
        archive.size(),
        dateSensitive,
        referenceNow);

    List<ClassifiedPassage> reranked = new ArrayList<>(website.size() + archive.size());
    reranked.addAll(website);
    reranked.addAll(archive);
    return List.copyOf(reranked);
  }

  /**
   * Computes the labels of a single passage.
   *
   * @param passage the passage to classify
   * @param referenceNow the current calendar day
   * @return the passage with its source type and date relevance
   */
  public ClassifiedPassage classify(Passage passage, LocalDate referenceNow) {
    ClassifiedPassage classified =
        new ClassifiedPassage(
            passage,
            sourceTypeClassifier.classifyPassage(passage),
            DateRelevanceClassifier.classify(passage.text(), referenceNow));
    log.debug(
        "Classified '{}' as {} / {}",
        passage.origin(),
        classified.sourceType(),
        classified.dateRelevance());
    return classified;
  }

  /** Checks whether the question asks about dates or events. */
  public boolean isDateSensitive(@Nullable String query) {
    return queryIntentClassifier.isDateQuery(query);
  }

  /** Returns the current calendar day, read from the clock on every call. */
  public LocalDate today() {
    return LocalDate.now(clock);
  }
}
