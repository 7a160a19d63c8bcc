package dev.beacon.search;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@link PassageRetriever} backed by a LangChain4j {@link EmbeddingStore}.
 *
 * <p>Embeds the query with the in-process bge-small-en-v1.5 model and passes the raw query text
 * alongside it for the store's lexical side (hybrid search). Filters on the {@code domain}
 * metadata key and maps each match to a {@link Passage}. Text-segment metadata written at
 * ingestion time:
 *
 * <ul>
 *   <li>{@code source_url} - origin of the page or document
 *   <li>{@code storage_uri} - location of the stored copy (archival documents)
 *   <li>{@code domain} - site domain the content belongs to
 *   <li>{@code meeting_date} - meeting date for board minutes, when known
 * </ul>
 */
@Service
public class EmbeddingStorePassageRetriever implements PassageRetriever {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingStorePassageRetriever.class);

  /**
   * BGE query prefix recommended by the bge-small-en-v1.5 model documentation. Prepended to
   * queries only, never to indexed passages.
   */
  static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  static final String SOURCE_URL = "source_url";
  static final String STORAGE_URI = "storage_uri";

  private static final List<String> CARRIED_METADATA =
      List.of(Passage.DOMAIN, Passage.MEETING_DATE);

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final EmbeddingModel embeddingModel;

  public EmbeddingStorePassageRetriever(
      EmbeddingStore<TextSegment> embeddingStore, EmbeddingModel embeddingModel) {
    this.embeddingStore = embeddingStore;
    this.embeddingModel = embeddingModel;
  }

  @Override
  public List<Passage> retrieve(String query, String domain, int maxResults) {
    Embedding queryEmbedding = embeddingModel.embed(BGE_QUERY_PREFIX + query).content();

    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            .query(query)
            .maxResults(maxResults)
            .filter(metadataKey(Passage.DOMAIN).isEqualTo(domain))
            .build();

    List<EmbeddingMatch<TextSegment>> matches = embeddingStore.search(request).matches();
    log.debug("Retrieved {} passages for domain {}", matches.size(), domain);
    return matches.stream().map(EmbeddingStorePassageRetriever::toPassage).toList();
  }

  static Passage toPassage(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = match.embedded();
    Metadata metadata = segment.metadata();

    Map<String, String> carried = new HashMap<>();
    for (String key : CARRIED_METADATA) {
      String value = metadata.getString(key);
      if (value != null) {
        carried.put(key, value);
      }
    }

    return new Passage(
        segment.text(),
        Objects.requireNonNullElse(metadata.getString(SOURCE_URL), ""),
        metadata.getString(STORAGE_URI),
        match.score(),
        carried);
  }
}
