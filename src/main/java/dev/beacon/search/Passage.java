package dev.beacon.search;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * One retrieved unit of knowledge-base content, as returned by the retrieval store.
 *
 * <p>Passages are immutable. Reranking reorders them and never rewrites any field; derived
 * classifications are carried alongside in {@link ClassifiedPassage}.
 *
 * @param text the retrieved content body
 * @param origin the source locator (website URL or document path); empty when unknown
 * @param storageLocator optional secondary locator of the stored copy (e.g. an object-store URI)
 * @param relevanceScore the similarity score assigned by the retrieval store (never recomputed)
 * @param metadata additional string metadata carried through from the store (e.g. {@code domain},
 *     {@code meeting_date})
 */
public record Passage(
    String text,
    String origin,
    @Nullable String storageLocator,
    double relevanceScore,
    Map<String, String> metadata) {

  public static final String DOMAIN = "domain";
  public static final String MEETING_DATE = "meeting_date";

  /** Compact constructor normalising nulls to empty values. */
  public Passage {
    text = text == null ? "" : text;
    origin = origin == null ? "" : origin.trim();
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /** Convenience constructor for passages without a storage locator or metadata. */
  public Passage(String text, String origin, double relevanceScore) {
    this(text, origin, null, relevanceScore, Map.of());
  }

  /**
   * Returns the metadata value stored under {@code key}.
   *
   * @param key the metadata key
   * @return the value, or null when absent
   */
  public @Nullable String metadataValue(String key) {
    return metadata.get(key);
  }
}
