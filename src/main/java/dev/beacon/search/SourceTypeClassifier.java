package dev.beacon.search;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Decides whether a passage came from a live website or an archival document.
 *
 * <p>An origin is {@link SourceType#ARCHIVE} only on a positive signal: the origin ends with an
 * archival extension, or the storage locator contains one. Everything else, including a missing
 * origin, is {@link SourceType#WEBSITE}.
 */
public class SourceTypeClassifier {

  /** Archival extensions used when none are configured. */
  public static final List<String> DEFAULT_ARCHIVE_EXTENSIONS = List.of(".pdf");

  private final List<String> archiveExtensions;

  public SourceTypeClassifier(Collection<String> archiveExtensions) {
    this.archiveExtensions =
        archiveExtensions.stream()
            .filter(e -> e != null && !e.isBlank())
            .map(e -> e.trim().toLowerCase(Locale.ROOT))
            .distinct()
            .toList();
  }

  public static SourceTypeClassifier withDefaults() {
    return new SourceTypeClassifier(DEFAULT_ARCHIVE_EXTENSIONS);
  }

  /**
   * Classifies an origin that has no secondary locator.
   *
   * @param origin the origin URL or path (nullable)
   * @return the source type
   */
  public SourceType classify(@Nullable String origin) {
    return classify(origin, null);
  }

  /**
   * Classifies an origin together with its storage locator.
   *
   * @param origin the origin URL or path (nullable)
   * @param storageLocator the storage locator of the stored copy (nullable)
   * @return {@link SourceType#ARCHIVE} if either locator carries an archival extension, otherwise
   *     {@link SourceType#WEBSITE}
   */
  public SourceType classify(@Nullable String origin, @Nullable String storageLocator) {
    String normalisedOrigin = origin == null ? "" : origin.trim().toLowerCase(Locale.ROOT);
    String normalisedLocator =
        storageLocator == null ? "" : storageLocator.toLowerCase(Locale.ROOT);

    for (String extension : archiveExtensions) {
      if (normalisedOrigin.endsWith(extension) || normalisedLocator.contains(extension)) {
        return SourceType.ARCHIVE;
      }
    }
    return SourceType.WEBSITE;
  }

  public SourceType classifyPassage(Passage passage) {
    return classify(passage.origin(), passage.storageLocator());
  }
}
