package dev.beacon.search;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for source-aware reranking.
 *
 * <p>Properties are bound from {@code beacon.rerank.*} in application.yml.
 *
 * <ul>
 *   <li>{@code archive-extensions} - file extensions that mark an origin as an archival document
 *       (default {@code .pdf}; each must start with a dot)
 *   <li>{@code date-keywords} - vocabulary that marks a question as date-sensitive (default
 *       {@link QueryIntentClassifier#DEFAULT_KEYWORDS}; must not be empty)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "beacon.rerank")
public class RerankProperties {

  private List<String> archiveExtensions =
      new ArrayList<>(SourceTypeClassifier.DEFAULT_ARCHIVE_EXTENSIONS);
  private List<String> dateKeywords = new ArrayList<>(QueryIntentClassifier.DEFAULT_KEYWORDS);

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (archiveExtensions.isEmpty()) {
      throw new IllegalStateException("beacon.rerank.archive-extensions must not be empty");
    }
    for (String extension : archiveExtensions) {
      if (extension == null || !extension.startsWith(".") || extension.length() < 2) {
        throw new IllegalStateException(
            "beacon.rerank.archive-extensions entries must look like '.pdf', got: " + extension);
      }
    }
    if (dateKeywords.stream().allMatch(k -> k == null || k.isBlank())) {
      throw new IllegalStateException("beacon.rerank.date-keywords must not be empty");
    }
  }

  public List<String> getArchiveExtensions() {
    return archiveExtensions;
  }

  public void setArchiveExtensions(List<String> archiveExtensions) {
    this.archiveExtensions = archiveExtensions;
  }

  public List<String> getDateKeywords() {
    return dateKeywords;
  }

  public void setDateKeywords(List<String> dateKeywords) {
    this.dateKeywords = dateKeywords;
  }
}
