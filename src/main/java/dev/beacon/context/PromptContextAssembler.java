package dev.beacon.context;

import dev.beacon.school.SchoolDirectory;
import dev.beacon.search.ClassifiedPassage;
import dev.beacon.search.Passage;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns reranked passages into numbered source blocks within a configurable token budget.
 *
 * <p>Each passage becomes a block headed {@code [Source N]: Meeting Date: ... source_url: ...
 * School Domain: ...} followed by its text. Blocks are added in reranked order until the next one
 * would exceed the budget, so the budget always cuts from the least preferred end.
 *
 * <p>Tokens are estimated as chars / 4. If even the first block exceeds the budget it is included
 * but truncated at the character level, so a non-empty input never yields an empty context.
 */
@Component
public class PromptContextAssembler {

  private static final double CHARS_PER_TOKEN = 4.0;
  private static final String NOT_AVAILABLE = "NA";

  private final int tokenBudget;
  private final SchoolDirectory schoolDirectory;

  public PromptContextAssembler(
      @Value("${beacon.context.token-budget:6000}") int tokenBudget,
      SchoolDirectory schoolDirectory) {
    if (tokenBudget < 1) {
      throw new IllegalStateException(
          "beacon.context.token-budget must be positive, got: " + tokenBudget);
    }
    this.tokenBudget = tokenBudget;
    this.schoolDirectory = schoolDirectory;
  }

  /**
   * Assembles the prompt context for the given passages.
   *
   * @param passages reranked passages, most preferred first
   * @return context text and citations for every included passage
   */
  public PromptContext assemble(@Nullable List<ClassifiedPassage> passages) {
    if (passages == null || passages.isEmpty()) {
      return PromptContext.EMPTY;
    }

    StringBuilder output = new StringBuilder();
    List<SourceCitation> citations = new ArrayList<>();
    int estimatedTokens = 0;

    for (int i = 0; i < passages.size(); i++) {
      Passage passage = passages.get(i).passage();
      String formatted = formatBlock(i + 1, passage);
      int blockTokens = estimateTokens(formatted);

      if (i == 0 && blockTokens > tokenBudget) {
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(formatted, 0, Math.min(maxChars, formatted.length()));
        citations.add(citationFor(i + 1, passage));
        break;
      }

      if (estimatedTokens + blockTokens > tokenBudget) {
        break;
      }

      output.append(formatted);
      citations.add(citationFor(i + 1, passage));
      estimatedTokens += blockTokens;
    }

    return new PromptContext(output.toString(), citations);
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String formatBlock(int index, Passage passage) {
    String meetingDate = orNotAvailable(passage.metadataValue(Passage.MEETING_DATE));
    String sourceUrl = orNotAvailable(passage.origin());
    String school =
        schoolDirectory.schoolForDomain(passage.metadataValue(Passage.DOMAIN)).orElse(NOT_AVAILABLE);
    return "[Source %d]: Meeting Date: %s source_url: %s School Domain: %s \n %s\n\n"
        .formatted(index, meetingDate, sourceUrl, school, passage.text());
  }

  static SourceCitation citationFor(int index, Passage passage) {
    String label = "Source " + index;
    String url = passage.origin().isEmpty() ? null : passage.origin();
    String storageUri = passage.storageLocator();
    String filename = label;
    if (storageUri != null && !storageUri.isBlank()) {
      String lastSegment = storageUri.substring(storageUri.lastIndexOf('/') + 1);
      if (!lastSegment.isBlank()) {
        filename = lastSegment;
      }
    }
    return new SourceCitation(label, url, storageUri, filename);
  }

  private static String orNotAvailable(@Nullable String value) {
    return value == null || value.isBlank() ? NOT_AVAILABLE : value;
  }
}
