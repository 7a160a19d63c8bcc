package dev.beacon.search;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * Keyword heuristic deciding whether a question is date-sensitive (asks about schedules, events,
 * deadlines).
 *
 * <p>A vocabulary term matches when it appears in the query starting at a word boundary, case
 * insensitive: {@code "events"} matches {@code event}, {@code "update"} does not match {@code
 * date}. A false positive only adds a harmless date-ordering pass.
 */
public class QueryIntentClassifier {

  /** Temporal vocabulary used when none is configured. */
  public static final List<String> DEFAULT_KEYWORDS =
      List.of(
          "when",
          "schedule",
          "calendar",
          "date",
          "dates",
          "conference",
          "deadline",
          "event",
          "holiday",
          "meeting",
          "upcoming",
          "next",
          "time",
          "semester",
          "break",
          "graduation",
          "registration",
          "enrollment");

  private final Pattern vocabulary;

  /**
   * Creates a classifier over the given vocabulary.
   *
   * @param keywords the temporal vocabulary; must contain at least one non-blank term
   */
  public QueryIntentClassifier(Collection<String> keywords) {
    List<String> terms =
        keywords.stream()
            .filter(k -> k != null && !k.isBlank())
            .map(k -> k.trim().toLowerCase(Locale.ROOT))
            .distinct()
            .toList();
    if (terms.isEmpty()) {
      throw new IllegalArgumentException("Date keyword vocabulary must not be empty");
    }
    this.vocabulary =
        Pattern.compile(
            "\\b(?:" + terms.stream().map(Pattern::quote).collect(Collectors.joining("|")) + ")",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }

  /** Returns a classifier over {@link #DEFAULT_KEYWORDS}. */
  public static QueryIntentClassifier withDefaults() {
    return new QueryIntentClassifier(DEFAULT_KEYWORDS);
  }

  /**
   * Checks whether the query asks about dates or events.
   *
   * @param query the raw user question
   * @return true if any vocabulary term occurs in the query
   */
  public boolean isDateQuery(@Nullable String query) {
    if (query == null || query.isBlank()) {
      return false;
    }
    return vocabulary.matcher(query).find();
  }
}
