package dev.beacon.search;

import java.time.LocalDate;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Labels a set of extracted dates relative to a reference day.
 *
 * <p>The reference day is a call parameter rather than a clock read, so the same content can be
 * classified differently on different days and tests can pin any day they like.
 */
public final class DateRelevanceClassifier {

  private DateRelevanceClassifier() {}

  /**
   * Classifies a set of dates against {@code referenceNow}.
   *
   * <ul>
   *   <li>{@link DateRelevance#NO_DATES} when the set is empty
   *   <li>{@link DateRelevance#HAS_FUTURE_DATES} when any date is on or after {@code
   *       referenceNow} (today counts as current)
   *   <li>{@link DateRelevance#ONLY_PAST_DATES} otherwise
   * </ul>
   *
   * @param dates the extracted dates
   * @param referenceNow the current calendar day
   * @return the date relevance label
   */
  public static DateRelevance classify(Set<LocalDate> dates, LocalDate referenceNow) {
    if (dates.isEmpty()) {
      return DateRelevance.NO_DATES;
    }
    for (LocalDate date : dates) {
      if (!date.isBefore(referenceNow)) {
        return DateRelevance.HAS_FUTURE_DATES;
      }
    }
    return DateRelevance.ONLY_PAST_DATES;
  }

  /** Extracts the dates in {@code text} and classifies them against {@code referenceNow}. */
  public static DateRelevance classify(@Nullable String text, LocalDate referenceNow) {
    return classify(DateExtractor.extractDates(text), referenceNow);
  }
}
