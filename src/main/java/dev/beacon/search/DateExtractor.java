package dev.beacon.search;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static utility that finds unambiguous calendar dates in free text.
 *
 * <p>Two families of literal formats are recognised:
 *
 * <ul>
 *   <li>numeric, month first: {@code 12/15/2099}, {@code 3-5-2099} (same separator twice)
 *   <li>written month: {@code March 5, 2099}, {@code Mar 5 2099}, {@code Sept. 21st, 2099}
 * </ul>
 *
 * <p>Only four-digit years match. Candidates that do not form a real calendar day (day 32,
 * February 30) are dropped without error, so a noisy passage yields fewer dates rather than a
 * failed request.
 */
public final class DateExtractor {

  private static final Logger log = LoggerFactory.getLogger(DateExtractor.class);

  private static final Pattern NUMERIC_DATE =
      Pattern.compile("\\b(\\d{1,2})([/-])(\\d{1,2})\\2(\\d{4})\\b");

  private static final Pattern WRITTEN_DATE =
      Pattern.compile(
          "\\b(january|february|march|april|may|june|july|august|september|october|november"
              + "|december|jan|feb|mar|apr|jun|jul|aug|sept|sep|oct|nov|dec)\\.?"
              + "\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{4})\\b",
          Pattern.CASE_INSENSITIVE);

  private static final Map<String, Integer> MONTHS =
      Map.ofEntries(
          Map.entry("jan", 1),
          Map.entry("feb", 2),
          Map.entry("mar", 3),
          Map.entry("apr", 4),
          Map.entry("may", 5),
          Map.entry("jun", 6),
          Map.entry("jul", 7),
          Map.entry("aug", 8),
          Map.entry("sep", 9),
          Map.entry("oct", 10),
          Map.entry("nov", 11),
          Map.entry("dec", 12));

  private DateExtractor() {
    // static utility
  }

  /**
   * Extracts every valid date mentioned in the text.
   *
   * @param text the passage text (null or blank yields an empty set)
   * @return unmodifiable set of dates in ascending order; duplicates collapse
   */
  public static Set<LocalDate> extractDates(@Nullable String text) {
    if (text == null || text.isBlank()) {
      return Collections.emptySortedSet();
    }

    TreeSet<LocalDate> dates = new TreeSet<>();

    Matcher numeric = NUMERIC_DATE.matcher(text);
    while (numeric.find()) {
      addIfValid(
          dates,
          numeric.group(),
          Integer.parseInt(numeric.group(4)),
          Integer.parseInt(numeric.group(1)),
          Integer.parseInt(numeric.group(3)));
    }

    Matcher written = WRITTEN_DATE.matcher(text);
    while (written.find()) {
      String monthKey = written.group(1).substring(0, 3).toLowerCase(Locale.ROOT);
      addIfValid(
          dates,
          written.group(),
          Integer.parseInt(written.group(3)),
          MONTHS.get(monthKey),
          Integer.parseInt(written.group(2)));
    }

    return Collections.unmodifiableSortedSet(dates);
  }

  private static void addIfValid(
      Set<LocalDate> dates, String candidate, int year, int month, int day) {
    try {
      dates.add(LocalDate.of(year, month, day));
    } catch (DateTimeException e) {
      log.debug("Discarding invalid date candidate '{}': {}", candidate, e.getMessage());
    }
  }
}
