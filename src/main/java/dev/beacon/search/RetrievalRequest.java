package dev.beacon.search;

import org.jspecify.annotations.Nullable;

/**
 * A user question with an optional school selection.
 *
 * @param question the raw user question (must not be null or blank)
 * @param school the selected school's display name, or null for district-wide questions; blank
 *     and the literal "None" sent by the chat front end both mean no selection
 */
public record RetrievalRequest(String question, @Nullable String school) {

  private static final String NO_SCHOOL = "None";

  /** Compact constructor validating input. */
  public RetrievalRequest {
    if (question == null || question.isBlank()) {
      throw new IllegalArgumentException("Question must not be blank");
    }
    if (school != null && (school.isBlank() || NO_SCHOOL.equalsIgnoreCase(school.trim()))) {
      school = null;
    }
    if (school != null) {
      school = school.trim();
    }
  }

  /** Convenience constructor for district-wide questions. */
  public RetrievalRequest(String question) {
    this(question, null);
  }
}
