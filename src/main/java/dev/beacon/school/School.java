package dev.beacon.school;

/**
 * A school served by the assistant and the site domain its pages are indexed under.
 *
 * @param name display name, as selected by the user (e.g. "Lakeview Junior High")
 * @param domain site domain used as the retrieval filter (e.g. "lakeview.orcuttschools.net")
 */
public record School(String name, String domain) {

  /** Compact constructor validating input. */
  public School {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("School name must not be blank");
    }
    if (domain == null || domain.isBlank()) {
      throw new IllegalArgumentException("School domain must not be blank for " + name);
    }
    name = name.trim();
    domain = domain.trim();
  }
}
