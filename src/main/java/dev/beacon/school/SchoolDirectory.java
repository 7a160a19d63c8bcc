package dev.beacon.school;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Lookup between school display names and the site domains their content is indexed under.
 *
 * <p>Name lookups ignore case and surrounding whitespace. Duplicate names are rejected at startup.
 */
@Component
public class SchoolDirectory {

  private final Map<String, School> byName = new LinkedHashMap<>();

  public SchoolDirectory(SchoolProperties properties) {
    for (School school : properties.getSchools()) {
      School previous = byName.putIfAbsent(key(school.name()), school);
      if (previous != null) {
        throw new IllegalStateException("Duplicate school in beacon.schools: " + school.name());
      }
    }
  }

  /**
   * Looks up a school by display name.
   *
   * @param name the school display name (nullable)
   * @return the configured school with its canonical name, or empty if the name is unknown
   */
  public Optional<School> find(@Nullable String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(byName.get(key(name)));
  }

  /**
   * Reverse lookup from a site domain to the school's display name.
   *
   * @param domain the site domain (nullable)
   * @return the school name, or empty if no configured school uses that domain
   */
  public Optional<String> schoolForDomain(@Nullable String domain) {
    if (domain == null || domain.isBlank()) {
      return Optional.empty();
    }
    return byName.values().stream()
        .filter(s -> s.domain().equalsIgnoreCase(domain.trim()))
        .map(School::name)
        .findFirst();
  }

  public List<School> schools() {
    return List.copyOf(byName.values());
  }

  private static String key(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
