package dev.beacon.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for knowledge-base retrieval.
 *
 * <p>Properties are bound from {@code beacon.retrieval.*} in application.yml.
 *
 * <ul>
 *   <li>{@code district-domain} - domain of the district-wide site, always queried (default
 *       orcuttschools.net)
 *   <li>{@code district-results} - passages requested from the district domain (default 40,
 *       bounded [1, 100])
 *   <li>{@code school-results} - passages requested from a selected school's domain (default 10,
 *       bounded [1, 100])
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "beacon.retrieval")
public class RetrievalProperties {

  private String districtDomain = "orcuttschools.net";
  private int districtResults = 40;
  private int schoolResults = 10;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (districtDomain == null || districtDomain.isBlank()) {
      throw new IllegalStateException("beacon.retrieval.district-domain must not be blank");
    }
    if (districtResults < 1 || districtResults > 100) {
      throw new IllegalStateException(
          "beacon.retrieval.district-results must be in [1, 100], got: " + districtResults);
    }
    if (schoolResults < 1 || schoolResults > 100) {
      throw new IllegalStateException(
          "beacon.retrieval.school-results must be in [1, 100], got: " + schoolResults);
    }
  }

  public String getDistrictDomain() {
    return districtDomain;
  }

  public void setDistrictDomain(String districtDomain) {
    this.districtDomain = districtDomain;
  }

  public int getDistrictResults() {
    return districtResults;
  }

  public void setDistrictResults(int districtResults) {
    this.districtResults = districtResults;
  }

  public int getSchoolResults() {
    return schoolResults;
  }

  public void setSchoolResults(int schoolResults) {
    this.schoolResults = schoolResults;
  }
}
