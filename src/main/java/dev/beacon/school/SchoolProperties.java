package dev.beacon.school;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Schools configured under {@code beacon.schools}, in display order.
 *
 * <pre>{@code
 * beacon:
 *   schools:
 *     - name: Lakeview Junior High
 *       domain: lakeview.orcuttschools.net
 * }</pre>
 */
@Configuration
@ConfigurationProperties(prefix = "beacon")
public class SchoolProperties {

  private List<School> schools = new ArrayList<>();

  public List<School> getSchools() {
    return schools;
  }

  public void setSchools(List<School> schools) {
    this.schools = schools;
  }
}
