package dev.beacon.school;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class SchoolDirectoryTest {

  private static SchoolDirectory directoryOf(School... schools) {
    var props = new SchoolProperties();
    props.setSchools(List.of(schools));
    return new SchoolDirectory(props);
  }

  @Test
  void findIgnoresCaseAndWhitespace() {
    var directory = directoryOf(new School("Pine Grove Elementary", "pinegrove.orcuttschools.net"));

    assertThat(directory.find("  pine grove elementary "))
        .map(School::domain)
        .contains("pinegrove.orcuttschools.net");
  }

  @Test
  void unknownOrNullNameIsEmpty() {
    var directory = directoryOf(new School("Pine Grove Elementary", "pinegrove.orcuttschools.net"));

    assertThat(directory.find("Hogwarts")).isEmpty();
    assertThat(directory.find(null)).isEmpty();
  }

  @Test
  void reverseLookupByDomain() {
    var directory =
        directoryOf(
            new School("Lakeview Junior High", "lakeview.orcuttschools.net"),
            new School("Orcutt Junior High", "ojhs.orcuttschools.net"));

    assertThat(directory.schoolForDomain("OJHS.orcuttschools.net")).contains("Orcutt Junior High");
    assertThat(directory.schoolForDomain("orcuttschools.net")).isEmpty();
    assertThat(directory.schoolForDomain(null)).isEmpty();
  }

  @Test
  void schoolsKeepConfiguredOrder() {
    var directory =
        directoryOf(
            new School("Ralph Dunlap Elementary", "ralphdunlap.orcuttschools.net"),
            new School("Alice Shaw Elementary", "aliceshaw.orcuttschools.net"));

    assertThat(directory.schools())
        .extracting(School::name)
        .containsExactly("Ralph Dunlap Elementary", "Alice Shaw Elementary");
  }

  @Test
  void duplicateNamesAreRejected() {
    assertThatThrownBy(
            () ->
                directoryOf(
                    new School("Olga Reed School K-8", "olgareed.orcuttschools.net"),
                    new School("olga reed school k-8", "other.orcuttschools.net")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Duplicate school");
  }

  @Test
  void blankDomainIsRejected() {
    assertThatThrownBy(() -> new School("Orcutt Academy K-8", " "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("School domain must not be blank for Orcutt Academy K-8");
  }
}
