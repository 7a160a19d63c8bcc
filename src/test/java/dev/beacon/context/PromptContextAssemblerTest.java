package dev.beacon.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.beacon.fixture.PassageBuilder;
import dev.beacon.school.School;
import dev.beacon.school.SchoolDirectory;
import dev.beacon.school.SchoolProperties;
import dev.beacon.search.ClassifiedPassage;
import dev.beacon.search.DateRelevance;
import dev.beacon.search.Passage;
import dev.beacon.search.SourceType;
import java.util.List;
import org.junit.jupiter.api.Test;

class PromptContextAssemblerTest {

  private static final SchoolDirectory SCHOOLS = schools();

  private static SchoolDirectory schools() {
    var props = new SchoolProperties();
    props.setSchools(List.of(new School("Lakeview Junior High", "lakeview.orcuttschools.net")));
    return new SchoolDirectory(props);
  }

  private static ClassifiedPassage website(Passage passage) {
    return new ClassifiedPassage(passage, SourceType.WEBSITE, DateRelevance.NO_DATES);
  }

  private static ClassifiedPassage archive(Passage passage) {
    return new ClassifiedPassage(passage, SourceType.ARCHIVE, DateRelevance.ONLY_PAST_DATES);
  }

  @Test
  void blocksCarryHeaderFieldsAndText() {
    var assembler = new PromptContextAssembler(6000, SCHOOLS);
    Passage page =
        new PassageBuilder()
            .origin("https://lakeview.orcuttschools.net/pta")
            .domain("lakeview.orcuttschools.net")
            .text("PTA meets monthly in the library.")
            .build();

    PromptContext context = assembler.assemble(List.of(website(page)));

    assertThat(context.text())
        .startsWith(
            "[Source 1]: Meeting Date: NA source_url: https://lakeview.orcuttschools.net/pta "
                + "School Domain: Lakeview Junior High \n PTA meets monthly in the library.");
  }

  @Test
  void sourcesAreNumberedInRerankedOrder() {
    var assembler = new PromptContextAssembler(6000, SCHOOLS);
    Passage page = new PassageBuilder().origin("https://orcuttschools.net/staff").build();
    Passage minutes =
        new PassageBuilder()
            .origin("https://orcuttschools.net/board/minutes")
            .storageLocator("s3://kb/board/2019-03-05.pdf")
            .meetingDate("2019-03-05")
            .build();

    PromptContext context = assembler.assemble(List.of(website(page), archive(minutes)));

    assertThat(context.text()).contains("[Source 2]: Meeting Date: 2019-03-05");
    assertThat(context.text().indexOf("[Source 1]"))
        .isLessThan(context.text().indexOf("[Source 2]"));
    assertThat(context.citations())
        .containsExactly(
            new SourceCitation("Source 1", "https://orcuttschools.net/staff", null, "Source 1"),
            new SourceCitation(
                "Source 2",
                "https://orcuttschools.net/board/minutes",
                "s3://kb/board/2019-03-05.pdf",
                "2019-03-05.pdf"));
  }

  @Test
  void missingOriginIsReportedAsNotAvailable() {
    var assembler = new PromptContextAssembler(6000, SCHOOLS);
    Passage orphan = new PassageBuilder().origin("").build();

    PromptContext context = assembler.assemble(List.of(website(orphan)));

    assertThat(context.text()).contains("source_url: NA");
    assertThat(context.citations().get(0).url()).isNull();
  }

  @Test
  void budgetDropsLeastPreferredPassages() {
    // Each block is ~70 chars (18 tokens): two fit in 40 tokens, the third does not
    var assembler = new PromptContextAssembler(40, SCHOOLS);
    Passage first = new PassageBuilder().origin("a").text("First").build();
    Passage second = new PassageBuilder().origin("b").text("Second").build();
    Passage third = new PassageBuilder().origin("c").text("Third").build();

    PromptContext context =
        assembler.assemble(List.of(website(first), website(second), archive(third)));

    assertThat(context.text()).contains("First").contains("Second").doesNotContain("Third");
    assertThat(context.citations()).hasSize(2);
  }

  @Test
  void firstPassageIsTruncatedWhenItExceedsBudget() {
    var assembler = new PromptContextAssembler(10, SCHOOLS);
    Passage longPage = new PassageBuilder().text("x".repeat(500)).build();

    PromptContext context = assembler.assemble(List.of(website(longPage)));

    assertThat(context.text()).hasSize(40);
    assertThat(context.citations()).hasSize(1);
  }

  @Test
  void emptyInputYieldsEmptyContext() {
    var assembler = new PromptContextAssembler(6000, SCHOOLS);

    assertThat(assembler.assemble(List.of()).isEmpty()).isTrue();
    assertThat(assembler.assemble(null).text()).isEmpty();
  }

  @Test
  void nonPositiveBudgetIsRejected() {
    assertThatThrownBy(() -> new PromptContextAssembler(0, SCHOOLS))
        .isInstanceOf(IllegalStateException.class);
  }
}
