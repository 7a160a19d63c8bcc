package dev.beacon.search;

import static dev.beacon.fixture.PassageBuilder.passage;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.beacon.context.PromptContext;
import dev.beacon.context.PromptContextAssembler;
import dev.beacon.fixture.PassageBuilder;
import dev.beacon.school.School;
import dev.beacon.school.SchoolDirectory;
import dev.beacon.school.SchoolProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ContextRetrievalServiceTest {

  private static final String DISTRICT = "orcuttschools.net";
  private static final String LAKEVIEW = "lakeview.orcuttschools.net";

  @Mock PassageRetriever passageRetriever;

  SchoolDirectory schools;
  ContextRetrievalService service;

  @BeforeEach
  void setUp() {
    SchoolProperties schoolProps = new SchoolProperties();
    schoolProps.setSchools(List.of(new School("Lakeview Junior High", LAKEVIEW)));

    RetrievalProperties retrievalProps = new RetrievalProperties();
    retrievalProps.setDistrictDomain(DISTRICT);
    retrievalProps.setDistrictResults(40);
    retrievalProps.setSchoolResults(10);

    SourceAwareReranker reranker =
        new SourceAwareReranker(
            new RerankProperties(),
            Clock.fixed(Instant.parse("2024-01-01T18:00:00Z"), ZoneId.of("America/Los_Angeles")));

    schools = new SchoolDirectory(schoolProps);
    service = new ContextRetrievalService(passageRetriever, reranker, schools, retrievalProps);
  }

  @Test
  void districtWideQuestionQueriesOnlyDistrictDomain() {
    Passage pdf = passage("https://orcuttschools.net/minutes.pdf", "Minutes");
    Passage page = passage("https://orcuttschools.net/staff", "Staff");
    when(passageRetriever.retrieve("Who is the superintendent?", DISTRICT, 40))
        .thenReturn(List.of(pdf, page));

    RetrievedContext context =
        service.retrieve(new RetrievalRequest("Who is the superintendent?"));

    assertThat(context.passages()).extracting(ClassifiedPassage::passage).containsExactly(page, pdf);
    assertThat(context.dateSensitive()).isFalse();
    assertThat(context.referenceNow()).isEqualTo(LocalDate.of(2024, 1, 1));
    verify(passageRetriever, never()).retrieve(anyString(), eq(LAKEVIEW), anyInt());
  }

  @Test
  void selectedSchoolIsAppendedToQueryAndMergedBeforeReranking() {
    String query = "When is the next meeting? Lakeview Junior High";
    Passage districtPdf = passage("https://orcuttschools.net/agenda.pdf", "Agenda 12/15/2099");
    Passage districtPast = passage("https://orcuttschools.net/news", "Meeting 01/05/2020");
    Passage schoolPage = passage("https://lakeview.orcuttschools.net/pta", "PTA 02/02/2099");
    when(passageRetriever.retrieve(query, DISTRICT, 40))
        .thenReturn(List.of(districtPdf, districtPast));
    when(passageRetriever.retrieve(query, LAKEVIEW, 10)).thenReturn(List.of(schoolPage));

    RetrievedContext context =
        service.retrieve(new RetrievalRequest("When is the next meeting?", "lakeview junior high"));

    assertThat(context.query()).isEqualTo(query);
    assertThat(context.dateSensitive()).isTrue();
    assertThat(context.passages())
        .extracting(ClassifiedPassage::passage)
        .containsExactly(schoolPage, districtPast, districtPdf);
  }

  @Test
  void schoolWebsitePageLeadsDistrictArchivesAndSurvivesTokenBudget() {
    String query = "Bus routes Lakeview Junior High";
    List<Passage> districtPdfs =
        IntStream.range(0, 40)
            .mapToObj(
                i ->
                    new PassageBuilder()
                        .origin("https://orcuttschools.net/board/minutes-" + i + ".pdf")
                        .domain(DISTRICT)
                        .text("Board minutes " + i + ". " + "Budget review of routes. ".repeat(40))
                        .build())
            .toList();
    Passage schoolPage =
        new PassageBuilder()
            .origin("https://lakeview.orcuttschools.net/transportation")
            .domain(LAKEVIEW)
            .text("Lakeview bus routes leave from the north lot at 7:40.")
            .build();
    when(passageRetriever.retrieve(query, DISTRICT, 40)).thenReturn(districtPdfs);
    when(passageRetriever.retrieve(query, LAKEVIEW, 10)).thenReturn(List.of(schoolPage));

    RetrievedContext context =
        service.retrieve(new RetrievalRequest("Bus routes", "Lakeview Junior High"));
    PromptContext prompt = new PromptContextAssembler(6000, schools).assemble(context.passages());

    assertThat(context.passages()).hasSize(41);
    assertThat(context.passages().get(0).passage()).isEqualTo(schoolPage);
    assertThat(context.passages().get(0).sourceType()).isEqualTo(SourceType.WEBSITE);
    assertThat(prompt.citations()).hasSizeLessThan(41);
    assertThat(prompt.citations().get(0).url())
        .isEqualTo("https://lakeview.orcuttschools.net/transportation");
    assertThat(prompt.text()).startsWith("[Source 1]").contains("north lot at 7:40");
  }

  @Test
  void unknownSchoolIsRejected() {
    assertThatThrownBy(
            () -> service.retrieve(new RetrievalRequest("Lunch menu", "Hogwarts Academy")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown school: Hogwarts Academy");
  }

  @Test
  void failingDomainContributesNoPassages() {
    String query = "Bus routes Lakeview Junior High";
    Passage schoolPage = passage("https://lakeview.orcuttschools.net/bus", "Bus routes");
    when(passageRetriever.retrieve(query, DISTRICT, 40))
        .thenThrow(new IllegalStateException("store unavailable"));
    when(passageRetriever.retrieve(query, LAKEVIEW, 10)).thenReturn(List.of(schoolPage));

    RetrievedContext context =
        service.retrieve(new RetrievalRequest("Bus routes", "Lakeview Junior High"));

    assertThat(context.passages()).extracting(ClassifiedPassage::passage).containsExactly(schoolPage);
  }

  @Test
  void noResultsYieldsEmptyContext() {
    when(passageRetriever.retrieve("Parking", DISTRICT, 40)).thenReturn(List.of());

    RetrievedContext context = service.retrieve(new RetrievalRequest("Parking", "None"));

    assertThat(context.isEmpty()).isTrue();
  }
}
