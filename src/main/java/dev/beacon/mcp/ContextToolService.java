package dev.beacon.mcp;

import dev.beacon.context.PromptContext;
import dev.beacon.context.PromptContextAssembler;
import dev.beacon.context.SourceCitation;
import dev.beacon.school.School;
import dev.beacon.school.SchoolDirectory;
import dev.beacon.search.ClassifiedPassage;
import dev.beacon.search.ContextRetrievalService;
import dev.beacon.search.RetrievalRequest;
import dev.beacon.search.RetrievedContext;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing Beacon retrieval as tool methods for the answer-generation agent.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * <p>{@code retrieve_context} returns the source blocks followed by a {@code Sources:} list that
 * maps each {@code [Source N]} label to its filename and locations.
 *
 * <p>Functional tools: {@code retrieve_context}, {@code explain_ranking}, {@code list_schools}.
 */
@Service
public class ContextToolService {

  private static final Logger log = LoggerFactory.getLogger(ContextToolService.class);

  private final ContextRetrievalService retrievalService;
  private final PromptContextAssembler assembler;
  private final SchoolDirectory schoolDirectory;

  public ContextToolService(
      ContextRetrievalService retrievalService,
      PromptContextAssembler assembler,
      SchoolDirectory schoolDirectory) {
    this.retrievalService = retrievalService;
    this.assembler = assembler;
    this.schoolDirectory = schoolDirectory;
  }

  /** Retrieves, reranks and assembles the prompt context for a question. */
  @Tool(
      name = "retrieve_context",
      description =
          "Retrieve district and school knowledge-base passages for a question. "
              + "Website pages come before archived PDFs; for date questions, upcoming dates "
              + "come before past ones. Returns numbered source blocks for citation.")
  public String retrieveContext(
      @ToolParam(description = "The user's question") @Nullable String question,
      @ToolParam(description = "Selected school name, or omit for district-wide", required = false)
          @Nullable String school) {
    try {
      if (question == null || question.isBlank()) {
        return "Error: Question must not be empty. Provide the user's question.";
      }
      RetrievedContext context = retrievalService.retrieve(new RetrievalRequest(question, school));
      if (context.isEmpty()) {
        return "No knowledge-base passages found for: \"" + question + "\"";
      }
      PromptContext prompt = assembler.assemble(context.passages());
      log.debug("Assembled {} source blocks for tool call", prompt.citations().size());
      return prompt.text() + formatCitations(prompt.citations());
    } catch (Exception e) {
      return "Error retrieving context: " + e.getMessage();
    }
  }

  /**
   * Renders the citation list that follows the source blocks, one line per block:
   * {@code - Source N: filename | url | storage URI}, with {@code NA} for missing locations.
   */
  static String formatCitations(List<SourceCitation> citations) {
    StringBuilder sb = new StringBuilder("Sources:\n");
    for (SourceCitation citation : citations) {
      sb.append(
          String.format(
              Locale.ROOT,
              "- %s: %s | %s | %s%n",
              citation.label(),
              citation.filename(),
              citation.url() == null ? "NA" : citation.url(),
              citation.storageUri() == null ? "NA" : citation.storageUri()));
    }
    return sb.toString();
  }

  /** Lists reranked passages with the labels that decided their position. */
  @Tool(
      name = "explain_ranking",
      description =
          "Show the reranked passage order for a question, with each passage's source type, "
              + "date relevance, retrieval score and origin.")
  public String explainRanking(
      @ToolParam(description = "The user's question") @Nullable String question,
      @ToolParam(description = "Selected school name, or omit for district-wide", required = false)
          @Nullable String school) {
    try {
      if (question == null || question.isBlank()) {
        return "Error: Question must not be empty. Provide the user's question.";
      }
      RetrievedContext context = retrievalService.retrieve(new RetrievalRequest(question, school));
      if (context.isEmpty()) {
        return "No knowledge-base passages found for: \"" + question + "\"";
      }

      StringBuilder sb = new StringBuilder();
      sb.append(
          String.format(
              Locale.ROOT,
              "Query: %s | date-sensitive: %s | reference day: %s%n",
              context.query(), context.dateSensitive(), context.referenceNow()));
      List<ClassifiedPassage> passages = context.passages();
      for (int i = 0; i < passages.size(); i++) {
        ClassifiedPassage p = passages.get(i);
        sb.append(
            String.format(
                Locale.ROOT,
                "%d. [%s/%s] score=%.3f %s%n",
                i + 1,
                p.sourceType().value(),
                p.dateRelevance().value(),
                p.passage().relevanceScore(),
                p.passage().origin().isEmpty() ? "(unknown origin)" : p.passage().origin()));
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error explaining ranking: " + e.getMessage();
    }
  }

  /** Lists the configured schools. */
  @Tool(name = "list_schools", description = "List the schools that can be selected, with domains.")
  public String listSchools() {
    List<School> schools = schoolDirectory.schools();
    if (schools.isEmpty()) {
      return "No schools configured. Questions are answered district-wide.";
    }
    StringBuilder sb = new StringBuilder();
    for (School school : schools) {
      sb.append(String.format(Locale.ROOT, "- %s (%s)%n", school.name(), school.domain()));
    }
    return sb.toString();
  }
}
