package dev.beacon.context;

import java.util.List;

/**
 * Prompt-ready context text and the citations of the passages it contains, in the same order.
 *
 * @param text numbered source blocks, ready to embed in a prompt
 * @param citations one citation per included source block
 */
public record PromptContext(String text, List<SourceCitation> citations) {

  public static final PromptContext EMPTY = new PromptContext("", List.of());

  public PromptContext {
    citations = List.copyOf(citations);
  }

  public boolean isEmpty() {
    return citations.isEmpty();
  }
}
