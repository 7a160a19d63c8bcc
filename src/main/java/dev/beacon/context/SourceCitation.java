package dev.beacon.context;

import org.jspecify.annotations.Nullable;

/**
 * Citation for one passage included in a prompt context.
 *
 * @param label the label the passage carries in the context ("Source 3")
 * @param url the original page or document URL, or null when unknown
 * @param storageUri the stored copy's location, or null for website pages
 * @param filename the last path segment of {@code storageUri}, or {@code label} when there is none
 */
public record SourceCitation(
    String label, @Nullable String url, @Nullable String storageUri, String filename) {}
