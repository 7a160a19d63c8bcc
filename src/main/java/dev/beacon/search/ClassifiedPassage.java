package dev.beacon.search;

/**
 * A passage together with the labels computed for it during one reranking call. Never persisted.
 *
 * @param passage the untouched retrieved passage
 * @param sourceType website or archive
 * @param dateRelevance temporal label relative to the request's reference day
 */
public record ClassifiedPassage(
    Passage passage, SourceType sourceType, DateRelevance dateRelevance) {}
