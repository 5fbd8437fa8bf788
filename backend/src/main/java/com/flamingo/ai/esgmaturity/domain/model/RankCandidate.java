package com.flamingo.ai.esgmaturity.domain.model;

import com.flamingo.ai.esgmaturity.exception.InvalidInputException;
import java.util.Map;

/**
 * A unit of rankable text with its precomputed lexical score. The lexical score is validated by the
 * ranker, not here, so a bad score fails the whole ranking call.
 *
 * @param documentId stable id of the text unit
 * @param text the text
 * @param lexicalScore lexical relevance, expected in [0,1]
 * @param metadata provenance such as page, offset and publication date
 */
public record RankCandidate(
    String documentId, String text, double lexicalScore, Map<String, Object> metadata) {

  public static final String META_PAGE = "page";
  public static final String META_OFFSET = "offset";
  public static final String META_PUBLISHED_ON = "published_on";

  public RankCandidate {
    if (documentId == null || documentId.isBlank()) {
      throw new InvalidInputException("documentId is required");
    }
    text = text == null ? "" : text;
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public RankCandidate(String documentId, String text, double lexicalScore) {
    this(documentId, text, lexicalScore, Map.of());
  }

  public int page() {
    return metadata.get(META_PAGE) instanceof Number n ? n.intValue() : 0;
  }

  public int offset() {
    return metadata.get(META_OFFSET) instanceof Number n ? n.intValue() : 0;
  }
}
