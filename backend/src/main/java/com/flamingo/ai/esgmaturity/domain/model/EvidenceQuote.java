package com.flamingo.ai.esgmaturity.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;
import lombok.Builder;

/**
 * A verbatim excerpt cited to back a theme score.
 *
 * @param evidenceId stable id of this quote
 * @param documentId id of the ranked text unit the quote was taken from
 * @param quote verbatim text, bounded in words
 * @param page 1-based page of the source span
 * @param offset character offset of the quote in the document text
 * @param theme rubric theme the quote was extracted for
 * @param contentHash SHA-256 hex of the whitespace-normalised quote
 * @param publishedOn publication date of the source report, if known
 */
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EvidenceQuote(
    String evidenceId,
    String documentId,
    String quote,
    int page,
    int offset,
    String theme,
    String contentHash,
    LocalDate publishedOn) {}
