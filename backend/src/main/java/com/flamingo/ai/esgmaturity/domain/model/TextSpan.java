package com.flamingo.ai.esgmaturity.domain.model;

/**
 * A unit of extracted text with enough provenance to rebuild an evidence location.
 *
 * @param spanId stable id, unique within the document
 * @param documentHash content hash of the source document
 * @param page 1-based page number
 * @param offset character offset of the span in the document text
 * @param text span text
 */
public record TextSpan(String spanId, String documentHash, int page, int offset, String text) {}
