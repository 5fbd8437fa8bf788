package com.flamingo.ai.esgmaturity.service.extraction;

import com.flamingo.ai.esgmaturity.domain.model.ResolvedDocument;
import com.flamingo.ai.esgmaturity.domain.model.TextSpan;
import com.flamingo.ai.esgmaturity.exception.ExtractionException;
import com.google.common.annotations.VisibleForTesting;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Routes a resolved document to the first {@link TextExtractor} that supports its content type. */
@Service
@RequiredArgsConstructor
@Slf4j
public class TextExtractorRouter {

  private final List<TextExtractor> extractors;

  public TextExtractor route(String contentType) {
    String normalized = normalize(contentType);
    return extractors.stream()
        .filter(e -> e.supports(normalized))
        .findFirst()
        .orElseThrow(
            () ->
                new ExtractionException(
                    null, "No text extractor for content type: " + contentType));
  }

  /**
   * Extracts spans from the document with the routed extractor.
   *
   * @throws ExtractionException if no extractor supports the type or extraction fails
   */
  public List<TextSpan> extract(ResolvedDocument document) {
    String contentType = document.source().contentType();
    TextExtractor extractor;
    try {
      extractor = route(contentType);
    } catch (ExtractionException e) {
      throw new ExtractionException(document.contentHash(), e.getMessage(), e);
    }
    List<TextSpan> spans = extractor.extract(document);
    log.debug(
        "Extracted {} spans from {} with {}",
        spans.size(),
        document.contentPath().getFileName(),
        extractor.getClass().getSimpleName());
    return spans;
  }

  @VisibleForTesting
  static String normalize(String contentType) {
    if (contentType == null) {
      return "";
    }
    int semicolon = contentType.indexOf(';');
    String base = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
    return base.trim().toLowerCase(Locale.ROOT);
  }
}
