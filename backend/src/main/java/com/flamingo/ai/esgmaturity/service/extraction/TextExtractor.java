package com.flamingo.ai.esgmaturity.service.extraction;

import com.flamingo.ai.esgmaturity.domain.model.ResolvedDocument;
import com.flamingo.ai.esgmaturity.domain.model.TextSpan;
import java.util.List;

/**
 * Turns a resolved report into text spans that carry page and character offset, so every quote
 * cut from them can be located again in the source.
 *
 * <p>Implementations are Spring beans picked by {@link TextExtractorRouter} in {@code @Order}
 * order. To support another format, register a new implementation with a lower order value.
 */
public interface TextExtractor {

  /**
   * Extracts spans in document order.
   *
   * @param document the resolved report
   * @return spans, possibly empty
   * @throws com.flamingo.ai.esgmaturity.exception.ExtractionException if the content is unreadable
   */
  List<TextSpan> extract(ResolvedDocument document);

  /**
   * @param contentType normalised MIME type without parameters
   * @return {@code true} if this extractor can read the type
   */
  boolean supports(String contentType);
}
