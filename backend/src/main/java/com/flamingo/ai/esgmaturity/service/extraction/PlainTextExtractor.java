package com.flamingo.ai.esgmaturity.service.extraction;

import com.flamingo.ai.esgmaturity.domain.model.ResolvedDocument;
import com.flamingo.ai.esgmaturity.domain.model.TextSpan;
import com.flamingo.ai.esgmaturity.exception.ExtractionException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Reads UTF-8 text. A form feed starts a new page and a blank line starts a new span. Span offsets
 * are character offsets into the whole decoded document, form feeds included.
 *
 * <p>Span ids have the form {@code <first 12 hex of content hash>:<page>:<offset>}.
 */
@Component
@Order(100)
@Slf4j
public class PlainTextExtractor implements TextExtractor {

  private static final Pattern BLANK_LINE = Pattern.compile("\\n\\s*\\n");
  private static final char PAGE_BREAK = '\f';

  @Override
  public boolean supports(String contentType) {
    return contentType.startsWith("text/") || contentType.equals("application/json");
  }

  @Override
  public List<TextSpan> extract(ResolvedDocument document) {
    String text;
    try {
      text = new String(Files.readAllBytes(document.contentPath()), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ExtractionException(
          document.contentHash(), "Failed to read " + document.contentPath(), e);
    }
    return split(document.contentHash(), text);
  }

  /** Splits decoded text into page-aware spans. */
  public static List<TextSpan> split(String documentHash, String text) {
    List<TextSpan> spans = new ArrayList<>();
    String idPrefix = documentHash.substring(0, Math.min(12, documentHash.length()));
    int pageStart = 0;
    int page = 1;
    while (true) {
      int pageBreak = text.indexOf(PAGE_BREAK, pageStart);
      int pageEnd = pageBreak < 0 ? text.length() : pageBreak;
      Matcher blank = BLANK_LINE.matcher(text).region(pageStart, pageEnd);
      int cursor = pageStart;
      while (blank.find()) {
        addSpan(spans, idPrefix, documentHash, page, text, cursor, blank.start());
        cursor = blank.end();
      }
      addSpan(spans, idPrefix, documentHash, page, text, cursor, pageEnd);
      if (pageBreak < 0) {
        break;
      }
      pageStart = pageBreak + 1;
      page++;
    }
    return spans;
  }

  private static void addSpan(
      List<TextSpan> spans,
      String idPrefix,
      String documentHash,
      int page,
      String text,
      int from,
      int to) {
    while (from < to && Character.isWhitespace(text.charAt(from))) {
      from++;
    }
    while (to > from && Character.isWhitespace(text.charAt(to - 1))) {
      to--;
    }
    if (from == to) {
      return;
    }
    String spanId = idPrefix + ":" + page + ":" + from;
    spans.add(new TextSpan(spanId, documentHash, page, from, text.substring(from, to)));
  }
}
