package com.flamingo.ai.esgmaturity.service.scoring;

import com.flamingo.ai.esgmaturity.config.ScoringConfig;
import com.flamingo.ai.esgmaturity.domain.model.EvidenceQuote;
import com.flamingo.ai.esgmaturity.domain.model.RankCandidate;
import com.flamingo.ai.esgmaturity.domain.model.RankedResult;
import com.flamingo.ai.esgmaturity.exception.ConfigException;
import com.flamingo.ai.esgmaturity.service.determinism.StableHash;
import com.flamingo.ai.esgmaturity.service.scoring.rubric.RubricStage;
import com.flamingo.ai.esgmaturity.service.scoring.rubric.RubricTheme;
import com.google.common.annotations.VisibleForTesting;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Cuts verbatim quotes for a theme out of the ranked top-K. Only ranked results are read, so every
 * quote's document id is a top-K id.
 *
 * <p>Whole sentences are matched against the theme's stage signals. A sentence longer than the
 * word limit is then cut to a window of that many words centred on the strongest signal.
 */
@Component
public class EvidenceExtractor {

  private static final Pattern SENTENCE = Pattern.compile("[^.!?\\n]+(?:[.!?]+|\\n|$)");
  private static final Pattern WORD = Pattern.compile("\\S+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final int maxQuotes;
  private final int quoteMaxWords;

  @Autowired
  public EvidenceExtractor(ScoringConfig scoringConfig) {
    this(
        scoringConfig.getRetrieval().getMaxQuotesPerTheme(),
        scoringConfig.getRetrieval().getQuoteMaxWords());
  }

  public EvidenceExtractor(int maxQuotes, int quoteMaxWords) {
    if (quoteMaxWords < 1) {
      throw new ConfigException("quote-max-words must be at least 1, got " + quoteMaxWords);
    }
    this.maxQuotes = maxQuotes;
    this.quoteMaxWords = quoteMaxWords;
  }

  /**
   * Extracts quotes in rank order, then sentence order.
   *
   * @param theme theme whose stage signals select sentences
   * @param topK ranked results to read from
   * @param candidatesById the ranked candidates' text and metadata
   * @return at most {@code maxQuotes} quotes
   */
  public List<EvidenceQuote> extract(
      RubricTheme theme, List<RankedResult> topK, Map<String, RankCandidate> candidatesById) {
    List<EvidenceQuote> quotes = new ArrayList<>();
    for (RankedResult result : topK) {
      RankCandidate candidate = candidatesById.get(result.documentId());
      if (candidate == null) {
        continue;
      }
      Matcher sentences = SENTENCE.matcher(candidate.text());
      while (sentences.find()) {
        if (quotes.size() >= maxQuotes) {
          return quotes;
        }
        int start = sentences.start();
        int end = sentences.end();
        while (start < end && Character.isWhitespace(candidate.text().charAt(start))) {
          start++;
        }
        String sentence = candidate.text().substring(start, end).strip();
        Optional<RubricStage.SignalSpan> signal = theme.strongestSignal(sentence);
        if (signal.isEmpty()) {
          continue;
        }
        int[] window = window(sentence, signal.get());
        quotes.add(
            toQuote(
                theme,
                candidate,
                sentence.substring(window[0], window[1]),
                candidate.offset() + start + window[0]));
      }
    }
    return quotes;
  }

  private EvidenceQuote toQuote(
      RubricTheme theme, RankCandidate candidate, String quote, int offset) {
    String normalized = WHITESPACE.matcher(quote).replaceAll(" ").trim();
    Object published = candidate.metadata().get(RankCandidate.META_PUBLISHED_ON);
    return EvidenceQuote.builder()
        .evidenceId(StableHash.shortId("ev", candidate.documentId(), offset, theme.id()))
        .documentId(candidate.documentId())
        .quote(quote)
        .page(candidate.page())
        .offset(offset)
        .theme(theme.id())
        .contentHash(StableHash.hex(normalized.getBytes(StandardCharsets.UTF_8)))
        .publishedOn(published instanceof LocalDate date ? date : null)
        .build();
  }

  /**
   * Character range of at most {@code quoteMaxWords} words around {@code signal}, spacing kept.
   * The words before and after the signal are split evenly, shifted inward at sentence edges.
   */
  @VisibleForTesting
  int[] window(String sentence, RubricStage.SignalSpan signal) {
    List<int[]> words = new ArrayList<>();
    Matcher matcher = WORD.matcher(sentence);
    while (matcher.find()) {
      words.add(new int[] {matcher.start(), matcher.end()});
    }
    if (words.size() <= quoteMaxWords) {
      return new int[] {0, sentence.length()};
    }
    int first = 0;
    while (first < words.size() - 1 && words.get(first)[1] <= signal.start()) {
      first++;
    }
    int last = first;
    while (last < words.size() - 1 && words.get(last + 1)[0] < signal.end()) {
      last++;
    }
    int from;
    int signalWords = last - first + 1;
    if (signalWords >= quoteMaxWords) {
      from = first;
    } else {
      from = Math.max(0, first - (quoteMaxWords - signalWords) / 2);
      from = Math.min(from, words.size() - quoteMaxWords);
    }
    int to = from + quoteMaxWords - 1;
    return new int[] {words.get(from)[0], words.get(to)[1]};
  }
}
