package com.flamingo.ai.esgmaturity.service.ranking;

import com.flamingo.ai.esgmaturity.domain.model.RankCandidate;
import com.flamingo.ai.esgmaturity.domain.model.TextSpan;
import com.google.common.annotations.VisibleForTesting;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Okapi BM25 over a pool of spans. Query terms are deduplicated and summed in sorted order so the
 * floating-point result does not depend on query word order. Scores are divided by the pool
 * maximum, giving [0,1].
 */
@Component
public class Bm25LexicalScorer {

  static final double K1 = 1.2;
  static final double B = 0.75;

  /**
   * Builds rank candidates for a query over the given spans.
   *
   * @param query search query
   * @param spans pool of spans, ids must be unique
   * @param publishedOn publication date of the source report, recorded in metadata when known
   * @return one candidate per span, in span order
   */
  public List<RankCandidate> score(String query, List<TextSpan> spans, LocalDate publishedOn) {
    double[] raw = rawScores(query, spans);
    double max = 0.0;
    for (double score : raw) {
      max = Math.max(max, score);
    }

    List<RankCandidate> candidates = new ArrayList<>(spans.size());
    for (int i = 0; i < spans.size(); i++) {
      TextSpan span = spans.get(i);
      Map<String, Object> metadata = new HashMap<>();
      metadata.put(RankCandidate.META_PAGE, span.page());
      metadata.put(RankCandidate.META_OFFSET, span.offset());
      if (publishedOn != null) {
        metadata.put(RankCandidate.META_PUBLISHED_ON, publishedOn);
      }
      double normalized = max > 0.0 ? raw[i] / max : 0.0;
      candidates.add(new RankCandidate(span.spanId(), span.text(), normalized, metadata));
    }
    return candidates;
  }

  @VisibleForTesting
  double[] rawScores(String query, List<TextSpan> spans) {
    int n = spans.size();
    double[] scores = new double[n];
    if (n == 0) {
      return scores;
    }

    List<Map<String, Integer>> termFrequencies = new ArrayList<>(n);
    int[] lengths = new int[n];
    long totalLength = 0;
    Map<String, Integer> documentFrequency = new HashMap<>();
    for (int i = 0; i < n; i++) {
      List<String> tokens = Tokenizer.tokens(spans.get(i).text());
      Map<String, Integer> tf = new HashMap<>();
      for (String token : tokens) {
        tf.merge(token, 1, Integer::sum);
      }
      for (String term : tf.keySet()) {
        documentFrequency.merge(term, 1, Integer::sum);
      }
      termFrequencies.add(tf);
      lengths[i] = tokens.size();
      totalLength += tokens.size();
    }
    if (totalLength == 0) {
      return scores;
    }
    double avgLength = (double) totalLength / n;

    Set<String> queryTerms = new TreeSet<>(Tokenizer.tokens(query));
    for (String term : queryTerms) {
      int df = documentFrequency.getOrDefault(term, 0);
      if (df == 0) {
        continue;
      }
      double idf = Math.log(1.0 + (n - df + 0.5) / (df + 0.5));
      for (int i = 0; i < n; i++) {
        int tf = termFrequencies.get(i).getOrDefault(term, 0);
        if (tf == 0) {
          continue;
        }
        double norm = K1 * (1.0 - B + B * lengths[i] / avgLength);
        scores[i] += idf * (tf * (K1 + 1.0)) / (tf + norm);
      }
    }
    return scores;
  }
}
