package com.flamingo.ai.esgmaturity.service.resolver;

import com.flamingo.ai.esgmaturity.domain.model.CompanyRef;
import com.flamingo.ai.esgmaturity.domain.model.ResolvedDocument;
import com.flamingo.ai.esgmaturity.domain.model.SourceCandidate;
import java.util.List;

/**
 * A data source that can find and fetch sustainability reports. Implementations are registered at
 * startup through {@link ProviderRegistry}; the set is closed.
 *
 * <p>Both operations may block on I/O. Failures should be raised as {@link
 * com.flamingo.ai.esgmaturity.exception.ProviderException}; the resolver absorbs them.
 */
public interface ReportProvider {

  /** Unique id, matched against {@link SourceCandidate#providerId()} on download. */
  String id();

  /** Quality tier this provider is registered under. */
  int tier();

  default boolean isEnabled() {
    return true;
  }

  /**
   * Finds candidate reports.
   *
   * @param company organisation to search for
   * @param year fiscal year
   * @param tier tier the provider is being queried in
   * @return candidates, possibly empty
   */
  List<SourceCandidate> search(CompanyRef company, int year, int tier);

  /**
   * Fetches a candidate's content to a local handle.
   *
   * @param candidate a candidate previously returned by {@link #search}
   * @return the resolved document
   */
  ResolvedDocument download(SourceCandidate candidate);
}
