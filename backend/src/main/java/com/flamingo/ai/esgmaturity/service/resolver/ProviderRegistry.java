package com.flamingo.ai.esgmaturity.service.resolver;

import com.flamingo.ai.esgmaturity.domain.model.SourceCandidate;
import com.flamingo.ai.esgmaturity.exception.ConfigException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/** Registered providers grouped by tier, in registration order within each tier. */
public class ProviderRegistry {

  private final SortedMap<Integer, List<ReportProvider>> tiers;
  private final Map<String, ReportProvider> byId;

  public ProviderRegistry(List<? extends ReportProvider> providers) {
    SortedMap<Integer, List<ReportProvider>> grouped = new TreeMap<>();
    Map<String, ReportProvider> ids = new LinkedHashMap<>();
    for (ReportProvider provider : providers) {
      int tier = provider.tier();
      if (tier < SourceCandidate.MIN_TIER || tier > SourceCandidate.MAX_TIER) {
        throw new ConfigException(
            "Provider " + provider.id() + " has tier " + tier + " outside [1,3]");
      }
      if (ids.putIfAbsent(provider.id(), provider) != null) {
        throw new ConfigException("Duplicate provider id: " + provider.id());
      }
      grouped.computeIfAbsent(tier, t -> new ArrayList<>()).add(provider);
    }
    grouped.replaceAll((tier, list) -> List.copyOf(list));
    this.tiers = Collections.unmodifiableSortedMap(grouped);
    this.byId = Collections.unmodifiableMap(ids);
  }

  /** Tier number to providers, ascending by tier. */
  public SortedMap<Integer, List<ReportProvider>> tiers() {
    return tiers;
  }

  public Optional<ReportProvider> find(String providerId) {
    return Optional.ofNullable(byId.get(providerId));
  }

  public int size() {
    return byId.size();
  }
}
