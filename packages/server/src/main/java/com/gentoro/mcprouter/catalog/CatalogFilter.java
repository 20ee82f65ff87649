package com.gentoro.mcprouter.catalog;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Coarse pre-filter handed to a {@link ProviderCatalog}. Catalogs return candidates that pass the
 * verification requirement and share at least one term or the category; fine-grained scoring is
 * left to the ranker.
 */
public record CatalogFilter(
    String category,
    Set<String> capabilityTerms,
    Set<String> queryTerms,
    boolean requireVerified) {

  public CatalogFilter {
    capabilityTerms =
        capabilityTerms == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(capabilityTerms));
    queryTerms =
        queryTerms == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(queryTerms));
  }

  public boolean isUnconstrained() {
    return (category == null || category.isBlank())
        && capabilityTerms.isEmpty()
        && queryTerms.isEmpty();
  }
}
