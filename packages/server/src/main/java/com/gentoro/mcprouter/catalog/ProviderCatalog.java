package com.gentoro.mcprouter.catalog;

import java.util.List;

/**
 * Read-only view of the provider catalog. Implementations may be remote, so callers wrap {@link
 * #query(CatalogFilter)} in a timeout.
 */
public interface ProviderCatalog {
  /** Candidates loosely matching the filter, in catalog order. */
  List<ProviderRecord> query(CatalogFilter filter);

  /** Number of providers known to the catalog. */
  int size();

  /** Driver id this catalog was created by. */
  default String driverId() {
    return "unknown";
  }
}
