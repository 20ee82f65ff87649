package com.gentoro.mcprouter.catalog.spi;

import com.gentoro.mcprouter.catalog.ProviderCatalog;
import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for pluggable catalog backends.
 *
 * <p>Implementations must register using ServiceLoader by adding their fully qualified class name
 * to: META-INF/services/com.gentoro.mcprouter.catalog.spi.ProviderCatalogProvider
 */
public interface ProviderCatalogProvider {
  /** Unique driver id used in configuration, e.g., "in-memory". */
  String id();

  /** Whether the provider can operate in the current runtime. */
  default boolean isAvailable(Configuration configuration) {
    return true;
  }

  /** Create a catalog from the {@code catalog.*} configuration keys. */
  ProviderCatalog create(Configuration configuration);
}
