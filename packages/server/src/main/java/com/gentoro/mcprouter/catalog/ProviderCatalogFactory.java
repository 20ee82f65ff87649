package com.gentoro.mcprouter.catalog;

import com.gentoro.mcprouter.catalog.spi.ProviderCatalogProvider;
import com.gentoro.mcprouter.exception.ConfigException;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/** Resolves the catalog backend named by {@code catalog.driver} through {@link ServiceLoader}. */
public final class ProviderCatalogFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.mcprouter.logging.LoggingService.getLogger(ProviderCatalogFactory.class);

  public static final String DEFAULT_DRIVER = "in-memory";

  private ProviderCatalogFactory() {}

  public static ProviderCatalog create(Configuration configuration) {
    String driver = configuration.getString("catalog.driver", DEFAULT_DRIVER).trim();
    List<String> known = new ArrayList<>();
    for (ProviderCatalogProvider provider : ServiceLoader.load(ProviderCatalogProvider.class)) {
      known.add(provider.id());
      if (!provider.id().equalsIgnoreCase(driver)) {
        continue;
      }
      if (!provider.isAvailable(configuration)) {
        throw new ConfigException("Catalog driver '" + driver + "' is not available");
      }
      log.info("Using catalog driver '{}'", provider.id());
      return provider.create(configuration);
    }
    throw new ConfigException(
        "Unknown catalog driver '" + driver + "'; available drivers: " + known);
  }
}
