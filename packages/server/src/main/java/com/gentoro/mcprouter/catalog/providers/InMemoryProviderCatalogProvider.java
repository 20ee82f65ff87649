package com.gentoro.mcprouter.catalog.providers;

import com.gentoro.mcprouter.catalog.ProviderCatalog;
import com.gentoro.mcprouter.catalog.memory.InMemoryProviderCatalog;
import com.gentoro.mcprouter.catalog.spi.ProviderCatalogProvider;
import org.apache.commons.configuration2.Configuration;

public class InMemoryProviderCatalogProvider implements ProviderCatalogProvider {
  public static final String DEFAULT_LOCATION = "classpath:catalog/providers.yaml";

  @Override
  public String id() {
    return InMemoryProviderCatalog.DRIVER_ID;
  }

  @Override
  public ProviderCatalog create(Configuration configuration) {
    return InMemoryProviderCatalog.load(
        configuration.getString("catalog.location", DEFAULT_LOCATION));
  }
}
