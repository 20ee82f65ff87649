package com.gentoro.mcprouter.catalog.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.mcprouter.catalog.CatalogFilter;
import com.gentoro.mcprouter.catalog.ProviderCatalog;
import com.gentoro.mcprouter.catalog.ProviderRecord;
import com.gentoro.mcprouter.exception.ConfigException;
import com.gentoro.mcprouter.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Immutable catalog held in memory, loaded once from a YAML or JSON seed document. */
public class InMemoryProviderCatalog implements ProviderCatalog {
  private static final org.slf4j.Logger log =
      com.gentoro.mcprouter.logging.LoggingService.getLogger(InMemoryProviderCatalog.class);

  public static final String DRIVER_ID = "in-memory";
  private static final String CLASSPATH_PREFIX = "classpath:";

  private final List<ProviderRecord> providers;

  public InMemoryProviderCatalog(List<ProviderRecord> providers) {
    Map<String, ProviderRecord> byId = new LinkedHashMap<>();
    for (ProviderRecord provider : providers) {
      if (provider == null || provider.id() == null || provider.id().isBlank()) {
        throw new ConfigException("Catalog entry without an id");
      }
      if (byId.putIfAbsent(provider.id(), provider) != null) {
        throw new ConfigException("Duplicate provider id in catalog: " + provider.id());
      }
    }
    this.providers = List.copyOf(byId.values());
  }

  /**
   * Load a catalog document. {@code location} is either {@code classpath:<resource>} or a file
   * path; files ending in {@code .json} are read as JSON, everything else as YAML.
   */
  public static InMemoryProviderCatalog load(String location) {
    if (location == null || location.isBlank()) {
      throw new ConfigException("catalog.location is not set");
    }
    ObjectMapper mapper =
        location.toLowerCase(Locale.ROOT).endsWith(".json")
            ? JacksonUtility.getJsonMapper()
            : JacksonUtility.getYamlMapper();
    try (InputStream in = open(location)) {
      CatalogDocument document = mapper.readValue(in, CatalogDocument.class);
      List<ProviderRecord> entries =
          document == null || document.providers() == null ? List.of() : document.providers();
      InMemoryProviderCatalog catalog = new InMemoryProviderCatalog(entries);
      log.info("Loaded {} providers from {}", catalog.size(), location);
      return catalog;
    } catch (IOException e) {
      throw new ConfigException("Failed to read provider catalog from " + location, e);
    }
  }

  private static InputStream open(String location) throws IOException {
    if (location.startsWith(CLASSPATH_PREFIX)) {
      String resource = location.substring(CLASSPATH_PREFIX.length());
      if (resource.startsWith("/")) {
        resource = resource.substring(1);
      }
      InputStream in =
          Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
      if (in == null) {
        throw new ConfigException("Catalog resource not found on classpath: " + resource);
      }
      return in;
    }
    Path path = Path.of(location);
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Catalog file not found: " + path.toAbsolutePath());
    }
    return Files.newInputStream(path);
  }

  @Override
  public List<ProviderRecord> query(CatalogFilter filter) {
    List<ProviderRecord> matches = new ArrayList<>();
    for (ProviderRecord provider : providers) {
      if (filter.requireVerified() && !provider.verified()) {
        continue;
      }
      if (filter.isUnconstrained() || matches(provider, filter)) {
        matches.add(provider);
      }
    }
    return Collections.unmodifiableList(matches);
  }

  private boolean matches(ProviderRecord provider, CatalogFilter filter) {
    String category = filter.category();
    if (category != null && !category.isBlank() && !provider.category().isEmpty()) {
      String a = provider.category().toLowerCase(Locale.ROOT);
      String b = category.toLowerCase(Locale.ROOT);
      if (a.contains(b) || b.contains(a)) {
        return true;
      }
    }
    String text = provider.searchableText();
    for (String term : filter.capabilityTerms()) {
      if (text.contains(term.toLowerCase(Locale.ROOT))) {
        return true;
      }
    }
    for (String term : filter.queryTerms()) {
      if (text.contains(term.toLowerCase(Locale.ROOT))) {
        return true;
      }
    }
    return false;
  }

  @Override
  public int size() {
    return providers.size();
  }

  @Override
  public String driverId() {
    return DRIVER_ID;
  }

  /** Root of a catalog seed document. */
  public record CatalogDocument(List<ProviderRecord> providers) {}
}
