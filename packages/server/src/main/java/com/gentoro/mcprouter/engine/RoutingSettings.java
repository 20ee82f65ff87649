package com.gentoro.mcprouter.engine;

import com.gentoro.mcprouter.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;

/**
 * {@code routing.*}, {@code catalog.timeout-ms} and {@code invoker.timeout-ms} settings.
 *
 * @param requireVerified default verification requirement when the request does not say
 * @param strict surface upstream errors instead of degrading to canned results
 * @param maxCandidates how many ranked providers the fallback chain visits
 * @param maxAlternates how many runners-up are reported
 * @param maxOptions how many providers a present-options response lists
 * @param catalogTimeoutMs time budget of one catalog query
 * @param invokerTimeoutMs time budget of one tool invocation
 */
public record RoutingSettings(
    boolean requireVerified,
    boolean strict,
    int maxCandidates,
    int maxAlternates,
    int maxOptions,
    long catalogTimeoutMs,
    long invokerTimeoutMs) {

  public RoutingSettings {
    if (maxCandidates <= 0) {
      throw new ConfigException("routing.max-candidates must be positive: " + maxCandidates);
    }
    if (maxAlternates < 0) {
      throw new ConfigException("routing.max-alternates must not be negative: " + maxAlternates);
    }
    if (maxOptions <= 0) {
      throw new ConfigException("routing.max-options must be positive: " + maxOptions);
    }
    if (catalogTimeoutMs <= 0 || invokerTimeoutMs <= 0) {
      throw new ConfigException("catalog and invoker timeouts must be positive");
    }
  }

  public static RoutingSettings defaults() {
    return new RoutingSettings(true, false, 5, 2, 10, 5_000L, 20_000L);
  }

  public static RoutingSettings fromConfiguration(Configuration configuration) {
    RoutingSettings d = defaults();
    return new RoutingSettings(
        configuration.getBoolean("routing.require-verified", d.requireVerified()),
        configuration.getBoolean("routing.strict", d.strict()),
        configuration.getInt("routing.max-candidates", d.maxCandidates()),
        configuration.getInt("routing.max-alternates", d.maxAlternates()),
        configuration.getInt("routing.max-options", d.maxOptions()),
        configuration.getLong("catalog.timeout-ms", d.catalogTimeoutMs()),
        configuration.getLong("invoker.timeout-ms", d.invokerTimeoutMs()));
  }
}
