package com.gentoro.mcprouter.invoke;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a provider tool is called with.
 *
 * @param intent resolved intent
 * @param query original query text, may be empty for structured requests
 * @param entities extracted or supplied entities
 * @param context caller supplied context
 */
public record InvocationParams(
    String intent, String query, Map<String, String> entities, Map<String, Object> context) {

  public InvocationParams {
    query = query == null ? "" : query;
    entities =
        entities == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entities));
    context =
        context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  /** Tool arguments: context first, then entities, then the query under {@code query}. */
  public Map<String, Object> toArguments() {
    Map<String, Object> arguments = new LinkedHashMap<>(context);
    arguments.putAll(entities);
    if (!query.isEmpty()) {
      arguments.put("query", query);
    }
    return arguments;
  }
}
