package com.gentoro.mcprouter.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Catalog entry for an upstream provider of tools.
 *
 * @param id stable identifier, e.g. {@code @openweather/current}
 * @param displayName human readable name
 * @param description free-text description
 * @param category coarse category such as Weather or Finance
 * @param tags free-form tags
 * @param tools declared tools, in declaration order
 * @param verified whether the provider has been vetted
 * @param usageCount number of recorded uses
 * @param author optional publisher
 * @param deploymentUrl endpoint for MCP JSON-RPC calls
 * @param apiKey optional bearer credential for {@code deploymentUrl}
 */
public record ProviderRecord(
    String id,
    String displayName,
    String description,
    String category,
    List<String> tags,
    List<ToolDescriptor> tools,
    boolean verified,
    long usageCount,
    String author,
    String deploymentUrl,
    String apiKey) {

  public ProviderRecord {
    displayName = displayName == null || displayName.isBlank() ? id : displayName;
    description = description == null ? "" : description;
    category = category == null ? "" : category;
    tags = tags == null ? List.of() : List.copyOf(tags);
    tools = tools == null ? List.of() : List.copyOf(tools);
    usageCount = Math.max(0L, usageCount);
  }

  /** Lower-cased names and descriptions of every tool, space separated. */
  @JsonIgnore
  public String toolText() {
    return tools.stream()
        .map(t -> t.name() + " " + t.description())
        .collect(Collectors.joining(" "))
        .toLowerCase(Locale.ROOT);
  }

  @JsonIgnore
  public String tagText() {
    return String.join(" ", tags).toLowerCase(Locale.ROOT);
  }

  /** Everything a term can match against: name, description, tags and tool text. */
  @JsonIgnore
  public String searchableText() {
    return (displayName + " " + description + " " + tagText() + " " + toolText())
        .toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return "ProviderRecord{id=" + id + ", verified=" + verified + "}";
  }
}
