package com.gentoro.mcprouter.catalog;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A tool exposed by a provider.
 *
 * @param name tool name as the provider declares it
 * @param description free-text description, may be empty
 * @param inputSchema optional JSON schema of the tool arguments
 */
public record ToolDescriptor(String name, String description, JsonNode inputSchema) {
  public ToolDescriptor {
    name = name == null ? "" : name;
    description = description == null ? "" : description;
  }

  public static ToolDescriptor of(String name, String description) {
    return new ToolDescriptor(name, description, null);
  }
}
