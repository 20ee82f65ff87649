package com.gentoro.mcprouter.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/** Shared, pre-configured Jackson mappers. */
public final class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER = configure(new ObjectMapper());
  private static final ObjectMapper YAML_MAPPER = configure(new ObjectMapper(new YAMLFactory()));
  private static final ObjectMapper CANONICAL_MAPPER =
      new ObjectMapper()
          .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
          .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, true);

  private JacksonUtility() {}

  private static ObjectMapper configure(ObjectMapper mapper) {
    mapper.findAndRegisterModules();
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    return mapper;
  }

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static ObjectMapper getYamlMapper() {
    return YAML_MAPPER;
  }

  /** Mapper with sorted map keys, used wherever byte-stable output matters (e.g. hashing). */
  public static ObjectMapper getCanonicalMapper() {
    return CANONICAL_MAPPER;
  }
}
