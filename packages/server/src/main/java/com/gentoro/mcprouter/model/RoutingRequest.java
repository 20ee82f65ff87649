package com.gentoro.mcprouter.model;

import com.gentoro.mcprouter.exception.MalformedInputException;
import com.gentoro.mcprouter.utility.JacksonUtility;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Inbound request surface. Either {@code query} (free text, optionally with {@code context}) or a
 * pre-structured {@code intent} + {@code capabilities} pair, optionally with {@code category} and
 * {@code entities}.
 */
public class RoutingRequest {
  private String query;
  private Map<String, Object> context;
  private String intent;
  private List<String> capabilities;
  private String category;
  private Map<String, String> entities;
  private Boolean requireVerified;

  public RoutingRequest() {}

  public static RoutingRequest ofQuery(String query) {
    RoutingRequest request = new RoutingRequest();
    request.setQuery(query);
    return request;
  }

  public static RoutingRequest ofIntent(String intent, List<String> capabilities) {
    RoutingRequest request = new RoutingRequest();
    request.setIntent(intent);
    request.setCapabilities(capabilities);
    return request;
  }

  public static RoutingRequest valueOf(String jsonString) {
    if (Objects.isNull(jsonString) || jsonString.isBlank()) {
      throw new MalformedInputException("Request body is empty");
    }
    try {
      return JacksonUtility.getJsonMapper().readValue(jsonString, RoutingRequest.class);
    } catch (Exception e) {
      throw new MalformedInputException("Request body is not a valid routing request", e);
    }
  }

  /** True when the request carries a usable structured intent. */
  public boolean isStructured() {
    return intent != null
        && !intent.isBlank()
        && capabilities != null
        && !capabilities.isEmpty();
  }

  public String getQuery() {
    return query;
  }

  public void setQuery(String query) {
    this.query = query;
  }

  public Map<String, Object> getContext() {
    return context;
  }

  public void setContext(Map<String, Object> context) {
    this.context = context;
  }

  public String getIntent() {
    return intent;
  }

  public void setIntent(String intent) {
    this.intent = intent;
  }

  public List<String> getCapabilities() {
    return capabilities;
  }

  public void setCapabilities(List<String> capabilities) {
    this.capabilities = capabilities;
  }

  public String getCategory() {
    return category;
  }

  public void setCategory(String category) {
    this.category = category;
  }

  public Map<String, String> getEntities() {
    return entities;
  }

  public void setEntities(Map<String, String> entities) {
    this.entities = entities;
  }

  public Boolean getRequireVerified() {
    return requireVerified;
  }

  public void setRequireVerified(Boolean requireVerified) {
    this.requireVerified = requireVerified;
  }
}
