package com.gentoro.mcprouter.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.mcprouter.exception.ErrorDetails;
import com.gentoro.mcprouter.exception.ExceptionUtil;
import com.gentoro.mcprouter.parse.ParsedRequest;

/** Outcome of one routing call. Either {@code result} or {@code error} is set. */
public class RoutingResponse {
  private boolean success;
  private JsonNode result;
  private ParsedRequest parsed;
  private ResponseMetadata metadata = new ResponseMetadata();
  private ErrorDetails error;

  public RoutingResponse() {}

  public static RoutingResponse success(
      JsonNode result, ParsedRequest parsed, ResponseMetadata metadata) {
    RoutingResponse response = new RoutingResponse();
    response.success = true;
    response.result = result;
    response.parsed = parsed;
    response.metadata = metadata;
    return response;
  }

  public static RoutingResponse failure(Throwable error, ParsedRequest parsed) {
    RoutingResponse response = new RoutingResponse();
    response.success = false;
    response.parsed = parsed;
    response.error = ExceptionUtil.toErrorDetails(error);
    if (parsed != null) {
      response.metadata.setStrategy(parsed.strategy().label());
      response.metadata.setConfidence(parsed.confidence());
    }
    return response;
  }

  /** Copy sharing the immutable parts; metadata is copied so it can be re-stamped. */
  public RoutingResponse copy() {
    RoutingResponse copy = new RoutingResponse();
    copy.success = success;
    copy.result = result;
    copy.parsed = parsed;
    copy.metadata = metadata == null ? new ResponseMetadata() : metadata.copy();
    copy.error = error;
    return copy;
  }

  @JsonIgnore
  public int httpStatus() {
    return success || error == null ? 200 : error.code().httpStatus();
  }

  public boolean isSuccess() {
    return success;
  }

  public void setSuccess(boolean success) {
    this.success = success;
  }

  public JsonNode getResult() {
    return result;
  }

  public void setResult(JsonNode result) {
    this.result = result;
  }

  public ParsedRequest getParsed() {
    return parsed;
  }

  public void setParsed(ParsedRequest parsed) {
    this.parsed = parsed;
  }

  public ResponseMetadata getMetadata() {
    return metadata;
  }

  public void setMetadata(ResponseMetadata metadata) {
    this.metadata = metadata;
  }

  public ErrorDetails getError() {
    return error;
  }

  public void setError(ErrorDetails error) {
    this.error = error;
  }
}
