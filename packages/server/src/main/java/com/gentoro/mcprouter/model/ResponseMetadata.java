package com.gentoro.mcprouter.model;

import java.util.ArrayList;
import java.util.List;

/** Routing decision details attached to every {@link RoutingResponse}. */
public class ResponseMetadata {
  private String strategy;
  private String chosenProvider;
  private String chosenProviderId;
  private String chosenTool;
  private Double confidence;
  private List<Alternate> alternates = new ArrayList<>();
  private boolean cached;
  private Long cacheAgeMs;
  private long elapsedMs;
  private boolean relaxedVerification;
  private boolean degraded;
  private String upstreamError;
  private String invoker;
  private List<String> evaluatedProviders = new ArrayList<>();

  public ResponseMetadata() {}

  /** Shallow copy with its own lists, so cached instances can be re-stamped safely. */
  public ResponseMetadata copy() {
    ResponseMetadata copy = new ResponseMetadata();
    copy.strategy = strategy;
    copy.chosenProvider = chosenProvider;
    copy.chosenProviderId = chosenProviderId;
    copy.chosenTool = chosenTool;
    copy.confidence = confidence;
    copy.alternates = new ArrayList<>(alternates);
    copy.cached = cached;
    copy.cacheAgeMs = cacheAgeMs;
    copy.elapsedMs = elapsedMs;
    copy.relaxedVerification = relaxedVerification;
    copy.degraded = degraded;
    copy.upstreamError = upstreamError;
    copy.invoker = invoker;
    copy.evaluatedProviders = new ArrayList<>(evaluatedProviders);
    return copy;
  }

  public String getStrategy() {
    return strategy;
  }

  public void setStrategy(String strategy) {
    this.strategy = strategy;
  }

  public String getChosenProvider() {
    return chosenProvider;
  }

  public void setChosenProvider(String chosenProvider) {
    this.chosenProvider = chosenProvider;
  }

  public String getChosenProviderId() {
    return chosenProviderId;
  }

  public void setChosenProviderId(String chosenProviderId) {
    this.chosenProviderId = chosenProviderId;
  }

  public String getChosenTool() {
    return chosenTool;
  }

  public void setChosenTool(String chosenTool) {
    this.chosenTool = chosenTool;
  }

  public Double getConfidence() {
    return confidence;
  }

  public void setConfidence(Double confidence) {
    this.confidence = confidence;
  }

  public List<Alternate> getAlternates() {
    return alternates;
  }

  public void setAlternates(List<Alternate> alternates) {
    this.alternates = alternates == null ? new ArrayList<>() : new ArrayList<>(alternates);
  }

  public boolean isCached() {
    return cached;
  }

  public void setCached(boolean cached) {
    this.cached = cached;
  }

  public Long getCacheAgeMs() {
    return cacheAgeMs;
  }

  public void setCacheAgeMs(Long cacheAgeMs) {
    this.cacheAgeMs = cacheAgeMs;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  public void setElapsedMs(long elapsedMs) {
    this.elapsedMs = elapsedMs;
  }

  public boolean isRelaxedVerification() {
    return relaxedVerification;
  }

  public void setRelaxedVerification(boolean relaxedVerification) {
    this.relaxedVerification = relaxedVerification;
  }

  public boolean isDegraded() {
    return degraded;
  }

  public void setDegraded(boolean degraded) {
    this.degraded = degraded;
  }

  public String getUpstreamError() {
    return upstreamError;
  }

  public void setUpstreamError(String upstreamError) {
    this.upstreamError = upstreamError;
  }

  public String getInvoker() {
    return invoker;
  }

  public void setInvoker(String invoker) {
    this.invoker = invoker;
  }

  public List<String> getEvaluatedProviders() {
    return evaluatedProviders;
  }

  public void setEvaluatedProviders(List<String> evaluatedProviders) {
    this.evaluatedProviders =
        evaluatedProviders == null ? new ArrayList<>() : new ArrayList<>(evaluatedProviders);
  }
}
