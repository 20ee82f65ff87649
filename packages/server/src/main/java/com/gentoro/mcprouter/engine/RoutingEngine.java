package com.gentoro.mcprouter.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.mcprouter.cache.CacheHit;
import com.gentoro.mcprouter.cache.Fingerprint;
import com.gentoro.mcprouter.cache.RequestFingerprinter;
import com.gentoro.mcprouter.cache.ResponseCache;
import com.gentoro.mcprouter.catalog.ProviderRecord;
import com.gentoro.mcprouter.catalog.ToolDescriptor;
import com.gentoro.mcprouter.exception.ExceptionUtil;
import com.gentoro.mcprouter.exception.RouterException;
import com.gentoro.mcprouter.exception.UpstreamFailureException;
import com.gentoro.mcprouter.exception.UpstreamTimeoutException;
import com.gentoro.mcprouter.invoke.InvocationParams;
import com.gentoro.mcprouter.invoke.Invoker;
import com.gentoro.mcprouter.invoke.MockInvoker;
import com.gentoro.mcprouter.model.Alternate;
import com.gentoro.mcprouter.model.ResponseMetadata;
import com.gentoro.mcprouter.model.RoutingRequest;
import com.gentoro.mcprouter.model.RoutingResponse;
import com.gentoro.mcprouter.parse.Intents;
import com.gentoro.mcprouter.parse.ParsedRequest;
import com.gentoro.mcprouter.parse.RequestParser;
import com.gentoro.mcprouter.ranking.ScoredCandidate;
import com.gentoro.mcprouter.utility.JacksonUtility;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point of the routing pipeline: parse, look up the cache, then either execute the best
 * provider tool or present the matching providers.
 *
 * <p>{@link #route(RoutingRequest)} never throws; every failure becomes an error response. Cache
 * misses on the same fingerprint are collapsed so that concurrent identical requests share one
 * computation. Upstream errors degrade to canned results unless strict mode is on, and degraded
 * results are never cached.
 */
public class RoutingEngine {
  private static final org.slf4j.Logger log =
      com.gentoro.mcprouter.logging.LoggingService.getLogger(RoutingEngine.class);

  static final String OPTIONS_NEXT_STEP = "Please select a service or provide more details";
  static final String DEGRADED_PROVIDER = "MockFallback";
  static final String DEGRADED_PROVIDER_ID = "@mock/fallback";
  static final String DEGRADED_TOOL = "mock_tool";

  private final RequestParser parser;
  private final RequestFingerprinter fingerprinter;
  private final ResponseCache<RoutingResponse> cache;
  private final boolean cacheEnabled;
  private final FallbackChain fallbackChain;
  private final Invoker invoker;
  private final MockInvoker degradedInvoker;
  private final UpstreamCallGuard guard;
  private final RoutingSettings settings;
  private final Map<Fingerprint, CompletableFuture<RoutingResponse>> inFlight =
      new ConcurrentHashMap<>();

  public RoutingEngine(
      RequestParser parser,
      RequestFingerprinter fingerprinter,
      ResponseCache<RoutingResponse> cache,
      boolean cacheEnabled,
      FallbackChain fallbackChain,
      Invoker invoker,
      MockInvoker degradedInvoker,
      UpstreamCallGuard guard,
      RoutingSettings settings) {
    this.parser = parser;
    this.fingerprinter = fingerprinter;
    this.cache = cache;
    this.cacheEnabled = cacheEnabled;
    this.fallbackChain = fallbackChain;
    this.invoker = invoker;
    this.degradedInvoker = degradedInvoker;
    this.guard = guard;
    this.settings = settings;
  }

  public RoutingResponse route(RoutingRequest request) {
    long start = System.nanoTime();
    ParsedRequest parsed = null;
    RoutingResponse response;
    try {
      parsed = parser.parse(request);
      boolean requireVerified =
          request.getRequireVerified() != null
              ? request.getRequireVerified()
              : settings.requireVerified();
      Fingerprint key = fingerprinter.fingerprint(parsed, request.getContext(), requireVerified);
      response =
          cacheEnabled
              ? lookup(key, parsed, request, requireVerified)
              : compute(parsed, request, requireVerified);
    } catch (RouterException e) {
      log.info("Routing failed [{}]: {}", e.getCode(), e.getMessage());
      response = RoutingResponse.failure(e, parsed);
    } catch (RuntimeException e) {
      log.error("Unexpected routing failure", e);
      response = RoutingResponse.failure(e, parsed);
    }
    response.getMetadata().setElapsedMs((System.nanoTime() - start) / 1_000_000);
    return response;
  }

  private RoutingResponse lookup(
      Fingerprint key, ParsedRequest parsed, RoutingRequest request, boolean requireVerified) {
    Optional<RoutingResponse> hit = fromCache(key);
    if (hit.isPresent()) {
      return hit.get();
    }
    log.debug("Cache miss for {}", key);

    CompletableFuture<RoutingResponse> mine = new CompletableFuture<>();
    CompletableFuture<RoutingResponse> leader = inFlight.putIfAbsent(key, mine);
    if (leader != null) {
      log.debug("Joining in-flight computation for {}", key);
      return await(leader).copy();
    }
    try {
      // another leader may have finished between the miss and the registration
      hit = fromCache(key);
      if (hit.isPresent()) {
        mine.complete(hit.get().copy());
        return hit.get();
      }
      RoutingResponse response = compute(parsed, request, requireVerified);
      if (response.isSuccess() && !response.getMetadata().isDegraded()) {
        cache.put(key, response.copy());
      }
      mine.complete(response.copy());
      return response;
    } catch (RuntimeException | Error e) {
      // followers are parked on this future and must always be released
      mine.completeExceptionally(e);
      throw e;
    } finally {
      inFlight.remove(key, mine);
    }
  }

  private Optional<RoutingResponse> fromCache(Fingerprint key) {
    Optional<CacheHit<RoutingResponse>> hit = cache.get(key);
    if (hit.isEmpty()) {
      return Optional.empty();
    }
    log.debug("Cache hit for {} (age {} ms)", key, hit.get().ageMs());
    RoutingResponse response = hit.get().payload().copy();
    response.getMetadata().setCached(true);
    response.getMetadata().setCacheAgeMs(hit.get().ageMs());
    return Optional.of(response);
  }

  private static RoutingResponse await(CompletableFuture<RoutingResponse> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }

  private RoutingResponse compute(
      ParsedRequest parsed, RoutingRequest request, boolean requireVerified) {
    InvocationParams params =
        new InvocationParams(
            parsed.intent(), parsed.rawText(), parsed.entities(), request.getContext());
    try {
      if (parsed.strategy().executes()) {
        return execute(parsed, params, requireVerified);
      }
      return presentOptions(parsed, requireVerified);
    } catch (UpstreamTimeoutException | UpstreamFailureException e) {
      if (settings.strict()) {
        throw e;
      }
      return degrade(parsed, params, e);
    }
  }

  private RoutingResponse execute(
      ParsedRequest parsed, InvocationParams params, boolean requireVerified) {
    FallbackChain.Selection selection = fallbackChain.select(parsed, requireVerified);
    ProviderRecord provider = selection.chosen().provider();
    ToolDescriptor tool = selection.tool();

    JsonNode result =
        guard.call(
            "Invocation of " + provider.id() + "/" + tool.name(),
            settings.invokerTimeoutMs(),
            () -> invoker.invoke(provider, tool, params));

    ResponseMetadata metadata = new ResponseMetadata();
    metadata.setStrategy(parsed.strategy().label());
    metadata.setChosenProvider(provider.displayName());
    metadata.setChosenProviderId(provider.id());
    metadata.setChosenTool(tool.name());
    metadata.setConfidence(parsed.confidence());
    metadata.setAlternates(selection.alternates().stream().map(Alternate::of).toList());
    metadata.setRelaxedVerification(selection.relaxedVerification());
    metadata.setInvoker(invoker.mode());
    metadata.setEvaluatedProviders(selection.evaluated());
    log.info(
        "Routed {} to {} / {} (score {}, relaxedVerification={})",
        parsed.intent(),
        provider.id(),
        tool.name(),
        selection.chosen().score(),
        selection.relaxedVerification());
    return RoutingResponse.success(result, parsed, metadata);
  }

  private RoutingResponse presentOptions(ParsedRequest parsed, boolean requireVerified) {
    FallbackChain.Ranked ranked = fallbackChain.rank(parsed, requireVerified);
    List<ScoredCandidate> top =
        ranked.candidates().subList(0, Math.min(settings.maxOptions(), ranked.candidates().size()));

    ObjectNode payload = JacksonUtility.getJsonMapper().createObjectNode();
    payload.put("type", "options");
    payload.put("message", "Found %d services for %s".formatted(top.size(), parsed.intent()));
    ArrayNode options = payload.putArray("options");
    for (ScoredCandidate candidate : top) {
      ProviderRecord provider = candidate.provider();
      options
          .addObject()
          .put("id", provider.id())
          .put("name", provider.displayName())
          .put("description", provider.description())
          .put("category", provider.category())
          .put("useCount", provider.usageCount())
          .put("verified", provider.verified())
          .put("score", candidate.score());
    }
    payload.put("nextStep", OPTIONS_NEXT_STEP);

    ResponseMetadata metadata = new ResponseMetadata();
    metadata.setStrategy(parsed.strategy().label());
    metadata.setConfidence(parsed.confidence());
    metadata.setRelaxedVerification(ranked.relaxedVerification());
    metadata.setEvaluatedProviders(top.stream().map(ScoredCandidate::name).toList());
    log.info("Presenting {} options for {}", top.size(), parsed.intent());
    return RoutingResponse.success(payload, parsed, metadata);
  }

  private RoutingResponse degrade(
      ParsedRequest parsed, InvocationParams params, RouterException cause) {
    log.warn(
        "Upstream error while routing {}, serving canned result: {}",
        parsed.intent(),
        ExceptionUtil.extractErrorMessage(cause));
    ResponseMetadata metadata = new ResponseMetadata();
    metadata.setStrategy(parsed.strategy().label());
    metadata.setChosenProvider(DEGRADED_PROVIDER);
    metadata.setChosenProviderId(DEGRADED_PROVIDER_ID);
    metadata.setChosenTool(DEGRADED_TOOL);
    metadata.setConfidence(Intents.FALLBACK_CONFIDENCE);
    metadata.setDegraded(true);
    metadata.setUpstreamError(cause.getMessage());
    metadata.setInvoker(degradedInvoker.mode());
    return RoutingResponse.success(degradedInvoker.resultFor(params), parsed, metadata);
  }

  public ResponseCache<RoutingResponse> cache() {
    return cache;
  }

  public RequestParser parser() {
    return parser;
  }

  public RoutingSettings settings() {
    return settings;
  }
}
