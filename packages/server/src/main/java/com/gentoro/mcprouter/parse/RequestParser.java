package com.gentoro.mcprouter.parse;

import com.gentoro.mcprouter.exception.MalformedInputException;
import com.gentoro.mcprouter.model.RoutingRequest;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Turns a {@link RoutingRequest} into a {@link ParsedRequest}.
 *
 * <p>Free text goes through normalization, classification, entity extraction and the static
 * capability/category/strategy tables. A structured request ({@code intent} plus non-empty {@code
 * capabilities}) skips classification and is taken at full confidence.
 */
public class RequestParser {
  private static final org.slf4j.Logger log =
      com.gentoro.mcprouter.logging.LoggingService.getLogger(RequestParser.class);

  private final QueryNormalizer normalizer;
  private final IntentClassifier classifier;
  private final EntityExtractor extractor;
  private final CapabilityMapper capabilityMapper;
  private final StrategySelector strategySelector;

  public RequestParser() {
    this(
        new QueryNormalizer(),
        new IntentClassifier(),
        new EntityExtractor(),
        new CapabilityMapper(),
        new StrategySelector());
  }

  public RequestParser(
      QueryNormalizer normalizer,
      IntentClassifier classifier,
      EntityExtractor extractor,
      CapabilityMapper capabilityMapper,
      StrategySelector strategySelector) {
    this.normalizer = normalizer;
    this.classifier = classifier;
    this.extractor = extractor;
    this.capabilityMapper = capabilityMapper;
    this.strategySelector = strategySelector;
  }

  public ParsedRequest parse(RoutingRequest request) {
    if (request == null) {
      throw new MalformedInputException("Routing request is missing");
    }
    if (request.isStructured()) {
      return parseStructured(request);
    }
    String query = request.getQuery();
    if (query == null || query.isEmpty()) {
      throw new MalformedInputException(
          "Request must carry either a query or an intent with capabilities");
    }
    return parseFreeText(query);
  }

  private ParsedRequest parseFreeText(String query) {
    String normalized = normalizer.normalize(query);
    IntentLabel label = classifier.classify(normalized);
    Map<String, String> entities = extractor.extract(normalizer.clean(query));
    ParsedRequest parsed =
        new ParsedRequest(
            query,
            normalized,
            label.name(),
            label.confidence(),
            entities,
            capabilityMapper.capabilitiesFor(label.name()),
            capabilityMapper.categoryFor(label.name()),
            strategySelector.select(label.name()),
            normalizer.terms(normalized),
            false);
    log.debug(
        "Classified '{}' as {} ({}) via {}",
        normalized,
        label.name(),
        label.confidence(),
        label.matchedPattern());
    return parsed;
  }

  private ParsedRequest parseStructured(RoutingRequest request) {
    String intent = request.getIntent().trim();
    String raw = request.getQuery() == null ? "" : request.getQuery();
    String normalized = normalizer.normalize(raw);

    Map<String, String> entities =
        request.getEntities() != null && !request.getEntities().isEmpty()
            ? new LinkedHashMap<>(request.getEntities())
            : extractor.extract(normalizer.clean(raw));

    String category =
        StringUtils.isNotBlank(request.getCategory())
            ? request.getCategory().trim()
            : capabilityMapper.categoryFor(intent);

    Set<String> terms = new LinkedHashSet<>(normalizer.terms(normalized));
    for (String value : entities.values()) {
      terms.addAll(normalizer.terms(normalizer.normalize(value)));
    }

    List<String> capabilities =
        request.getCapabilities().stream()
            .filter(StringUtils::isNotBlank)
            .map(StringUtils::trim)
            .distinct()
            .toList();
    if (capabilities.isEmpty()) {
      if (StringUtils.isNotEmpty(request.getQuery())) {
        log.debug("Structured fields are blank, parsing the query as free text");
        return parseFreeText(request.getQuery());
      }
      throw new MalformedInputException("Structured request carries only blank capabilities");
    }

    return new ParsedRequest(
        raw,
        normalized,
        intent,
        Intents.STRUCTURED_CONFIDENCE,
        entities,
        capabilities,
        category,
        strategySelector.select(intent),
        terms,
        true);
  }
}
