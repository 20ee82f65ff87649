package com.gentoro.mcprouter.cache;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.mcprouter.model.RoutingRequest;
import com.gentoro.mcprouter.parse.ParsedRequest;
import com.gentoro.mcprouter.parse.RequestParser;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RequestFingerprinterTest {

  private final RequestParser parser = new RequestParser();
  private final RequestFingerprinter fingerprinter = new RequestFingerprinter();

  private ParsedRequest parse(String query) {
    return parser.parse(RoutingRequest.ofQuery(query));
  }

  @Test
  void identicalRequestsCollide() {
    Fingerprint a = fingerprinter.fingerprint(parse("bitcoin price"), null, true);
    Fingerprint b = fingerprinter.fingerprint(parse("  Bitcoin   price "), Map.of(), true);

    assertEquals(a, b);
    assertEquals(64, a.hash().length());
    assertTrue(a.hash().matches("[0-9a-f]+"));
  }

  @Test
  void extractedEntitiesArePartOfTheKey() {
    ParsedRequest upper = parse("AAPL stock price");
    ParsedRequest lower = parse("aapl stock price");
    assertEquals(upper.normalizedText(), lower.normalizedText());
    assertEquals("AAPL", upper.entities().get("stockSymbol"));
    assertNull(lower.entities().get("stockSymbol"));

    assertNotEquals(
        fingerprinter.fingerprint(upper, null, true), fingerprinter.fingerprint(lower, null, true));
  }

  @Test
  void contextAndVerificationArePartOfTheKey() {
    ParsedRequest parsed = parse("bitcoin price");
    Fingerprint base = fingerprinter.fingerprint(parsed, Map.of("user", "a"), true);

    assertNotEquals(base, fingerprinter.fingerprint(parsed, Map.of("user", "b"), true));
    assertNotEquals(base, fingerprinter.fingerprint(parsed, Map.of("user", "a"), false));
  }

  @Test
  void structuredKeyIgnoresEntityAndCapabilityOrder() {
    Map<String, String> first = new LinkedHashMap<>();
    first.put("location", "Seoul");
    first.put("unit", "celsius");
    Map<String, String> second = new LinkedHashMap<>();
    second.put("unit", "celsius");
    second.put("location", "Seoul");

    RoutingRequest a =
        RoutingRequest.ofIntent("weather_query", List.of("weather_lookup", "location_search"));
    a.setEntities(first);
    RoutingRequest b =
        RoutingRequest.ofIntent("weather_query", List.of("location_search", "weather_lookup"));
    b.setEntities(second);

    assertEquals(
        fingerprinter.fingerprint(parser.parse(a), null, true),
        fingerprinter.fingerprint(parser.parse(b), null, true));
  }

  @Test
  void contextKeyOrderDoesNotMatter() {
    ParsedRequest parsed = parse("bitcoin price");
    Map<String, Object> first = new LinkedHashMap<>();
    first.put("b", 2);
    first.put("a", 1);

    assertEquals(
        fingerprinter.fingerprint(parsed, Map.of("a", 1, "b", 2), true),
        fingerprinter.fingerprint(parsed, first, true));
  }
}
