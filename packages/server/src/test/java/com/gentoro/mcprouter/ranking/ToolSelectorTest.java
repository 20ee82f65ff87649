package com.gentoro.mcprouter.ranking;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.mcprouter.catalog.ProviderRecord;
import com.gentoro.mcprouter.catalog.ToolDescriptor;
import com.gentoro.mcprouter.parse.Intents;
import com.gentoro.mcprouter.parse.SemanticExpander;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ToolSelectorTest {

  private final ToolSelector selector = new ToolSelector();
  private final SemanticExpander expander = new SemanticExpander();

  private static ProviderRecord withTools(ToolDescriptor... tools) {
    return new ProviderRecord(
        "@test/provider", "Test", "", "Misc", List.of(), List.of(tools), true, 0, null, null,
        null);
  }

  @Test
  void picksPriceToolForCryptoQuery() {
    ProviderRecord coingecko =
        withTools(
            ToolDescriptor.of("get_market_chart", "Historical market data for a coin"),
            ToolDescriptor.of("get_price", "Current price of a cryptocurrency in a fiat currency"));
    Set<String> capabilities = expander.expandCapabilities(List.of("crypto_price", "market_data"));

    ToolDescriptor tool =
        selector.select(
            coingecko, Intents.CRYPTO_PRICE_QUERY, capabilities, List.of("bitcoin", "price"));

    assertEquals("get_price", tool.name());
  }

  @Test
  void fallsBackToFirstDeclaredToolWhenNothingScores() {
    ProviderRecord provider =
        withTools(
            ToolDescriptor.of("xyz_handler", "handles things"),
            ToolDescriptor.of("abc", "other"));

    ToolDescriptor tool =
        selector.select(provider, Intents.WEATHER_QUERY, List.of(), List.of("foo"));

    assertEquals("xyz_handler", tool.name());
  }

  @Test
  void earliestToolWinsTies() {
    ProviderRecord provider =
        withTools(
            ToolDescriptor.of("weather_a", "weather report"),
            ToolDescriptor.of("weather_b", "weather report"));

    assertEquals(
        "weather_a",
        selector.select(provider, Intents.WEATHER_QUERY, List.of(), List.of()).name());
  }

  @Test
  void providerWithoutToolsYieldsNothing() {
    assertNull(selector.select(withTools(), Intents.WEATHER_QUERY, List.of(), List.of()));
  }

  @Test
  void keywordsForUnknownIntentsAreDerivedFromTheName() {
    assertEquals(List.of("image", "lookup"), ToolSelector.keywordsFor("image_lookup_query"));
    assertEquals(List.of("user", "profile"), ToolSelector.keywordsFor("get_user_profile"));
    assertTrue(ToolSelector.keywordsFor(null).isEmpty());
    assertTrue(ToolSelector.keywordsFor(Intents.WEATHER_QUERY).contains("forecast"));
  }

  @Test
  void scoreCombinesIntentCapabilityAndQueryMatches() {
    ToolDescriptor tool = ToolDescriptor.of("get_forecast", "five day forecast");

    double score =
        selector.score(tool, List.of("forecast"), List.of("forecast"), List.of("forecast"));

    // intent 10 + 5, capability 8 + 4, query 5 + 3
    assertEquals(35.0, score, 1e-9);
  }
}
