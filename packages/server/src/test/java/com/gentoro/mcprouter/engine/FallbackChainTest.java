package com.gentoro.mcprouter.engine;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.gentoro.mcprouter.catalog.ProviderRecord;
import com.gentoro.mcprouter.catalog.ToolDescriptor;
import com.gentoro.mcprouter.exception.NoCandidateFoundException;
import com.gentoro.mcprouter.exception.NoMatchingToolException;
import com.gentoro.mcprouter.model.RoutingRequest;
import com.gentoro.mcprouter.parse.ParsedRequest;
import com.gentoro.mcprouter.parse.RequestParser;
import com.gentoro.mcprouter.parse.SemanticExpander;
import com.gentoro.mcprouter.ranking.CandidateRanker;
import com.gentoro.mcprouter.ranking.ScoredCandidate;
import com.gentoro.mcprouter.ranking.ToolSelector;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FallbackChainTest {

  private CandidateRanker ranker;
  private FallbackChain chain;
  private ParsedRequest parsed;

  @BeforeEach
  void setUp() {
    ranker = mock(CandidateRanker.class);
    chain =
        new FallbackChain(
            ranker, new ToolSelector(), new SemanticExpander(), RoutingSettings.defaults());
    parsed = new RequestParser().parse(RoutingRequest.ofQuery("what's the weather in Seoul"));
  }

  private static ScoredCandidate candidate(String id, double score, ToolDescriptor... tools) {
    ProviderRecord provider =
        new ProviderRecord(
            id,
            id.substring(1).toUpperCase(),
            "",
            "Weather",
            List.of(),
            List.of(tools),
            true,
            0,
            null,
            null,
            null);
    return new ScoredCandidate(provider, score);
  }

  @Test
  void verifiedRankingIsUsedWhenNotEmpty() {
    ScoredCandidate best = candidate("@a", 40, ToolDescriptor.of("get_weather", "weather"));
    when(ranker.rank(parsed, true)).thenReturn(List.of(best));

    FallbackChain.Ranked ranked = chain.rank(parsed, true);

    assertFalse(ranked.relaxedVerification());
    assertEquals(List.of(best), ranked.candidates());
    verify(ranker, never()).rank(parsed, false);
  }

  @Test
  void relaxesVerificationOnceWhenNothingVerifiedMatches() {
    ScoredCandidate unverified = candidate("@u", 12, ToolDescriptor.of("get_weather", "weather"));
    when(ranker.rank(parsed, true)).thenReturn(List.of());
    when(ranker.rank(parsed, false)).thenReturn(List.of(unverified));

    FallbackChain.Selection selection = chain.select(parsed, true);

    assertTrue(selection.relaxedVerification());
    assertEquals("@u", selection.chosen().id());
    assertEquals("get_weather", selection.tool().name());
  }

  @Test
  void failsWhenRelaxedRankingIsEmptyToo() {
    when(ranker.rank(parsed, true)).thenReturn(List.of());
    when(ranker.rank(parsed, false)).thenReturn(List.of());

    NoCandidateFoundException e =
        assertThrows(NoCandidateFoundException.class, () -> chain.select(parsed, true));
    assertTrue(e.getMessage().contains("weather_query"));
    assertEquals(NoCandidateFoundException.SUGGESTION, e.getContext().get("suggestion"));
  }

  @Test
  void skipsProvidersWithoutToolsAndReportsAlternates() {
    ScoredCandidate empty = candidate("@first", 50);
    ScoredCandidate second = candidate("@second", 40, ToolDescriptor.of("get_weather", "weather"));
    ScoredCandidate third = candidate("@third", 30, ToolDescriptor.of("weather_now", "weather"));
    ScoredCandidate fourth = candidate("@fourth", 20, ToolDescriptor.of("weather_now", "weather"));
    when(ranker.rank(parsed, true)).thenReturn(List.of(empty, second, third, fourth));

    FallbackChain.Selection selection = chain.select(parsed, true);

    assertEquals("@second", selection.chosen().id());
    assertEquals(List.of("FIRST", "SECOND"), selection.evaluated());
    assertEquals(
        List.of("@first", "@third"),
        selection.alternates().stream().map(ScoredCandidate::id).toList());
  }

  @Test
  void failsWithEvaluatedProvidersWhenNoneHasATool() {
    List<ScoredCandidate> toolless = new ArrayList<>();
    for (int i = 0; i < 7; i++) {
      toolless.add(candidate("@p" + i, 50 - i));
    }
    when(ranker.rank(parsed, true)).thenReturn(toolless);

    NoMatchingToolException e =
        assertThrows(NoMatchingToolException.class, () -> chain.select(parsed, true));

    // bounded by routing.max-candidates
    assertEquals(List.of("P0", "P1", "P2", "P3", "P4"), e.getEvaluatedProviders());
  }
}
