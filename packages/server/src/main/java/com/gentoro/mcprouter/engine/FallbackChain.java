package com.gentoro.mcprouter.engine;

import com.gentoro.mcprouter.catalog.ToolDescriptor;
import com.gentoro.mcprouter.exception.NoCandidateFoundException;
import com.gentoro.mcprouter.exception.NoMatchingToolException;
import com.gentoro.mcprouter.parse.ParsedRequest;
import com.gentoro.mcprouter.parse.SemanticExpander;
import com.gentoro.mcprouter.ranking.CandidateRanker;
import com.gentoro.mcprouter.ranking.ScoredCandidate;
import com.gentoro.mcprouter.ranking.ToolSelector;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Degrades gracefully from the best match to weaker ones.
 *
 * <ol>
 *   <li>Rank with the requested verification requirement; if that yields nothing, rank once more
 *       with verification relaxed.
 *   <li>Walk the ranked list, bounded by {@code maxCandidates}, and take the first provider that
 *       yields a tool.
 *   <li>Fail with {@link NoMatchingToolException} naming every provider that was looked at.
 * </ol>
 */
public class FallbackChain {
  private static final org.slf4j.Logger log =
      com.gentoro.mcprouter.logging.LoggingService.getLogger(FallbackChain.class);

  private final CandidateRanker ranker;
  private final ToolSelector toolSelector;
  private final SemanticExpander expander;
  private final RoutingSettings settings;

  public FallbackChain(
      CandidateRanker ranker,
      ToolSelector toolSelector,
      SemanticExpander expander,
      RoutingSettings settings) {
    this.ranker = ranker;
    this.toolSelector = toolSelector;
    this.expander = expander;
    this.settings = settings;
  }

  /** Ranked candidates, relaxing verification once when the strict ranking is empty. */
  public Ranked rank(ParsedRequest parsed, boolean requireVerified) {
    List<ScoredCandidate> ranked = ranker.rank(parsed, requireVerified);
    boolean relaxed = false;
    if (ranked.isEmpty() && requireVerified) {
      log.debug("No verified candidates for intent {}, relaxing verification", parsed.intent());
      ranked = ranker.rank(parsed, false);
      relaxed = true;
    }
    if (ranked.isEmpty()) {
      throw new NoCandidateFoundException(
          "No provider matches intent '%s' in category '%s'"
              .formatted(parsed.intent(), parsed.category()));
    }
    return new Ranked(ranked, relaxed);
  }

  public Selection select(ParsedRequest parsed, boolean requireVerified) {
    Ranked ranked = rank(parsed, requireVerified);
    Set<String> capabilities = expander.expandCapabilities(parsed.capabilities());
    List<String> evaluated = new ArrayList<>();

    int limit = Math.min(settings.maxCandidates(), ranked.candidates().size());
    for (int i = 0; i < limit; i++) {
      ScoredCandidate candidate = ranked.candidates().get(i);
      evaluated.add(candidate.name());
      ToolDescriptor tool =
          toolSelector.select(
              candidate.provider(), parsed.intent(), capabilities, parsed.queryTerms());
      if (tool != null) {
        return new Selection(
            candidate,
            tool,
            alternatesOf(ranked.candidates(), candidate),
            ranked.relaxedVerification(),
            evaluated);
      }
      log.debug("Provider {} exposes no usable tool, trying next", candidate.id());
    }
    throw new NoMatchingToolException(
        "None of the %d evaluated providers exposes a usable tool".formatted(evaluated.size()),
        evaluated);
  }

  private List<ScoredCandidate> alternatesOf(
      List<ScoredCandidate> ranked, ScoredCandidate chosen) {
    List<ScoredCandidate> alternates = new ArrayList<>();
    for (ScoredCandidate candidate : ranked) {
      if (alternates.size() >= settings.maxAlternates()) {
        break;
      }
      if (candidate != chosen) {
        alternates.add(candidate);
      }
    }
    return alternates;
  }

  /** Ranking outcome and whether verification had to be relaxed to get it. */
  public record Ranked(List<ScoredCandidate> candidates, boolean relaxedVerification) {
    public Ranked {
      candidates = List.copyOf(candidates);
    }
  }

  /**
   * Provider and tool chosen by the chain.
   *
   * @param chosen winning candidate
   * @param tool tool picked on the winner
   * @param alternates next best candidates, excluding the winner
   * @param relaxedVerification whether unverified providers had to be admitted
   * @param evaluated display names of every provider visited, in order
   */
  public record Selection(
      ScoredCandidate chosen,
      ToolDescriptor tool,
      List<ScoredCandidate> alternates,
      boolean relaxedVerification,
      List<String> evaluated) {
    public Selection {
      alternates = List.copyOf(alternates);
      evaluated = List.copyOf(evaluated);
    }
  }
}
