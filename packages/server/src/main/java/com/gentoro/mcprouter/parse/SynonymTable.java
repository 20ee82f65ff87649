package com.gentoro.mcprouter.parse;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Bidirectional synonym table built from synonym groups. Groups sharing a term are merged at
 * construction, so every term maps to its full equivalence class and expansion is idempotent.
 */
public class SynonymTable {
  private final Map<String, Set<String>> classes;

  public SynonymTable(List<List<String>> groups) {
    List<Set<String>> merged = new ArrayList<>();
    for (List<String> group : groups) {
      Set<String> incoming = new LinkedHashSet<>();
      for (String term : group) {
        incoming.add(term.toLowerCase(Locale.ROOT).trim());
      }
      List<Set<String>> overlapping = new ArrayList<>();
      for (Set<String> existing : merged) {
        if (!Collections.disjoint(existing, incoming)) {
          overlapping.add(existing);
        }
      }
      if (overlapping.isEmpty()) {
        merged.add(incoming);
        continue;
      }
      Set<String> target = overlapping.get(0);
      for (int i = 1; i < overlapping.size(); i++) {
        target.addAll(overlapping.get(i));
        merged.remove(overlapping.get(i));
      }
      target.addAll(incoming);
    }

    Map<String, Set<String>> index = new LinkedHashMap<>();
    for (Set<String> equivalence : merged) {
      Set<String> frozen = Collections.unmodifiableSet(new LinkedHashSet<>(equivalence));
      for (String term : frozen) {
        index.put(term, frozen);
      }
    }
    this.classes = Collections.unmodifiableMap(index);
  }

  /** Every term equivalent to the given one, itself included; a singleton for unknown terms. */
  public Set<String> synonymsOf(String term) {
    if (term == null) {
      return Set.of();
    }
    String key = term.toLowerCase(Locale.ROOT).trim();
    Set<String> equivalence = classes.get(key);
    return equivalence != null ? equivalence : Set.of(key);
  }

  /**
   * Input terms (lower-cased, in order) followed by their synonyms. Duplicates are dropped and
   * blank terms ignored.
   */
  public Set<String> expand(Collection<String> terms) {
    Set<String> expanded = new LinkedHashSet<>();
    if (terms == null) {
      return expanded;
    }
    for (String term : terms) {
      if (term != null && !term.isBlank()) {
        expanded.add(term.toLowerCase(Locale.ROOT).trim());
      }
    }
    for (String term : new ArrayList<>(expanded)) {
      expanded.addAll(synonymsOf(term));
    }
    return expanded;
  }

  public int size() {
    return classes.size();
  }
}
