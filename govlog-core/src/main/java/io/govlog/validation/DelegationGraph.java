package io.govlog.validation;

import io.govlog.projection.Delegation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph of actors, with an edge {@code from -> to} for each delegation.
 */
final class DelegationGraph {
  private final Map<String, List<String>> edges = new HashMap<>();

  DelegationGraph(Collection<Delegation> delegations) {
    for (Delegation d : delegations) {
      edges.computeIfAbsent(d.fromActor(), k -> new ArrayList<>()).add(d.toActor());
    }
  }

  /**
   * Returns {@code true} if adding {@code from -> to} would close a cycle, i.e. {@code from}
   * is already reachable from {@code to}.
   */
  boolean wouldCycle(String from, String to) {
    if (from.equals(to)) {
      return true;
    }
    Set<String> visited = new HashSet<>();
    Deque<String> stack = new ArrayDeque<>();
    stack.push(to);
    while (!stack.isEmpty()) {
      String actor = stack.pop();
      if (actor.equals(from)) {
        return true;
      }
      if (visited.add(actor)) {
        for (String next : edges.getOrDefault(actor, List.of())) {
          if (!visited.contains(next)) {
            stack.push(next);
          }
        }
      }
    }
    return false;
  }
}
