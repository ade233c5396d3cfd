package org.albs.exporter.application.noarch;

import java.util.List;

/**
 * Result of comparing two package listings.
 *
 * @param toAdd source content handles to add to the destination
 * @param toRemove destination content handles to remove
 * @param decisions decisions in source listing order
 * @since 0.1.0
 */
public record ReconciliationPlan(
    List<String> toAdd, List<String> toRemove, List<ReconciliationDecision> decisions) {

  public ReconciliationPlan {
    toAdd = List.copyOf(toAdd);
    toRemove = List.copyOf(toRemove);
    decisions = List.copyOf(decisions);
  }

  public boolean isEmpty() {
    return toAdd.isEmpty() && toRemove.isEmpty();
  }
}
