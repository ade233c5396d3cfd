package org.albs.exporter.application.noarch;

import java.util.ArrayList;
import java.util.List;
import org.albs.exporter.domain.Architectures;
import org.albs.exporter.domain.Repository;

/**
 * Pairs every {@code x86_64} repository with the other binary architectures of the same selection.
 *
 * @since 0.1.0
 */
public final class ReconciliationPairPlanner {

  private ReconciliationPairPlanner() {}

  /**
   * Builds reconciliation pairs.
   *
   * @param repositories repositories of one platform or distribution
   * @return pairs whose destination is neither {@code x86_64} nor {@code src} and whose debug flag
   *     matches the source
   */
  public static List<ReconciliationPair> plan(List<Repository> repositories) {
    List<ReconciliationPair> pairs = new ArrayList<>();
    for (Repository source : repositories) {
      if (!source.isArch(Architectures.X86_64)) {
        continue;
      }
      for (Repository destination : repositories) {
        if (destination.isArch(Architectures.X86_64)
            || destination.isArch(Architectures.SRC)
            || destination.debug() != source.debug()) {
          continue;
        }
        pairs.add(new ReconciliationPair(source, destination));
      }
    }
    return pairs;
  }
}
