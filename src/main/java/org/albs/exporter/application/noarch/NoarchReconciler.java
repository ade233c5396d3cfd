package org.albs.exporter.application.noarch;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.albs.exporter.application.noarch.ReconciliationDecision.Kind;
import org.albs.exporter.domain.PackageRecord;

/**
 * <strong>What:</strong> Computes which noarch packages a destination repository must gain or replace so
 * its noarch content matches a source repository.
 * <p><strong>Why:</strong> Architecture-independent packages are built once, on the primary architecture;
 * every other architecture must ship byte-identical copies.</p>
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>Only source packages with {@code arch=noarch} are considered.</li>
 *   <li>A source package without a destination counterpart of the same name, version and release is
 *   added, unless it is modular or only divergences are requested.</li>
 *   <li>A counterpart with a different checksum is removed and the source package added.</li>
 *   <li>A counterpart with the same checksum needs nothing.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; a pure function of its inputs.</p>
 *
 * @since 0.1.0
 */
public final class NoarchReconciler {

  /**
   * Compares two listings.
   *
   * @param source packages of the source repository version
   * @param destination packages of the destination repository version
   * @param sourceName display name of the source repository
   * @param destinationName display name of the destination repository
   * @param options reconciliation flags
   * @return add/remove sets and decisions; applying the plan and reconciling again yields an empty plan
   */
  public ReconciliationPlan reconcile(
      List<PackageRecord> source,
      List<PackageRecord> destination,
      String sourceName,
      String destinationName,
      ReconcileOptions options) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(destination, "destination");
    Objects.requireNonNull(options, "options");

    Map<String, PackageRecord> byNevr = new HashMap<>();
    for (PackageRecord pkg : destination) {
      byNevr.putIfAbsent(nevr(pkg), pkg);
    }

    List<String> toAdd = new ArrayList<>();
    List<String> toRemove = new ArrayList<>();
    List<ReconciliationDecision> decisions = new ArrayList<>();
    for (PackageRecord pkg : source) {
      if (!pkg.isNoarch()) {
        continue;
      }
      PackageRecord counterpart = byNevr.get(nevr(pkg));
      if (counterpart == null) {
        if (pkg.isModular() || options.differOnly()) {
          continue;
        }
        toAdd.add(pkg.href());
        decisions.add(new ReconciliationDecision(
            Kind.ADD, pkg, null, sourceName, destinationName, options.compareOnly()));
      } else if (!pkg.sameContent(counterpart)) {
        toRemove.add(counterpart.href());
        toAdd.add(pkg.href());
        decisions.add(new ReconciliationDecision(
            Kind.REPLACE, pkg, counterpart, sourceName, destinationName, options.compareOnly()));
      }
    }
    return new ReconciliationPlan(toAdd, toRemove, decisions);
  }

  private static String nevr(PackageRecord pkg) {
    return pkg.name() + '\u0000' + pkg.version() + '\u0000' + pkg.release();
  }
}
