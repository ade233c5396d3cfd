package org.albs.exporter.application.task;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs a batch of independent units on a shared executor and collects one outcome
 * per unit.
 * <p><strong>Why:</strong> A failing repository must not abort its siblings; the run reports every
 * failure at the end instead.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Tag each unit's log lines with its subject under the {@code repo} MDC key.</li>
 *   <li>Turn unit exceptions into failed {@link UnitOutcome}s.</li>
 *   <li>Cancel outstanding units when the waiting thread is interrupted.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Submit and await from a single coordinating thread.</p>
 *
 * @since 0.1.0
 */
public final class TaskGroup {
  /** MDC key carrying the repository or directory a log line belongs to. */
  public static final String MDC_KEY = "repo";

  private static final Logger log = LoggerFactory.getLogger(TaskGroup.class);

  private final ExecutorService executor;
  private final String stage;
  private final List<Submitted> submitted = new ArrayList<>();

  public TaskGroup(ExecutorService executor, String stage) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.stage = Objects.requireNonNull(stage, "stage");
  }

  /**
   * Schedules a unit.
   *
   * @param subject unit identity used in logs and outcomes
   * @param unit work to run
   */
  public void submit(String subject, Unit unit) {
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(unit, "unit");
    Future<UnitOutcome> future = executor.submit(() -> runUnit(subject, unit));
    submitted.add(new Submitted(subject, future));
  }

  /**
   * Waits for every submitted unit.
   *
   * @return outcomes in submission order
   * @throws InterruptedException when the waiting thread is interrupted; outstanding units are cancelled
   */
  public List<UnitOutcome> awaitAll() throws InterruptedException {
    List<UnitOutcome> outcomes = new ArrayList<>(submitted.size());
    try {
      for (Submitted entry : submitted) {
        outcomes.add(await(entry));
      }
    } catch (InterruptedException ex) {
      for (Submitted entry : submitted) {
        entry.future().cancel(true);
      }
      throw ex;
    } finally {
      submitted.clear();
    }
    return outcomes;
  }

  private UnitOutcome await(Submitted entry) throws InterruptedException {
    try {
      return entry.future().get();
    } catch (ExecutionException ex) {
      // runUnit catches everything but errors
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      log.error("{} failed for {}", stage, entry.subject(), cause);
      return UnitOutcome.failed(stage, entry.subject(), cause);
    } catch (CancellationException ex) {
      return UnitOutcome.failed(stage, entry.subject(), "cancelled");
    }
  }

  private UnitOutcome runUnit(String subject, Unit unit) {
    String previous = MDC.get(MDC_KEY);
    MDC.put(MDC_KEY, subject);
    try {
      unit.run();
      return UnitOutcome.ok(stage, subject);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("{} interrupted for {}", stage, subject);
      return UnitOutcome.failed(stage, subject, ex);
    } catch (Exception ex) {
      log.error("{} failed for {}: {}", stage, subject, ex.getMessage(), ex);
      return UnitOutcome.failed(stage, subject, ex);
    } finally {
      if (previous == null) {
        MDC.remove(MDC_KEY);
      } else {
        MDC.put(MDC_KEY, previous);
      }
    }
  }

  /** Unit of work run by a {@link TaskGroup}. */
  @FunctionalInterface
  public interface Unit {
    void run() throws Exception;
  }

  private record Submitted(String subject, Future<UnitOutcome> future) {}
}
