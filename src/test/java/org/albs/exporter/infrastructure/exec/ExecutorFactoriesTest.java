package org.albs.exporter.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void buildsNamedFixedPool() throws Exception {
    ExecutorService pool = ExecutorFactories.newWorkerPool(3, "export", null);
    try {
      assertEquals(3, ((ThreadPoolExecutor) pool).getMaximumPoolSize());
      String name = pool.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);
      assertTrue(name.startsWith("export-"));
      assertFalse(pool.submit(() -> Thread.currentThread().isDaemon()).get(5, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void blankPrefixFallsBackToDefault() throws Exception {
    ExecutorService pool = ExecutorFactories.newWorkerPool(1, " ", null);
    try {
      assertTrue(pool.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS)
          .startsWith("exporter-worker-"));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void rejectsNonPositiveSize() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newWorkerPool(0, "x", null));
  }
}
