package ca.gc.cra.sbuild.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void workerPoolNamesNonDaemonThreads() throws Exception {
    AtomicReference<Thread> seen = new AtomicReference<>();
    ExecutorService pool = ExecutorFactories.newWorkerPool(2, "lint-worker", null);
    pool.execute(() -> seen.set(Thread.currentThread()));
    pool.shutdown();
    assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

    assertTrue(seen.get().getName().startsWith("lint-worker-"));
    assertEquals(false, seen.get().isDaemon());
  }

  @Test
  void jobPoolUsesDaemonThreads() throws Exception {
    ExecutorService pool = ExecutorFactories.newJobPool("", null);
    try {
      Thread thread = pool.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);
      assertTrue(thread.isDaemon());
      assertTrue(thread.getName().startsWith("lint-job-"));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void rejectsEmptyWorkerPool() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newWorkerPool(0, "x", null));
  }
}
