package ca.gc.cra.sbuild.application.pipeline;

import ca.gc.cra.sbuild.application.lint.FileLinter;
import ca.gc.cra.sbuild.application.lint.LintOutcome;
import ca.gc.cra.sbuild.application.port.ConsolePort;
import ca.gc.cra.sbuild.application.port.LintLogger;
import ca.gc.cra.sbuild.application.port.MetricsPort;
import ca.gc.cra.sbuild.application.port.ResultListPort;
import ca.gc.cra.sbuild.infrastructure.exec.ExecutorFactories;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs a {@link FileLinter} over many files with bounded concurrency.
 * <p><strong>Why:</strong> Large descriptor trees are linted in parallel without interleaving console
 * output or letting one slow file hold back the rest.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Gate dispatch with a semaphore sized to the configured parallelism; the worker releases its
 *   permit when the job ends.</li>
 *   <li>Bound each job by the optional time budget, cancelling and failing jobs that exceed it.</li>
 *   <li>Tally outcomes, append files to the success and failure lists, and emit metrics.</li>
 *   <li>Own the {@link LogAggregator} lifecycle: started before the first job, drained after the last.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe for concurrent {@link #run(List)} invocations.</p>
 * <p><strong>Observability:</strong> Metrics {@code lint.files.validated}, {@code lint.files.failed},
 * {@code lint.files.timeout}, {@code lint.job.latencyNanos}; MDC key {@code lint.file} on worker
 * threads.</p>
 *
 * @since 0.1.0
 */
public final class LintOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(LintOrchestrator.class);

  static final String MDC_FILE = "lint.file";

  private final FileLinter linter;
  private final LintRunSettings settings;
  private final ConsolePort console;
  private final ResultListPort successList;
  private final ResultListPort failList;
  private final MetricsPort metrics;

  /**
   * Creates an orchestrator.
   *
   * @param linter per-file linter shared by every job
   * @param settings concurrency settings
   * @param console destination for per-file output
   * @param successList receives files that passed
   * @param failList receives files that failed
   * @param metrics metrics sink; {@link MetricsPort#NO_OP} when disabled
   */
  public LintOrchestrator(
      FileLinter linter,
      LintRunSettings settings,
      ConsolePort console,
      ResultListPort successList,
      ResultListPort failList,
      MetricsPort metrics) {
    this.linter = Objects.requireNonNull(linter, "linter");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.console = Objects.requireNonNull(console, "console");
    this.successList = Objects.requireNonNull(successList, "successList");
    this.failList = Objects.requireNonNull(failList, "failList");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Lints every file and waits for all jobs to finish.
   *
   * @param files descriptor paths in dispatch order
   * @return run tallies
   * @throws InterruptedException if the calling thread is interrupted; in-flight jobs are cancelled
   */
  public LintSummary run(List<Path> files) throws InterruptedException {
    Objects.requireNonNull(files, "files");
    long start = System.nanoTime();
    AtomicInteger passed = new AtomicInteger();
    AtomicInteger failed = new AtomicInteger();

    LogAggregator aggregator = new LogAggregator(console, !settings.parallelMode());
    aggregator.start();
    LintLogger logger = aggregator.handle();

    Semaphore permits = new Semaphore(settings.parallelism());
    ExecutorService workers = ExecutorFactories.newWorkerPool(settings.parallelism(), "lint-worker",
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
    ExecutorService jobs = settings.jobTimeout().isPresent()
        ? ExecutorFactories.newJobPool("lint-job",
            (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex))
        : null;

    try {
      for (Path file : files) {
        permits.acquire();
        try {
          workers.execute(() -> {
            try {
              record(file, runJob(file, logger, jobs), passed, failed);
            } finally {
              permits.release();
            }
          });
        } catch (RejectedExecutionException ex) {
          permits.release();
          throw new IllegalStateException("lint worker pool rejected " + file, ex);
        }
      }
      workers.shutdown();
      workers.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
    } catch (InterruptedException ex) {
      log.warn("Lint run interrupted; cancelling in-flight jobs");
      workers.shutdownNow();
      throw ex;
    } finally {
      if (jobs != null) {
        jobs.shutdownNow();
      }
      aggregator.shutdown();
    }

    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
    LintSummary summary = new LintSummary(passed.get(), failed.get(), files.size(), elapsed);
    log.info("Lint run finished: {} passed, {} failed, {} submitted in {}",
        summary.passed(), summary.failed(), summary.submitted(), summary.elapsedText());
    return summary;
  }

  private LintOutcome runJob(Path file, LintLogger logger, ExecutorService jobs) {
    long jobStart = System.nanoTime();
    MDC.put(MDC_FILE, file.toString());
    try {
      log.debug("Linting {}", file);
      if (jobs == null) {
        return linter.lint(file, logger);
      }
      return runTimeBoxed(file, logger, jobs, settings.jobTimeout().get());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.error("'" + file + "' was interrupted");
      return LintOutcome.FAILED;
    } catch (RuntimeException | Error ex) {
      log.error("Unexpected failure while linting {}", file, ex);
      logger.error("'" + file + "': " + ex);
      return LintOutcome.FAILED;
    } finally {
      metrics.observe("lint.job.latencyNanos", System.nanoTime() - jobStart);
      MDC.remove(MDC_FILE);
    }
  }

  private LintOutcome runTimeBoxed(Path file, LintLogger logger, ExecutorService jobs, Duration budget)
      throws InterruptedException {
    Future<LintOutcome> future = jobs.submit(() -> {
      MDC.put(MDC_FILE, file.toString());
      try {
        return linter.lint(file, logger);
      } finally {
        MDC.remove(MDC_FILE);
      }
    });
    try {
      return future.get(budget.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      metrics.increment("lint.files.timeout");
      log.warn("Lint of {} exceeded {} ms; cancelled", file, budget.toMillis());
      logger.error("'" + file + "' timed out after " + budget.toSeconds() + "s");
      return LintOutcome.FAILED;
    } catch (ExecutionException ex) {
      log.error("Lint job for {} failed", file, ex.getCause());
      logger.error("'" + file + "': " + ex.getCause());
      return LintOutcome.FAILED;
    } catch (InterruptedException ex) {
      future.cancel(true);
      throw ex;
    }
  }

  private void record(Path file, LintOutcome outcome, AtomicInteger passed, AtomicInteger failed) {
    if (outcome.passed()) {
      passed.incrementAndGet();
      metrics.increment("lint.files.validated");
      successList.append(file);
    } else {
      failed.incrementAndGet();
      metrics.increment("lint.files.failed");
      failList.append(file);
    }
  }
}
