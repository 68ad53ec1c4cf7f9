package ca.gc.cra.sbuild.application.pipeline;

import ca.gc.cra.sbuild.application.port.ConsolePort;
import ca.gc.cra.sbuild.application.port.LintLogger;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Serializes console output from concurrent lint jobs through one consumer
 * thread.
 * <p>Producers obtain a {@link LintLogger} via {@link #handle()} and enqueue without blocking. The
 * consumer writes messages in arrival order until it dequeues the {@code DONE} sentinel posted by
 * {@link #shutdown()}. Info and success lines go to {@link ConsolePort#out}; warnings, errors
 * and raw excerpts go to {@link ConsolePort#err}.</p>
 * <p>With {@code showDetail=false} every message is consumed and discarded, so parallel runs print
 * only the tallies the caller writes after shutdown.</p>
 * <p><strong>Thread-safety:</strong> {@link #handle()} is safe for any number of producers;
 * {@link #start()} and {@link #shutdown()} belong to the owning thread.</p>
 *
 * @since 0.1.0
 */
public final class LogAggregator {
  private static final Logger log = LoggerFactory.getLogger(LogAggregator.class);

  static final String SUCCESS_PREFIX = "[✔] ";
  static final String ERROR_PREFIX = "[〤] ";
  static final String WARN_PREFIX = "[⚠] ";

  private final BlockingQueue<LogMessage> queue = new LinkedBlockingQueue<>();
  private final ConsolePort console;
  private final boolean showDetail;
  private final Thread consumer;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopped = new AtomicBoolean();
  private final LintLogger handle = new QueueHandle();

  /**
   * Creates an aggregator.
   *
   * @param console destination for rendered lines
   * @param showDetail whether per-file messages are written
   */
  public LogAggregator(ConsolePort console, boolean showDetail) {
    this.console = Objects.requireNonNull(console, "console");
    this.showDetail = showDetail;
    this.consumer = new Thread(this::drainLoop, "lint-log");
    this.consumer.setDaemon(true);
  }

  /** Starts the consumer thread. Must be called before any job uses {@link #handle()}. */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("log aggregator already started");
    }
    consumer.start();
  }

  /**
   * Returns the logger jobs post to. Safe to share across worker threads.
   *
   * @return queue-backed logger; messages posted after {@link #shutdown()} are dropped
   */
  public LintLogger handle() {
    return handle;
  }

  /**
   * Posts the sentinel and waits for the consumer to write everything queued before it.
   *
   * @throws InterruptedException if interrupted while waiting for the consumer
   */
  public void shutdown() throws InterruptedException {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    queue.put(LogMessage.DONE);
    if (started.get()) {
      consumer.join();
    }
  }

  void post(LogMessage message) {
    if (stopped.get()) {
      log.debug("Dropping {} message posted after shutdown", message.kind());
      return;
    }
    queue.add(message);
  }

  private void drainLoop() {
    try {
      while (true) {
        LogMessage message = queue.take();
        if (message.kind() == LogMessage.Kind.DONE) {
          return;
        }
        if (showDetail) {
          render(message);
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Log aggregator interrupted with {} message(s) pending", queue.size());
    } catch (RuntimeException ex) {
      log.error("Log aggregator failed; console output stopped", ex);
    }
  }

  private void render(LogMessage message) {
    switch (message.kind()) {
      case INFO -> console.out(message.text());
      case SUCCESS -> console.out(SUCCESS_PREFIX + message.text());
      case WARN -> console.err(WARN_PREFIX + message.text());
      case ERROR -> console.err(ERROR_PREFIX + message.text());
      case RAW -> console.err(message.text());
      default -> throw new IllegalStateException("unexpected message kind " + message.kind());
    }
  }

  private final class QueueHandle implements LintLogger {
    @Override
    public void info(String message) {
      post(new LogMessage(LogMessage.Kind.INFO, message));
    }

    @Override
    public void success(String message) {
      post(new LogMessage(LogMessage.Kind.SUCCESS, message));
    }

    @Override
    public void warn(String message) {
      post(new LogMessage(LogMessage.Kind.WARN, message));
    }

    @Override
    public void error(String message) {
      post(new LogMessage(LogMessage.Kind.ERROR, message));
    }

    @Override
    public void raw(String message) {
      post(new LogMessage(LogMessage.Kind.RAW, message));
    }
  }
}
