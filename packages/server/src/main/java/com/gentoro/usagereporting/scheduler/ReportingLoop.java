package com.gentoro.usagereporting.scheduler;

import com.gentoro.usagereporting.logging.LoggingService;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * The single thread that owns all reporting state: live reports, the derived data cache and the
 * schema id memo. Request threads hand work to it, so that state is never touched concurrently.
 */
public class ReportingLoop implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(ReportingLoop.class);

  private final ScheduledExecutorService executor;
  private volatile Thread thread;

  public ReportingLoop(String threadName) {
    this.executor =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread t = new Thread(runnable, threadName);
              t.setDaemon(true);
              thread = t;
              return t;
            });
  }

  /**
   * Runs the task on the loop thread. The future completes with its result or failure. Once the
   * loop is closed the task is dropped and the future completes with null.
   */
  public <T> CompletableFuture<T> submit(Callable<T> task) {
    CompletableFuture<T> result = new CompletableFuture<>();
    try {
      executor.execute(
          () -> {
            try {
              result.complete(task.call());
            } catch (Throwable t) {
              result.completeExceptionally(t);
            }
          });
    } catch (RejectedExecutionException e) {
      log.debug("Reporting loop is closed; dropping task");
      result.complete(null);
    }
    return result;
  }

  /**
   * Runs a task that starts further asynchronous work, such as a flush, and completes once that
   * work has completed too.
   */
  public CompletableFuture<Void> submitAndChain(Callable<CompletableFuture<Void>> task) {
    return submit(task)
        .thenCompose(next -> next == null ? CompletableFuture.<Void>completedFuture(null) : next);
  }

  public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, long periodMs) {
    return executor.scheduleAtFixedRate(
        () -> {
          try {
            task.run();
          } catch (RuntimeException e) {
            // An exception would cancel all further runs.
            log.error("Periodic reporting task failed", e);
          }
        },
        periodMs,
        periodMs,
        TimeUnit.MILLISECONDS);
  }

  public boolean inLoop() {
    return Thread.currentThread() == thread;
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Reporting loop did not terminate in time");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }
}
