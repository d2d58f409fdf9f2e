package com.codeheadsystems.tradenet.client.scheduler;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TaskScheduler} running every task on a single daemon thread.
 * <p>
 * A task that throws is logged and the loop carries on with the next task.
 */
@Singleton
public class ExecutorTaskScheduler implements TaskScheduler, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ExecutorTaskScheduler.class);

  private final ScheduledExecutorService executor;

  /**
   * Instantiates a new scheduler with its own main-loop thread.
   */
  public ExecutorTaskScheduler() {
    this(Executors.newSingleThreadScheduledExecutor(runnable -> {
      Thread thread = new Thread(runnable, "tradenet-main");
      thread.setDaemon(true);
      return thread;
    }));
  }

  /**
   * Instantiates a new scheduler on the given executor, which must run tasks one at a time.
   *
   * @param executor the executor
   */
  public ExecutorTaskScheduler(final ScheduledExecutorService executor) {
    log.info("ExecutorTaskScheduler()");
    this.executor = executor;
  }

  @Override
  public void execute(final Runnable task) {
    executor.execute(guarded(task));
  }

  @Override
  public void schedule(final Runnable task, final Duration delay) {
    executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
  }

  private Runnable guarded(final Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (RuntimeException e) {
        log.error("Scheduled task failed", e);
      }
    };
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }
}
