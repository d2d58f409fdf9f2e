package com.codeheadsystems.tradenet.client.scheduler;

import java.time.Duration;

/**
 * The host's cooperative main loop.
 * <p>
 * Every piece of client state (cached token, outstanding ticket, staged trades) is touched only
 * from tasks run here, so tasks never run concurrently with each other and no locking is used.
 * Neither method blocks the caller.
 */
public interface TaskScheduler {

  /**
   * Runs the task on the main loop as soon as possible.
   *
   * @param task the task
   */
  void execute(Runnable task);

  /**
   * Runs the task once on the main loop after the delay.
   *
   * @param task  the task
   * @param delay the delay
   */
  void schedule(Runnable task, Duration delay);
}
