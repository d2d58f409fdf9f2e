package com.codeheadsystems.tradenet.client.testing;

import com.codeheadsystems.tradenet.client.scheduler.TaskScheduler;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Runs tasks only when the test asks it to. Delayed tasks become due as the
 * {@link MutableClock} is advanced.
 */
public class ManualTaskScheduler implements TaskScheduler {

  private final MutableClock clock;
  private final Deque<Runnable> ready = new ArrayDeque<>();
  private final List<Delayed> delayed = new ArrayList<>();
  private int executed;
  private int scheduled;

  /**
   * Instantiates a new Manual task scheduler.
   *
   * @param clock the clock delayed tasks are measured against
   */
  public ManualTaskScheduler(final MutableClock clock) {
    this.clock = clock;
  }

  @Override
  public void execute(final Runnable task) {
    executed++;
    ready.add(task);
  }

  @Override
  public void schedule(final Runnable task, final Duration delay) {
    scheduled++;
    delayed.add(new Delayed(clock.instant().plus(delay), task));
  }

  /**
   * Runs ready tasks, including the ones they enqueue, until none are left.
   *
   * @return the number of tasks run
   */
  public int runReady() {
    int count = 0;
    Runnable task;
    while ((task = ready.poll()) != null) {
      task.run();
      count++;
    }
    return count;
  }

  /**
   * Advances the clock, runs every delayed task that became due in due order, and drains the
   * ready queue after each.
   *
   * @param duration the duration
   */
  public void advance(final Duration duration) {
    clock.advance(duration);
    runReady();
    Delayed next;
    while ((next = nextDue()) != null) {
      delayed.remove(next);
      next.task().run();
      runReady();
    }
  }

  private Delayed nextDue() {
    return delayed.stream()
        .filter(d -> !d.due().isAfter(clock.instant()))
        .min(Comparator.comparing(Delayed::due))
        .orElse(null);
  }

  /**
   * Tasks handed to {@link #execute(Runnable)} so far.
   *
   * @return the int
   */
  public int executedCount() {
    return executed;
  }

  /**
   * Tasks handed to {@link #schedule(Runnable, Duration)} so far.
   *
   * @return the int
   */
  public int scheduledCount() {
    return scheduled;
  }

  /**
   * Delayed tasks not yet run.
   *
   * @return the int
   */
  public int pendingDelayed() {
    return delayed.size();
  }

  private record Delayed(Instant due, Runnable task) {
  }
}
