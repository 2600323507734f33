package dev.aahmedlab.taskpool;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-threaded execution context hosted by the schedule thread of a {@link TaskPool}.
 *
 * <p>Work posted here runs on that one thread, one unit at a time, in posting order. Units never
 * overlap, so state touched only from this context needs no further synchronization. Obtain a
 * context through {@link TaskPool#getScheduleContext()} after {@link
 * TaskPool#enableScheduleThread()}.
 *
 * @since 1.0.0
 */
public final class ScheduleContext {
  private static final Logger logger = LoggerFactory.getLogger(ScheduleContext.class);

  private final String name;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Deque<Runnable> queue = new ArrayDeque<>();
  private boolean quit;
  private volatile Thread owner;

  ScheduleContext(String name) {
    this.name = name;
  }

  /**
   * Appends {@code work} to this context. It runs after everything posted before it.
   *
   * @param work the unit of work
   * @return false if the loop has been asked to quit and the work was dropped
   * @throws NullPointerException if work is null
   */
  public boolean post(Runnable work) {
    Objects.requireNonNull(work, "work");
    lock.lock();
    try {
      if (quit) {
        logger.debug("Dropping work posted to stopped schedule context {}", name);
        return false;
      }
      queue.addLast(work);
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns true if the caller is running on the thread of this context.
   *
   * @return true when called from work posted to this context
   */
  public boolean isScheduleThread() {
    return Thread.currentThread() == owner;
  }

  public String getName() {
    return name;
  }

  /** Runs posted work on the calling thread until {@link #quit()} is called. */
  void run() {
    owner = Thread.currentThread();
    while (true) {
      Runnable work;
      lock.lock();
      try {
        while (queue.isEmpty() && !quit) {
          notEmpty.awaitUninterruptibly();
        }
        if (quit) {
          if (!queue.isEmpty()) {
            logger.warn(
                "Schedule context {} stopped with {} posted units of work not run",
                name,
                queue.size());
            queue.clear();
          }
          return;
        }
        work = queue.removeFirst();
      } finally {
        lock.unlock();
      }
      try {
        work.run();
      } catch (Throwable t) {
        logger.error("Exception occurred while running work on schedule context {}", name, t);
      }
    }
  }

  /**
   * Makes {@link #run()} return once the unit of work in progress, if any, has finished. Work
   * still queued is dropped; later posts are refused.
   */
  void quit() {
    lock.lock();
    try {
      quit = true;
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "ScheduleContext[" + name + "]";
  }
}
