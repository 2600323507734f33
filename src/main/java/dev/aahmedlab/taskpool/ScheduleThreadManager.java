package dev.aahmedlab.taskpool;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reference-counted owner of the schedule thread of one {@link TaskPool}. This class is
 * package-private and not part of the public API.
 *
 * <p>The thread and its {@link ScheduleContext} exist exactly while the count is positive: the
 * first {@link #acquire()} starts them and waits until the loop runs, the last {@link #release()}
 * stops the loop and joins the thread outside the lock. A later acquire may start a new thread
 * while the old one is still finishing its last unit of work. The count is unrelated to the lifetime of the pool object.
 * {@code scheduleLock} is never held together with a backend lock.
 */
final class ScheduleThreadManager {
  private static final Logger logger = LoggerFactory.getLogger(ScheduleThreadManager.class);

  private final String name;
  private final ReentrantLock scheduleLock = new ReentrantLock();
  private final Condition scheduleCond = scheduleLock.newCondition();
  private volatile int refCount; // written under scheduleLock
  private volatile ScheduleContext context; // written under scheduleLock
  private Thread thread; // guarded by scheduleLock
  private boolean running; // guarded by scheduleLock

  ScheduleThreadManager(String name) {
    this.name = name;
  }

  /**
   * Adds a reference, starting the schedule thread if this is the first one. Returns only after
   * the thread's loop is running.
   */
  @SuppressFBWarnings(
      value = "VO_VOLATILE_INCREMENT",
      justification = "Writes happen under scheduleLock; volatile only serves lock-free readers")
  void acquire() {
    scheduleLock.lock();
    try {
      if (refCount == 0) {
        ScheduleContext ctx = new ScheduleContext(name);
        Thread t = new Thread(() -> runLoop(ctx), name);
        t.setDaemon(true);
        running = false;
        t.start();
        while (!running) {
          scheduleCond.awaitUninterruptibly();
        }
        thread = t;
        context = ctx;
        logger.debug("Schedule thread {} is running", name);
      }
      refCount++;
    } finally {
      scheduleLock.unlock();
    }
  }

  /**
   * Drops a reference. Dropping the last one stops the loop after its current unit of work and
   * joins the thread before returning.
   *
   * @throws IllegalStateException if no reference is held, or if the last reference is dropped
   *     from the schedule thread itself
   */
  @SuppressFBWarnings(
      value = "VO_VOLATILE_INCREMENT",
      justification = "Writes happen under scheduleLock; volatile only serves lock-free readers")
  void release() {
    ScheduleContext stopping = null;
    Thread stoppingThread = null;
    scheduleLock.lock();
    try {
      if (refCount == 0) {
        throw new IllegalStateException("Schedule thread of " + name + " is not enabled");
      }
      if (refCount == 1 && Thread.currentThread() == thread) {
        throw new IllegalStateException("The schedule thread cannot release its last reference");
      }
      refCount--;
      if (refCount == 0) {
        stopping = context;
        stoppingThread = thread;
        context = null;
        thread = null;
        running = false;
      }
    } finally {
      scheduleLock.unlock();
    }
    // Outside the lock, so the unit of work still running may enable a new schedule thread.
    if (stopping != null) {
      stopping.quit();
      Threads.joinUninterruptibly(stoppingThread);
      logger.debug("Schedule thread {} stopped", name);
    }
  }

  /**
   * Returns the live context, or null while no reference is held. Does not take the lock, so work
   * on the schedule thread can call it while the last reference is being dropped.
   */
  ScheduleContext getContext() {
    return context;
  }

  int getRefCount() {
    return refCount;
  }

  private void runLoop(ScheduleContext ctx) {
    // The first unit of work proves the loop is live.
    ctx.post(this::signalRunning);
    ctx.run();
  }

  private void signalRunning() {
    scheduleLock.lock();
    try {
      running = true;
      scheduleCond.signalAll();
    } finally {
      scheduleLock.unlock();
    }
  }
}
