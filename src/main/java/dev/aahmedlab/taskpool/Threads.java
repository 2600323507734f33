package dev.aahmedlab.taskpool;

import java.util.concurrent.ThreadFactory;

/** Thread helpers shared by the backends and the schedule-thread manager. */
final class Threads {

  private Threads() {}

  /**
   * Creates an unstarted thread for {@code task}. Without a factory the thread is a daemon named
   * {@code name}.
   *
   * @return the thread, or null if the factory refused to create one
   */
  static Thread newThread(ThreadFactory factory, Runnable task, String name) {
    if (factory != null) {
      return factory.newThread(task);
    }
    Thread t = new Thread(task, name);
    t.setDaemon(true); // Make daemon to prevent JVM hangs
    return t;
  }

  /**
   * Waits for {@code thread} to die. An interrupt does not cut the wait short; it is re-asserted
   * on the calling thread once the join has completed.
   */
  static void joinUninterruptibly(Thread thread) {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          thread.join();
          return;
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
