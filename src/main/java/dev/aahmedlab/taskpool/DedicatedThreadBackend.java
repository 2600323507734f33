package dev.aahmedlab.taskpool;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backend that starts a fresh thread for every job. Threads are never reused, which makes each job
 * joinable through the handle returned by {@link #push(Job)}.
 *
 * <p>Suited to a small number of long-running jobs, such as streaming loops, that should not
 * occupy the threads of a shared worker pool.
 *
 * @since 1.0.0
 */
public final class DedicatedThreadBackend implements TaskPoolBackend {
  private static final Logger logger = LoggerFactory.getLogger(DedicatedThreadBackend.class);

  private final String name;
  private final ThreadFactory threadFactory;
  private final ReentrantLock backendLock = new ReentrantLock();
  private final Set<Thread> running = new HashSet<>();
  private boolean prepared;
  private int threadSequence;

  public DedicatedThreadBackend(String name) {
    this(name, null);
  }

  /**
   * Creates an unprepared backend.
   *
   * @param name prefix for the job thread names
   * @param threadFactory creates the job threads, or null for daemon threads named after the
   *     backend; a factory returning null makes {@link #push(Job)} fail
   */
  public DedicatedThreadBackend(String name, ThreadFactory threadFactory) {
    this.name = Objects.requireNonNull(name, "name");
    this.threadFactory = threadFactory;
  }

  @Override
  public void prepare() {
    backendLock.lock();
    try {
      if (prepared) {
        throw new IllegalStateException("Backend " + name + " is already prepared");
      }
      prepared = true;
    } finally {
      backendLock.unlock();
    }
  }

  /**
   * Starts a new thread running {@code job}.
   *
   * @return a joinable handle, or {@link JobHandle#NONE} if the backend is not prepared
   * @throws TaskPoolException if the thread factory refused to create the thread or it could not
   *     be started
   */
  @Override
  public JobHandle push(Job job) throws TaskPoolException {
    Objects.requireNonNull(job, "job");
    backendLock.lock();
    try {
      if (!prepared) {
        logger.debug("Dropping {} pushed to unprepared backend {}", job, name);
        return JobHandle.NONE;
      }
      Thread t =
          Threads.newThread(threadFactory, () -> runJob(job), name + "-job-" + threadSequence++);
      if (t == null) {
        throw new TaskPoolException("Thread factory refused to create a thread for " + job);
      }
      running.add(t);
      try {
        t.start();
      } catch (OutOfMemoryError | IllegalThreadStateException e) {
        running.remove(t);
        throw new TaskPoolException("Could not start thread " + t.getName() + " for " + job, e);
      }
      return new ThreadHandle(this, t);
    } finally {
      backendLock.unlock();
    }
  }

  private void runJob(Job job) {
    try {
      job.run();
    } catch (Throwable t) {
      logger.error("Exception occurred while executing job", t);
    } finally {
      backendLock.lock();
      try {
        running.remove(Thread.currentThread());
      } finally {
        backendLock.unlock();
      }
    }
  }

  /**
   * Waits until the job behind {@code handle} has finished.
   *
   * @throws IllegalArgumentException if the handle was not returned by this backend
   * @throws IllegalStateException if called from the job's own thread
   */
  @Override
  public void join(JobHandle handle) {
    if (handle == JobHandle.NONE) {
      return;
    }
    if (!(handle instanceof ThreadHandle) || ((ThreadHandle) handle).owner != this) {
      throw new IllegalArgumentException(handle + " was not returned by backend " + name);
    }
    Thread thread = ((ThreadHandle) handle).thread;
    if (thread == Thread.currentThread()) {
      throw new IllegalStateException("A job cannot join itself");
    }
    Threads.joinUninterruptibly(thread);
  }

  /**
   * Stops accepting jobs and waits for every running job thread to exit.
   *
   * @throws IllegalStateException if called from one of this backend's job threads
   */
  @Override
  public void cleanup() {
    List<Thread> threads;
    backendLock.lock();
    try {
      if (!prepared) {
        return;
      }
      if (running.contains(Thread.currentThread())) {
        throw new IllegalStateException(
            "cleanup() called from a job of " + name + ", it would wait for itself");
      }
      prepared = false;
      threads = new ArrayList<>(running);
    } finally {
      backendLock.unlock();
    }
    for (Thread t : threads) {
      Threads.joinUninterruptibly(t);
    }
    logger.debug("Cleaned up backend {}, joined {} job threads", name, threads.size());
  }

  @Override
  public boolean isPrepared() {
    backendLock.lock();
    try {
      return prepared;
    } finally {
      backendLock.unlock();
    }
  }

  /**
   * Returns the number of jobs whose thread has not finished yet.
   *
   * @return the number of running job threads
   */
  public int getRunningJobCount() {
    backendLock.lock();
    try {
      return running.size();
    } finally {
      backendLock.unlock();
    }
  }

  @Override
  public String toString() {
    return "DedicatedThreadBackend[" + name + "]";
  }

  private static final class ThreadHandle implements JobHandle {
    private final DedicatedThreadBackend owner;
    private final Thread thread;

    ThreadHandle(DedicatedThreadBackend owner, Thread thread) {
      this.owner = owner;
      this.thread = thread;
    }

    @Override
    public boolean isJoinable() {
      return true;
    }

    @Override
    public String toString() {
      return "JobHandle[" + thread.getName() + "]";
    }
  }
}
