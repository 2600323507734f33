package dev.aahmedlab.taskpool;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The default backend: runs jobs on a generic pool of worker threads.
 *
 * <p>Jobs are queued in arrival order and run concurrently on up to {@link
 * TaskPoolConfig#getMaxThreads()} workers, so they may complete in any order. {@link #cleanup()}
 * waits for the queue to drain: every job accepted by {@link #push(Job)} runs to completion before
 * it returns. Jobs cannot be joined individually; {@link #push(Job)} always returns {@link
 * JobHandle#NONE}.
 *
 * @author Abdullah Ahmed
 * @since 1.0.0
 */
public final class WorkerPoolBackend implements TaskPoolBackend {
  private static final Logger logger = LoggerFactory.getLogger(WorkerPoolBackend.class);

  private final String name;
  private final TaskPoolConfig config;
  private final ReentrantLock backendLock = new ReentrantLock();
  private WorkerPool workers; // guarded by backendLock

  /**
   * Creates an unprepared backend.
   *
   * @param name prefix for the worker thread names
   * @param config thread limit, exclusivity and keep-alive of the workers
   * @since 1.0.0
   */
  public WorkerPoolBackend(String name, TaskPoolConfig config) {
    this.name = Objects.requireNonNull(name, "name");
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Creates the worker pool. In exclusive mode every worker thread is started here.
   *
   * @throws TaskPoolException if an exclusive pool could not start all of its workers
   * @throws IllegalStateException if the backend is already prepared
   * @since 1.0.0
   */
  @Override
  public void prepare() throws TaskPoolException {
    backendLock.lock();
    try {
      if (workers != null) {
        throw new IllegalStateException("Backend " + name + " is already prepared");
      }
      WorkerPool pool = new WorkerPool(name, config);
      pool.start();
      workers = pool;
      logger.debug("Prepared backend {} with {}", name, config);
    } finally {
      backendLock.unlock();
    }
  }

  /**
   * Queues the job for a worker. Without a prepared worker pool the job is dropped.
   *
   * @return always {@link JobHandle#NONE}
   * @throws TaskPoolException if no worker exists and the thread factory refused to create one
   * @since 1.0.0
   */
  @Override
  public JobHandle push(Job job) throws TaskPoolException {
    Objects.requireNonNull(job, "job");
    backendLock.lock();
    try {
      if (workers == null) {
        logger.debug("Dropping {} pushed to unprepared backend {}", job, name);
      } else {
        workers.submit(job);
      }
      return JobHandle.NONE;
    } finally {
      backendLock.unlock();
    }
  }

  /** Worker threads are shared between jobs and cannot be joined; this does nothing. */
  @Override
  public void join(JobHandle handle) {
    logger.debug("Join is not supported by backend {}, ignoring {}", name, handle);
  }

  /**
   * Detaches the worker pool so that new pushes are dropped, then waits until it has run every
   * queued and running job and all workers have exited.
   *
   * @throws IllegalStateException if called from one of this backend's workers
   * @since 1.0.0
   */
  @Override
  public void cleanup() {
    WorkerPool pool;
    backendLock.lock();
    try {
      pool = workers;
      if (pool == null) {
        return;
      }
      if (pool.isWorkerThread(Thread.currentThread())) {
        throw new IllegalStateException(
            "cleanup() called from a worker of " + name + ", it would wait for itself");
      }
      workers = null;
    } finally {
      backendLock.unlock();
    }
    // Drained outside the lock so that jobs pushing during cleanup are dropped, not deadlocked.
    pool.shutdownAndAwait();
    logger.debug("Cleaned up backend {}", name);
  }

  @Override
  public boolean isPrepared() {
    return current() != null;
  }

  public TaskPoolConfig getConfig() {
    return config;
  }

  /**
   * Returns the number of live worker threads, or 0 if the backend is not prepared.
   *
   * @return the number of worker threads
   */
  public int getThreadCount() {
    WorkerPool pool = current();
    return pool == null ? 0 : pool.getThreadCount();
  }

  /**
   * Returns the number of worker threads waiting for a job.
   *
   * @return the number of idle worker threads
   */
  public int getIdleThreadCount() {
    WorkerPool pool = current();
    return pool == null ? 0 : pool.getIdleThreadCount();
  }

  /**
   * Returns the number of accepted jobs that no worker has picked up yet.
   *
   * @return the number of queued jobs
   */
  public int getQueuedJobCount() {
    WorkerPool pool = current();
    return pool == null ? 0 : pool.getQueuedJobCount();
  }

  /**
   * Returns the number of jobs running right now.
   *
   * @return the number of running jobs
   */
  public int getActiveJobCount() {
    WorkerPool pool = current();
    return pool == null ? 0 : pool.getActiveJobCount();
  }

  /**
   * Returns the number of jobs finished since the last {@link #prepare()}.
   *
   * @return the number of completed jobs
   */
  public long getCompletedJobCount() {
    WorkerPool pool = current();
    return pool == null ? 0 : pool.getCompletedJobCount();
  }

  private WorkerPool current() {
    backendLock.lock();
    try {
      return workers;
    } finally {
      backendLock.unlock();
    }
  }

  @Override
  public String toString() {
    return "WorkerPoolBackend[" + name + ", " + config + "]";
  }
}
