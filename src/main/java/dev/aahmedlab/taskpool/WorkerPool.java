package dev.aahmedlab.taskpool;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generic worker pool behind {@link WorkerPoolBackend}. This class is package-private and not part
 * of the public API.
 *
 * <p>Jobs wait in an unbounded FIFO queue. In exclusive mode all worker threads are started by
 * {@link #start()} and live until {@link #shutdownAndAwait()}; otherwise a worker is started
 * whenever the queue holds more jobs than there are idle workers, up to the thread limit, and a
 * worker that stays idle for the keep-alive time exits. One instance serves one prepare/cleanup
 * cycle and is not restartable.
 */
final class WorkerPool {
  private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

  private final String name;
  private final int maxThreads;
  private final boolean exclusive;
  private final long keepAliveNanos;
  private final ThreadFactory threadFactory;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Deque<Runnable> queue = new ArrayDeque<>();
  private final Set<Thread> workerThreads = new HashSet<>();
  private int idleThreads;
  private int activeJobs;
  private long completedJobs;
  private int threadSequence;
  private boolean closed;

  WorkerPool(String name, TaskPoolConfig config) {
    this.name = name;
    this.maxThreads = config.getMaxThreads();
    this.exclusive = config.isExclusive();
    this.keepAliveNanos = config.getKeepAlive(TimeUnit.NANOSECONDS);
    this.threadFactory = config.getThreadFactory();
  }

  /**
   * Starts the permanent workers of an exclusive pool. Does nothing for a non-exclusive one.
   *
   * @throws TaskPoolException if not every worker could be started; the workers that did start
   *     have exited again when this is thrown
   */
  void start() throws TaskPoolException {
    if (!exclusive) {
      return;
    }
    TaskPoolException failure = null;
    int started = 0;
    lock.lock();
    try {
      for (; started < maxThreads; started++) {
        addWorker(true);
      }
    } catch (TaskPoolException e) {
      failure = e;
    } finally {
      lock.unlock();
    }
    if (failure != null) {
      shutdownAndAwait();
      throw new TaskPoolException(
          "Could only start " + started + " of " + maxThreads + " worker threads for " + name,
          failure);
    }
  }

  /**
   * Queues a job, starting a new worker first if no idle one can pick it up and the thread limit
   * allows it.
   *
   * @throws TaskPoolException if no worker exists and none could be started
   */
  void submit(Runnable job) throws TaskPoolException {
    lock.lock();
    try {
      if (closed) {
        throw new IllegalStateException("Worker pool " + name + " is shut down");
      }
      // The job is only queued once a worker to run it is known to exist.
      if (!exclusive
          && queue.size() >= idleThreads
          && (maxThreads == TaskPoolConfig.UNBOUNDED || workerThreads.size() < maxThreads)) {
        try {
          addWorker(false);
        } catch (TaskPoolException e) {
          if (workerThreads.isEmpty()) {
            throw new TaskPoolException(
                "No worker thread available to run " + job + " on " + name, e);
          }
          logger.warn("Could not start an extra worker for {}, queueing anyway", name, e);
        }
      }
      queue.addLast(job);
      notEmpty.signal();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops accepting jobs, lets the workers run every queued job and waits until all of them have
   * exited. Nothing queued is discarded.
   */
  void shutdownAndAwait() {
    List<Thread> threads;
    lock.lock();
    try {
      closed = true;
      notEmpty.signalAll();
      threads = new ArrayList<>(workerThreads);
    } finally {
      lock.unlock();
    }
    // Workers only exit once the queue is empty, and none are added after close.
    for (Thread t : threads) {
      Threads.joinUninterruptibly(t);
    }
    logger.debug("Worker pool {} drained, {} jobs completed", name, getCompletedJobCount());
  }

  boolean isWorkerThread(Thread thread) {
    lock.lock();
    try {
      return workerThreads.contains(thread);
    } finally {
      lock.unlock();
    }
  }

  // Called with the lock held.
  private void addWorker(boolean permanent) throws TaskPoolException {
    Thread t =
        Threads.newThread(
            threadFactory, new Worker(permanent), name + "-worker-" + threadSequence++);
    if (t == null) {
      throw new TaskPoolException("Thread factory refused to create a worker thread for " + name);
    }
    workerThreads.add(t);
    try {
      t.start();
    } catch (OutOfMemoryError | IllegalThreadStateException e) {
      // OutOfMemoryError is how the JVM reports that no native thread could be created.
      workerThreads.remove(t);
      throw new TaskPoolException("Could not start worker thread " + t.getName(), e);
    }
    logger.debug("Started {} worker {}", permanent ? "permanent" : "on-demand", t.getName());
  }

  /**
   * Takes the next job, or returns null when the calling worker must exit. An exiting worker is
   * unregistered here, under the same lock that saw the empty queue, so that {@link #submit}
   * never counts a worker that will not look at the queue again.
   */
  @SuppressFBWarnings(
      value = "CWO_CLOSED_WITHOUT_OPENED",
      justification = "Lock is properly acquired before the try block and released in finally")
  private Runnable nextJob(boolean permanent) {
    lock.lock();
    try {
      long deadline = System.nanoTime() + keepAliveNanos;
      while (queue.isEmpty()) {
        long nanos = deadline - System.nanoTime();
        if (closed || (!permanent && nanos <= 0)) {
          workerThreads.remove(Thread.currentThread());
          if (!closed) {
            logger.debug("Reclaiming idle worker {}", Thread.currentThread().getName());
          }
          return null;
        }
        idleThreads++;
        try {
          if (permanent) {
            notEmpty.await();
          } else {
            notEmpty.awaitNanos(nanos);
          }
        } catch (InterruptedException e) {
          // The pool never interrupts its workers; treat a foreign interrupt as a wake-up.
          logger.debug("Worker {} interrupted while idle", Thread.currentThread().getName());
        } finally {
          idleThreads--;
        }
      }
      activeJobs++;
      return queue.removeFirst();
    } finally {
      lock.unlock();
    }
  }

  private void jobFinished() {
    lock.lock();
    try {
      activeJobs--;
      completedJobs++;
    } finally {
      lock.unlock();
    }
  }

  int getThreadCount() {
    lock.lock();
    try {
      return workerThreads.size();
    } finally {
      lock.unlock();
    }
  }

  int getIdleThreadCount() {
    lock.lock();
    try {
      return idleThreads;
    } finally {
      lock.unlock();
    }
  }

  int getQueuedJobCount() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  int getActiveJobCount() {
    lock.lock();
    try {
      return activeJobs;
    } finally {
      lock.unlock();
    }
  }

  long getCompletedJobCount() {
    lock.lock();
    try {
      return completedJobs;
    } finally {
      lock.unlock();
    }
  }

  private final class Worker implements Runnable {
    private final boolean permanent;

    Worker(boolean permanent) {
      this.permanent = permanent;
    }

    @Override
    public void run() {
      Runnable job;
      while ((job = nextJob(permanent)) != null) {
        try {
          job.run();
        } catch (Throwable t) {
          logger.error("Exception occurred while executing job", t);
        } finally {
          // A job's interrupt status must not leak into the next one.
          Thread.interrupted();
          jobFinished();
        }
      }
    }
  }
}
