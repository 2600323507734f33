package dev.aahmedlab.taskpool;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A pool of threads for running streaming jobs.
 *
 * <p>A task pool separates what has to run concurrently from how threads are created and reused.
 * Callers {@link #prepare()} the pool, {@link #push} fire-and-forget jobs and finally {@link
 * #cleanup()} it; the {@link TaskPoolBackend} chosen at construction decides on which thread each
 * job runs. The default backend is a {@link WorkerPoolBackend}.
 *
 * <p>Jobs that need strictly ordered execution can instead be posted to the pool's schedule
 * context, a single dedicated thread started on demand by {@link #enableScheduleThread()}.
 *
 * <p>All methods are thread-safe.
 *
 * @author Abdullah Ahmed
 * @since 1.0.0
 */
public final class TaskPool {
  private static final Logger logger = LoggerFactory.getLogger(TaskPool.class);
  private static final AtomicInteger poolSequence = new AtomicInteger();

  private final String name;
  private final TaskPoolBackend backend;
  private final boolean shared;
  private final ScheduleThreadManager schedule;
  private final ReentrantLock poolLock = new ReentrantLock();
  private volatile PoolState poolState = PoolState.UNINITIALIZED;

  /**
   * Creates an unprepared pool running its jobs on {@code backend}.
   *
   * @param name the pool name, also used for the schedule thread
   * @param backend the execution strategy; must not be shared with another pool
   * @since 1.0.0
   */
  public TaskPool(String name, TaskPoolBackend backend) {
    this(name, backend, false);
  }

  private TaskPool(String name, TaskPoolBackend backend, boolean shared) {
    this.name = Objects.requireNonNull(name, "name");
    this.backend = Objects.requireNonNull(backend, "backend");
    this.shared = shared;
    this.schedule = new ScheduleThreadManager(name);
  }

  /**
   * Creates an unprepared pool on a worker backend without a thread limit.
   *
   * @return a new TaskPool instance
   * @since 1.0.0
   */
  public static TaskPool create() {
    return withConfig(TaskPoolConfig.unbounded());
  }

  /**
   * Creates an unprepared pool on a worker backend with at most {@code maxThreads} threads.
   *
   * @param maxThreads the thread limit, or {@link TaskPoolConfig#UNBOUNDED}
   * @param exclusive whether all threads are started up front and kept until cleanup
   * @return a new TaskPool instance
   * @throws IllegalArgumentException if the combination of arguments is invalid
   * @since 1.0.0
   */
  public static TaskPool create(int maxThreads, boolean exclusive) {
    return withConfig(TaskPoolConfig.bounded(maxThreads, exclusive));
  }

  /**
   * Creates an unprepared pool on a worker backend configured by {@code config}.
   *
   * @param config the worker configuration
   * @return a new TaskPool instance
   * @since 1.0.0
   */
  public static TaskPool withConfig(TaskPoolConfig config) {
    String name = "taskpool" + poolSequence.getAndIncrement();
    return new TaskPool(name, new WorkerPoolBackend(name, config));
  }

  /**
   * Returns the process-wide default pool, prepared on first access and shared by every caller.
   * It is never cleaned up, and its schedule thread cannot be enabled.
   *
   * @return the default pool
   * @since 1.0.0
   */
  public static TaskPool getDefault() {
    return DefaultPoolHolder.INSTANCE;
  }

  /**
   * Allocates the backend's execution resources. Must complete before jobs are pushed.
   *
   * @throws TaskPoolException if the backend could not allocate its resources; the pool then
   *     drops every pushed job
   * @throws IllegalStateException if the pool is already prepared
   * @since 1.0.0
   */
  public void prepare() throws TaskPoolException {
    if (shared && poolState == PoolState.PREPARED) {
      logger.warn("Ignoring prepare() on the default task pool, it is always prepared");
      return;
    }
    poolLock.lock();
    try {
      backend.prepare();
      poolState = PoolState.PREPARED;
      logger.debug("Prepared task pool {} on {}", name, backend);
    } finally {
      poolLock.unlock();
    }
  }

  /**
   * Pushes a job that calls {@code function} with {@code payload} on some thread of the backend.
   * Jobs are not guaranteed to run in push order.
   *
   * <p>If the pool is not prepared the job is silently dropped and never runs.
   *
   * @param function the function to call
   * @param payload the argument for the function, may be null
   * @param <T> the payload type
   * @return a handle for {@link #join(JobHandle)}; {@link JobHandle#NONE} if the backend cannot
   *     join jobs or the job was dropped
   * @throws NullPointerException if function is null
   * @throws TaskPoolException if the prepared backend could not accept the job
   * @since 1.0.0
   */
  public <T> JobHandle push(TaskFunction<? super T> function, T payload) throws TaskPoolException {
    if (function == null) throw new NullPointerException("function");
    return backend.push(new Job(function, payload));
  }

  /**
   * Pushes a job that runs {@code job} on some thread of the backend.
   *
   * @param job the job to run
   * @return a handle for {@link #join(JobHandle)}, possibly {@link JobHandle#NONE}
   * @throws NullPointerException if job is null
   * @throws TaskPoolException if the prepared backend could not accept the job
   * @see #push(TaskFunction, Object)
   * @since 1.0.0
   */
  public JobHandle push(Runnable job) throws TaskPoolException {
    if (job == null) throw new NullPointerException("job");
    return backend.push(Job.of(job));
  }

  /**
   * Waits for the job behind {@code handle} to finish, if the backend supports it. Joining {@link
   * JobHandle#NONE} returns immediately.
   *
   * @param handle a handle returned by {@link #push} on this pool
   * @since 1.0.0
   */
  public void join(JobHandle handle) {
    if (handle == null) throw new NullPointerException("handle");
    if (handle == JobHandle.NONE) {
      return;
    }
    backend.join(handle);
  }

  /**
   * Stops accepting jobs and waits until every job already accepted, queued or running, has
   * finished; then releases the backend's resources. Afterwards pushes are dropped until the pool
   * is prepared again.
   *
   * <p>Calling this on the default pool has no effect.
   *
   * @since 1.0.0
   */
  public void cleanup() {
    if (shared) {
      logger.warn("Ignoring cleanup() on the default task pool, it is never torn down");
      return;
    }
    poolLock.lock();
    try {
      backend.cleanup();
      if (poolState == PoolState.PREPARED) {
        poolState = PoolState.CLEANED_UP;
      }
      logger.debug("Cleaned up task pool {}", name);
    } finally {
      poolLock.unlock();
    }
  }

  /**
   * Requests the schedule thread. The first request starts the thread and blocks until its
   * context is running; later ones only count a reference. Each successful call must be balanced
   * by {@link #disableScheduleThread()}.
   *
   * @return true if a reference was taken, false for the default pool, which has no schedule
   *     thread
   * @since 1.0.0
   */
  public boolean enableScheduleThread() {
    if (shared) {
      logger.debug("The default task pool does not provide a schedule thread");
      return false;
    }
    schedule.acquire();
    return true;
  }

  /**
   * Releases a reference taken by {@link #enableScheduleThread()}. Releasing the last one stops
   * the context after its current unit of work and joins the thread; work still posted is
   * dropped.
   *
   * @return true if a reference was released, false for the default pool
   * @throws IllegalStateException if the schedule thread is not enabled
   * @since 1.0.0
   */
  public boolean disableScheduleThread() {
    if (shared) {
      logger.debug("The default task pool does not provide a schedule thread");
      return false;
    }
    schedule.release();
    return true;
  }

  /**
   * Returns the schedule context while the schedule thread is enabled.
   *
   * @return the context, or empty if the schedule thread is not enabled
   * @since 1.0.0
   */
  public Optional<ScheduleContext> getScheduleContext() {
    return Optional.ofNullable(schedule.getContext());
  }

  /**
   * Returns the number of outstanding {@link #enableScheduleThread()} calls.
   *
   * @return the schedule thread reference count
   */
  public int getScheduleThreadRefCount() {
    return schedule.getRefCount();
  }

  /**
   * Returns true if the backend currently accepts jobs.
   *
   * @return true between a successful prepare and the next cleanup
   */
  public boolean isPrepared() {
    return backend.isPrepared();
  }

  /**
   * Returns true if this is the instance returned by {@link #getDefault()}.
   *
   * @return true for the default pool
   */
  public boolean isDefault() {
    return shared;
  }

  PoolState getPoolState() {
    return poolState;
  }

  public String getName() {
    return name;
  }

  public TaskPoolBackend getBackend() {
    return backend;
  }

  @Override
  public String toString() {
    return "TaskPool[" + name + ", " + poolState + ", " + backend + "]";
  }

  /** Lazily creates the default pool; class initialization makes this happen exactly once. */
  private static final class DefaultPoolHolder {
    static final TaskPool INSTANCE = createDefault();

    private static TaskPool createDefault() {
      String name = "default-taskpool";
      TaskPool pool =
          new TaskPool(name, new WorkerPoolBackend(name, TaskPoolConfig.unbounded()), true);
      try {
        pool.prepare();
      } catch (TaskPoolException e) {
        logger.error("Failed to prepare the default task pool, its jobs will be dropped", e);
      }
      return pool;
    }
  }
}
