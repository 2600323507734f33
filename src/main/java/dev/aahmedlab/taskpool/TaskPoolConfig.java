package dev.aahmedlab.taskpool;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Configuration of the default worker backend.
 *
 * <p>Instances are immutable; the {@code with*} methods return modified copies.
 *
 * @since 1.0.0
 */
public final class TaskPoolConfig {

  /** Value of {@link #getMaxThreads()} for a pool without a thread limit. */
  public static final int UNBOUNDED = -1;

  /** Idle time after which a non-exclusive worker thread is reclaimed, unless configured. */
  public static final long DEFAULT_KEEP_ALIVE_MILLIS = 15_000L;

  private final int maxThreads;
  private final boolean exclusive;
  private final long keepAliveNanos;
  private final ThreadFactory threadFactory;

  private TaskPoolConfig(
      int maxThreads, boolean exclusive, long keepAliveNanos, ThreadFactory threadFactory) {
    if (maxThreads <= 0 && maxThreads != UNBOUNDED) {
      throw new IllegalArgumentException("maxThreads must be > 0 or UNBOUNDED");
    }
    if (exclusive && maxThreads == UNBOUNDED) {
      throw new IllegalArgumentException("an exclusive pool needs a thread limit");
    }
    if (keepAliveNanos <= 0) throw new IllegalArgumentException("keepAlive must be > 0");
    this.maxThreads = maxThreads;
    this.exclusive = exclusive;
    this.keepAliveNanos = keepAliveNanos;
    this.threadFactory = threadFactory;
  }

  /**
   * Creates a configuration without a thread limit. Threads are created on demand and reclaimed
   * when idle.
   *
   * @return the configuration used by {@link TaskPool#create()}
   * @since 1.0.0
   */
  public static TaskPoolConfig unbounded() {
    return new TaskPoolConfig(
        UNBOUNDED, false, TimeUnit.MILLISECONDS.toNanos(DEFAULT_KEEP_ALIVE_MILLIS), null);
  }

  /**
   * Creates a configuration with at most {@code maxThreads} worker threads.
   *
   * @param maxThreads the thread limit, or {@link #UNBOUNDED}
   * @param exclusive if true all threads are started by {@code prepare} and kept until {@code
   *     cleanup}; otherwise they are started on demand and reclaimed when idle
   * @return a new configuration
   * @throws IllegalArgumentException if maxThreads is not positive or UNBOUNDED, or if an
   *     exclusive configuration is requested without a limit
   * @since 1.0.0
   */
  public static TaskPoolConfig bounded(int maxThreads, boolean exclusive) {
    return new TaskPoolConfig(
        maxThreads, exclusive, TimeUnit.MILLISECONDS.toNanos(DEFAULT_KEEP_ALIVE_MILLIS), null);
  }

  /**
   * Creates an exclusive configuration for CPU-bound jobs, with one thread per available
   * processor.
   *
   * @return a new configuration
   * @since 1.0.0
   */
  public static TaskPoolConfig cpuBound() {
    return bounded(Runtime.getRuntime().availableProcessors(), true);
  }

  /**
   * Creates a non-exclusive configuration for I/O-bound jobs, with up to twice the number of
   * available processors.
   *
   * @return a new configuration
   * @since 1.0.0
   */
  public static TaskPoolConfig ioBound() {
    return bounded(Runtime.getRuntime().availableProcessors() * 2, false);
  }

  /**
   * Returns a copy of this configuration with a different idle time for non-exclusive threads.
   *
   * @param keepAlive the idle time
   * @param unit the unit of {@code keepAlive}
   * @return a new configuration
   * @throws IllegalArgumentException if keepAlive is not positive
   */
  public TaskPoolConfig withKeepAlive(long keepAlive, TimeUnit unit) {
    return new TaskPoolConfig(maxThreads, exclusive, unit.toNanos(keepAlive), threadFactory);
  }

  /**
   * Returns a copy of this configuration that creates worker threads with {@code factory}. A
   * factory returning null refuses the thread; the backend reports that as a {@link
   * TaskPoolException}.
   *
   * @param factory the thread factory
   * @return a new configuration
   */
  public TaskPoolConfig withThreadFactory(ThreadFactory factory) {
    return new TaskPoolConfig(
        maxThreads, exclusive, keepAliveNanos, Objects.requireNonNull(factory, "factory"));
  }

  public int getMaxThreads() {
    return maxThreads;
  }

  public boolean isBounded() {
    return maxThreads != UNBOUNDED;
  }

  public boolean isExclusive() {
    return exclusive;
  }

  public long getKeepAlive(TimeUnit unit) {
    return unit.convert(keepAliveNanos, TimeUnit.NANOSECONDS);
  }

  /**
   * Returns the configured thread factory, or null if the backend names its own daemon threads.
   *
   * @return the thread factory or null
   */
  public ThreadFactory getThreadFactory() {
    return threadFactory;
  }

  @Override
  public String toString() {
    return "TaskPoolConfig[maxThreads="
        + (isBounded() ? String.valueOf(maxThreads) : "unbounded")
        + ", exclusive="
        + exclusive
        + ", keepAlive="
        + TimeUnit.NANOSECONDS.toMillis(keepAliveNanos)
        + "ms]";
  }
}
