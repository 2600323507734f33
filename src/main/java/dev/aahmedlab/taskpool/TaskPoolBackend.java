package dev.aahmedlab.taskpool;

/**
 * Execution strategy behind a {@link TaskPool}.
 *
 * <p>A backend owns no execution resources until {@link #prepare()} succeeds and releases them
 * again in {@link #cleanup()}. Implementations must be thread-safe: {@link #push(Job)} may be
 * called concurrently from any thread, including from jobs the backend is running.
 *
 * @since 1.0.0
 */
public interface TaskPoolBackend {

  /**
   * Allocates the execution resources. On failure nothing stays allocated and subsequent pushes
   * are dropped.
   *
   * @throws TaskPoolException if the resources cannot be allocated
   * @throws IllegalStateException if the backend is already prepared
   */
  void prepare() throws TaskPoolException;

  /**
   * Hands a job over for eventual execution on some thread of this backend.
   *
   * @param job the job to run
   * @return a handle for {@link #join(JobHandle)}, or {@link JobHandle#NONE} if the backend cannot
   *     join jobs or has no resources (in which case the job was dropped)
   * @throws TaskPoolException if the backend is prepared but cannot accept the job
   */
  JobHandle push(Job job) throws TaskPoolException;

  /**
   * Waits for the job behind {@code handle} to finish, if this backend supports it.
   *
   * @param handle a handle returned by {@link #push(Job)} of this backend
   */
  void join(JobHandle handle);

  /**
   * Stops accepting jobs, waits until every accepted job has finished and releases the execution
   * resources. Does nothing if the backend is not prepared.
   */
  void cleanup();

  /**
   * Returns true between a successful {@link #prepare()} and the next {@link #cleanup()}.
   *
   * @return true if the backend accepts jobs
   */
  boolean isPrepared();
}
