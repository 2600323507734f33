package dev.aahmedlab.taskpool;

/**
 * Thrown when a backend cannot allocate its execution resources or cannot accept a job.
 *
 * <p>Dropping a job because the pool is not prepared is not an error and never raises this
 * exception.
 *
 * @since 1.0.0
 */
public class TaskPoolException extends Exception {
  private static final long serialVersionUID = 1L;

  public TaskPoolException(String message) {
    super(message);
  }

  public TaskPoolException(String message, Throwable cause) {
    super(message, cause);
  }
}
