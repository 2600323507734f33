package dev.aahmedlab.taskpool;

import java.util.Objects;

/**
 * A function together with its payload, as handed to a {@link TaskPoolBackend}. The backend owns
 * the job from {@link TaskPoolBackend#push(Job)} until {@link #run()} returns; nothing of it is
 * retained afterwards.
 *
 * @since 1.0.0
 */
public final class Job implements Runnable {
  private final Object function;
  private final Runnable invocation;

  <T> Job(TaskFunction<? super T> function, T payload) {
    Objects.requireNonNull(function, "function");
    this.function = function;
    this.invocation = () -> function.call(payload);
  }

  static Job of(Runnable runnable) {
    Objects.requireNonNull(runnable, "job");
    return new Job(ignored -> runnable.run(), null);
  }

  /** Invokes the function with the payload on the calling thread. */
  @Override
  public void run() {
    invocation.run();
  }

  @Override
  public String toString() {
    return "Job[" + function + "]";
  }
}
