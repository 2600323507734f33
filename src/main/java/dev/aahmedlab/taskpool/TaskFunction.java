package dev.aahmedlab.taskpool;

/**
 * A unit of work pushed to a {@link TaskPool}, invoked once with the payload given at push time.
 *
 * @param <T> the payload type
 * @since 1.0.0
 */
@FunctionalInterface
public interface TaskFunction<T> {
  void call(T payload);
}
