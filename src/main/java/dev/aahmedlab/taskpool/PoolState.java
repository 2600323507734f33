package dev.aahmedlab.taskpool;

/**
 * Lifecycle state of a task pool. This enum is package-private and not part of the public API.
 * Use {@link TaskPool#isPrepared()} to check whether a pool accepts jobs.
 */
enum PoolState {
  UNINITIALIZED,
  PREPARED,
  CLEANED_UP
}
