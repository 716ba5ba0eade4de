package dev.aahmedlab.workerpool;

/**
 * Internal state of the worker pool. This enum is package-private and not part of the public API.
 */
enum PoolState {
  RUNNING,
  SHUTDOWN,
  TERMINATED
}
