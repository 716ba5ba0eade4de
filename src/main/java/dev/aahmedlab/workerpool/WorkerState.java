package dev.aahmedlab.workerpool;

/** Lifecycle of a single worker. STOPPED is terminal. */
enum WorkerState {
  IDLE,
  RUNNING,
  STOPPED
}
