package dev.aahmedlab.workerpool;

/**
 * A unit of deferred work submitted to a {@link WorkerPool}.
 *
 * <p>A job takes no arguments and produces no result. Any state it needs is captured when it is
 * created. The pool runs each submitted job exactly once, on exactly one worker thread, so a job
 * must be safe to run on a thread other than the one that created it.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface Job {
  /**
   * Runs this job to completion on the calling worker thread.
   *
   * @since 1.0.0
   */
  void run();
}
