package dev.aahmedlab.workerpool;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A long-lived thread that takes messages from the shared queue and runs the jobs they carry until
 * it receives a stop message. This class is package-private and not part of the public API.
 *
 * <p>The id and creation time are kept for diagnostics only; no message is ever routed by them.
 */
final class Worker implements Runnable {
  private static final Logger logger = LoggerFactory.getLogger(Worker.class);

  private final UUID id = UUID.randomUUID();
  private final Instant created = Instant.now();
  private final SharedQueue<ControlMessage> queue;
  private final Thread thread;
  private final AtomicLong completedJobs = new AtomicLong();
  private final AtomicLong failedJobs = new AtomicLong();
  private volatile WorkerState state = WorkerState.IDLE;

  Worker(SharedQueue<ControlMessage> queue, String name) {
    this.queue = queue;
    this.thread = new Thread(this, name);
    this.thread.setDaemon(true);
  }

  void start() {
    thread.start();
  }

  @Override
  public void run() {
    logger.debug("Worker {} started on {}", id, thread.getName());
    while (true) {
      ControlMessage message;
      try {
        message = queue.pop();
      } catch (InterruptedException e) {
        // Nothing cancels a worker; only a STOP message ends the loop.
        logger.warn("Worker {} interrupted while waiting for work, ignoring", id);
        continue;
      } catch (IllegalStateException e) {
        state = WorkerState.STOPPED;
        logger.error("Worker {} lost its queue before receiving STOP", id, e);
        throw e;
      }

      if (message.kind() == ControlMessage.Kind.STOP) {
        state = WorkerState.STOPPED;
        logger.debug(
            "Worker {} stopped after {} jobs ({} failed)",
            id,
            completedJobs.get(),
            failedJobs.get());
        return;
      }

      state = WorkerState.RUNNING;
      try {
        message.job().run();
      } catch (Throwable t) {
        failedJobs.incrementAndGet();
        logger.error("Exception occurred while executing job on worker {}", id, t);
      } finally {
        // the next job must start with a clear interrupt status
        if (Thread.interrupted()) {
          logger.warn("Job on worker {} left the thread interrupted, clearing", id);
        }
        completedJobs.incrementAndGet();
        state = WorkerState.IDLE;
      }
    }
  }

  /**
   * Blocks until this worker's thread has exited. An interrupt received while waiting does not cut
   * the wait short; the interrupt status is restored before returning.
   */
  void join() {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          thread.join();
          return;
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  UUID getId() {
    return id;
  }

  Instant getCreated() {
    return created;
  }

  String getName() {
    return thread.getName();
  }

  WorkerState getState() {
    return state;
  }

  boolean isAlive() {
    return thread.isAlive();
  }

  boolean isCurrentThread() {
    return Thread.currentThread() == thread;
  }

  /** Number of jobs this worker has finished, failed ones included. */
  long getCompletedJobs() {
    return completedJobs.get();
  }

  long getFailedJobs() {
    return failedJobs.get();
  }
}
