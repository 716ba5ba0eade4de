package dev.aahmedlab.workerpool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A fixed-size pool of worker threads fed from a single unbounded queue.
 *
 * <p>The pool starts all of its workers on construction. Submitted jobs are placed on the shared
 * queue and picked up by whichever worker is idle first; every job runs exactly once. Submission
 * never blocks, since the queue has no capacity limit.
 *
 * <p>{@link #shutdown()} is a blocking drain: it sends one stop message per worker behind every job
 * already queued and waits for each worker thread to exit. When it returns, every job submitted
 * before it has finished. The pool implements {@link AutoCloseable} so that it can be torn down at
 * the end of a try-with-resources block.
 *
 * <pre>{@code
 * try (WorkerPool pool = new WorkerPool(4)) {
 *   pool.submit(() -> System.out.println("hello from " + Thread.currentThread().getName()));
 * }
 * }</pre>
 *
 * <p>A job that throws does not take its worker down with it. The exception is logged and the
 * worker moves on to the next message, so {@link #capacity()} always reflects the number of live
 * workers.
 *
 * @author Abdullah Ahmed
 * @since 1.0.0
 */
public final class WorkerPool implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

  /** Thread name prefix used when none is given. */
  public static final String DEFAULT_THREAD_NAME_PREFIX = "worker-pool-";

  private final SharedQueue<ControlMessage> queue;
  private final List<Worker> workers;
  private final AtomicBoolean shutdownStarted = new AtomicBoolean();
  private volatile PoolState poolState;

  /**
   * Creates a pool with the given number of workers and the default thread name prefix.
   *
   * @param capacity the number of worker threads
   * @throws IllegalArgumentException if capacity is less than or equal to 0
   * @since 1.0.0
   */
  public WorkerPool(int capacity) {
    this(capacity, DEFAULT_THREAD_NAME_PREFIX);
  }

  /**
   * Creates a pool with the given number of workers. Worker threads are named {@code
   * threadNamePrefix} followed by their index.
   *
   * @param capacity the number of worker threads
   * @param threadNamePrefix prefix for worker thread names
   * @throws IllegalArgumentException if capacity is less than or equal to 0
   * @throws NullPointerException if threadNamePrefix is null
   * @since 1.0.0
   */
  public WorkerPool(int capacity, String threadNamePrefix) {
    if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
    if (threadNamePrefix == null) throw new NullPointerException("threadNamePrefix");
    this.queue = new SharedQueue<>();
    this.poolState = PoolState.RUNNING;

    List<Worker> created = new ArrayList<>(capacity);
    for (int i = 0; i < capacity; i++) {
      Worker worker = new Worker(queue, threadNamePrefix + i);
      worker.start();
      created.add(worker);
    }
    this.workers = Collections.unmodifiableList(created);
    logger.debug("Started pool with {} workers ({}*)", capacity, threadNamePrefix);
  }

  /**
   * Creates a pool with the given number of workers.
   *
   * @param capacity the number of worker threads
   * @return a new WorkerPool instance
   * @throws IllegalArgumentException if capacity is less than or equal to 0
   * @since 1.0.0
   */
  public static WorkerPool create(int capacity) {
    return new WorkerPool(capacity);
  }

  /**
   * Creates a pool with one worker per available processor.
   *
   * @return a new WorkerPool instance sized for CPU-bound jobs
   * @since 1.0.0
   */
  public static WorkerPool createCpuBound() {
    return new WorkerPool(Runtime.getRuntime().availableProcessors());
  }

  /**
   * Returns the number of workers owned by this pool. The value is fixed for the lifetime of the
   * pool.
   *
   * @return the number of worker threads
   * @since 1.0.0
   */
  public int capacity() {
    return workers.size();
  }

  /**
   * Submits a job for execution. Returns as soon as the job is queued.
   *
   * @param job the job to run
   * @throws NullPointerException if job is null
   * @throws RejectedExecutionException if the pool has been shut down
   * @since 1.0.0
   */
  public void submit(Job job) {
    if (job == null) throw new NullPointerException("job");
    if (poolState != PoolState.RUNNING) {
      throw new RejectedExecutionException("Pool is shut down");
    }
    try {
      queue.push(ControlMessage.run(job));
    } catch (IllegalStateException stateException) {
      // lost the race against shutdown(): the stop messages are already queued
      throw new RejectedExecutionException("Pool is shut down", stateException);
    }
  }

  /**
   * Changes the number of workers. Only the current capacity is accepted; growing or shrinking a
   * running pool is not supported.
   *
   * @param newCapacity the requested number of worker threads
   * @throws IllegalArgumentException if newCapacity is less than or equal to 0
   * @throws IllegalStateException if the pool has been shut down
   * @throws UnsupportedOperationException if newCapacity differs from {@link #capacity()}
   * @since 1.0.0
   */
  public void resize(int newCapacity) {
    if (newCapacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
    if (poolState != PoolState.RUNNING) {
      throw new IllegalStateException("Pool is shut down");
    }
    if (newCapacity != workers.size()) {
      throw new UnsupportedOperationException(
          "Cannot resize pool from " + workers.size() + " to " + newCapacity + " workers");
    }
  }

  /**
   * Shuts the pool down and waits for it to drain.
   *
   * <p>This method:
   *
   * <ul>
   *   <li>Rejects any job submitted from now on
   *   <li>Queues one stop message per worker behind the jobs already queued
   *   <li>Waits, in creation order, for every worker thread to exit
   * </ul>
   *
   * <p>Only the first call sends the stop messages. Later or concurrent calls send nothing but still
   * wait for every worker thread to exit. Waiting is not cut short by interrupts; the caller's
   * interrupt status is restored before returning.
   *
   * @throws IllegalStateException if called from one of this pool's own worker threads
   * @since 1.0.0
   */
  public void shutdown() {
    for (Worker worker : workers) {
      if (worker.isCurrentThread()) {
        throw new IllegalStateException("Pool cannot be shut down from its own worker thread");
      }
    }
    if (!shutdownStarted.compareAndSet(false, true)) {
      logger.debug("Pool already shutting down, waiting for workers");
      joinWorkers();
      return;
    }

    poolState = PoolState.SHUTDOWN;
    logger.debug("Shutting down pool, sending {} stop messages", workers.size());
    queue.pushAllAndClose(ControlMessage.stop(), workers.size());

    joinWorkers();
    poolState = PoolState.TERMINATED;
    logger.debug("Pool terminated");
  }

  private void joinWorkers() {
    for (Worker worker : workers) {
      worker.join();
    }
  }

  /**
   * Same as {@link #shutdown()}.
   *
   * @since 1.0.0
   */
  @Override
  public void close() {
    shutdown();
  }

  PoolState getPoolState() {
    return poolState;
  }

  List<Worker> getWorkers() {
    return workers;
  }

  int getQueueSize() {
    return queue.size();
  }
}
