package dev.aahmedlab.workerpool;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class WorkerTest {

  @Test
  void runsJobsUntilStop() {
    SharedQueue<ControlMessage> queue = new SharedQueue<>();
    Worker worker = new Worker(queue, "test-worker");
    AtomicInteger executed = new AtomicInteger();

    assertEquals(WorkerState.IDLE, worker.getState());
    worker.start();
    queue.push(ControlMessage.run(executed::incrementAndGet));
    queue.push(ControlMessage.run(executed::incrementAndGet));
    queue.push(ControlMessage.stop());
    worker.join();

    assertEquals(2, executed.get());
    assertEquals(2, worker.getCompletedJobs());
    assertEquals(0, worker.getFailedJobs());
    assertEquals(WorkerState.STOPPED, worker.getState());
    assertFalse(worker.isAlive());
  }

  @Test
  void messagesAfterStopAreLeftForOtherWorkers() {
    SharedQueue<ControlMessage> queue = new SharedQueue<>();
    Worker worker = new Worker(queue, "test-worker");
    AtomicInteger executed = new AtomicInteger();

    queue.push(ControlMessage.stop());
    queue.push(ControlMessage.run(executed::incrementAndGet));
    worker.start();
    worker.join();

    assertEquals(0, executed.get());
    assertEquals(1, queue.size());
  }

  @Test
  void reportsRunningWhileExecutingJob() throws Exception {
    SharedQueue<ControlMessage> queue = new SharedQueue<>();
    Worker worker = new Worker(queue, "test-worker");
    var gate = WorkerPoolTestSupport.newWorkerGate();

    worker.start();
    queue.push(ControlMessage.run(WorkerPoolTestSupport.jobHoldingWorker(gate, null)));
    assertTrue(gate.entered.await(1, TimeUnit.SECONDS));
    assertEquals(WorkerState.RUNNING, worker.getState());

    gate.release.countDown();
    queue.push(ControlMessage.stop());
    worker.join();
    assertEquals(WorkerState.STOPPED, worker.getState());
  }

  @Test
  void exitsWhenQueueIsClosedWithoutStop() {
    SharedQueue<ControlMessage> queue = new SharedQueue<>();
    Worker worker = new Worker(queue, "orphan-worker");

    worker.start();
    queue.pushAllAndClose(ControlMessage.stop(), 0);
    worker.join();

    assertFalse(worker.isAlive());
    assertEquals(WorkerState.STOPPED, worker.getState());
  }

  @Test
  void controlMessagesCarryTheirPayload() {
    Job job = () -> {};
    ControlMessage run = ControlMessage.run(job);

    assertEquals(ControlMessage.Kind.RUN, run.kind());
    assertSame(job, run.job());
    assertEquals(ControlMessage.Kind.STOP, ControlMessage.stop().kind());
    assertSame(ControlMessage.stop(), ControlMessage.stop());
    assertThrows(IllegalStateException.class, () -> ControlMessage.stop().job());
    assertThrows(NullPointerException.class, () -> ControlMessage.run(null));
  }
}
