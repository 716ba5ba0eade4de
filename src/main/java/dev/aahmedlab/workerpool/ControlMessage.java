package dev.aahmedlab.workerpool;

/**
 * Message carried on the shared queue between the pool and its workers. Either a job to run or a
 * request for the receiving worker to stop. This class is package-private and not part of the
 * public API.
 */
final class ControlMessage {

  enum Kind {
    RUN,
    STOP
  }

  private static final ControlMessage STOP = new ControlMessage(Kind.STOP, null);

  private final Kind kind;
  private final Job job;

  private ControlMessage(Kind kind, Job job) {
    this.kind = kind;
    this.job = job;
  }

  static ControlMessage run(Job job) {
    if (job == null) throw new NullPointerException("job");
    return new ControlMessage(Kind.RUN, job);
  }

  static ControlMessage stop() {
    return STOP;
  }

  Kind kind() {
    return kind;
  }

  /** Returns the job of a RUN message. */
  Job job() {
    if (kind != Kind.RUN) {
      throw new IllegalStateException("STOP message carries no job");
    }
    return job;
  }

  @Override
  public String toString() {
    return kind == Kind.RUN ? "RUN(" + job + ")" : "STOP";
  }
}
