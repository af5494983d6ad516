package agentdesk.worker;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed set of striped locks that serializes state changes per task id.
 *
 * <p>Two task ids may share a stripe; that only costs some parallelism. This class is
 * thread-safe.
 */
final class TaskLocks {
  static final int DEFAULT_STRIPES = 64;

  private final ReentrantLock[] stripes;

  TaskLocks() {
    this(DEFAULT_STRIPES);
  }

  TaskLocks(int stripeCount) {
    if (stripeCount <= 0) {
      throw new IllegalArgumentException("stripeCount must be > 0");
    }
    this.stripes = new ReentrantLock[stripeCount];
    for (int i = 0; i < stripeCount; i++) {
      stripes[i] = new ReentrantLock();
    }
  }

  ReentrantLock lockFor(String taskId) {
    return stripes[Math.floorMod(taskId.hashCode(), stripes.length)];
  }
}
