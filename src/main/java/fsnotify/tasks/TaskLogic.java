package fsnotify.tasks;

import java.time.Duration;

import org.apache.commons.lang3.StringUtils;

/**
 * The body of a long-lived loop, like a helper connection's frame reader or its stderr pump.
 *
 * {@link #runOneLoop()} returns {@code null} to go again right away, a positive duration to
 * pause first, or a negative one when the task is done.
 */
public interface TaskLogic {

  Duration runOneLoop() throws InterruptedException;

  /**
   * Called on the caller's thread when the task is stopped. Loops blocked in reads that ignore
   * interrupts close their stream here.
   */
  default void onInterrupt() {
  }

  /** Called on the task's own thread after its last loop, however it ended. */
  default void onStop() {
  }

  default String getName() {
    String name = getClass().getSimpleName();
    // lambdas and anonymous classes
    return name.isEmpty() ? StringUtils.substringAfterLast(getClass().getName(), ".") : name;
  }
}
