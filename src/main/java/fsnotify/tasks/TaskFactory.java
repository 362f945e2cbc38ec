package fsnotify.tasks;

/**
 * Runs each {@link TaskLogic} on a thread of its own, so a task can block on a helper's
 * stdout without holding anyone else up.
 */
public interface TaskFactory {

  default void runTask(TaskLogic logic) {
    runTask(logic, null);
  }

  /** @param onFailure run on the task's thread if {@link TaskLogic#runOneLoop()} throws, may be null */
  void runTask(TaskLogic logic, Runnable onFailure);

  /** Stops the task and waits for it to finish, unless called from the task itself. */
  void stopTask(TaskLogic logic);

}
