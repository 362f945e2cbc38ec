package fsnotify.tasks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.google.common.annotations.VisibleForTesting;

public class ThreadBasedTaskFactory implements TaskFactory {

  private final Map<TaskLogic, ThreadBasedTask> running = new ConcurrentHashMap<>();

  @Override
  public void runTask(TaskLogic logic, Runnable onFailure) {
    ThreadBasedTask task = new ThreadBasedTask(logic, onFailure, () -> running.remove(logic));
    if (running.putIfAbsent(logic, task) != null) {
      throw new IllegalStateException("Task " + logic.getName() + " is already running");
    }
    task.start();
  }

  // unsynchronized, as stopping a monitor's tasks happens from one of its own tasks
  @Override
  public void stopTask(TaskLogic logic) {
    ThreadBasedTask task = running.remove(logic);
    if (task != null) {
      task.stop();
    }
  }

  @VisibleForTesting
  int numberOfTasks() {
    return running.size();
  }

}
