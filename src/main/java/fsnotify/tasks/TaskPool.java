package fsnotify.tasks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The tasks that serve one helper. They are stopped together: explicitly, when the monitor
 * tears down, or as soon as any one of them fails.
 */
public class TaskPool {

  private static final Logger log = LoggerFactory.getLogger(TaskPool.class);
  private final TaskFactory factory;
  private final String owner;
  private final List<TaskLogic> tasks = new ArrayList<>();
  private boolean stopped;

  public TaskPool(TaskFactory factory, String owner) {
    this.factory = factory;
    this.owner = owner;
  }

  /** @throws IllegalStateException if the pool was already stopped */
  public void runTask(TaskLogic logic) {
    synchronized (tasks) {
      if (stopped) {
        throw new IllegalStateException("Tasks of " + owner + " are already stopped");
      }
      tasks.add(logic);
    }
    factory.runTask(logic, () -> {
      log.warn("{} failed, stopping the other tasks of {}", logic.getName(), owner);
      stopAll();
    });
  }

  /**
   * Stops every task on a thread of its own, as the caller may be one of them.
   * Calls after the first do nothing.
   */
  public void stopAll() {
    synchronized (tasks) {
      if (stopped) {
        return;
      }
      stopped = true;
    }
    factory.runTask(new StopAll());
  }

  public boolean isStopped() {
    synchronized (tasks) {
      return stopped;
    }
  }

  private class StopAll implements TaskLogic {
    @Override
    public Duration runOneLoop() {
      List<TaskLogic> toStop;
      synchronized (tasks) {
        toStop = new ArrayList<>(tasks);
        tasks.clear();
      }
      for (TaskLogic task : toStop) {
        try {
          factory.stopTask(task);
        } catch (RuntimeException e) {
          log.error("Error stopping " + task.getName(), e);
        }
      }
      log.debug("Stopped the tasks of {}", owner);
      return Duration.ofMillis(-1);
    }

    @Override
    public String getName() {
      return "StopAll-" + owner;
    }
  }

}
