package fsnotify;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import fsnotify.helper.HelperLauncher;
import fsnotify.helper.ProcessHelperLauncher;
import fsnotify.tasks.TaskFactory;
import fsnotify.tasks.TaskLogic;
import fsnotify.tasks.ThreadBasedTaskFactory;

/**
 * Starts, addresses, and stops monitors by name, and manages their subscriptions.
 *
 * At most one monitor runs under a given name. Subscriptions are kept in a
 * {@link SubscriberDirectory} and are independent of any monitor, so they may be made
 * before a monitor starts and carry over when it is restarted.
 */
public class FsNotify {

  private static final Logger log = LoggerFactory.getLogger(FsNotify.class);
  private final MonitorConfig config;
  private final TaskFactory taskFactory;
  private final SubscriberDirectory directory;
  private final Broadcaster broadcaster;
  private final HelperLauncher launcher;
  private final Map<String, Monitor> monitors = new ConcurrentHashMap<>();
  // stopped by name, but not yet torn down
  private final Map<String, Monitor> stopping = new ConcurrentHashMap<>();

  /** Main method for manually watching the given paths with a real helper. */
  public static void main(String[] args) throws Exception {
    LoggingConfig.init();
    FsNotify fs = new FsNotify(MonitorConfig.fromSystemProperties());
    Subscriber subscriber = fs.subscribe("main");
    fs.start("main", Arrays.asList(args));
    while (true) {
      MonitorMessage message = subscriber.take();
      log.info("Message: " + message);
      if (message instanceof MonitorStopped) {
        break;
      }
    }
  }

  /** Uses the global directory and launches {@link MonitorConfig#getHelperCommand()} as a subprocess. */
  public FsNotify(MonitorConfig config) {
    this(
      config,
      new ThreadBasedTaskFactory(),
      SubscriberDirectory.global(),
      new ProcessHelperLauncher(config.getHelperCommand()));
  }

  public FsNotify(MonitorConfig config, TaskFactory taskFactory, SubscriberDirectory directory, HelperLauncher launcher) {
    this.config = config;
    this.taskFactory = taskFactory;
    this.directory = directory;
    this.broadcaster = new Broadcaster(directory);
    this.launcher = launcher;
  }

  /**
   * Starts a monitor and applies {@code watches}; if any of them fails, nothing is left running.
   *
   * @throws IllegalStateException if a monitor with this name is running, or still stopping
   * @throws MonitorStartException if the monitor could not be started
   */
  public void start(String name, List<String> watches) {
    Monitor monitor = new Monitor(name, watches, config, taskFactory, launcher, broadcaster);
    if (monitors.putIfAbsent(name, monitor) != null) {
      throw new IllegalStateException("Monitor " + name + " is already running");
    }
    // stop() registers the old monitor here before releasing the name, so this cannot miss it
    Monitor old = stopping.get(name);
    if (old != null && old != monitor) {
      monitors.remove(name, monitor);
      throw new IllegalStateException("Monitor " + name + " is still stopping");
    }
    monitor.addStoppedCallback(() -> {
      monitors.remove(name, monitor);
      stopping.remove(name, monitor);
    });
    try {
      monitor.start();
    } catch (RuntimeException e) {
      monitors.remove(name, monitor);
      throw e;
    }
  }

  /** @throws CommandFailedException if the helper could not watch {@code path} */
  public void addWatch(String name, String path) {
    monitor(name).addWatch(path);
  }

  /** @throws CommandFailedException if the helper was not watching {@code path} */
  public void remove(String name, String path) {
    monitor(name).remove(path);
  }

  /** @return the watched paths, in no particular order */
  public List<String> watchList(String name) {
    return monitor(name).watchList();
  }

  /**
   * Asks the monitor to stop, without waiting for it; unknown names are ignored.
   *
   * Later commands fail with {@link NoSuchMonitorException} right away, but the name cannot be
   * started again until the old monitor has stopped, which subscribers learn from its
   * {@link MonitorStopped}.
   */
  public void stop(String name) {
    Monitor monitor = monitors.get(name);
    if (monitor == null) {
      log.debug("Ignoring stop of unknown monitor {}", name);
      return;
    }
    if (stopping.putIfAbsent(name, monitor) != null) {
      // another caller is stopping it
      return;
    }
    if (!monitors.remove(name, monitor)) {
      // stopped on its own in the meantime
      stopping.remove(name, monitor);
      return;
    }
    // its stopped callback may already have run, and missed the entry we just added
    if (monitor.getState() == MonitorState.STOPPED) {
      stopping.remove(name, monitor);
    }
    taskFactory.runTask(new StopMonitor(monitor));
  }

  /** @return whether a monitor stopped by name is still being torn down */
  public boolean isStopping(String name) {
    return stopping.containsKey(name);
  }

  public boolean isRunning(String name) {
    return getMonitor(name).map(m -> m.getState() == MonitorState.RUNNING).orElse(false);
  }

  public Optional<Monitor> getMonitor(String name) {
    return Optional.ofNullable(monitors.get(name));
  }

  /** Subscribes a new mailbox of the configured capacity to {@code name}. */
  public Subscriber subscribe(String name) {
    Subscriber subscriber = new Subscriber(name + "-" + Thread.currentThread().getName(), config.getMailboxCapacity());
    subscribe(name, subscriber);
    return subscriber;
  }

  public void subscribe(String name, Subscriber subscriber) {
    directory.subscribe(name, subscriber);
  }

  public void unsubscribe(String name, Subscriber subscriber) {
    directory.unsubscribe(name, subscriber);
  }

  private Monitor monitor(String name) {
    return getMonitor(name).orElseThrow(() -> new NoSuchMonitorException(name));
  }

  /** Stops one monitor on its own thread, so {@link #stop} never blocks the caller. */
  private static class StopMonitor implements TaskLogic {
    private final Monitor monitor;

    private StopMonitor(Monitor monitor) {
      this.monitor = monitor;
    }

    @Override
    public Duration runOneLoop() {
      monitor.stop();
      return Duration.ofMillis(-1);
    }

    @Override
    public String getName() {
      return "StopMonitor-" + monitor.getName();
    }
  }

}
