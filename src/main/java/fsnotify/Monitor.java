package fsnotify;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import fsnotify.helper.HelperConnection;
import fsnotify.helper.HelperLauncher;
import fsnotify.helper.HelperProcess;
import fsnotify.helper.HelperStderrLogger;
import fsnotify.helper.WatchCommands;
import fsnotify.tasks.TaskFactory;
import fsnotify.tasks.TaskPool;

/**
 * One named helper process, its connection, and the watches it was started with.
 *
 * A monitor moves through {@link MonitorState} once: {@link #start()} launches the helper and
 * applies the initial watches (any failure aborts the whole start), then commands are served
 * until {@link #stop()} is called or the helper goes away on its own. Either way the stream is
 * closed, the process is terminated, pending commands fail, and every current subscriber of
 * the monitor's name gets one {@link MonitorStopped}.
 *
 * Broadcasts from the helper are decoded on the connection's reader thread and handed to the
 * {@link Broadcaster}, which never blocks.
 */
public class Monitor {

  private static final Logger log = LoggerFactory.getLogger(Monitor.class);
  private final String name;
  private final List<String> initialWatches;
  private final MonitorConfig config;
  private final HelperLauncher launcher;
  private final Broadcaster broadcaster;
  private final BroadcastDecoder decoder = new BroadcastDecoder();
  private final TaskPool taskPool;
  private final AtomicReference<MonitorState> state = new AtomicReference<>(MonitorState.STARTING);
  private final List<Runnable> stoppedCallbacks = new CopyOnWriteArrayList<>();
  private volatile HelperProcess process;
  private volatile HelperConnection connection;
  private volatile WatchCommands commands;

  public Monitor(
    String name,
    List<String> initialWatches,
    MonitorConfig config,
    TaskFactory taskFactory,
    HelperLauncher launcher,
    Broadcaster broadcaster) {
    this.name = name;
    this.initialWatches = ImmutableList.copyOf(initialWatches);
    this.config = config;
    this.launcher = launcher;
    this.broadcaster = broadcaster;
    // the reader and stderr pump live and die together
    this.taskPool = new TaskPool(taskFactory, "monitor " + name);
  }

  /**
   * Launches the helper and applies the initial watches, in order.
   *
   * @throws MonitorStartException if the helper could not be launched or any initial watch failed;
   *           the helper is torn down and no stop message is broadcast
   */
  public void start() {
    if (state.get() != MonitorState.STARTING) {
      throw new IllegalStateException("Monitor " + name + " was already started");
    }
    log.info("Starting monitor {} with {} initial watches", name, initialWatches.size());
    try {
      process = launcher.launch();
    } catch (IOException e) {
      throw abandonStart(new MonitorStartException("Could not launch helper for monitor " + name, e));
    }
    connection = new HelperConnection(
      name,
      process.getInputStream(),
      process.getOutputStream(),
      config.getCommandTimeout(),
      this::onBroadcast,
      this::onConnectionClosed);
    commands = new WatchCommands(connection);
    try {
      taskPool.runTask(connection.reader());
      process.getErrorStream().ifPresent(stderr -> taskPool.runTask(new HelperStderrLogger(name, stderr)));
    } catch (RuntimeException e) {
      throw abandonStart(new MonitorStartException("Could not start the reader of monitor " + name, e));
    }

    for (String path : initialWatches) {
      try {
        commands.addWatch(path);
      } catch (FsNotifyException e) {
        throw abandonStart(new MonitorStartException("Monitor " + name + " could not watch " + path, e));
      }
    }

    if (!state.compareAndSet(MonitorState.STARTING, MonitorState.RUNNING)) {
      throw abandonStart(new MonitorStartException("Monitor " + name + " was stopped while starting"));
    }
    log.info("Monitor {} is running", name);
  }

  public void addWatch(String path) {
    runningCommands().addWatch(path);
  }

  public void remove(String path) {
    runningCommands().remove(path);
  }

  public List<String> watchList() {
    return runningCommands().watchList();
  }

  /**
   * Stops the monitor and broadcasts {@link MonitorStopped}; calling it again does nothing.
   */
  public void stop() {
    while (true) {
      MonitorState current = state.get();
      if (current == MonitorState.RUNNING) {
        if (state.compareAndSet(current, MonitorState.STOPPING)) {
          teardown(true);
          return;
        }
      } else if (current == MonitorState.STARTING) {
        // start() notices and fails
        if (state.compareAndSet(current, MonitorState.STOPPING)) {
          teardown(false);
          return;
        }
      } else {
        return;
      }
    }
  }

  public MonitorState getState() {
    return state.get();
  }

  public String getName() {
    return name;
  }

  /** Runs {@code callback} once the monitor has reached {@link MonitorState#STOPPED}. */
  public void addStoppedCallback(Runnable callback) {
    stoppedCallbacks.add(callback);
    if (state.get() == MonitorState.STOPPED && stoppedCallbacks.remove(callback)) {
      callback.run();
    }
  }

  private WatchCommands runningCommands() {
    MonitorState current = state.get();
    if (current != MonitorState.RUNNING) {
      throw new MonitorStoppedException(name, current);
    }
    return commands;
  }

  private void onBroadcast(byte[] payload) {
    MonitorMessage message = decoder.decode(payload);
    if (log.isDebugEnabled()) {
      log.debug("Monitor {} broadcasting {}", name, message);
    }
    broadcaster.dispatch(name, message);
  }

  private void onConnectionClosed() {
    if (state.get() == MonitorState.RUNNING) {
      String reason = connection.getCloseCause().map(Throwable::getMessage).orElse("connection closed");
      log.info("Monitor {} lost its helper: {}", name, reason);
    }
    stop();
  }

  /**
   * Tears down a start that failed. A {@link #stop()} racing with the start may already have
   * torn down before the helper or its connection existed, so those are released here too.
   */
  private MonitorStartException abandonStart(MonitorStartException e) {
    if (state.compareAndSet(MonitorState.STARTING, MonitorState.STOPPING)) {
      teardown(false);
    } else {
      releaseHelper();
    }
    return e;
  }

  private void teardown(boolean broadcastStop) {
    log.info("Stopping monitor {}", name);
    releaseHelper();
    if (broadcastStop) {
      broadcaster.dispatch(name, new MonitorStopped(name));
    }
    state.set(MonitorState.STOPPED);
    // off-thread, as the reader may be the one calling us
    taskPool.stopAll();
    for (Runnable callback : stoppedCallbacks) {
      if (stoppedCallbacks.remove(callback)) {
        try {
          callback.run();
        } catch (RuntimeException e) {
          log.error("Error calling stopped callback of monitor " + name, e);
        }
      }
    }
  }

  // both are safe to call again
  private void releaseHelper() {
    HelperConnection c = connection;
    if (c != null) {
      c.close();
    }
    HelperProcess p = process;
    if (p != null) {
      Optional<Integer> status = p.destroy();
      log.info("Helper of monitor {} exited with status {}", name, status.map(String::valueOf).orElse("unknown"));
    }
  }

}
