package fsnotify.tasks;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import fsnotify.Utils;

/**
 * Loops one {@link TaskLogic} on a daemon thread until it finishes, throws, or is stopped.
 */
class ThreadBasedTask implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(ThreadBasedTask.class);
  private static final AtomicInteger threadIds = new AtomicInteger();
  private final TaskLogic logic;
  private final Runnable onFailure;
  private final Runnable onFinished;
  private final AtomicBoolean stopping = new AtomicBoolean(false);
  private final CountDownLatch finished = new CountDownLatch(1);
  private final Thread thread;

  ThreadBasedTask(TaskLogic logic, Runnable onFailure, Runnable onFinished) {
    this.logic = logic;
    this.onFailure = onFailure;
    this.onFinished = onFinished;
    // monitor names end up in thread names, and the format must not see their %s
    String name = logic.getName().replace("%", "%%");
    this.thread = new ThreadFactoryBuilder()
      .setDaemon(true)
      .setNameFormat("fsnotify-" + name + "-" + threadIds.incrementAndGet())
      .build()
      .newThread(this);
  }

  void start() {
    thread.start();
  }

  void stop() {
    if (stopping.compareAndSet(false, true)) {
      thread.interrupt();
      logic.onInterrupt();
    }
    if (Thread.currentThread() != thread) {
      Utils.resetIfInterrupted(finished::await);
    }
  }

  @Override
  public void run() {
    try {
      loop();
    } catch (InterruptedException e) {
      log.debug("{} interrupted", logic.getName());
    } catch (RuntimeException e) {
      log.error("Task " + logic.getName() + " failed", e);
      if (!stopping.get() && onFailure != null) {
        runQuietly("onFailure", onFailure);
      }
    } finally {
      runQuietly("onStop", logic::onStop);
      runQuietly("onFinished", onFinished);
      finished.countDown();
    }
  }

  private void loop() throws InterruptedException {
    while (!stopping.get() && !Thread.currentThread().isInterrupted()) {
      Duration pause = logic.runOneLoop();
      if (pause == null) {
        continue;
      }
      if (pause.isNegative()) {
        return;
      }
      Thread.sleep(pause.toMillis());
    }
  }

  private void runQuietly(String what, Runnable r) {
    try {
      r.run();
    } catch (RuntimeException e) {
      log.error(what + " of " + logic.getName() + " failed", e);
    }
  }

}
