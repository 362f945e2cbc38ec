package fsnotify.tasks;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

public class TaskPoolTest {

  private final ThreadBasedTaskFactory factory = new ThreadBasedTaskFactory();
  private final TaskPool pool = new TaskPool(factory, "monitor test");

  @Test
  public void shouldStopThePumpWhenTheReaderFails() throws Exception {
    CountDownLatch failReader = new CountDownLatch(1);
    BlockingTask pump = new BlockingTask();
    pool.runTask(() -> {
      failReader.await();
      throw new IllegalStateException("stream broke");
    });
    pool.runTask(pump);

    failReader.countDown();
    assertThat(pump.stopped.await(1, TimeUnit.SECONDS), is(true));
    assertThat(pump.interrupted.getCount(), is(0L));
    assertThat(pool.isStopped(), is(true));
  }

  @Test
  public void shouldLetATaskStopItsOwnPool() throws Exception {
    BlockingTask pump = new BlockingTask();
    CountDownLatch readerStopped = new CountDownLatch(1);
    pool.runTask(pump);
    pool.runTask(new TaskLogic() {
      @Override
      public Duration runOneLoop() {
        // as the reader does when the helper exits
        pool.stopAll();
        return Duration.ofMillis(10);
      }

      @Override
      public void onStop() {
        readerStopped.countDown();
      }
    });
    assertThat(readerStopped.await(1, TimeUnit.SECONDS), is(true));
    assertThat(pump.stopped.await(1, TimeUnit.SECONDS), is(true));
  }

  @Test
  public void shouldScheduleTheStopOnlyOnce() {
    TaskFactory mocked = mock(TaskFactory.class);
    TaskPool p = new TaskPool(mocked, "monitor test");
    p.stopAll();
    p.stopAll();
    verify(mocked, times(1)).runTask(any(TaskLogic.class));
  }

  @Test
  public void shouldRejectTasksOnceStopped() {
    pool.stopAll();
    try {
      pool.runTask(new BlockingTask());
      fail();
    } catch (IllegalStateException e) {
      assertThat(e.getMessage(), is("Tasks of monitor test are already stopped"));
    }
  }

  /** Blocks until interrupted, like a pump waiting on a quiet stream. */
  private static class BlockingTask implements TaskLogic {
    private final BlockingQueue<String> lines = new LinkedBlockingQueue<>();
    private final CountDownLatch interrupted = new CountDownLatch(1);
    private final CountDownLatch stopped = new CountDownLatch(1);

    @Override
    public Duration runOneLoop() throws InterruptedException {
      lines.take();
      return null;
    }

    @Override
    public void onInterrupt() {
      interrupted.countDown();
    }

    @Override
    public void onStop() {
      stopped.countDown();
    }
  }
}
