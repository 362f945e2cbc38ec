package fsnotify;

import static org.hamcrest.CoreMatchers.hasItems;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Test;

import fsnotify.helper.FakeHelper;
import fsnotify.tasks.ThreadBasedTaskFactory;

public class FsNotifyTest {

  private static final Duration wait = Duration.ofSeconds(2);
  private final FakeHelper helper = new FakeHelper();
  private final SubscriberDirectory directory = new SubscriberDirectory();
  private final MonitorConfig config = MonitorConfig.newBuilder().commandTimeout(Duration.ofSeconds(5)).mailboxCapacity(100).build();
  private final FsNotify fs = new FsNotify(config, new ThreadBasedTaskFactory(), directory, helper);

  @After
  public void after() {
    fs.stop("project");
  }

  @Test
  public void shouldWatchListAndRemoveByName() {
    fs.start("project", Collections.singletonList("/tmp/a"));
    assertThat(fs.isRunning("project"), is(true));
    fs.addWatch("project", "/tmp/b");
    assertThat(fs.watchList("project"), hasItems("/tmp/a", "/tmp/b"));
    fs.remove("project", "/tmp/a");
    assertThat(fs.watchList("project"), is(Arrays.asList("/tmp/b")));
  }

  @Test
  public void shouldRoundTripNonAsciiPaths() {
    fs.start("project", Collections.singletonList("/tmp/café"));
    fs.addWatch("project", "/tmp/日本語");
    assertThat(helper.getCommands(), is(Arrays.asList("add_watch /tmp/café", "add_watch /tmp/日本語")));
    assertThat(fs.watchList("project"), hasItems("/tmp/café", "/tmp/日本語"));
    fs.remove("project", "/tmp/café");
    assertThat(fs.watchList("project"), is(Arrays.asList("/tmp/日本語")));
  }

  @Test
  public void shouldDeliverEventsToEverySubscriber() throws Exception {
    Subscriber first = fs.subscribe("project");
    Subscriber second = fs.subscribe("project");
    Subscriber other = fs.subscribe("other");
    fs.start("project", Collections.emptyList());
    helper.sendEvent("/tmp/a/b", Op.WRITE.getBit() | Op.CHMOD.getBit());
    WatchEvent expected = new WatchEvent("/tmp/a/b", EnumSet.of(Op.WRITE, Op.CHMOD));
    assertThat(first.poll(wait), is((MonitorMessage) expected));
    assertThat(second.poll(wait), is((MonitorMessage) expected));
    assertThat(other.poll(Duration.ofMillis(50)), is(nullValue()));
  }

  @Test
  public void shouldStopByName() throws Exception {
    Subscriber subscriber = fs.subscribe("project");
    fs.start("project", Collections.emptyList());
    fs.stop("project");
    // released right away, even though the stop itself is asynchronous
    assertThat(fs.isRunning("project"), is(false));
    try {
      fs.addWatch("project", "/tmp/a");
      fail();
    } catch (NoSuchMonitorException e) {
      assertThat(e.getMessage(), is("No monitor named project is running"));
    }
    assertThat(subscriber.poll(wait), is((MonitorMessage) new MonitorStopped("project")));
    // a second stop is ignored, and nothing more is broadcast
    fs.stop("project");
    assertThat(subscriber.poll(Duration.ofMillis(100)), is(nullValue()));
  }

  @Test
  public void shouldNotRestartANameUntilItsMonitorHasStopped() throws Exception {
    Subscriber subscriber = fs.subscribe("project");
    fs.start("project", Collections.emptyList());
    helper.delayExit();
    fs.stop("project");
    assertThat(fs.isStopping("project"), is(true));
    try {
      fs.start("project", Collections.emptyList());
      fail();
    } catch (IllegalStateException e) {
      assertThat(e.getMessage(), is("Monitor project is still stopping"));
    }
    assertThat(helper.getLaunches(), is(1));

    helper.allowExit();
    assertThat(subscriber.poll(wait), is((MonitorMessage) new MonitorStopped("project")));
    awaitNotStopping("project");
    fs.start("project", Collections.emptyList());
    assertThat(fs.isRunning("project"), is(true));
    // the old stop came before the restart, and nothing stale follows it
    assertThat(subscriber.poll(Duration.ofMillis(100)), is(nullValue()));
  }

  @Test
  public void shouldRejectASecondMonitorWithTheSameName() {
    fs.start("project", Collections.emptyList());
    try {
      fs.start("project", Collections.emptyList());
      fail();
    } catch (IllegalStateException e) {
      assertThat(e.getMessage(), is("Monitor project is already running"));
    }
    assertThat(helper.getLaunches(), is(1));
  }

  @Test
  public void shouldReleaseTheNameWhenStartFails() {
    helper.makeUnwatchable("/missing");
    try {
      fs.start("project", Arrays.asList("/missing"));
      fail();
    } catch (MonitorStartException e) {
      assertThat(fs.getMonitor("project").isPresent(), is(false));
    }
    fs.start("project", Arrays.asList("/tmp/a"));
    assertThat(fs.isRunning("project"), is(true));
  }

  @Test
  public void shouldKeepSubscribersAcrossARestart() throws Exception {
    Subscriber subscriber = fs.subscribe("project");
    fs.start("project", Collections.emptyList());
    Monitor first = fs.getMonitor("project").get();
    CountDownLatch stopped = new CountDownLatch(1);
    first.addStoppedCallback(stopped::countDown);
    fs.stop("project");
    assertThat(stopped.await(2, TimeUnit.SECONDS), is(true));
    assertThat(subscriber.poll(wait), is((MonitorMessage) new MonitorStopped("project")));

    fs.start("project", Collections.emptyList());
    helper.sendError("overflow");
    assertThat(subscriber.poll(wait), is((MonitorMessage) new WatchFailure("overflow")));
    assertThat(helper.getLaunches(), is(2));
  }

  @Test
  public void shouldForgetAMonitorWhoseHelperExited() throws Exception {
    fs.start("project", Collections.emptyList());
    CountDownLatch stopped = new CountDownLatch(1);
    fs.getMonitor("project").get().addStoppedCallback(stopped::countDown);
    helper.exit();
    assertThat(stopped.await(2, TimeUnit.SECONDS), is(true));
    assertThat(fs.getMonitor("project").isPresent(), is(false));
  }

  @Test
  public void shouldNotDeliverAfterUnsubscribing() throws Exception {
    Subscriber subscriber = fs.subscribe("project");
    fs.unsubscribe("project", subscriber);
    fs.start("project", Collections.emptyList());
    helper.sendError("overflow");
    assertThat(subscriber.poll(Duration.ofMillis(100)), is(nullValue()));
    assertThat(directory.isSubscribed("project", subscriber), is(false));
  }

  private void awaitNotStopping(String name) throws InterruptedException {
    long deadline = System.currentTimeMillis() + wait.toMillis();
    while (fs.isStopping(name) && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
    assertThat(fs.isStopping(name), is(false));
  }

}
