package fsnotify;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

public class SubscriberDirectoryTest {

  private final SubscriberDirectory directory = new SubscriberDirectory();
  private final Subscriber a = new Subscriber("a", 10);
  private final Subscriber b = new Subscriber("b", 10);

  @Test
  public void shouldSubscribeIdempotently() {
    directory.subscribe("M", a);
    directory.subscribe("M", a);
    directory.subscribe("M", b);
    assertThat(directory.members("M").size(), is(2));
  }

  @Test
  public void shouldUnsubscribeIdempotently() {
    directory.subscribe("M", a);
    directory.unsubscribe("M", a);
    directory.unsubscribe("M", a);
    directory.unsubscribe("unknown", a);
    assertThat(directory.members("M").isEmpty(), is(true));
    assertThat(directory.isSubscribed("M", a), is(false));
  }

  @Test
  public void shouldKeepNamesSeparate() {
    directory.subscribe("M", a);
    directory.subscribe("N", b);
    assertThat(directory.isSubscribed("M", a), is(true));
    assertThat(directory.isSubscribed("M", b), is(false));
    assertThat(directory.isSubscribed("N", b), is(true));
  }

  @Test
  public void shouldTreatEqualLookingSubscribersAsDistinct() {
    directory.subscribe("M", new Subscriber("same", 10));
    directory.subscribe("M", new Subscriber("same", 10));
    assertThat(directory.members("M").size(), is(2));
  }

  @Test
  public void shouldReturnASnapshot() {
    directory.subscribe("M", a);
    Set<Subscriber> before = directory.members("M");
    directory.subscribe("M", b);
    assertThat(before.size(), is(1));
  }

  @Test
  public void shouldShareTheGlobalDirectory() {
    assertThat(SubscriberDirectory.global() == SubscriberDirectory.global(), is(true));
  }

  @Test
  public void shouldNotLoseSubscriptionsUnderConcurrentChurn() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    List<Subscriber> keepers = new ArrayList<>();
    CountDownLatch done = new CountDownLatch(200);
    for (int i = 0; i < 100; i++) {
      Subscriber keeper = new Subscriber("keeper" + i, 1);
      Subscriber churn = new Subscriber("churn" + i, 1);
      keepers.add(keeper);
      pool.execute(() -> {
        directory.subscribe("M", keeper);
        done.countDown();
      });
      pool.execute(() -> {
        directory.subscribe("M", churn);
        directory.unsubscribe("M", churn);
        done.countDown();
      });
    }
    assertThat(done.await(5, TimeUnit.SECONDS), is(true));
    pool.shutdown();
    assertThat(directory.members("M").size(), is(100));
    assertThat(directory.members("M").containsAll(keepers), is(true));
  }
}
