package fsnotify;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A handle that receives {@link MonitorMessage}s through a bounded mailbox.
 *
 * Delivery never blocks the sender: when the mailbox is full the message is dropped.
 * Two subscribers are the same only if they are the same object.
 */
public class Subscriber {

  private final String label;
  private final BlockingQueue<MonitorMessage> mailbox;

  public Subscriber(String label, int capacity) {
    this.label = label;
    this.mailbox = new ArrayBlockingQueue<>(capacity);
  }

  /** @return false if the mailbox was full and the message was dropped */
  boolean offer(MonitorMessage message) {
    return mailbox.offer(message);
  }

  public MonitorMessage take() throws InterruptedException {
    return mailbox.take();
  }

  /** @return the next message, or null if none arrived within {@code timeout} */
  public MonitorMessage poll(Duration timeout) throws InterruptedException {
    return mailbox.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  public int size() {
    return mailbox.size();
  }

  public String getLabel() {
    return label;
  }

  @Override
  public String toString() {
    return "Subscriber[" + label + "]";
  }
}
