package fsnotify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands a message to every distinct subscriber of a monitor name, without ever blocking.
 */
public class Broadcaster {

  private static final Logger log = LoggerFactory.getLogger(Broadcaster.class);
  private final SubscriberDirectory directory;

  public Broadcaster(SubscriberDirectory directory) {
    this.directory = directory;
  }

  /** @return how many subscribers accepted the message */
  public int dispatch(String name, MonitorMessage message) {
    int delivered = 0;
    for (Subscriber subscriber : directory.members(name)) {
      if (subscriber.offer(message)) {
        delivered++;
      } else {
        log.warn("Mailbox of {} is full, dropping {}", subscriber, message);
      }
    }
    return delivered;
  }

}
