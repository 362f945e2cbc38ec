package fsnotify;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.google.common.collect.ImmutableSet;

/**
 * Which subscribers want the messages of which monitor name.
 *
 * Membership is keyed by name, not by monitor instance, so it outlives any one monitor:
 * when a monitor stops and a new one starts under the same name, existing subscribers
 * hear from the new one without subscribing again.
 *
 * The {@link #global()} directory is created on first use and lives for the whole process.
 */
public class SubscriberDirectory {

  private final Map<String, Set<Subscriber>> members = new ConcurrentHashMap<>();

  private static class Holder {
    private static final SubscriberDirectory global = new SubscriberDirectory();
  }

  public static SubscriberDirectory global() {
    return Holder.global;
  }

  /** Adds {@code subscriber} to {@code name}; subscribing twice has no further effect. */
  public void subscribe(String name, Subscriber subscriber) {
    members.compute(name, (k, set) -> {
      Set<Subscriber> s = set == null ? ConcurrentHashMap.newKeySet() : set;
      s.add(subscriber);
      return s;
    });
  }

  /** Removes {@code subscriber} from {@code name}; a no-op if it was not subscribed. */
  public void unsubscribe(String name, Subscriber subscriber) {
    members.computeIfPresent(name, (k, set) -> {
      set.remove(subscriber);
      return set.isEmpty() ? null : set;
    });
  }

  /** @return a snapshot of the distinct subscribers of {@code name} */
  public Set<Subscriber> members(String name) {
    Set<Subscriber> set = members.get(name);
    return set == null ? ImmutableSet.of() : ImmutableSet.copyOf(set);
  }

  public boolean isSubscribed(String name, Subscriber subscriber) {
    return members(name).contains(subscriber);
  }

}
