package fsnotify;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/** An error the helper's watcher reported on its own, outside of any command. */
public class WatchFailure implements MonitorMessage {

  private final String message;

  public WatchFailure(String message) {
    this.message = Objects.requireNonNull(message);
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof WatchFailure && message.equals(((WatchFailure) o).message);
  }

  @Override
  public int hashCode() {
    return message.hashCode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("message", message).toString();
  }
}
