package fsnotify;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/** Sent once to each subscriber when a monitor stops, whether asked to or because its helper died. */
public class MonitorStopped implements MonitorMessage {

  private final String name;

  public MonitorStopped(String name) {
    this.name = Objects.requireNonNull(name);
  }

  public String getName() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof MonitorStopped && name.equals(((MonitorStopped) o).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("name", name).toString();
  }
}
