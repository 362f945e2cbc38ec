package fsnotify;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import com.google.common.base.MoreObjects;

/** A change to a watched path. */
public class WatchEvent implements MonitorMessage {

  private final String path;
  private final Set<Op> ops;

  public WatchEvent(String path, Set<Op> ops) {
    this.path = Objects.requireNonNull(path);
    this.ops = Collections.unmodifiableSet(ops.isEmpty() ? EnumSet.noneOf(Op.class) : EnumSet.copyOf(ops));
  }

  public String getPath() {
    return path;
  }

  public Set<Op> getOps() {
    return ops;
  }

  public boolean is(Op op) {
    return ops.contains(op);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof WatchEvent)) {
      return false;
    }
    WatchEvent other = (WatchEvent) o;
    return path.equals(other.path) && ops.equals(other.ops);
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, ops);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("path", path).add("ops", ops).toString();
  }
}
