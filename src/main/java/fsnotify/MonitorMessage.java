package fsnotify;

/**
 * A message delivered to the subscribers of a monitor: a {@link WatchEvent}, a
 * {@link WatchFailure}, or a {@link MonitorStopped}.
 */
public interface MonitorMessage {
}
