package fsnotify;

/** The lifecycle of a {@link Monitor}; transitions only move forward. */
public enum MonitorState {
  /** Launching the helper and applying the initial watches. */
  STARTING,
  /** Accepting commands and broadcasting events. */
  RUNNING,
  /** Tearing down the stream and the helper process. */
  STOPPING,
  /** Terminal. */
  STOPPED
}
