package fsnotify;

import java.time.Duration;

/** No reply arrived within the configured command timeout; the connection stays up. */
public class CommandTimeoutException extends FsNotifyException {

  private static final long serialVersionUID = 1L;

  public CommandTimeoutException(String command, Duration timeout) {
    super("No reply to '" + command + "' within " + timeout.toMillis() + "ms");
  }

}
