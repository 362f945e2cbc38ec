package fsnotify;

/** A monitor could not be started; nothing of it is left running. */
public class MonitorStartException extends FsNotifyException {

  private static final long serialVersionUID = 1L;

  public MonitorStartException(String message) {
    super(message);
  }

  public MonitorStartException(String message, Throwable cause) {
    super(message, cause);
  }

}
