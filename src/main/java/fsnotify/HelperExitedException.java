package fsnotify;

/**
 * The helper connection is gone, either because the helper exited, its stream broke,
 * or the monitor was stopped. Every command still waiting for a reply fails with this.
 */
public class HelperExitedException extends FsNotifyException {

  private static final long serialVersionUID = 1L;

  public HelperExitedException(String message) {
    super(message);
  }

  public HelperExitedException(String message, Throwable cause) {
    super(message, cause);
  }

}
