package fsnotify;

/**
 * Base class for everything that can go wrong talking to a helper.
 */
public class FsNotifyException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public FsNotifyException(String message) {
    super(message);
  }

  public FsNotifyException(String message, Throwable cause) {
    super(message, cause);
  }

}
