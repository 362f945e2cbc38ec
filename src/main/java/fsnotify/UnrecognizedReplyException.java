package fsnotify;

/** The helper answered a command with a payload that is neither a success nor an error. */
public class UnrecognizedReplyException extends FsNotifyException {

  private static final long serialVersionUID = 1L;

  public UnrecognizedReplyException(String message) {
    super(message);
  }

  public UnrecognizedReplyException(String message, Throwable cause) {
    super(message, cause);
  }

}
