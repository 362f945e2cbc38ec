package fsnotify;

/** The helper sent a malformed or truncated frame; fatal to its monitor. */
public class FramingException extends FsNotifyException {

  private static final long serialVersionUID = 1L;

  public FramingException(String message) {
    super(message);
  }

}
