package fsnotify;

/** The helper answered a command with an error. */
public class CommandFailedException extends FsNotifyException {

  private static final long serialVersionUID = 1L;
  private final String helperMessage;

  public CommandFailedException(String command, String helperMessage) {
    super(command + " failed: " + helperMessage);
    this.helperMessage = helperMessage;
  }

  /** @return the error text exactly as the helper reported it */
  public String getHelperMessage() {
    return helperMessage;
  }

}
