package fsnotify;

public class NoSuchMonitorException extends FsNotifyException {

  private static final long serialVersionUID = 1L;

  public NoSuchMonitorException(String name) {
    super("No monitor named " + name + " is running");
  }

}
