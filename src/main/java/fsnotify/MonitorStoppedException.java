package fsnotify;

public class MonitorStoppedException extends FsNotifyException {

  private static final long serialVersionUID = 1L;

  public MonitorStoppedException(String name, MonitorState state) {
    super("Monitor " + name + " is " + state.name().toLowerCase());
  }

}
