package fsnotify.helper;

/** The commands the helper understands; it treats anything else as fatal. */
public enum Command {
  ADD_WATCH("add_watch"),
  REMOVE("remove"),
  WATCH_LIST("watch_list");

  private final String wireName;

  Command(String wireName) {
    this.wireName = wireName;
  }

  /** @return the command text, {@code "<name> <argument>"}, or just the name when there is no argument */
  public String format(String argument) {
    return argument == null ? wireName : wireName + " " + argument;
  }
}
