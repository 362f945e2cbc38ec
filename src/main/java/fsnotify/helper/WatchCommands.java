package fsnotify.helper;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import fsnotify.CommandFailedException;
import fsnotify.UnrecognizedReplyException;

/**
 * The typed watch commands, on top of a {@link HelperConnection}.
 */
public class WatchCommands {

  private static final Type listOfPaths = new TypeToken<List<String>>() {
  }.getType();
  private final Gson gson = new Gson();
  private final HelperConnection connection;

  public WatchCommands(HelperConnection connection) {
    this.connection = connection;
  }

  /**
   * Starts watching {@code path}.
   *
   * @throws CommandFailedException if the helper could not watch it
   */
  public void addWatch(String path) {
    run(Command.ADD_WATCH, path);
  }

  /**
   * Stops watching {@code path}.
   *
   * @throws CommandFailedException if the helper was not watching it
   */
  public void remove(String path) {
    run(Command.REMOVE, path);
  }

  /** @return every watched path, in no particular order */
  public List<String> watchList() {
    Reply reply = run(Command.WATCH_LIST, null);
    JsonElement value = reply.getValue().orElse(null);
    // an empty list can come back as null
    if (value == null || value.isJsonNull()) {
      return new ArrayList<>();
    }
    try {
      List<String> paths = gson.fromJson(value, listOfPaths);
      return new ArrayList<>(paths);
    } catch (JsonParseException | IllegalStateException e) {
      throw new UnrecognizedReplyException("Unrecognized watch list: " + value, e);
    }
  }

  private Reply run(Command command, String argument) {
    String text = command.format(argument);
    return Reply.parse(text, connection.call(text)).orThrow();
  }

}
