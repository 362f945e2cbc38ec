package fsnotify.helper;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.Optional;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import fsnotify.CommandFailedException;
import fsnotify.UnrecognizedReplyException;
import fsnotify.Utils;

/**
 * A decoded reply to a command.
 *
 * <ul>
 * <li>{@code "ok"}: success without a value</li>
 * <li>{@code {"OK": value}}: success with a value</li>
 * <li>{@code {"Err": message}}: failure</li>
 * <li>a bare JSON array: success with that array as the value ({@code watch_list} in older helpers)</li>
 * </ul>
 */
public final class Reply {

  private final String command;
  private final JsonElement value;
  private final String error;

  private Reply(String command, JsonElement value, String error) {
    this.command = command;
    this.value = value;
    this.error = error;
  }

  /**
   * @throws UnrecognizedReplyException if the payload has none of the known shapes
   */
  public static Reply parse(String command, byte[] payload) {
    JsonElement json;
    try {
      json = JsonParser.parseString(new String(payload, UTF_8));
    } catch (JsonParseException e) {
      throw new UnrecognizedReplyException("Unparseable reply to '" + command + "': " + Utils.debugString(payload), e);
    }
    if (json.isJsonPrimitive() && json.getAsJsonPrimitive().isString() && json.getAsString().equals("ok")) {
      return new Reply(command, null, null);
    }
    if (json.isJsonArray()) {
      return new Reply(command, json, null);
    }
    if (json.isJsonObject()) {
      JsonObject object = json.getAsJsonObject();
      if (object.has("OK")) {
        return new Reply(command, object.get("OK"), null);
      }
      if (object.has("Err") && object.get("Err").isJsonPrimitive()) {
        return new Reply(command, null, object.get("Err").getAsString());
      }
    }
    throw new UnrecognizedReplyException("Unrecognized reply to '" + command + "': " + Utils.debugString(payload));
  }

  public boolean isSuccess() {
    return error == null;
  }

  public Optional<JsonElement> getValue() {
    return Optional.ofNullable(value);
  }

  public Optional<String> getError() {
    return Optional.ofNullable(error);
  }

  /**
   * @return this reply, if it was a success
   * @throws CommandFailedException if the helper reported an error
   */
  public Reply orThrow() {
    if (error != null) {
      throw new CommandFailedException(command, error);
    }
    return this;
  }

  @Override
  public String toString() {
    return isSuccess() ? "Reply[ok " + (value == null ? "" : value) + "]" : "Reply[error " + error + "]";
  }
}
