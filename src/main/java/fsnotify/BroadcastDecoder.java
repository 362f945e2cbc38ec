package fsnotify;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

/**
 * Turns a broadcast payload into a {@link WatchEvent} ({@code {"Name": path, "Op": bits}})
 * or a {@link WatchFailure} ({@code {"Err": message}}).
 */
public class BroadcastDecoder {

  private final Gson gson = new Gson();

  private static class Broadcast {
    @SerializedName("Name")
    String name;
    @SerializedName("Op")
    Integer op;
    @SerializedName("Err")
    String err;
  }

  /**
   * @throws UnrecognizedReplyException if the payload is neither an event nor an error
   */
  public MonitorMessage decode(byte[] payload) {
    Broadcast b;
    try {
      b = gson.fromJson(new String(payload, UTF_8), Broadcast.class);
    } catch (JsonParseException e) {
      throw new UnrecognizedReplyException("Unparseable broadcast: " + Utils.debugString(payload), e);
    }
    if (b != null && b.name != null && b.op != null) {
      return new WatchEvent(b.name, Op.fromMask(b.op));
    }
    if (b != null && b.err != null) {
      return new WatchFailure(b.err);
    }
    throw new UnrecognizedReplyException("Unrecognized broadcast: " + Utils.debugString(payload));
  }

}
