package fsnotify.helper;

import java.util.Arrays;

import com.google.common.base.MoreObjects;

import fsnotify.Utils;

/**
 * One unit on the helper stream: a correlation id plus an opaque payload.
 *
 * Id {@code 0} marks an unsolicited broadcast; every command gets a nonzero id.
 * Ids are unsigned 64-bit values carried in a {@code long}.
 */
public final class Frame {

  public static final long BROADCAST_ID = 0;

  private final long id;
  private final byte[] payload;

  public Frame(long id, byte[] payload) {
    this.id = id;
    this.payload = payload.clone();
  }

  public long getId() {
    return id;
  }

  /** @return a copy of the payload */
  public byte[] getPayload() {
    return payload.clone();
  }

  public boolean isBroadcast() {
    return id == BROADCAST_ID;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Frame)) {
      return false;
    }
    Frame other = (Frame) o;
    return id == other.id && Arrays.equals(payload, other.payload);
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(id) + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this) //
      .add("id", Long.toUnsignedString(id))
      .add("payload", Utils.debugString(payload))
      .toString();
  }
}
