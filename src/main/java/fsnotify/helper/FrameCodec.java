package fsnotify.helper;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Optional;

import com.google.common.io.ByteStreams;

import fsnotify.FramingException;

/**
 * Encodes and decodes frames: {@code [length:u16][id:u64][payload]}, all big-endian,
 * where {@code length} counts the id and the payload.
 *
 * Each read consumes exactly one frame; nothing is buffered between calls.
 */
public final class FrameCodec {

  public static final int LENGTH_SIZE = 2;
  public static final int ID_SIZE = 8;
  public static final int MAX_PAYLOAD_SIZE = 0xFFFF - ID_SIZE;

  private FrameCodec() {
  }

  public static byte[] encode(long id, byte[] payload) {
    checkArgument(payload.length <= MAX_PAYLOAD_SIZE, "Payload of %s bytes exceeds the %s byte frame limit", payload.length, MAX_PAYLOAD_SIZE);
    ByteBuffer buffer = ByteBuffer.allocate(LENGTH_SIZE + ID_SIZE + payload.length);
    buffer.putShort((short) (ID_SIZE + payload.length));
    buffer.putLong(id);
    buffer.put(payload);
    return buffer.array();
  }

  /** Writes one frame and flushes, so the helper sees it immediately. */
  public static void write(OutputStream out, long id, byte[] payload) throws IOException {
    out.write(encode(id, payload));
    out.flush();
  }

  /**
   * Reads the next frame.
   *
   * @return the frame, or empty if the stream ended cleanly on a frame boundary
   * @throws FramingException if the stream ended inside a frame, or the frame is too short to hold an id
   */
  public static Optional<Frame> read(InputStream in) throws IOException {
    int high = in.read();
    if (high == -1) {
      return Optional.empty();
    }
    int low = in.read();
    if (low == -1) {
      throw new FramingException("Stream ended inside a frame length");
    }
    int length = (high << 8) | low;
    if (length < ID_SIZE) {
      throw new FramingException("Frame length " + length + " cannot hold a correlation id");
    }
    byte[] body = new byte[length];
    int read = ByteStreams.read(in, body, 0, length);
    if (read < length) {
      throw new FramingException("Stream ended after " + read + " of " + length + " frame bytes");
    }
    long id = ByteBuffer.wrap(body).getLong();
    return Optional.of(new Frame(id, Arrays.copyOfRange(body, ID_SIZE, length)));
  }

}
