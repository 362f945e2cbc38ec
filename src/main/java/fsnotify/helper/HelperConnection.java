package fsnotify.helper;

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;

import fsnotify.CommandTimeoutException;
import fsnotify.FramingException;
import fsnotify.FsNotifyException;
import fsnotify.HelperExitedException;
import fsnotify.Utils;
import fsnotify.tasks.TaskLogic;

/**
 * Multiplexes commands and their replies, plus unsolicited broadcasts, over one helper stream.
 *
 * Callers {@link #send} a command, which registers a {@link PendingCommand} under a fresh nonzero
 * id before the frame is written, and then {@link #await} it. A single {@link #reader()} task
 * owns the input stream: broadcast frames (id 0) go to the broadcast handler, every other
 * frame completes the pending command with that id, if anyone is still waiting for it.
 *
 * Once the connection closes (the helper exited, the stream broke, or {@link #close()} was
 * called) every pending command fails immediately rather than waiting out its timeout.
 */
public class HelperConnection implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(HelperConnection.class);
  private static final Duration STOP = Duration.ofMillis(-1);
  private final String name;
  private final InputStream input;
  private final OutputStream output;
  private final Duration timeout;
  private final Consumer<byte[]> broadcasts;
  private final Runnable onClosed;
  private final AtomicLong lastId = new AtomicLong();
  private final Map<Long, PendingCommand> waiters = new ConcurrentHashMap<>();
  private final Object writeLock = new Object();
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private volatile HelperExitedException closeCause;

  /**
   * @param name the monitor name, for log lines and errors
   * @param input the helper's stdout
   * @param output the helper's stdin
   * @param timeout how long each command waits for its reply
   * @param broadcasts receives the payload of every broadcast frame, on the reader thread
   * @param onClosed called once, on whichever thread closed the connection
   */
  public HelperConnection(
    String name,
    InputStream input,
    OutputStream output,
    Duration timeout,
    Consumer<byte[]> broadcasts,
    Runnable onClosed) {
    this.name = name;
    this.input = input;
    this.output = output;
    this.timeout = timeout;
    this.broadcasts = broadcasts;
    this.onClosed = onClosed;
  }

  /** Sends {@code command} and blocks for its reply. */
  public byte[] call(String command) {
    return await(send(command));
  }

  /**
   * Registers a pending command and writes it to the helper.
   *
   * @throws IllegalArgumentException if the command does not fit in one frame
   * @throws HelperExitedException if the connection is closed or the write fails
   */
  public PendingCommand send(String command) {
    // paths go out as their UTF-8 bytes, the same encoding replies and broadcasts come back in
    byte[] payload = command.getBytes(UTF_8);
    checkArgument(
      payload.length <= FrameCodec.MAX_PAYLOAD_SIZE,
      "Command %s is %s bytes, over the %s byte frame limit",
      StringUtils.abbreviate(command, 80),
      payload.length,
      FrameCodec.MAX_PAYLOAD_SIZE);
    if (closed.get()) {
      throw closedException();
    }
    PendingCommand pending = new PendingCommand(nextId(), command, System.nanoTime() + timeout.toNanos());
    waiters.put(pending.getId(), pending);
    // close() may have failed the waiters between our check and our put
    if (closed.get()) {
      waiters.remove(pending.getId());
      throw closedException();
    }
    try {
      synchronized (writeLock) {
        FrameCodec.write(output, pending.getId(), payload);
      }
    } catch (IOException e) {
      waiters.remove(pending.getId());
      throw new HelperExitedException("Could not send '" + command + "' to helper " + name, e);
    }
    log.debug("Sent {}", pending);
    return pending;
  }

  /**
   * Blocks until the reply to {@code pending} arrives or its deadline passes.
   *
   * On timeout the command is forgotten, so a reply that shows up later is dropped.
   *
   * @throws CommandTimeoutException if no reply arrived in time
   * @throws HelperExitedException if the connection closed first
   */
  public byte[] await(PendingCommand pending) {
    try {
      return pending.slot.get(pending.remainingNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      if (waiters.remove(pending.getId(), pending)) {
        pending.slot.cancel(false);
        throw new CommandTimeoutException(pending.getCommand(), timeout);
      }
      // the reader claimed it just as we gave up, so the reply is about to land
      return getAfterClaimed(pending);
    } catch (ExecutionException e) {
      throw rethrow(pending, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      waiters.remove(pending.getId(), pending);
      throw new FsNotifyException("Interrupted waiting for '" + pending.getCommand() + "'", e);
    }
  }

  private byte[] getAfterClaimed(PendingCommand pending) {
    try {
      return pending.slot.get();
    } catch (ExecutionException e) {
      throw rethrow(pending, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FsNotifyException("Interrupted waiting for '" + pending.getCommand() + "'", e);
    }
  }

  private static FsNotifyException rethrow(PendingCommand pending, ExecutionException e) {
    Throwable cause = e.getCause();
    if (cause instanceof HelperExitedException) {
      return new HelperExitedException(cause.getMessage() + " while waiting for '" + pending.getCommand() + "'", cause);
    }
    return new FsNotifyException("Failed waiting for '" + pending.getCommand() + "'", cause);
  }

  /** @return the task that reads frames until the stream ends; run exactly one per connection. */
  public TaskLogic reader() {
    return new FrameReader();
  }

  public boolean isClosed() {
    return closed.get();
  }

  /** @return why the connection closed, if it has */
  public Optional<HelperExitedException> getCloseCause() {
    return Optional.ofNullable(closeCause);
  }

  @Override
  public void close() {
    close(new HelperExitedException("Connection to helper " + name + " was closed"));
  }

  void close(HelperExitedException cause) {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    closeCause = cause;
    log.debug("Closing connection to helper {}: {}", name, cause.getMessage());
    Utils.closeQuietly(output);
    Utils.closeQuietly(input);
    for (PendingCommand pending : new ArrayList<>(waiters.values())) {
      if (waiters.remove(pending.getId(), pending)) {
        pending.slot.setException(cause);
      }
    }
    try {
      onClosed.run();
    } catch (RuntimeException e) {
      log.error("Error running close callback for helper " + name, e);
    }
  }

  @VisibleForTesting
  int numberOfPendingCommands() {
    return waiters.size();
  }

  /** Never returns 0, which is reserved for broadcasts, even after wrapping around. */
  private long nextId() {
    long id;
    do {
      id = lastId.incrementAndGet();
    } while (id == Frame.BROADCAST_ID);
    return id;
  }

  private HelperExitedException closedException() {
    HelperExitedException cause = closeCause;
    String message = "Connection to helper " + name + " is closed";
    return cause == null ? new HelperExitedException(message) : new HelperExitedException(message, cause);
  }

  private void dispatch(Frame frame) {
    if (log.isTraceEnabled()) {
      log.trace("Read {}", frame);
    }
    if (frame.isBroadcast()) {
      broadcasts.accept(frame.getPayload());
      return;
    }
    PendingCommand pending = waiters.remove(frame.getId());
    if (pending == null) {
      log.debug("Dropping reply to unknown or timed out command {} of helper {}", Long.toUnsignedString(frame.getId()), name);
      return;
    }
    pending.slot.set(frame.getPayload());
  }

  /** The only reader of {@link #input}. */
  private class FrameReader implements TaskLogic {
    @Override
    public Duration runOneLoop() {
      Optional<Frame> frame;
      try {
        frame = FrameCodec.read(input);
      } catch (FramingException e) {
        log.error("Malformed frame from helper {}: {}", name, e.getMessage());
        close(new HelperExitedException("Helper " + name + " sent a malformed frame", e));
        return STOP;
      } catch (IOException e) {
        if (!closed.get()) {
          log.info("Reading from helper {} failed: {}", name, e.getMessage());
        }
        close(new HelperExitedException("Stream from helper " + name + " failed", e));
        return STOP;
      }
      if (!frame.isPresent()) {
        close(new HelperExitedException("Helper " + name + " closed its output"));
        return STOP;
      }
      try {
        dispatch(frame.get());
      } catch (RuntimeException e) {
        log.error("Unusable broadcast from helper " + name, e);
        close(new HelperExitedException("Helper " + name + " sent an unusable broadcast", e));
        return STOP;
      }
      return null;
    }

    // a read blocked on a pipe ignores interrupts, but returns once the stream is closed
    @Override
    public void onInterrupt() {
      close(new HelperExitedException("Reader for helper " + name + " was stopped"));
    }

    @Override
    public void onStop() {
      close(new HelperExitedException("Reader for helper " + name + " stopped"));
    }

    @Override
    public String getName() {
      return "FrameReader-" + name;
    }
  }

}
