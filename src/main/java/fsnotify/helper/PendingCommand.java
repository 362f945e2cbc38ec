package fsnotify.helper;

import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.SettableFuture;

/**
 * A command that has been written to the helper and is waiting for its reply.
 *
 * The slot is completed at most once: by the read loop with the reply, with a failure
 * when the connection closes, or not at all if the caller's deadline passes first.
 */
public final class PendingCommand {

  private final long id;
  private final String command;
  private final long deadlineNanos;
  final SettableFuture<byte[]> slot = SettableFuture.create();

  PendingCommand(long id, String command, long deadlineNanos) {
    this.id = id;
    this.command = command;
    this.deadlineNanos = deadlineNanos;
  }

  public long getId() {
    return id;
  }

  public String getCommand() {
    return command;
  }

  long remainingNanos() {
    return Math.max(0, deadlineNanos - System.nanoTime());
  }

  @Override
  public String toString() {
    return "PendingCommand[" + Long.toUnsignedString(id) + " " + command + ", " + TimeUnit.NANOSECONDS.toMillis(remainingNanos()) + "ms left]";
  }
}
