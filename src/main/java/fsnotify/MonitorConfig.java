package fsnotify;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * Deployment-wide settings shared by every monitor.
 */
public class MonitorConfig {

  public static final List<String> defaultHelperCommand = ImmutableList.of("fsnotify");
  public static final Duration defaultCommandTimeout = Duration.ofMillis(1000);
  public static final int defaultMailboxCapacity = 1024;

  private final List<String> helperCommand;
  private final Duration commandTimeout;
  private final int mailboxCapacity;

  private MonitorConfig(Builder b) {
    this.helperCommand = ImmutableList.copyOf(b.helperCommand);
    this.commandTimeout = b.commandTimeout;
    this.mailboxCapacity = b.mailboxCapacity;
  }

  public static MonitorConfig defaults() {
    return newBuilder().build();
  }

  /**
   * Reads {@code fsnotify.helper} (the helper command line, split on whitespace),
   * {@code fsnotify.commandTimeoutMillis} and {@code fsnotify.mailboxCapacity}, using the
   * defaults for anything unset.
   */
  public static MonitorConfig fromSystemProperties() {
    Builder b = newBuilder();
    String helper = System.getProperty("fsnotify.helper");
    if (StringUtils.isNotBlank(helper)) {
      b.helperCommand(Arrays.asList(StringUtils.split(helper)));
    }
    String timeout = System.getProperty("fsnotify.commandTimeoutMillis");
    if (StringUtils.isNotBlank(timeout)) {
      b.commandTimeout(Duration.ofMillis(Long.parseLong(timeout.trim())));
    }
    String capacity = System.getProperty("fsnotify.mailboxCapacity");
    if (StringUtils.isNotBlank(capacity)) {
      b.mailboxCapacity(Integer.parseInt(capacity.trim()));
    }
    return b.build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public List<String> getHelperCommand() {
    return helperCommand;
  }

  public Duration getCommandTimeout() {
    return commandTimeout;
  }

  public int getMailboxCapacity() {
    return mailboxCapacity;
  }

  @Override
  public String toString() {
    return MoreObjects
      .toStringHelper(this)
      .add("helperCommand", helperCommand)
      .add("commandTimeout", commandTimeout)
      .add("mailboxCapacity", mailboxCapacity)
      .toString();
  }

  public static class Builder {
    private List<String> helperCommand = defaultHelperCommand;
    private Duration commandTimeout = defaultCommandTimeout;
    private int mailboxCapacity = defaultMailboxCapacity;

    public Builder helperCommand(List<String> helperCommand) {
      if (helperCommand.isEmpty()) {
        throw new IllegalArgumentException("Helper command is empty");
      }
      this.helperCommand = helperCommand;
      return this;
    }

    public Builder commandTimeout(Duration commandTimeout) {
      if (commandTimeout.isNegative() || commandTimeout.isZero()) {
        throw new IllegalArgumentException("Command timeout must be positive: " + commandTimeout);
      }
      this.commandTimeout = commandTimeout;
      return this;
    }

    public Builder mailboxCapacity(int mailboxCapacity) {
      if (mailboxCapacity < 1) {
        throw new IllegalArgumentException("Mailbox capacity must be positive: " + mailboxCapacity);
      }
      this.mailboxCapacity = mailboxCapacity;
      return this;
    }

    public MonitorConfig build() {
      return new MonitorConfig(this);
    }
  }
}
