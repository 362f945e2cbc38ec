package fsnotify.helper;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import fsnotify.Utils;
import fsnotify.tasks.TaskLogic;

/**
 * Copies the helper's stderr into our log, one line at a time, so its panics are not lost.
 */
public class HelperStderrLogger implements TaskLogic {

  private static final Logger log = LoggerFactory.getLogger(HelperStderrLogger.class);
  private final String name;
  private final InputStream stderr;
  private final BufferedReader reader;

  public HelperStderrLogger(String name, InputStream stderr) {
    this.name = name;
    this.stderr = stderr;
    this.reader = new BufferedReader(new InputStreamReader(stderr, UTF_8));
  }

  @Override
  public Duration runOneLoop() {
    try {
      String line = reader.readLine();
      if (line == null) {
        return Duration.ofMillis(-1);
      }
      log.warn("[helper {}] {}", name, line);
      return null;
    } catch (IOException e) {
      // stderr is closed along with the process
      log.debug("Stopped reading stderr of helper " + name, e);
      return Duration.ofMillis(-1);
    }
  }

  // closes the raw stream, as the reader's own close would wait on the blocked readLine
  @Override
  public void onInterrupt() {
    Utils.closeQuietly(stderr);
  }

  @Override
  public String getName() {
    return "HelperStderr-" + name;
  }

}
