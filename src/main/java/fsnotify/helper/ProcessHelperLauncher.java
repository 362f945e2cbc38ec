package fsnotify.helper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * Launches the helper as a subprocess, talking to it over its stdin/stdout.
 */
public class ProcessHelperLauncher implements HelperLauncher {

  private static final Logger log = LoggerFactory.getLogger(ProcessHelperLauncher.class);
  private static final long exitGraceMillis = 1000;
  private final List<String> command;

  public ProcessHelperLauncher(List<String> command) {
    if (command.isEmpty()) {
      throw new IllegalArgumentException("Helper command is empty");
    }
    this.command = ImmutableList.copyOf(command);
  }

  @Override
  public HelperProcess launch() throws IOException {
    log.debug("Launching helper {}", command);
    Process process = new ProcessBuilder(command).start();
    return new SubprocessHelper(process);
  }

  private static class SubprocessHelper implements HelperProcess {
    private final Process process;

    private SubprocessHelper(Process process) {
      this.process = process;
    }

    @Override
    public InputStream getInputStream() {
      return process.getInputStream();
    }

    @Override
    public OutputStream getOutputStream() {
      return process.getOutputStream();
    }

    @Override
    public Optional<InputStream> getErrorStream() {
      return Optional.of(process.getErrorStream());
    }

    @Override
    public Optional<Integer> destroy() {
      try {
        if (process.isAlive()) {
          process.destroy();
          if (!process.waitFor(exitGraceMillis, TimeUnit.MILLISECONDS)) {
            log.warn("Helper {} ignored termination, killing it", process.pid());
            process.destroyForcibly().waitFor(exitGraceMillis, TimeUnit.MILLISECONDS);
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        process.destroyForcibly();
      }
      return process.isAlive() ? Optional.empty() : Optional.of(process.exitValue());
    }

    @Override
    public String toString() {
      return "helper pid " + process.pid();
    }
  }

}
