package fsnotify.helper;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.Optional;

/** A running helper and the two ends of its duplex stream. */
public interface HelperProcess {

  /** @return the helper's stdout, which carries replies and broadcasts */
  InputStream getInputStream();

  /** @return the helper's stdin, which carries commands */
  OutputStream getOutputStream();

  /** @return the helper's stderr, if it has a separate one */
  Optional<InputStream> getErrorStream();

  /**
   * Terminates the helper if it is still running and waits briefly for it to exit.
   *
   * @return the exit status, if the helper has exited
   */
  Optional<Integer> destroy();

}
