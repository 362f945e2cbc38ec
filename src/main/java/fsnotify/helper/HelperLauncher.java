package fsnotify.helper;

import java.io.IOException;

/** Starts a new helper; each monitor gets its own. */
@FunctionalInterface
public interface HelperLauncher {

  HelperProcess launch() throws IOException;

}
