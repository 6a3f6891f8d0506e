package it.unimib.datai.faaslocal.scheduler.process;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@FunctionalInterface
public interface ProcessLauncher {
    /**
     * Starts the command with {@code env} applied on top of the parent environment.
     */
    Process launch(List<String> command, Map<String, String> env) throws IOException;
}
