package it.unimib.datai.faaslocal.scheduler.process;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;

public class ProcessBuilderLauncher implements ProcessLauncher {
    private final File workingDirectory;

    public ProcessBuilderLauncher(File workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    @Override
    public Process launch(List<String> command, Map<String, String> env) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.inheritIO();
        if (workingDirectory != null) {
            pb.directory(workingDirectory);
        }
        pb.environment().putAll(env);
        return pb.start();
    }
}
