package it.unimib.datai.faaslocal.scheduler.process;

import it.unimib.datai.faaslocal.common.model.BuildOptions;
import it.unimib.datai.faaslocal.scheduler.FunctionDeathNotifier;
import it.unimib.datai.faaslocal.scheduler.ShutdownSignal;
import it.unimib.datai.faaslocal.scheduler.metadata.FunctionMetadataReader;
import it.unimib.datai.faaslocal.scheduler.service.SchedulerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs one function's process until it exits on its own or the shutdown signal fires.
 */
public class FunctionSupervisor implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(FunctionSupervisor.class);
    private static final long KILL_WAIT_SECONDS = 5;

    private final String functionName;
    private final String runtimeApi;
    private final String cargo;
    private final BuildOptions buildOptions;
    private final String logLevel;
    private final FunctionMetadataReader metadataReader;
    private final ProcessLauncher launcher;
    private final ShutdownSignal shutdown;
    private final FunctionDeathNotifier deathNotifier;
    private final SchedulerMetrics metrics;

    public FunctionSupervisor(String functionName,
                              String runtimeApi,
                              String cargo,
                              BuildOptions buildOptions,
                              String logLevel,
                              FunctionMetadataReader metadataReader,
                              ProcessLauncher launcher,
                              ShutdownSignal shutdown,
                              FunctionDeathNotifier deathNotifier,
                              SchedulerMetrics metrics) {
        this.functionName = functionName;
        this.runtimeApi = runtimeApi;
        this.cargo = cargo;
        this.buildOptions = buildOptions;
        this.logLevel = logLevel;
        this.metadataReader = metadataReader;
        this.launcher = launcher;
        this.shutdown = shutdown;
        this.deathNotifier = deathNotifier;
        this.metrics = metrics;
    }

    public String functionName() {
        return functionName;
    }

    /**
     * @throws FunctionSpawnException when the process cannot be started
     */
    @Override
    public void run() {
        log.info("Starting function {} (manifest {})", functionName, buildOptions.manifestPath());

        List<String> command = LaunchCommand.toCommand(cargo, buildOptions, functionName);
        Map<String, String> env = FunctionEnvironment.compose(functionName, runtimeApi, logLevel, readMetadata());
        log.debug("Spawning function {}: command={} env={}", functionName, command, env);

        Process process;
        try {
            process = launcher.launch(command, env);
        } catch (IOException | RuntimeException e) {
            metrics.spawnFailed(functionName);
            throw new FunctionSpawnException(functionName, e);
        }
        metrics.started(functionName);

        CompletableFuture<Process> exit = process.onExit();
        CompletableFuture.anyOf(exit, shutdown.whenTriggered()).join();

        if (shutdown.isTriggered()) {
            log.info("Terminating function {}", functionName);
            terminate(process);
            return;
        }

        metrics.exited(functionName);
        log.info("Function {} exited with code {}", functionName, process.exitValue());
        if (!deathNotifier.notifyDeath(functionName)) {
            log.error("Failed to send cleanup message for dead function {}", functionName);
        }
    }

    private Map<String, String> readMetadata() {
        try {
            return metadataReader.read(buildOptions.manifestPath(), LaunchCommand.binName(functionName));
        } catch (RuntimeException e) {
            log.warn("Ignoring invalid function metadata for {}: {}", functionName, e.getMessage());
            return Map.of();
        }
    }

    private void terminate(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(KILL_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Function {} did not terminate within {}s", functionName, KILL_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while terminating function {}", functionName);
        }
    }
}
