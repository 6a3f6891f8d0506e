package it.unimib.datai.faaslocal.scheduler.process;

import it.unimib.datai.faaslocal.common.model.BuildOptions;
import it.unimib.datai.faaslocal.scheduler.FunctionDeathNotifier;
import it.unimib.datai.faaslocal.scheduler.ShutdownSignal;
import it.unimib.datai.faaslocal.scheduler.metadata.FunctionMetadataReader;
import it.unimib.datai.faaslocal.scheduler.queue.FunctionStart;
import it.unimib.datai.faaslocal.scheduler.service.SchedulerMetrics;

/**
 * Builds a supervisor for each function the scheduler starts, sharing launch configuration and the shutdown signal.
 */
public class FunctionSupervisorFactory {
    private final String cargo;
    private final BuildOptions buildOptions;
    private final String logLevel;
    private final FunctionMetadataReader metadataReader;
    private final ProcessLauncher launcher;
    private final ShutdownSignal shutdown;
    private final SchedulerMetrics metrics;

    public FunctionSupervisorFactory(String cargo,
                                     BuildOptions buildOptions,
                                     String logLevel,
                                     FunctionMetadataReader metadataReader,
                                     ProcessLauncher launcher,
                                     ShutdownSignal shutdown,
                                     SchedulerMetrics metrics) {
        this.cargo = cargo;
        this.buildOptions = buildOptions;
        this.logLevel = logLevel;
        this.metadataReader = metadataReader;
        this.launcher = launcher;
        this.shutdown = shutdown;
        this.metrics = metrics;
    }

    public FunctionSupervisor create(FunctionStart start, FunctionDeathNotifier deathNotifier) {
        return new FunctionSupervisor(
                start.functionName(),
                start.runtimeApi(),
                cargo,
                buildOptions,
                logLevel,
                metadataReader,
                launcher,
                shutdown,
                deathNotifier,
                metrics
        );
    }
}
