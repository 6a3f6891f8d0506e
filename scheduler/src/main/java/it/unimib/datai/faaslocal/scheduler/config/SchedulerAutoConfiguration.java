package it.unimib.datai.faaslocal.scheduler.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import it.unimib.datai.faaslocal.scheduler.LocalScheduler;
import it.unimib.datai.faaslocal.scheduler.ShutdownSignal;
import it.unimib.datai.faaslocal.scheduler.api.RuntimeApi;
import it.unimib.datai.faaslocal.scheduler.metadata.CargoFunctionMetadataReader;
import it.unimib.datai.faaslocal.scheduler.metadata.FunctionMetadataReader;
import it.unimib.datai.faaslocal.scheduler.process.FunctionEnvironment;
import it.unimib.datai.faaslocal.scheduler.process.FunctionSupervisorFactory;
import it.unimib.datai.faaslocal.scheduler.process.ProcessBuilderLauncher;
import it.unimib.datai.faaslocal.scheduler.process.ProcessLauncher;
import it.unimib.datai.faaslocal.scheduler.queue.InvocationRegistry;
import it.unimib.datai.faaslocal.scheduler.response.ResponseRegistry;
import it.unimib.datai.faaslocal.scheduler.service.SchedulerMetrics;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.io.File;
import java.nio.file.Path;

/**
 * Wires the local scheduler for an HTTP front end. Every collaborator can be replaced by declaring a bean of the same type.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
})
@EnableConfigurationProperties(WatchProperties.class)
public class SchedulerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    SchedulerMetrics schedulerMetrics(MeterRegistry meterRegistry) {
        return new SchedulerMetrics(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    ShutdownSignal shutdownSignal() {
        return new ShutdownSignal();
    }

    @Bean
    @ConditionalOnMissingBean
    InvocationRegistry invocationRegistry(WatchProperties props, MeterRegistry meterRegistry) {
        return new InvocationRegistry(props.runtimeApiBaseOrDefault(), meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    ResponseRegistry responseRegistry() {
        return new ResponseRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    FunctionMetadataReader functionMetadataReader() {
        return new CargoFunctionMetadataReader();
    }

    @Bean
    @ConditionalOnMissingBean
    ProcessLauncher processLauncher(WatchProperties props) {
        Path parent = props.manifestPathOrDefault().toAbsolutePath().getParent();
        File workingDirectory = parent == null ? null : parent.toFile();
        return new ProcessBuilderLauncher(workingDirectory);
    }

    @Bean
    @ConditionalOnMissingBean
    FunctionSupervisorFactory functionSupervisorFactory(WatchProperties props,
                                                        FunctionMetadataReader metadataReader,
                                                        ProcessLauncher launcher,
                                                        ShutdownSignal shutdown,
                                                        SchedulerMetrics metrics) {
        return new FunctionSupervisorFactory(
                props.cargoExecutableOrDefault(),
                props.buildOptions(),
                System.getenv(FunctionEnvironment.LOG_LEVEL),
                metadataReader,
                launcher,
                shutdown,
                metrics
        );
    }

    @Bean
    @ConditionalOnMissingBean
    LocalScheduler localScheduler(WatchProperties props,
                                  InvocationRegistry registry,
                                  FunctionSupervisorFactory supervisorFactory,
                                  ShutdownSignal shutdown,
                                  SchedulerMetrics metrics) {
        return new LocalScheduler(registry, supervisorFactory, shutdown, metrics, props.shutdownGraceMsOrDefault());
    }

    @Bean
    @ConditionalOnMissingBean
    RuntimeApi runtimeApi(LocalScheduler scheduler, InvocationRegistry registry, ResponseRegistry responses) {
        return new RuntimeApi(scheduler, registry, responses);
    }
}
