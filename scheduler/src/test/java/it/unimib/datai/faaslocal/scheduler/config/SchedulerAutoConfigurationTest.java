package it.unimib.datai.faaslocal.scheduler.config;

import it.unimib.datai.faaslocal.scheduler.LocalScheduler;
import it.unimib.datai.faaslocal.scheduler.ShutdownSignal;
import it.unimib.datai.faaslocal.scheduler.api.RuntimeApi;
import it.unimib.datai.faaslocal.scheduler.metadata.CargoFunctionMetadataReader;
import it.unimib.datai.faaslocal.scheduler.metadata.FunctionMetadataReader;
import it.unimib.datai.faaslocal.scheduler.queue.InvocationRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.core.env.MapPropertySource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerAutoConfigurationTest {

    @Test
    void wiresSchedulerAndStartsIt() {
        ShutdownSignal shutdown;
        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
            context.getEnvironment().getPropertySources().addFirst(new MapPropertySource("test", Map.of(
                    "faaslocal.watch.runtime-api-base", "http://localhost:9100/.rt",
                    "faaslocal.watch.no-reload", "true")));
            context.register(SchedulerAutoConfiguration.class);
            context.refresh();

            RuntimeApi api = context.getBean(RuntimeApi.class);
            assertThat(api.runtimeApiAddress("orders")).isEqualTo("http://localhost:9100/.rt/orders");
            assertThat(context.getBean(WatchProperties.class).noReload()).isTrue();
            assertThat(context.getBean(FunctionMetadataReader.class)).isInstanceOf(CargoFunctionMetadataReader.class);
            assertThat(context.getBean(LocalScheduler.class).isRunning()).isTrue();
            assertThat(context.getBean(InvocationRegistry.class)).isNotNull();
            shutdown = context.getBean(ShutdownSignal.class);
        }

        assertThat(shutdown.isTriggered()).isTrue();
    }

    @Test
    void userBeanReplacesDefaultMetadataReader() {
        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
            FunctionMetadataReader custom = FunctionMetadataReader.empty();
            context.registerBean(FunctionMetadataReader.class, () -> custom);
            context.register(SchedulerAutoConfiguration.class);
            context.refresh();

            assertThat(context.getBean(FunctionMetadataReader.class)).isSameAs(custom);
            assertThat(context.getBeansOfType(FunctionMetadataReader.class)).hasSize(1);
        }
    }
}
