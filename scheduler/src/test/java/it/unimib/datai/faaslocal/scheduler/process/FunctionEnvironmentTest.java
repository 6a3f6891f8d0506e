package it.unimib.datai.faaslocal.scheduler.process;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FunctionEnvironmentTest {

    @Test
    void defaults_arePresent() {
        Map<String, String> env = FunctionEnvironment.compose("orders", "http://rt/orders", "debug", Map.of());

        assertThat(env)
                .containsEntry("RUST_LOG", "debug")
                .containsEntry("FUNCTION_VERSION", "1")
                .containsEntry("FUNCTION_MEMORY_SIZE", "4096")
                .containsEntry("RUNTIME_API", "http://rt/orders")
                .containsEntry("FUNCTION_NAME", "orders");
    }

    @Test
    void unsetLogLevel_isPassedAsEmpty() {
        Map<String, String> env = FunctionEnvironment.compose("orders", "http://rt/orders", null, null);

        assertThat(env).containsEntry("RUST_LOG", "");
    }

    @Test
    void metadata_overridesPlatformDefaults() {
        Map<String, String> env = FunctionEnvironment.compose("orders", "http://rt/orders", "info",
                Map.of("FUNCTION_MEMORY_SIZE", "128", "RUST_LOG", "trace", "TABLE", "orders-local"));

        assertThat(env)
                .containsEntry("FUNCTION_MEMORY_SIZE", "128")
                .containsEntry("RUST_LOG", "trace")
                .containsEntry("TABLE", "orders-local");
    }

    @Test
    void metadata_cannotShadowRuntimeApiOrFunctionName() {
        Map<String, String> env = FunctionEnvironment.compose("orders", "http://rt/orders", "info",
                Map.of("RUNTIME_API", "http://evil", "FUNCTION_NAME", "other"));

        assertThat(env)
                .containsEntry("RUNTIME_API", "http://rt/orders")
                .containsEntry("FUNCTION_NAME", "orders");
    }
}
