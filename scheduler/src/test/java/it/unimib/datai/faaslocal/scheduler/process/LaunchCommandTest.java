package it.unimib.datai.faaslocal.scheduler.process;

import it.unimib.datai.faaslocal.common.model.BuildOptions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LaunchCommandTest {

    @Test
    void buildsWatchCommandLine() {
        BuildOptions options = new BuildOptions(
                Path.of("Cargo.toml"),
                "dynamodb,s3",
                true,
                List.of("--ignore", "*.md"),
                false
        );

        List<String> cmd = LaunchCommand.toCommand("cargo", options, "orders");

        assertThat(cmd).containsExactly(
                "cargo", "watch", "--ignore", "*.md", "--", "cargo",
                "run",
                "--features", "dynamodb,s3",
                "--release",
                "--bin", "orders"
        );
    }

    @Test
    void noReload_runsDirectly() {
        BuildOptions options = new BuildOptions(Path.of("Cargo.toml"), null, false, List.of("--ignore", "x"), true);

        List<String> cmd = LaunchCommand.toCommand("cargo", options, "orders");

        assertThat(cmd).containsExactly("cargo", "run", "--bin", "orders");
        assertThat(cmd).doesNotContain("watch", "--ignore", "--release", "--features");
    }

    @Test
    void defaultPackageFunction_letsRunInferBinary() {
        BuildOptions options = new BuildOptions(Path.of("Cargo.toml"), "   ", false, null, true);

        List<String> cmd = LaunchCommand.toCommand("cargo", options, LaunchCommand.DEFAULT_PACKAGE_FUNCTION);

        assertThat(cmd).containsExactly("cargo", "run");
    }

    @Test
    void binName_emptyOrSentinel_isNull() {
        assertThat(LaunchCommand.binName("")).isNull();
        assertThat(LaunchCommand.binName("_")).isNull();
        assertThat(LaunchCommand.binName("orders")).isEqualTo("orders");
    }
}
